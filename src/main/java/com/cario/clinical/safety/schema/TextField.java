package com.cario.clinical.safety.schema;

import lombok.Value;

/** One free-text value of a payload and the path it was read from. */
@Value
public class TextField {

  /** Path such as {@code anatomical_observations.lungs[0]} or {@code plan.follow_up[1]}. */
  String path;

  String value;
}
