package com.cario.clinical.safety.vocabulary;

import lombok.Value;

/** A forbidden phrase found in a field, as written in the vocabulary table. */
@Value
public class MatchedPhrase {

  String phrase;
}
