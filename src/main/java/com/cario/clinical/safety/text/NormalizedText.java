package com.cario.clinical.safety.text;

import lombok.Value;

/**
 * Matching-friendly views of a piece of text, produced by {@link TextNormalizer}.
 *
 * <ul>
 *   <li>{@code spaced}: lowercase, diacritic-free, every run of whitespace or punctuation replaced
 *       by one space. Defeats punctuation injected between words ("pneumon.ia").
 *   <li>{@code collapsed}: the spaced form with all spaces removed. Defeats letters spread apart
 *       ("p n e u m o n i a").
 * </ul>
 */
@Value
public class NormalizedText {

  public static final NormalizedText EMPTY = new NormalizedText("", "");

  String spaced;
  String collapsed;

  public boolean isEmpty() {
    return collapsed.isEmpty();
  }
}
