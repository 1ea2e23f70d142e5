package com.cario.clinical.safety.text;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonicalizes text before forbidden-phrase matching:
 *
 * <ol>
 *   <li>locale-independent lowercasing
 *   <li>compatibility decomposition (NFKD) with combining marks stripped, so "café" and "cafe" (or
 *       a full-width "ｃａｆｅ") compare equal
 *   <li>every run of non letter/digit code points collapsed to one space (spaced form)
 *   <li>spaces removed entirely (collapsed form)
 * </ol>
 *
 * <p>Pure and total: every input, including {@code null}, has a normalization. Scripts without
 * case or decomposable marks (CJK, Cyrillic, Greek letters) pass through as letters; homoglyph
 * folding is not attempted.
 */
public final class TextNormalizer {

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

  public NormalizedText normalize(String raw) {
    if (raw == null || raw.isEmpty()) {
      return NormalizedText.EMPTY;
    }

    String s = raw.toLowerCase(Locale.ROOT);
    s = Normalizer.normalize(s, Normalizer.Form.NFKD);
    s = COMBINING_MARKS.matcher(s).replaceAll("");
    // NFKD can surface uppercase compatibility forms (e.g. full-width letters)
    s = s.toLowerCase(Locale.ROOT);

    StringBuilder spaced = new StringBuilder(s.length());
    StringBuilder collapsed = new StringBuilder(s.length());
    boolean pendingSpace = false;

    for (int i = 0; i < s.length(); ) {
      int cp = s.codePointAt(i);
      i += Character.charCount(cp);

      if (Character.isLetterOrDigit(cp)) {
        if (pendingSpace && spaced.length() > 0) {
          spaced.append(' ');
        }
        pendingSpace = false;
        spaced.appendCodePoint(cp);
        collapsed.appendCodePoint(cp);
      } else {
        pendingSpace = true;
      }
    }

    if (collapsed.length() == 0) {
      return NormalizedText.EMPTY;
    }
    return new NormalizedText(spaced.toString(), collapsed.toString());
  }
}
