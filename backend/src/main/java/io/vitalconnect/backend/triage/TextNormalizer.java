package io.vitalconnect.backend.triage;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/** Case and accent folding for cause and sector comparisons ("Cirúrgico" equals "cirurgico"). */
public final class TextNormalizer {

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");

  private TextNormalizer() {}

  public static String fold(String value) {
    if (value == null) {
      return "";
    }
    String decomposed = Normalizer.normalize(value.trim(), Normalizer.Form.NFD);
    return COMBINING_MARKS.matcher(decomposed).replaceAll("").toLowerCase(Locale.ROOT);
  }
}
