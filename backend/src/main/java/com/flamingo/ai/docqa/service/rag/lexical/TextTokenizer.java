package com.flamingo.ai.docqa.service.rag.lexical;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** Lower-cases text and splits it on anything that is not a letter or digit. */
public final class TextTokenizer {

  private static final Pattern SPLIT = Pattern.compile("[^\\p{L}\\p{N}]+");

  private TextTokenizer() {}

  public static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return tokens;
    }
    for (String token : SPLIT.split(text.toLowerCase(Locale.ROOT))) {
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
