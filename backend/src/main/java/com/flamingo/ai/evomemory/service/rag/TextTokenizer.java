package com.flamingo.ai.evomemory.service.rag;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Whitespace tokenizer shared by retrieval and rule mining. Tokens are lower-cased and lose
 * leading and trailing punctuation, so "LED?" and "led" are the same term.
 */
public final class TextTokenizer {

  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern EDGE_PUNCTUATION =
      Pattern.compile("^[^\\p{L}\\p{N}]+|[^\\p{L}\\p{N}]+$");

  private TextTokenizer() {}

  /**
   * Splits text into normalized terms.
   *
   * @param text the text, may be null
   * @return the terms in order of appearance, never null
   */
  public static List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    List<String> tokens = new ArrayList<>();
    for (String raw : WHITESPACE.split(text.strip())) {
      String token = EDGE_PUNCTUATION.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("");
      if (!token.isEmpty()) {
        tokens.add(token);
      }
    }
    return tokens;
  }
}
