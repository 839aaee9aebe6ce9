package com.flamingo.ai.evomemory.service.evolution;

import java.util.List;

/** Splits neuron text into the words rule mining counts. */
public interface KeywordExtractor {

  /** Minimum exclusive length of a keyword. */
  int DEFAULT_MIN_LENGTH = 3;

  /**
   * Splits text into normalized words.
   *
   * @param text the text, may be null
   * @return the words in order of appearance
   */
  List<String> words(String text);

  /** Words strictly longer than {@code minLength} characters, in order of appearance. */
  default List<String> extractKeywords(String text, int minLength) {
    return words(text).stream().filter(word -> word.length() > minLength).toList();
  }

  /** Words longer than three characters, in order of appearance. */
  default List<String> extractKeywords(String text) {
    return extractKeywords(text, DEFAULT_MIN_LENGTH);
  }
}
