package com.flamingo.ai.evomemory.service.scoring;

/**
 * Optional statistics reported by the text-generation engine. Either value may be null when the
 * engine did not report it.
 *
 * @param promptTokens number of tokens in the prompt
 * @param tokensPerSecond generation throughput
 */
public record GenerationStats(Integer promptTokens, Double tokensPerSecond) {

  private static final GenerationStats NONE = new GenerationStats(null, null);

  public static GenerationStats none() {
    return NONE;
  }
}
