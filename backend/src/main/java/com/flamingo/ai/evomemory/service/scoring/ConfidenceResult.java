package com.flamingo.ai.evomemory.service.scoring;

/**
 * Outcome of scoring one generated text.
 *
 * @param confidence value within [0, 1]
 * @param reasoning labels of the adjustments applied, in evaluation order, joined by "; "
 */
public record ConfidenceResult(double confidence, String reasoning) {

  public ConfidenceLabel label() {
    return ConfidenceLabel.of(confidence);
  }
}
