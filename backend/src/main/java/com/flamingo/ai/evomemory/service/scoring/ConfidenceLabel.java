package com.flamingo.ai.evomemory.service.scoring;

/** Human-readable band of a confidence value. */
public enum ConfidenceLabel {
  VERY_HIGH("very-high", 0.8),
  HIGH("high", 0.6),
  MEDIUM("medium", 0.4),
  LOW("low", 0.2),
  VERY_LOW("very-low", Double.NEGATIVE_INFINITY);

  private final String displayName;
  private final double lowerBound;

  ConfidenceLabel(String displayName, double lowerBound) {
    this.displayName = displayName;
    this.lowerBound = lowerBound;
  }

  public String getDisplayName() {
    return displayName;
  }

  /** Returns the highest band whose lower bound the confidence reaches. */
  public static ConfidenceLabel of(double confidence) {
    for (ConfidenceLabel label : values()) {
      if (confidence >= label.lowerBound) {
        return label;
      }
    }
    return VERY_LOW;
  }
}
