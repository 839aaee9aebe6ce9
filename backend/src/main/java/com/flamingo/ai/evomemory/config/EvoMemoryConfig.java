package com.flamingo.ai.evomemory.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/** Configuration properties for the episodic memory. */
@Configuration
@ConfigurationProperties(prefix = "evomemory")
@Validated
@Getter
@Setter
public class EvoMemoryConfig {

  @Valid private Retrieval retrieval = new Retrieval();
  @Valid private Scoring scoring = new Scoring();
  @Valid private Evolution evolution = new Evolution();
  @Valid private Pruning pruning = new Pruning();

  @Getter
  @Setter
  public static class Retrieval {
    /** Size of the window of recent neurons indexed by a rebuild. */
    @Min(1)
    private int maxNeurons = 1000;

    /** Window used for the snapshot built at startup. */
    @Min(1)
    private int startupMaxNeurons = 500;

    private boolean warmupOnStartup = true;

    /** Rebuild the snapshot after every N stored neurons; 0 disables it. */
    @Min(0)
    private int reindexEvery = 10;

    private double k1 = 1.5;
    private double b = 0.75;

    private double highConfidenceThreshold = 0.7;
    private double highConfidenceBoost = 1.2;
    private double positiveFeedbackBoost = 1.3;

    private int contextTopK = 3;
    private double minContextScore = 0.5;
    private int maxContextTokens = 300;
    private int contextInputChars = 100;
    private int contextOutputChars = 150;

    private int hybridTopK = 5;
    private double contextMatchScore = 0.5;
  }

  /** Thresholds and deltas of the heuristic confidence scorer. */
  @Getter
  @Setter
  public static class Scoring {
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double baseline = 0.5;

    private int shortLength = 10;
    private double shortPenalty = 0.2;
    private int detailedLength = 50;
    private double detailedBonus = 0.1;

    private double uncertaintyPenalty = 0.15;
    private double certaintyBonus = 0.1;

    private int questionMarkLimit = 1;
    private double questionPenalty = 0.1;

    private int repetitionMinWords = 10;
    private double repetitionMinUniqueRatio = 0.6;
    private double repetitionPenalty = 0.15;

    private int longPromptTokens = 500;
    private int shortForPromptLength = 50;
    private double shortForPromptPenalty = 0.1;

    private double fluentTokensPerSecond = 5;
    private double fluentBonus = 0.05;

    private double clarificationThreshold = 0.4;

    private List<String> uncertaintyPhrases =
        new ArrayList<>(
            List.of(
                "non sono sicuro",
                "non so",
                "forse",
                "probabilmente",
                "potrebbe essere",
                "possibilmente",
                "I'm not sure",
                "I don't know",
                "maybe",
                "probably",
                "might be",
                "could be"));

    private List<String> certaintyPhrases =
        new ArrayList<>(
            List.of(
                "sicuramente",
                "certamente",
                "conferma",
                "essenzialmente",
                "definitivamente",
                "certainly",
                "definitely",
                "clearly",
                "obviously"));
  }

  @Getter
  @Setter
  public static class Evolution {
    @Min(0)
    private int minNeurons = 50;

    @Min(1)
    private int minOccurrences = 3;

    /** Window of recent neurons grouped by skill, mood and keyword. */
    @Min(1)
    private int analysisWindow = 200;

    private int feedbackWindow = 100;
    private int highConfidenceWindow = 100;
    private int lowConfidenceWindow = 50;

    /** Where the human-readable rule snapshot is written. */
    @NotBlank private String snapshotPath = "data/evomemory/instinct.json";
  }

  @Getter
  @Setter
  public static class Pruning {
    @Min(0)
    private int keepDays = 30;

    private double minConfidence = 0.3;
  }
}
