package com.flamingo.ai.evomemory.service.scoring;

import com.flamingo.ai.evomemory.config.EvoMemoryConfig;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Heuristic self-assessment of generated responses. Starts from a baseline and applies additive
 * adjustments for length, hedging or assertive phrases, questions, repetitions and the optional
 * generation statistics. Deterministic and free of side effects.
 */
@Service
@Slf4j
public class ConfidenceScorer {

  static final String STANDARD_EVALUATION = "standard evaluation";

  private final EvoMemoryConfig.Scoring scoring;
  private final Pattern uncertaintyPattern;
  private final Pattern certaintyPattern;

  public ConfidenceScorer(EvoMemoryConfig config) {
    this.scoring = config.getScoring();
    this.uncertaintyPattern = compile(scoring.getUncertaintyPhrases());
    this.certaintyPattern = compile(scoring.getCertaintyPhrases());
  }

  /** Scores a response without generation statistics. */
  public ConfidenceResult score(String outputText) {
    return score(outputText, GenerationStats.none());
  }

  /**
   * Scores a response.
   *
   * @param outputText the generated text
   * @param stats generation statistics, null or partially null when unavailable
   * @return the clamped confidence and the reasoning
   */
  public ConfidenceResult score(String outputText, GenerationStats stats) {
    String text = outputText == null ? "" : outputText;
    double confidence = scoring.getBaseline();
    List<String> reasons = new ArrayList<>();

    int length = text.strip().length();
    if (length < scoring.getShortLength()) {
      confidence -= scoring.getShortPenalty();
      reasons.add("output too short");
    } else if (length > scoring.getDetailedLength()) {
      confidence += scoring.getDetailedBonus();
      reasons.add("detailed response");
    }

    int uncertain = countMatches(uncertaintyPattern, text);
    if (uncertain > 0) {
      confidence -= scoring.getUncertaintyPenalty() * uncertain;
      reasons.add("found " + uncertain + " uncertainty expressions");
    }

    int certain = countMatches(certaintyPattern, text);
    if (certain > 0) {
      confidence += scoring.getCertaintyBonus() * certain;
      reasons.add("found " + certain + " certainty expressions");
    }

    long questionMarks = text.chars().filter(c -> c == '?').count();
    if (questionMarks > scoring.getQuestionMarkLimit()) {
      confidence -= scoring.getQuestionPenalty();
      reasons.add("response contains questions");
    }

    String[] words = text.toLowerCase(Locale.ROOT).trim().split("\\s+");
    int wordCount = text.isBlank() ? 0 : words.length;
    if (wordCount > scoring.getRepetitionMinWords()) {
      long unique = Arrays.stream(words).distinct().count();
      if ((double) unique / wordCount < scoring.getRepetitionMinUniqueRatio()) {
        confidence -= scoring.getRepetitionPenalty();
        reasons.add("too many repetitions");
      }
    }

    GenerationStats context = stats == null ? GenerationStats.none() : stats;
    if (context.promptTokens() != null
        && context.promptTokens() > scoring.getLongPromptTokens()
        && length < scoring.getShortForPromptLength()) {
      confidence -= scoring.getShortForPromptPenalty();
      reasons.add("response too short for the prompt");
    }
    if (context.tokensPerSecond() != null
        && context.tokensPerSecond() > scoring.getFluentTokensPerSecond()) {
      confidence += scoring.getFluentBonus();
      reasons.add("fluent generation");
    }

    confidence = Math.max(0.0, Math.min(1.0, confidence));
    String reasoning = reasons.isEmpty() ? STANDARD_EVALUATION : String.join("; ", reasons);
    log.debug("Scored response ({} chars): {} ({})", length, confidence, reasoning);
    return new ConfidenceResult(confidence, reasoning);
  }

  /** Label of a confidence value. */
  public ConfidenceLabel label(double confidence) {
    return ConfidenceLabel.of(confidence);
  }

  /** Whether the agent should ask for clarification, using the configured threshold. */
  public boolean shouldAskClarification(double confidence) {
    return shouldAskClarification(confidence, scoring.getClarificationThreshold());
  }

  public boolean shouldAskClarification(double confidence, double threshold) {
    return confidence < threshold;
  }

  private static int countMatches(Pattern pattern, String text) {
    if (pattern == null) {
      return 0;
    }
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  private static Pattern compile(List<String> phrases) {
    if (phrases == null || phrases.isEmpty()) {
      return null;
    }
    String alternation =
        phrases.stream()
            .map(phrase -> "\\b" + Pattern.quote(phrase) + "\\b")
            .collect(Collectors.joining("|"));
    return Pattern.compile(alternation, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
  }
}
