package com.flamingo.ai.evomemory.service.evolution;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.evomemory.domain.entity.Rule;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Rule list exported for human inspection after an evolution pass.
 *
 * @param generatedAt when the snapshot was produced
 * @param rulesCount number of rules
 * @param rules the rules in generation order
 */
public record RuleSnapshot(
    @JsonProperty("generated_at") LocalDateTime generatedAt,
    @JsonProperty("rules_count") int rulesCount,
    @JsonProperty("rules") List<Entry> rules) {

  /** Builds a snapshot of the given rules stamped with the current time. */
  public static RuleSnapshot of(List<Rule> rules) {
    List<Entry> entries = rules.stream().map(Entry::from).toList();
    return new RuleSnapshot(LocalDateTime.now(), entries.size(), entries);
  }

  /** Exported fields of one rule. */
  public record Entry(
      @JsonProperty("rule_text") String ruleText,
      @JsonProperty("trigger_pattern") String triggerPattern,
      @JsonProperty("confidence_threshold") double confidenceThreshold,
      @JsonProperty("priority") int priority,
      @JsonProperty("enabled") boolean enabled) {

    static Entry from(Rule rule) {
      return new Entry(
          rule.getRuleText(),
          rule.getTriggerPattern(),
          rule.getConfidenceThreshold(),
          rule.getPriority(),
          rule.isEnabled());
    }
  }
}
