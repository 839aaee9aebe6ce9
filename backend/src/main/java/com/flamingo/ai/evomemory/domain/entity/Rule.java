package com.flamingo.ai.evomemory.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** A behavioral rule mined from neuron history. The rule text is its natural key. */
@Entity
@Table(
    name = "rules",
    uniqueConstraints = @UniqueConstraint(name = "uk_rules_rule_text", columnNames = "rule_text"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Rule {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "rule_text", columnDefinition = "TEXT", nullable = false)
  private String ruleText;

  /** Prefix-tagged trigger, e.g. {@code skill_id:gpio} or {@code avoid_word:forse}. */
  @Column(name = "trigger_pattern")
  private String triggerPattern;

  @Column(name = "confidence_threshold", nullable = false)
  @Builder.Default
  private double confidenceThreshold = 0.5;

  /** Higher means more specific or urgent. */
  @Column(nullable = false)
  @Builder.Default
  private int priority = 1;

  @Column(nullable = false)
  @Builder.Default
  private boolean enabled = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  // Reserved: nothing increments it yet.
  @Column(name = "applied_count", nullable = false)
  @Builder.Default
  private int appliedCount = 0;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
