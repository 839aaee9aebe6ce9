package com.flamingo.ai.evomemory.domain.entity;

import com.flamingo.ai.evomemory.domain.enums.Mood;
import com.flamingo.ai.evomemory.service.memory.ContextHasher;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * One stored input/output exchange of the agent.
 *
 * <p>Input, output, confidence and context hash are fixed at creation. Only feedback (with the
 * mood derived from it) and access bookkeeping change afterwards.
 */
@Entity
@Table(
    name = "neurons",
    indexes = {
      @Index(name = "idx_neurons_timestamp", columnList = "timestamp DESC"),
      @Index(name = "idx_neurons_confidence", columnList = "confidence DESC"),
      @Index(name = "idx_neurons_context", columnList = "context_hash"),
      @Index(name = "idx_neurons_skill", columnList = "skill_id")
    })
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Neuron {

  public static final double DEFAULT_CONFIDENCE = 0.5;

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "input_text", columnDefinition = "TEXT", nullable = false, updatable = false)
  private String inputText;

  /** Optional short annotation, e.g. whether retrieval context was used. */
  private String idea;

  @Column(name = "output_text", columnDefinition = "TEXT", nullable = false, updatable = false)
  private String outputText;

  @Column(nullable = false)
  private Mood mood;

  /** Self-assessed confidence, always within [0, 1]. */
  @Column(nullable = false, updatable = false)
  private double confidence;

  /** -1, 0 or +1. */
  @Column(name = "user_feedback", nullable = false)
  private int userFeedback;

  @Column(name = "context_hash", length = 8, updatable = false)
  private String contextHash;

  @Column(name = "skill_id")
  private String skillId;

  @Column(name = "timestamp", nullable = false, updatable = false)
  private LocalDateTime timestamp;

  @Column(name = "last_accessed")
  private LocalDateTime lastAccessed;

  @Column(name = "access_count", nullable = false)
  private int accessCount;

  @Builder
  private Neuron(
      Long id,
      String inputText,
      String idea,
      String outputText,
      Double confidence,
      Integer userFeedback,
      String skillId,
      LocalDateTime timestamp) {
    this.id = id;
    this.inputText = inputText;
    this.idea = idea;
    this.outputText = outputText;
    this.confidence = confidence == null ? DEFAULT_CONFIDENCE : confidence;
    this.userFeedback = userFeedback == null ? 0 : userFeedback;
    this.mood = Mood.fromFeedback(this.userFeedback);
    this.skillId = skillId;
    this.contextHash = ContextHasher.hash(inputText);
    this.timestamp = timestamp;
  }

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    if (timestamp == null) {
      timestamp = now;
    }
    lastAccessed = now;
  }

  /** Records user feedback and recomputes the mood from it. */
  public void applyFeedback(int feedback) {
    this.userFeedback = feedback;
    this.mood = Mood.fromFeedback(feedback);
    touch();
  }

  /** Updates the last accessed timestamp. */
  public void touch() {
    lastAccessed = LocalDateTime.now();
  }

  /** Marks the neuron as read into a prompt context. */
  public void recordAccess() {
    accessCount++;
    touch();
  }

  /** Text indexed for retrieval: input followed by output. */
  public String document() {
    return inputText + " " + outputText;
  }
}
