package com.flamingo.ai.evomemory.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Compressed pattern over several similar neurons. The table is part of the persisted layout but
 * nothing writes to it yet; it is only counted in the statistics.
 */
@Entity
@Table(name = "meta_neurons")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MetaNeuron {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String pattern;

  @Column(columnDefinition = "TEXT", nullable = false)
  private String template;

  @Column(nullable = false)
  @Builder.Default
  private int occurrences = 1;

  @Column(name = "avg_confidence", nullable = false)
  @Builder.Default
  private double avgConfidence = 0.5;

  @Column(name = "skill_id")
  private String skillId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @Column(name = "updated_at", nullable = false)
  private LocalDateTime updatedAt;

  @PrePersist
  protected void onCreate() {
    LocalDateTime now = LocalDateTime.now();
    createdAt = now;
    updatedAt = now;
  }

  @PreUpdate
  protected void onUpdate() {
    updatedAt = LocalDateTime.now();
  }
}
