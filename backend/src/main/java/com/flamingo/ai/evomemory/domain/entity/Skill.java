package com.flamingo.ai.evomemory.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Named category grouping neurons by {@code skill_id}. The aggregate columns are kept for layout
 * compatibility; live values are computed from the neurons table on read.
 */
@Entity
@Table(name = "skills")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Skill {

  @Id private String id;

  @Column(nullable = false)
  private String name;

  private String description;

  @Column(name = "neuron_count", nullable = false)
  @Builder.Default
  private int neuronCount = 0;

  @Column(name = "avg_confidence", nullable = false)
  @Builder.Default
  private double avgConfidence = 0.5;

  @Column(nullable = false)
  @Builder.Default
  private boolean enabled = true;

  @Column(name = "created_at", nullable = false, updatable = false)
  private LocalDateTime createdAt;

  @PrePersist
  protected void onCreate() {
    createdAt = LocalDateTime.now();
  }
}
