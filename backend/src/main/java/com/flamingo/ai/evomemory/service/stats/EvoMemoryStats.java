package com.flamingo.ai.evomemory.service.stats;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Snapshot of the memory's size and health. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvoMemoryStats {
  private long neurons;
  private long metaNeurons;
  private long activeRules;
  private long activeSkills;

  /** Average confidence of neurons from the last seven days, 0 when there are none. */
  private double avgConfidence;

  private int indexedNeurons;
  private LocalDateTime timestamp;
}
