package com.flamingo.ai.evomemory.service.stats;

/** Service for memory statistics. */
public interface StatsService {

  /**
   * Gets counts of neurons, meta-neurons, enabled rules and skills, plus the recent average
   * confidence.
   *
   * @return the statistics
   */
  EvoMemoryStats getStats();
}
