package com.flamingo.ai.evomemory.config;

import com.flamingo.ai.evomemory.service.rag.RetrievalIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Builds the first retrieval snapshot on application startup so the first query does not pay for
 * it. Uses the smaller startup window.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetrievalIndexWarmup implements CommandLineRunner {

  private final RetrievalIndex retrievalIndex;
  private final EvoMemoryConfig evoMemoryConfig;

  @Override
  public void run(String... args) {
    EvoMemoryConfig.Retrieval retrieval = evoMemoryConfig.getRetrieval();
    if (!retrieval.isWarmupOnStartup()) {
      log.info("Retrieval index warm-up disabled");
      return;
    }
    try {
      int indexed = retrievalIndex.reindex(retrieval.getStartupMaxNeurons());
      log.info("Retrieval index warm-up complete: {} neurons", indexed);
    } catch (RuntimeException e) {
      // the index is rebuilt lazily on the first query
      log.error("Retrieval index warm-up failed: {}", e.getMessage(), e);
    }
  }
}
