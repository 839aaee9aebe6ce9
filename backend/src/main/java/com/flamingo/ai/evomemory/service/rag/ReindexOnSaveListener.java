package com.flamingo.ai.evomemory.service.rag;

import com.flamingo.ai.evomemory.config.EvoMemoryConfig;
import com.flamingo.ai.evomemory.service.memory.NeuronSavedEvent;
import java.util.concurrent.atomic.AtomicLong;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Rebuilds the retrieval snapshot after every N-th stored neuron. Counts saves seen since the
 * last rebuild rather than table rows, so concurrent saves and prunes cannot skip a rebuild.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReindexOnSaveListener {

  private final RetrievalIndex retrievalIndex;
  private final EvoMemoryConfig evoMemoryConfig;

  private final AtomicLong savesSinceRebuild = new AtomicLong();

  @Async("indexingExecutor")
  @TransactionalEventListener(fallbackExecution = true)
  public void onNeuronSaved(NeuronSavedEvent event) {
    int every = evoMemoryConfig.getRetrieval().getReindexEvery();
    if (every <= 0) {
      return;
    }
    long pending = savesSinceRebuild.updateAndGet(count -> count + 1 >= every ? 0 : count + 1);
    if (pending == 0) {
      log.debug(
          "{} neurons saved since the last rebuild (latest {}), reindexing",
          every,
          event.neuronId());
      retrievalIndex.reindex();
    }
  }

  /** Saves counted towards the next rebuild. */
  long pendingSaves() {
    return savesSinceRebuild.get();
  }
}
