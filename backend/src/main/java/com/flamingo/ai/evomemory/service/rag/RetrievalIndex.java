package com.flamingo.ai.evomemory.service.rag;

import com.flamingo.ai.evomemory.config.EvoMemoryConfig;
import com.flamingo.ai.evomemory.domain.entity.Neuron;
import com.flamingo.ai.evomemory.service.memory.ContextHasher;
import com.flamingo.ai.evomemory.service.memory.NeuronStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Lightweight retrieval over recent neurons ("RAG-Lite").
 *
 * <p>Holds a BM25 snapshot of the most recent neurons. A rebuild reads the window, builds a new
 * {@link Bm25Snapshot} off to the side and swaps the reference, so readers always see a complete
 * snapshot. Between rebuilds the snapshot may lag behind the store.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalIndex {

  static final String CONTEXT_HEADER = "### Relevant past experiences:";

  private final NeuronStore neuronStore;
  private final EvoMemoryConfig evoMemoryConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicReference<Bm25Snapshot> snapshot = new AtomicReference<>();

  /**
   * Rebuilds the snapshot over the most recent neurons.
   *
   * @param maxNeurons size of the window
   * @return number of indexed neurons
   */
  @Timed(value = "evomemory.index.rebuild", description = "Time to rebuild the BM25 snapshot")
  public int reindex(int maxNeurons) {
    EvoMemoryConfig.Retrieval retrieval = evoMemoryConfig.getRetrieval();
    List<Neuron> neurons = neuronStore.recent(maxNeurons);

    Bm25Snapshot rebuilt = Bm25Snapshot.build(neurons, retrieval.getK1(), retrieval.getB());
    snapshot.set(rebuilt);

    meterRegistry.counter("evomemory.index.rebuilds").increment();
    log.info(
        "Retrieval index rebuilt with {} neurons (avg length {})",
        rebuilt.size(),
        String.format(Locale.ROOT, "%.1f", rebuilt.averageDocumentLength()));
    return rebuilt.size();
  }

  /** Rebuilds the snapshot with the configured window. */
  public int reindex() {
    return reindex(evoMemoryConfig.getRetrieval().getMaxNeurons());
  }

  /**
   * Ranks indexed neurons against a query. Builds the snapshot first if none exists.
   *
   * @param query the query text
   * @param topK maximum number of results
   * @return neurons ordered by boosted score, highest first
   */
  @Timed(value = "evomemory.retrieve", description = "Time for BM25 retrieval")
  public List<ScoredNeuron> retrieve(String query, int topK) {
    if (topK <= 0) {
      return List.of();
    }
    Bm25Snapshot current = currentSnapshot();
    List<String> queryTerms = TextTokenizer.tokenize(query);
    EvoMemoryConfig.Retrieval retrieval = evoMemoryConfig.getRetrieval();

    List<ScoredNeuron> results = new ArrayList<>(current.size());
    for (Bm25Snapshot.IndexedDocument document : current.documents()) {
      Neuron neuron = document.neuron();
      double score = current.score(queryTerms, document);

      if (neuron.getConfidence() > retrieval.getHighConfidenceThreshold()) {
        score *= retrieval.getHighConfidenceBoost();
      }
      if (neuron.getUserFeedback() > 0) {
        score *= retrieval.getPositiveFeedbackBoost();
      }
      results.add(new ScoredNeuron(neuron, score));
    }

    results.sort(
        Comparator.comparingDouble(ScoredNeuron::score)
            .reversed()
            .thenComparing(scored -> scored.neuron().getId(), Comparator.reverseOrder()));

    meterRegistry.counter("evomemory.retrieval.count").increment();
    List<ScoredNeuron> top = results.subList(0, Math.min(topK, results.size()));
    if (log.isDebugEnabled() && !top.isEmpty()) {
      log.debug(
          "Retrieved {} neurons for '{}', best score {}",
          top.size(),
          query,
          String.format(Locale.ROOT, "%.3f", top.get(0).score()));
    }
    return List.copyOf(top);
  }

  /** Builds prompt context with the configured token budget. */
  public String getContextForPrompt(String query) {
    return getContextForPrompt(query, evoMemoryConfig.getRetrieval().getMaxContextTokens());
  }

  /**
   * Formats the best matching past exchanges for inclusion in a prompt.
   *
   * <p>Returns an empty string when nothing is relevant enough: no results, or a best score below
   * the configured minimum. Blocks are added while the estimated token count (output length / 4)
   * stays within the budget. Neurons that make it into the context get their access recorded.
   *
   * @param query the user query
   * @param maxContextTokens token budget for the context
   * @return formatted context, or an empty string
   */
  public String getContextForPrompt(String query, int maxContextTokens) {
    EvoMemoryConfig.Retrieval retrieval = evoMemoryConfig.getRetrieval();
    List<ScoredNeuron> relevant = retrieve(query, retrieval.getContextTopK());

    if (relevant.isEmpty() || relevant.get(0).score() < retrieval.getMinContextScore()) {
      meterRegistry.counter("evomemory.context.skipped").increment();
      return "";
    }

    List<String> parts = new ArrayList<>();
    parts.add(CONTEXT_HEADER);
    List<Long> injected = new ArrayList<>();
    double currentTokens = 0;

    for (ScoredNeuron scored : relevant) {
      Neuron neuron = scored.neuron();
      double estimatedTokens = neuron.getOutputText().length() / 4.0;
      if (currentTokens + estimatedTokens > maxContextTokens) {
        break;
      }
      parts.add(
          String.format(
              Locale.ROOT,
              "- Input: %s\n  Output: %s\n  (confidence: %.2f)",
              truncate(neuron.getInputText(), retrieval.getContextInputChars()),
              truncate(neuron.getOutputText(), retrieval.getContextOutputChars()),
              neuron.getConfidence()));
      injected.add(neuron.getId());
      currentTokens += estimatedTokens;
    }

    if (injected.isEmpty()) {
      meterRegistry.counter("evomemory.context.skipped").increment();
      return "";
    }

    neuronStore.recordAccess(injected);
    meterRegistry.counter("evomemory.context.injected").increment();
    return String.join("\n", parts) + "\n\n";
  }

  /**
   * Combines ranked retrieval with exact context-hash matches.
   *
   * @param query the query text
   * @return ranked results, hash matches and the de-duplicated combination
   */
  public HybridSearchResult hybridSearch(String query) {
    EvoMemoryConfig.Retrieval retrieval = evoMemoryConfig.getRetrieval();
    int topK = retrieval.getHybridTopK();

    List<ScoredNeuron> bm25Results = retrieve(query, topK);
    List<Neuron> contextMatches = neuronStore.similar(ContextHasher.hash(query), topK);

    Set<Long> seen = new HashSet<>();
    List<HybridSearchResult.HybridMatch> combined = new ArrayList<>();
    for (ScoredNeuron scored : bm25Results) {
      if (seen.add(scored.neuron().getId())) {
        combined.add(
            new HybridSearchResult.HybridMatch(
                scored.neuron(), scored.score(), HybridSearchResult.MatchSource.BM25));
      }
    }
    for (Neuron neuron : contextMatches) {
      if (seen.add(neuron.getId())) {
        combined.add(
            new HybridSearchResult.HybridMatch(
                neuron,
                retrieval.getContextMatchScore(),
                HybridSearchResult.MatchSource.CONTEXT_HASH));
      }
    }

    List<HybridSearchResult.HybridMatch> truncated =
        List.copyOf(combined.subList(0, Math.min(topK, combined.size())));
    return new HybridSearchResult(bm25Results, contextMatches, truncated);
  }

  /** Whether a snapshot has been built. */
  public boolean isIndexed() {
    return snapshot.get() != null;
  }

  /** Number of neurons in the current snapshot, 0 before the first build. */
  public int indexedCount() {
    Bm25Snapshot current = snapshot.get();
    return current == null ? 0 : current.size();
  }

  private Bm25Snapshot currentSnapshot() {
    Bm25Snapshot current = snapshot.get();
    if (current == null) {
      log.debug("No retrieval snapshot yet, building one");
      reindex(evoMemoryConfig.getRetrieval().getMaxNeurons());
      current = snapshot.get();
    }
    return current;
  }

  private static String truncate(String text, int maxChars) {
    return text.length() <= maxChars ? text : text.substring(0, maxChars);
  }
}
