package com.flamingo.ai.evomemory.service.rag;

import com.flamingo.ai.evomemory.domain.entity.Neuron;
import java.util.List;

/**
 * Result of combining ranked retrieval with context-hash matching.
 *
 * @param bm25Results top ranked neurons
 * @param contextMatches neurons whose context hash equals the query's
 * @param combined ranked results first, then context matches not already present
 */
public record HybridSearchResult(
    List<ScoredNeuron> bm25Results, List<Neuron> contextMatches, List<HybridMatch> combined) {

  /** Where a combined match came from. */
  public enum MatchSource {
    BM25,
    CONTEXT_HASH
  }

  /**
   * One entry of the combined list.
   *
   * @param neuron the neuron
   * @param score BM25 score, or the fixed fallback score for context matches
   * @param source the search that found it
   */
  public record HybridMatch(Neuron neuron, double score, MatchSource source) {}
}
