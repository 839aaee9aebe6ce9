package com.flamingo.ai.evomemory.service.rag;

import com.flamingo.ai.evomemory.domain.entity.Neuron;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Immutable BM25 index over a window of neurons. Each neuron is one document made of its input
 * followed by its output.
 *
 * <p>{@code idf(t) = ln((N - df(t) + 0.5) / (df(t) + 0.5) + 1)} and a document scores {@code
 * sum idf(t) * tf * (k1 + 1) / (tf + k1 * (1 - b + b * len / avgLen))} over the query terms. Terms
 * outside the indexed vocabulary contribute nothing.
 */
public final class Bm25Snapshot {

  private final List<IndexedDocument> documents;
  private final Map<String, Double> idf;
  private final double avgDocLength;
  private final double k1;
  private final double b;
  private final LocalDateTime builtAt;

  private Bm25Snapshot(
      List<IndexedDocument> documents,
      Map<String, Double> idf,
      double avgDocLength,
      double k1,
      double b) {
    this.documents = Collections.unmodifiableList(documents);
    this.idf = Collections.unmodifiableMap(idf);
    this.avgDocLength = avgDocLength;
    this.k1 = k1;
    this.b = b;
    this.builtAt = LocalDateTime.now();
  }

  /**
   * Builds a snapshot over the given neurons.
   *
   * @param neurons the neurons to index, in the order results should break ties
   * @param k1 term frequency saturation
   * @param b length normalization
   * @return the new snapshot
   */
  public static Bm25Snapshot build(List<Neuron> neurons, double k1, double b) {
    List<IndexedDocument> documents = new ArrayList<>(neurons.size());
    Map<String, Integer> documentFrequency = new HashMap<>();
    long totalLength = 0;

    for (Neuron neuron : neurons) {
      List<String> terms = TextTokenizer.tokenize(neuron.document());
      Map<String, Integer> termFrequencies = new HashMap<>();
      for (String term : terms) {
        termFrequencies.merge(term, 1, Integer::sum);
      }
      for (String term : new HashSet<>(terms)) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
      totalLength += terms.size();
      documents.add(new IndexedDocument(neuron, Map.copyOf(termFrequencies), terms.size()));
    }

    int n = documents.size();
    double avgDocLength = n > 0 ? (double) totalLength / n : 0.0;

    Map<String, Double> idf = new HashMap<>(documentFrequency.size());
    documentFrequency.forEach(
        (term, df) -> idf.put(term, Math.log((n - df + 0.5) / (df + 0.5) + 1)));

    return new Bm25Snapshot(documents, idf, avgDocLength, k1, b);
  }

  /** Base BM25 score of one indexed document, before any boost. */
  public double score(List<String> queryTerms, IndexedDocument document) {
    if (avgDocLength == 0.0) {
      return 0.0;
    }
    double lengthRatio = document.length() / avgDocLength;
    double score = 0.0;
    for (String term : queryTerms) {
      Double termIdf = idf.get(term);
      if (termIdf == null) {
        continue;
      }
      int tf = document.termFrequencies().getOrDefault(term, 0);
      double numerator = tf * (k1 + 1);
      double denominator = tf + k1 * (1 - b + b * lengthRatio);
      score += termIdf * (numerator / denominator);
    }
    return score;
  }

  /** Inverse document frequency of a term; 0 for terms outside the vocabulary. */
  public double idf(String term) {
    return idf.getOrDefault(term, 0.0);
  }

  public List<IndexedDocument> documents() {
    return documents;
  }

  public int size() {
    return documents.size();
  }

  public double averageDocumentLength() {
    return avgDocLength;
  }

  public LocalDateTime builtAt() {
    return builtAt;
  }

  /**
   * One neuron with its precomputed term statistics.
   *
   * @param neuron the indexed neuron
   * @param termFrequencies occurrences of each term in the document
   * @param length number of terms in the document
   */
  public record IndexedDocument(Neuron neuron, Map<String, Integer> termFrequencies, int length) {}
}
