package com.flamingo.ai.evomemory.service.rag;

import com.flamingo.ai.evomemory.domain.entity.Neuron;

/**
 * A retrieved neuron with its boosted BM25 score.
 *
 * @param neuron the neuron
 * @param score relevance score, higher is better
 */
public record ScoredNeuron(Neuron neuron, double score) {}
