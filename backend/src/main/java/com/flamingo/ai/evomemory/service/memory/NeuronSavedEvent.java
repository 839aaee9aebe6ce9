package com.flamingo.ai.evomemory.service.memory;

/**
 * Published after a neuron has been stored.
 *
 * @param neuronId id assigned to the new neuron
 */
public record NeuronSavedEvent(long neuronId) {}
