package com.flamingo.ai.evomemory.domain.repository;

/** Per-skill neuron statistics computed by {@link NeuronRepository#aggregateBySkill()}. */
public record SkillAggregate(String skillId, Long neuronCount, Double avgConfidence) {}
