package com.flamingo.ai.evomemory.service.evolution;

/**
 * Outcome of one auto-evolution pass.
 *
 * @param neuronsAnalyzed neurons in the store when the pass started
 * @param rulesGenerated rules produced by the heuristics
 * @param rulesSaved rules actually inserted (new rule texts only)
 * @param message human-readable summary
 */
public record EvolutionResult(
    long neuronsAnalyzed, int rulesGenerated, int rulesSaved, String message) {}
