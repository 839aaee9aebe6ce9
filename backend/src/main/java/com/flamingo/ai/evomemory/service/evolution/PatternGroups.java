package com.flamingo.ai.evomemory.service.evolution;

import com.flamingo.ai.evomemory.domain.entity.Neuron;
import com.flamingo.ai.evomemory.domain.enums.Mood;
import java.util.List;
import java.util.Map;

/**
 * Recent neurons grouped three ways. Map iteration follows first appearance, newest first.
 *
 * @param bySkill neurons per skill id, neurons without a skill are left out
 * @param byMood neurons per mood
 * @param byKeyword neurons per keyword among the first three keywords of their input
 */
public record PatternGroups(
    Map<String, List<Neuron>> bySkill,
    Map<Mood, List<Neuron>> byMood,
    Map<String, List<Neuron>> byKeyword) {}
