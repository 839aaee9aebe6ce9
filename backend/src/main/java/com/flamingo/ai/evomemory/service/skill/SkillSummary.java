package com.flamingo.ai.evomemory.service.skill;

/**
 * A skill with aggregates computed from the neurons table.
 *
 * @param id the skill id used as {@code skill_id} on neurons
 * @param name display name, the id when the skill was never registered
 * @param description optional description
 * @param neuronCount neurons tagged with the skill
 * @param avgConfidence average confidence of those neurons, 0 when there are none
 * @param enabled whether the skill is enabled
 */
public record SkillSummary(
    String id,
    String name,
    String description,
    long neuronCount,
    double avgConfidence,
    boolean enabled) {}
