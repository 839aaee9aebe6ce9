package com.flamingo.ai.evomemory.service.skill;

import com.flamingo.ai.evomemory.domain.entity.Skill;
import com.flamingo.ai.evomemory.domain.repository.NeuronRepository;
import com.flamingo.ai.evomemory.domain.repository.SkillAggregate;
import com.flamingo.ai.evomemory.domain.repository.SkillRepository;
import com.flamingo.ai.evomemory.exception.NeuronValidationException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Skill registry. Neuron counts and average confidence are derived from the neurons on every read
 * instead of being maintained as counters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SkillService {

  private final SkillRepository skillRepository;
  private final NeuronRepository neuronRepository;

  /**
   * Registers a skill or updates its name and description.
   *
   * @param id the skill id
   * @param name display name
   * @param description optional description
   * @return the stored skill
   */
  @Transactional
  public Skill register(String id, String name, String description) {
    if (id == null || id.isBlank()) {
      throw new NeuronValidationException("skill_id", "is required");
    }
    Skill skill =
        skillRepository
            .findById(id)
            .orElseGet(() -> Skill.builder().id(id).build());
    skill.setName(name == null || name.isBlank() ? id : name);
    skill.setDescription(description);
    Skill saved = skillRepository.save(skill);
    log.info("Registered skill {}", id);
    return saved;
  }

  /**
   * Lists registered skills plus any skill id found on neurons, with live aggregates.
   *
   * @return skills ordered by id, registered ones first
   */
  @Transactional(readOnly = true)
  public List<SkillSummary> listSkills() {
    Map<String, SkillAggregate> aggregates = new LinkedHashMap<>();
    for (SkillAggregate aggregate : neuronRepository.aggregateBySkill()) {
      aggregates.put(aggregate.skillId(), aggregate);
    }

    List<SkillSummary> summaries = new ArrayList<>();
    for (Skill skill : skillRepository.findAll()) {
      SkillAggregate aggregate = aggregates.remove(skill.getId());
      summaries.add(
          new SkillSummary(
              skill.getId(),
              skill.getName(),
              skill.getDescription(),
              aggregate == null ? 0 : aggregate.neuronCount(),
              aggregate == null || aggregate.avgConfidence() == null
                  ? 0.0
                  : aggregate.avgConfidence(),
              skill.isEnabled()));
    }
    summaries.sort((a, b) -> a.id().compareTo(b.id()));

    aggregates
        .values()
        .forEach(
            aggregate ->
                summaries.add(
                    new SkillSummary(
                        aggregate.skillId(),
                        aggregate.skillId(),
                        null,
                        aggregate.neuronCount(),
                        aggregate.avgConfidence() == null ? 0.0 : aggregate.avgConfidence(),
                        true)));
    return summaries;
  }
}
