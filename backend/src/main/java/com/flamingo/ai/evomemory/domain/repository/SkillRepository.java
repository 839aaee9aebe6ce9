package com.flamingo.ai.evomemory.domain.repository;

import com.flamingo.ai.evomemory.domain.entity.Skill;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Skill entities. */
@Repository
public interface SkillRepository extends JpaRepository<Skill, String> {

  long countByEnabledTrue();
}
