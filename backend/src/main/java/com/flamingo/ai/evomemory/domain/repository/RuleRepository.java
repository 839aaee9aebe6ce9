package com.flamingo.ai.evomemory.domain.repository;

import com.flamingo.ai.evomemory.domain.entity.Rule;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Rule entities. */
@Repository
public interface RuleRepository extends JpaRepository<Rule, Long> {

  /** Checks whether a rule with exactly this text exists. */
  boolean existsByRuleText(String ruleText);

  /** Finds enabled rules, most urgent first. */
  List<Rule> findByEnabledTrueOrderByPriorityDescIdAsc();

  long countByEnabledTrue();
}
