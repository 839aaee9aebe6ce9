package com.flamingo.ai.evomemory.domain.repository;

import com.flamingo.ai.evomemory.domain.entity.Neuron;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

/** Repository for Neuron entities. */
@Repository
public interface NeuronRepository extends JpaRepository<Neuron, Long> {

  /** Finds the most recent neurons (newest first). */
  List<Neuron> findAllByOrderByTimestampDescIdDesc(Pageable pageable);

  /** Finds the most recent neurons of one skill (newest first). */
  List<Neuron> findBySkillIdOrderByTimestampDescIdDesc(String skillId, Pageable pageable);

  /** Finds neurons sharing a context hash, most confident first, then newest. */
  List<Neuron> findByContextHashOrderByConfidenceDescTimestampDesc(
      String contextHash, Pageable pageable);

  /** Finds neurons ordered by confidence, most confident first, then newest. */
  List<Neuron> findAllByOrderByConfidenceDescIdDesc(Pageable pageable);

  /** Finds prune candidates: older than the cutoff, below the confidence, no positive feedback. */
  List<Neuron> findByTimestampBeforeAndConfidenceLessThanAndUserFeedbackLessThanEqual(
      LocalDateTime cutoff, double minConfidence, int maxFeedback);

  /** Average confidence of neurons created after the given time, null when there are none. */
  @Query("SELECT AVG(n.confidence) FROM Neuron n WHERE n.timestamp > :since")
  Double averageConfidenceSince(@Param("since") LocalDateTime since);

  /** Neuron count and average confidence per skill id. */
  @Query(
      "SELECT new com.flamingo.ai.evomemory.domain.repository.SkillAggregate("
          + "n.skillId, COUNT(n), AVG(n.confidence)) "
          + "FROM Neuron n WHERE n.skillId IS NOT NULL GROUP BY n.skillId ORDER BY n.skillId")
  List<SkillAggregate> aggregateBySkill();
}
