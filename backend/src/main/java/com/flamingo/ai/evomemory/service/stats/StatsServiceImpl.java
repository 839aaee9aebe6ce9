package com.flamingo.ai.evomemory.service.stats;

import com.flamingo.ai.evomemory.domain.repository.MetaNeuronRepository;
import com.flamingo.ai.evomemory.domain.repository.NeuronRepository;
import com.flamingo.ai.evomemory.domain.repository.RuleRepository;
import com.flamingo.ai.evomemory.domain.repository.SkillRepository;
import com.flamingo.ai.evomemory.exception.StorageException;
import com.flamingo.ai.evomemory.service.rag.RetrievalIndex;
import io.micrometer.core.annotation.Timed;
import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Implementation of StatsService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatsServiceImpl implements StatsService {

  private static final int RECENT_DAYS = 7;

  private final NeuronRepository neuronRepository;
  private final MetaNeuronRepository metaNeuronRepository;
  private final RuleRepository ruleRepository;
  private final SkillRepository skillRepository;
  private final RetrievalIndex retrievalIndex;

  @Override
  @Transactional(readOnly = true)
  @Timed(value = "evomemory.stats", description = "Time to get memory stats")
  public EvoMemoryStats getStats() {
    try {
      Double avgConfidence =
          neuronRepository.averageConfidenceSince(LocalDateTime.now().minusDays(RECENT_DAYS));

      return EvoMemoryStats.builder()
          .neurons(neuronRepository.count())
          .metaNeurons(metaNeuronRepository.count())
          .activeRules(ruleRepository.countByEnabledTrue())
          .activeSkills(skillRepository.countByEnabledTrue())
          .avgConfidence(avgConfidence == null ? 0.0 : avgConfidence)
          .indexedNeurons(retrievalIndex.indexedCount())
          .timestamp(LocalDateTime.now())
          .build();
    } catch (DataAccessException e) {
      log.error("Failed to read memory stats: {}", e.getMessage(), e);
      throw new StorageException("stats", e);
    }
  }
}
