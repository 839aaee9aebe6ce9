package com.flamingo.ai.evomemory.service.memory;

import com.flamingo.ai.evomemory.config.EvoMemoryConfig;
import com.flamingo.ai.evomemory.domain.entity.Neuron;
import com.flamingo.ai.evomemory.domain.repository.NeuronRepository;
import com.flamingo.ai.evomemory.exception.NeuronValidationException;
import com.flamingo.ai.evomemory.exception.StorageException;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** SQLite-backed implementation of NeuronStore. */
@Service
@RequiredArgsConstructor
@Slf4j
public class NeuronStoreImpl implements NeuronStore {

  static final int SEARCH_PAGE_SIZE = 200;

  private final NeuronRepository neuronRepository;
  private final EvoMemoryConfig evoMemoryConfig;
  private final ApplicationEventPublisher eventPublisher;
  private final MeterRegistry meterRegistry;

  @Override
  @Transactional
  public long save(Neuron neuron) {
    validate(neuron);

    Neuron saved = execute("save", () -> neuronRepository.save(neuron));
    meterRegistry.counter("evomemory.neurons.saved").increment();
    log.debug(
        "Saved neuron {} (confidence={}, skill={})",
        saved.getId(),
        saved.getConfidence(),
        saved.getSkillId());

    eventPublisher.publishEvent(new NeuronSavedEvent(saved.getId()));
    return saved.getId();
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<Neuron> get(long id) {
    return execute("get", () -> neuronRepository.findById(id));
  }

  @Override
  public List<Neuron> recent(int limit) {
    return recent(limit, null);
  }

  @Override
  @Transactional(readOnly = true)
  public List<Neuron> recent(int limit, String skillId) {
    requirePositive("limit", limit);
    PageRequest page = PageRequest.of(0, limit);
    if (skillId != null) {
      return execute(
          "recent", () -> neuronRepository.findBySkillIdOrderByTimestampDescIdDesc(skillId, page));
    }
    return execute("recent", () -> neuronRepository.findAllByOrderByTimestampDescIdDesc(page));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Neuron> similar(String contextHash, int limit) {
    requirePositive("limit", limit);
    if (contextHash == null || contextHash.isBlank()) {
      return List.of();
    }
    return execute(
        "similar",
        () ->
            neuronRepository.findByContextHashOrderByConfidenceDescTimestampDesc(
                contextHash, PageRequest.of(0, limit)));
  }

  @Override
  @Transactional(readOnly = true)
  public List<Neuron> search(String text, int limit) {
    requirePositive("limit", limit);
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    String needle = text.toLowerCase(Locale.ROOT);
    List<Neuron> matches = new ArrayList<>();
    int pageNumber = 0;
    while (matches.size() < limit) {
      PageRequest page = PageRequest.of(pageNumber++, SEARCH_PAGE_SIZE);
      List<Neuron> batch =
          execute("search", () -> neuronRepository.findAllByOrderByConfidenceDescIdDesc(page));
      for (Neuron neuron : batch) {
        if (containsFolded(neuron.getInputText(), needle)
            || containsFolded(neuron.getOutputText(), needle)) {
          matches.add(neuron);
          if (matches.size() == limit) {
            break;
          }
        }
      }
      if (batch.size() < SEARCH_PAGE_SIZE) {
        break;
      }
    }
    log.debug("Search '{}' matched {} neurons", text, matches.size());
    return matches;
  }

  // SQLite LOWER() and LIKE only fold ASCII, so matching happens here
  private static boolean containsFolded(String haystack, String needle) {
    return haystack != null && haystack.toLowerCase(Locale.ROOT).contains(needle);
  }

  @Override
  @Transactional
  public boolean updateFeedback(long id, int feedback) {
    if (feedback < -1 || feedback > 1) {
      log.warn("Rejected feedback {} for neuron {}", feedback, id);
      throw new NeuronValidationException("user_feedback", "must be -1, 0 or 1, got " + feedback);
    }

    Optional<Neuron> neuron = execute("update_feedback", () -> neuronRepository.findById(id));
    if (neuron.isEmpty()) {
      log.debug("Feedback for unknown neuron {}", id);
      return false;
    }

    Neuron updated = neuron.get();
    updated.applyFeedback(feedback);
    execute("update_feedback", () -> neuronRepository.save(updated));
    meterRegistry.counter("evomemory.feedback.updated").increment();
    log.debug("Neuron {} feedback={} mood={}", id, feedback, updated.getMood().getValue());
    return true;
  }

  @Override
  @Transactional
  public int prune(int keepDays, double minConfidence) {
    if (keepDays < 0) {
      throw new NeuronValidationException("keep_days", "must not be negative");
    }
    LocalDateTime cutoff = LocalDateTime.now().minusDays(keepDays);

    List<Neuron> candidates =
        execute(
            "prune",
            () ->
                neuronRepository
                    .findByTimestampBeforeAndConfidenceLessThanAndUserFeedbackLessThanEqual(
                        cutoff, minConfidence, 0));
    if (candidates.isEmpty()) {
      return 0;
    }

    execute(
        "prune",
        () -> {
          neuronRepository.deleteAll(candidates);
          return null;
        });
    meterRegistry.counter("evomemory.neurons.pruned").increment(candidates.size());
    log.info(
        "Pruned {} neurons older than {} days with confidence < {}",
        candidates.size(),
        keepDays,
        minConfidence);
    return candidates.size();
  }

  @Override
  public int prune() {
    EvoMemoryConfig.Pruning pruning = evoMemoryConfig.getPruning();
    return prune(pruning.getKeepDays(), pruning.getMinConfidence());
  }

  @Override
  @Transactional
  public void recordAccess(Collection<Long> ids) {
    if (ids == null || ids.isEmpty()) {
      return;
    }
    List<Neuron> neurons = execute("record_access", () -> neuronRepository.findAllById(ids));
    for (Neuron neuron : neurons) {
      neuron.recordAccess();
    }
    if (!neurons.isEmpty()) {
      execute("record_access", () -> neuronRepository.saveAll(neurons));
    }
  }

  @Override
  @Transactional(readOnly = true)
  public long count() {
    return execute("count", neuronRepository::count);
  }

  private void validate(Neuron neuron) {
    if (neuron == null) {
      throw new NeuronValidationException("neuron", "must not be null");
    }
    if (neuron.getId() != null) {
      throw new NeuronValidationException("id", "is assigned by the store");
    }
    if (neuron.getInputText() == null) {
      throw new NeuronValidationException("input_text", "is required");
    }
    if (neuron.getOutputText() == null) {
      throw new NeuronValidationException("output_text", "is required");
    }
    double confidence = neuron.getConfidence();
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      log.warn("Rejected neuron with confidence {}", confidence);
      throw new NeuronValidationException(
          "confidence", "must be within [0, 1], got " + confidence);
    }
    int feedback = neuron.getUserFeedback();
    if (feedback < -1 || feedback > 1) {
      throw new NeuronValidationException("user_feedback", "must be -1, 0 or 1, got " + feedback);
    }
  }

  private static void requirePositive(String field, int value) {
    if (value <= 0) {
      throw new NeuronValidationException(field, "must be positive, got " + value);
    }
  }

  private <T> T execute(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException e) {
      log.error("Neuron store operation '{}' failed: {}", operation, e.getMessage(), e);
      throw new StorageException(operation, e);
    }
  }
}
