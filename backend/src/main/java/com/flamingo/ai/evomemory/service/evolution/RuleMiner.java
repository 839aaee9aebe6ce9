package com.flamingo.ai.evomemory.service.evolution;

import com.flamingo.ai.evomemory.config.EvoMemoryConfig;
import com.flamingo.ai.evomemory.domain.entity.Neuron;
import com.flamingo.ai.evomemory.domain.entity.Rule;
import com.flamingo.ai.evomemory.domain.enums.Mood;
import com.flamingo.ai.evomemory.domain.repository.RuleRepository;
import com.flamingo.ai.evomemory.exception.StorageException;
import com.flamingo.ai.evomemory.service.memory.NeuronStore;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

/**
 * Auto-evolution: mines recurring patterns in recent neurons and persists them as rules.
 *
 * <p>Each pass reads one window of recent neurons in a single query and runs four independent
 * heuristics over prefixes of it:
 *
 * <ul>
 *   <li>skills whose neurons are confidently answered on average
 *   <li>words that keep showing up in responses the user rated negatively
 *   <li>input keywords that keep leading to very confident responses
 *   <li>topics that keep leading to unconfident responses and deserve a clarifying question
 * </ul>
 *
 * <p>Rules are de-duplicated by exact rule text, backed by a unique constraint; each insertion is
 * its own transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RuleMiner {

  private static final int KEYWORDS_PER_INPUT = 3;
  private static final int TOPIC_WORDS_PER_INPUT = 5;
  private static final int AVOID_WORD_MIN_LENGTH = 4;

  private static final double SKILL_MIN_AVG_CONFIDENCE = 0.7;
  private static final int MIN_NEGATIVE_NEURONS = 3;
  private static final int TOP_AVOID_WORDS = 5;
  private static final double HIGH_CONFIDENCE = 0.8;
  private static final int MIN_HIGH_CONFIDENCE_NEURONS = 5;
  private static final int TOP_HIGH_CONFIDENCE_KEYWORDS = 3;
  private static final double LOW_CONFIDENCE = 0.4;
  private static final int MIN_LOW_CONFIDENCE_NEURONS = 5;
  private static final int TOP_CLARIFY_TOPICS = 2;
  private static final int MIN_WORD_COUNT = 3;

  private final NeuronStore neuronStore;
  private final RuleRepository ruleRepository;
  private final KeywordExtractor keywordExtractor;
  private final RuleSnapshotExporter ruleSnapshotExporter;
  private final EvoMemoryConfig evoMemoryConfig;
  private final MeterRegistry meterRegistry;

  /**
   * Groups the most recent neurons by skill, by mood and by the first keywords of their input.
   *
   * @param limit number of recent neurons to analyze
   * @return the groups
   */
  public PatternGroups analyze(int limit) {
    return group(neuronStore.recent(limit));
  }

  /** Generates rules with the configured minimum group size. */
  public List<Rule> generateRules() {
    return generateRules(evoMemoryConfig.getEvolution().getMinOccurrences());
  }

  /**
   * Runs the four mining heuristics over the recent neurons. Nothing is persisted.
   *
   * @param minOccurrences minimum skill group size for a skill rule
   * @return the candidate rules, in heuristic order
   */
  public List<Rule> generateRules(int minOccurrences) {
    EvoMemoryConfig.Evolution evolution = evoMemoryConfig.getEvolution();
    int window =
        Stream.of(
                evolution.getAnalysisWindow(),
                evolution.getFeedbackWindow(),
                evolution.getHighConfidenceWindow(),
                evolution.getLowConfidenceWindow())
            .max(Integer::compare)
            .orElse(evolution.getAnalysisWindow());
    List<Neuron> neurons = neuronStore.recent(window);

    List<Rule> rules = new ArrayList<>();
    rules.addAll(
        skillConfidenceRules(
            group(head(neurons, evolution.getAnalysisWindow())), minOccurrences));
    rules.addAll(avoidWordRules(head(neurons, evolution.getFeedbackWindow())));
    rules.addAll(highConfidenceRules(head(neurons, evolution.getHighConfidenceWindow())));
    rules.addAll(clarificationRules(head(neurons, evolution.getLowConfidenceWindow())));

    meterRegistry.counter("evomemory.rules.generated").increment(rules.size());
    log.debug("Generated {} candidate rules from {} neurons", rules.size(), neurons.size());
    return rules;
  }

  /**
   * Inserts every rule whose text is not stored yet.
   *
   * @param rules candidate rules
   * @return number of rules inserted
   * @throws StorageException if a lookup or insertion fails; earlier insertions stay committed
   */
  public int saveRules(List<Rule> rules) {
    int saved = 0;
    for (Rule rule : rules) {
      boolean exists =
          execute("save_rules", () -> ruleRepository.existsByRuleText(rule.getRuleText()));
      if (!exists && insert(rule)) {
        saved++;
      }
    }
    if (saved > 0) {
      meterRegistry.counter("evomemory.rules.saved").increment(saved);
      log.info("Saved {} new rules ({} candidates)", saved, rules.size());
    }
    return saved;
  }

  /** Runs an evolution pass with the configured minimum store size. */
  public EvolutionResult autoEvolve() {
    return autoEvolve(evoMemoryConfig.getEvolution().getMinNeurons());
  }

  /**
   * Full evolution pass: generate rules, store the new ones and export a snapshot.
   *
   * @param minNeurons the pass is skipped while the store holds fewer neurons
   * @return counts and a summary message
   */
  @Timed(value = "evomemory.evolve", description = "Time for an auto-evolution pass")
  public EvolutionResult autoEvolve(int minNeurons) {
    long total = neuronStore.count();
    if (total < minNeurons) {
      log.info("Skipping evolution: {} neurons < {}", total, minNeurons);
      return new EvolutionResult(
          total, 0, 0, String.format("Not enough neurons (%d < %d)", total, minNeurons));
    }

    List<Rule> rules = generateRules(evoMemoryConfig.getEvolution().getMinOccurrences());
    int saved = saveRules(rules);
    ruleSnapshotExporter.export(rules);

    String message = String.format("Generated %d rules, saved %d new ones", rules.size(), saved);
    log.info("Evolution pass over {} neurons: {}", total, message);
    return new EvolutionResult(total, rules.size(), saved, message);
  }

  /** Enabled rules, most urgent first. */
  public List<Rule> activeRules() {
    return execute("active_rules", ruleRepository::findByEnabledTrueOrderByPriorityDescIdAsc);
  }

  private PatternGroups group(List<Neuron> neurons) {
    Map<String, List<Neuron>> bySkill = new LinkedHashMap<>();
    Map<Mood, List<Neuron>> byMood = new LinkedHashMap<>();
    Map<String, List<Neuron>> byKeyword = new LinkedHashMap<>();

    for (Neuron neuron : neurons) {
      if (neuron.getSkillId() != null) {
        bySkill.computeIfAbsent(neuron.getSkillId(), k -> new ArrayList<>()).add(neuron);
      }
      byMood.computeIfAbsent(neuron.getMood(), k -> new ArrayList<>()).add(neuron);
      keywordExtractor.extractKeywords(neuron.getInputText()).stream()
          .limit(KEYWORDS_PER_INPUT)
          .forEach(kw -> byKeyword.computeIfAbsent(kw, k -> new ArrayList<>()).add(neuron));
    }
    return new PatternGroups(bySkill, byMood, byKeyword);
  }

  private List<Rule> skillConfidenceRules(PatternGroups groups, int minOccurrences) {
    List<Rule> rules = new ArrayList<>();
    groups
        .bySkill()
        .forEach(
            (skillId, members) -> {
              if (members.size() < minOccurrences) {
                return;
              }
              double avg =
                  members.stream().mapToDouble(Neuron::getConfidence).average().orElse(0.0);
              if (avg > SKILL_MIN_AVG_CONFIDENCE) {
                rules.add(
                    rule(
                        "Use high confidence for " + skillId + " tasks",
                        "skill_id:" + skillId,
                        avg,
                        2));
              }
            });
    return rules;
  }

  private List<Rule> avoidWordRules(List<Neuron> window) {
    List<Neuron> negative = window.stream().filter(n -> n.getUserFeedback() < 0).toList();
    if (negative.size() < MIN_NEGATIVE_NEURONS) {
      return List.of();
    }
    Stream<String> words =
        negative.stream()
            .flatMap(
                n ->
                    keywordExtractor
                        .extractKeywords(n.getOutputText(), AVOID_WORD_MIN_LENGTH)
                        .stream());

    List<Rule> rules = new ArrayList<>();
    for (Map.Entry<String, Integer> entry : mostCommon(words, TOP_AVOID_WORDS)) {
      if (entry.getValue() >= MIN_WORD_COUNT) {
        String word = entry.getKey();
        rules.add(
            rule(
                "Avoid using '" + word + "' in responses (negative feedback pattern)",
                "avoid_word:" + word,
                0.3,
                3));
      }
    }
    return rules;
  }

  private List<Rule> highConfidenceRules(List<Neuron> window) {
    List<Neuron> confident =
        window.stream().filter(n -> n.getConfidence() > HIGH_CONFIDENCE).toList();
    if (confident.size() < MIN_HIGH_CONFIDENCE_NEURONS) {
      return List.of();
    }
    Stream<String> keywords =
        confident.stream()
            .flatMap(n -> keywordExtractor.extractKeywords(n.getInputText()).stream());

    List<Rule> rules = new ArrayList<>();
    for (Map.Entry<String, Integer> entry : mostCommon(keywords, TOP_HIGH_CONFIDENCE_KEYWORDS)) {
      if (entry.getValue() >= MIN_WORD_COUNT) {
        String keyword = entry.getKey();
        rules.add(
            rule(
                "High confidence pattern detected for '" + keyword + "' queries",
                "keyword:" + keyword,
                HIGH_CONFIDENCE,
                1));
      }
    }
    return rules;
  }

  private List<Rule> clarificationRules(List<Neuron> window) {
    List<Neuron> unsure = window.stream().filter(n -> n.getConfidence() < LOW_CONFIDENCE).toList();
    if (unsure.size() < MIN_LOW_CONFIDENCE_NEURONS) {
      return List.of();
    }
    Stream<String> topics =
        unsure.stream()
            .flatMap(
                n ->
                    keywordExtractor.words(n.getInputText()).stream()
                        .limit(TOPIC_WORDS_PER_INPUT)
                        .filter(w -> w.length() > KeywordExtractor.DEFAULT_MIN_LENGTH));

    List<Rule> rules = new ArrayList<>();
    for (Map.Entry<String, Integer> entry : mostCommon(topics, TOP_CLARIFY_TOPICS)) {
      if (entry.getValue() >= MIN_WORD_COUNT) {
        String topic = entry.getKey();
        rules.add(
            rule(
                "Ask clarification for '" + topic + "' topics (low confidence pattern)",
                "clarify:" + topic,
                LOW_CONFIDENCE,
                2));
      }
    }
    return rules;
  }

  /** Top entries by count; equal counts keep first-seen order. */
  private static List<Map.Entry<String, Integer>> mostCommon(Stream<String> words, int top) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    words.forEach(word -> counts.merge(word, 1, Integer::sum));
    return counts.entrySet().stream()
        .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
        .limit(top)
        .toList();
  }

  private static List<Neuron> head(List<Neuron> neurons, int size) {
    return neurons.subList(0, Math.min(size, neurons.size()));
  }

  private static Rule rule(String text, String trigger, double threshold, int priority) {
    return Rule.builder()
        .ruleText(text)
        .triggerPattern(trigger)
        .confidenceThreshold(threshold)
        .priority(priority)
        .enabled(true)
        .build();
  }

  /** Inserts one rule; false when a concurrent pass stored the same text first. */
  private boolean insert(Rule rule) {
    try {
      ruleRepository.save(rule);
      return true;
    } catch (DataIntegrityViolationException e) {
      log.debug("Rule '{}' was stored concurrently, skipping", rule.getRuleText());
      return false;
    } catch (DataAccessException e) {
      log.error("Rule storage operation 'save_rules' failed: {}", e.getMessage(), e);
      throw new StorageException("save_rules", e);
    }
  }

  private <T> T execute(String operation, Supplier<T> action) {
    try {
      return action.get();
    } catch (DataAccessException e) {
      log.error("Rule storage operation '{}' failed: {}", operation, e.getMessage(), e);
      throw new StorageException(operation, e);
    }
  }
}
