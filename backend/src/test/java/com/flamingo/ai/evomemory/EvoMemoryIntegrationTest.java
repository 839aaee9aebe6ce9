package com.flamingo.ai.evomemory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.evomemory.domain.entity.Neuron;
import com.flamingo.ai.evomemory.domain.entity.Rule;
import com.flamingo.ai.evomemory.domain.enums.Mood;
import com.flamingo.ai.evomemory.domain.repository.NeuronRepository;
import com.flamingo.ai.evomemory.domain.repository.RuleRepository;
import com.flamingo.ai.evomemory.domain.repository.SkillRepository;
import com.flamingo.ai.evomemory.service.evolution.EvolutionResult;
import com.flamingo.ai.evomemory.service.evolution.RuleMiner;
import com.flamingo.ai.evomemory.service.memory.ContextHasher;
import com.flamingo.ai.evomemory.service.memory.NeuronStore;
import com.flamingo.ai.evomemory.service.rag.RetrievalIndex;
import com.flamingo.ai.evomemory.service.rag.ScoredNeuron;
import com.flamingo.ai.evomemory.service.skill.SkillService;
import com.flamingo.ai.evomemory.service.skill.SkillSummary;
import com.flamingo.ai.evomemory.service.stats.EvoMemoryStats;
import com.flamingo.ai.evomemory.service.stats.StatsService;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/**
 * End-to-end test over a real SQLite file: storage, retrieval, evolution and stats wired by Spring.
 */
@SpringBootTest
@DisplayName("EvoMemory Integration Test")
class EvoMemoryIntegrationTest {

  @TempDir static Path dataDir;

  @DynamicPropertySource
  static void sqliteProperties(DynamicPropertyRegistry registry) {
    registry.add(
        "spring.datasource.url", () -> "jdbc:sqlite:" + dataDir.resolve("neurons.db"));
    registry.add(
        "evomemory.evolution.snapshot-path", () -> dataDir.resolve("instinct.json").toString());
    registry.add("evomemory.retrieval.warmup-on-startup", () -> "false");
    registry.add("evomemory.retrieval.reindex-every", () -> "0");
  }

  @Autowired private NeuronStore neuronStore;
  @Autowired private RetrievalIndex retrievalIndex;
  @Autowired private RuleMiner ruleMiner;
  @Autowired private StatsService statsService;
  @Autowired private SkillService skillService;
  @Autowired private NeuronRepository neuronRepository;
  @Autowired private RuleRepository ruleRepository;
  @Autowired private SkillRepository skillRepository;

  @BeforeEach
  void cleanUp() {
    neuronRepository.deleteAll();
    ruleRepository.deleteAll();
    skillRepository.deleteAll();
  }

  private long store(String input, String output, double confidence, String skill) {
    return neuronStore.save(
        Neuron.builder()
            .inputText(input)
            .outputText(output)
            .confidence(confidence)
            .skillId(skill)
            .build());
  }

  @Test
  @DisplayName("should store, read back and rate a neuron")
  void shouldStoreAndRateNeuron() {
    long id = store("Accendi il LED", "OK, GPIO 17 attivo", 0.8, "gpio");

    Neuron stored = neuronStore.get(id).orElseThrow();
    assertThat(stored.getInputText()).isEqualTo("Accendi il LED");
    assertThat(stored.getMood()).isEqualTo(Mood.NEUTRAL);
    assertThat(stored.getContextHash()).isEqualTo(ContextHasher.hash("Accendi il LED"));
    assertThat(stored.getTimestamp()).isNotNull();

    assertThat(neuronStore.updateFeedback(id, 1)).isTrue();
    Neuron rated = neuronStore.get(id).orElseThrow();
    assertThat(rated.getUserFeedback()).isEqualTo(1);
    assertThat(rated.getMood()).isEqualTo(Mood.POSITIVE);
    assertThat(rated.getConfidence()).isEqualTo(0.8);

    assertThat(neuronStore.updateFeedback(id + 1000, 1)).isFalse();
  }

  @Test
  @DisplayName("should query by recency, context hash and text")
  void shouldQueryNeurons() {
    long first = store("Accendi il LED", "OK", 0.6, "gpio");
    long second = store("accendi il led  ", "Fatto", 0.9, null);
    long third = store("Che ore sono", "Le dieci", 0.5, null);

    assertThat(neuronStore.recent(2)).extracting(Neuron::getId).containsExactly(third, second);
    assertThat(neuronStore.recent(10, "gpio")).extracting(Neuron::getId).containsExactly(first);
    assertThat(neuronStore.similar(ContextHasher.hash("ACCENDI IL LED"), 5))
        .extracting(Neuron::getId)
        .containsExactly(second, first);
    assertThat(neuronStore.search("DIECI", 5)).extracting(Neuron::getId).containsExactly(third);
    assertThat(neuronStore.count()).isEqualTo(3);
  }

  @Test
  @DisplayName("should search literally and fold accented capitals")
  void shouldSearchLiterallyAcrossCases() {
    long ohm = store("Che resistenza uso?", "Usa 500 ohm", 0.7, null);
    store("Come scrivo sul pin?", "Chiama gpioXwrite", 0.7, null);
    long led = store("Stato del LED", "Il LED È spento", 0.7, null);
    long percent = store("Duty cycle", "Imposta il 50% di duty", 0.7, null);

    assertThat(neuronStore.search("50%", 5)).extracting(Neuron::getId).containsExactly(percent);
    assertThat(neuronStore.search("gpio_write", 5)).isEmpty();
    assertThat(neuronStore.search("è spento", 5)).extracting(Neuron::getId).containsExactly(led);
    assertThat(neuronStore.search("È SPENTO", 5)).extracting(Neuron::getId).containsExactly(led);
    assertThat(neuronStore.search("500 OHM", 5)).extracting(Neuron::getId).containsExactly(ohm);
  }

  @Test
  @DisplayName("should prune old unconfident neurons without positive feedback")
  void shouldPrune() throws InterruptedException {
    long weak = store("Boh", "Non so", 0.1, null);
    long liked = store("Boh", "Non so", 0.1, null);
    long strong = store("Accendi il LED", "OK", 0.9, null);
    neuronStore.updateFeedback(liked, 1);
    Thread.sleep(50);

    int pruned = neuronStore.prune(0, 0.3);

    assertThat(pruned).isEqualTo(1);
    assertThat(neuronStore.get(weak)).isEmpty();
    assertThat(neuronStore.get(liked)).isPresent();
    assertThat(neuronStore.get(strong)).isPresent();
    assertThat(neuronStore.prune(30, 0.3)).isZero();
  }

  @Test
  @DisplayName("should retrieve LED neurons and build prompt context")
  void shouldRetrieveAndBuildContext() {
    long on = store("Accendi il LED rosso", "OK, GPIO 17 attivo", 0.5, null);
    long off = store("Spegni il LED", "OK, GPIO 17 su LOW", 0.5, null);
    store("Che temperatura fa?", "22.5°C", 0.5, null);
    long sensor = store("Leggi la temperatura del sensore", "Il sensore segna 22 gradi", 0.9, null);

    assertThat(retrievalIndex.reindex()).isEqualTo(4);

    List<ScoredNeuron> results = retrievalIndex.retrieve("Come controllo un LED?", 3);
    assertThat(results.get(0).neuron().getId()).isIn(on, off);

    String context = retrievalIndex.getContextForPrompt("temperatura sensore");
    assertThat(context).startsWith("### Relevant past experiences:");
    assertThat(context).contains("Leggi la temperatura del sensore");
    assertThat(neuronStore.get(sensor).orElseThrow().getAccessCount()).isEqualTo(1);
  }

  @Test
  @DisplayName("should evolve a skill rule once and export it")
  void shouldEvolveRules() throws Exception {
    store("Accendi pin", "Fatto", 0.92, "gpio");
    store("Spegni pin", "Fatto", 0.90, "gpio");
    store("Leggi pin", "Alto", 0.88, "gpio");

    EvolutionResult first = ruleMiner.autoEvolve(3);
    EvolutionResult second = ruleMiner.autoEvolve(3);

    assertThat(first.rulesSaved()).isEqualTo(1);
    assertThat(second.rulesSaved()).isZero();
    List<Rule> rules = ruleMiner.activeRules();
    assertThat(rules).hasSize(1);
    assertThat(rules.get(0).getTriggerPattern()).isEqualTo("skill_id:gpio");
    assertThat(rules.get(0).getConfidenceThreshold()).isCloseTo(0.90, within(1e-9));
    assertThat(rules.get(0).getPriority()).isEqualTo(2);
    assertThat(rules.get(0).getCreatedAt()).isNotNull();
    assertThat(Files.readString(dataDir.resolve("instinct.json"))).contains("skill_id:gpio");
  }

  @Test
  @DisplayName("should reject a second rule with the same text")
  void shouldEnforceUniqueRuleText() {
    ruleRepository.save(Rule.builder().ruleText("Use high confidence for gpio tasks").build());

    assertThatThrownBy(
            () ->
                ruleRepository.save(
                    Rule.builder().ruleText("Use high confidence for gpio tasks").build()))
        .isInstanceOf(DataIntegrityViolationException.class);
    assertThat(ruleRepository.count()).isEqualTo(1);
  }

  @Test
  @DisplayName("should report stats and skill aggregates")
  void shouldReportStatsAndSkills() {
    store("Accendi pin", "Fatto", 0.8, "gpio");
    store("Spegni pin", "Fatto", 0.6, "gpio");
    store("Suona nota", "Fatto", 0.5, "audio");
    skillService.register("gpio", "GPIO", "Pins and LEDs");

    EvoMemoryStats stats = statsService.getStats();
    assertThat(stats.getNeurons()).isEqualTo(3);
    assertThat(stats.getActiveSkills()).isEqualTo(1);
    assertThat(stats.getAvgConfidence()).isCloseTo(0.6333, within(1e-3));

    List<SkillSummary> skills = skillService.listSkills();
    assertThat(skills).extracting(SkillSummary::id).containsExactly("gpio", "audio");
    assertThat(skills.get(0).neuronCount()).isEqualTo(2);
    assertThat(skills.get(0).avgConfidence()).isCloseTo(0.7, within(1e-9));
    assertThat(skills.get(1).name()).isEqualTo("audio");
  }
}
