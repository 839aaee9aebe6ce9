package com.flamingo.ai.evomemory;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.evomemory.config.EvoMemoryConfig;
import com.flamingo.ai.evomemory.service.evolution.RuleMiner;
import com.flamingo.ai.evomemory.service.memory.NeuronStore;
import com.flamingo.ai.evomemory.service.rag.RetrievalIndex;
import com.flamingo.ai.evomemory.service.scoring.ConfidenceScorer;
import com.flamingo.ai.evomemory.service.skill.SkillService;
import com.flamingo.ai.evomemory.service.stats.StatsService;
import java.nio.file.Path;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

/** Verifies the Spring application context loads against an empty SQLite file. */
@SpringBootTest
class ApplicationContextTest {

  @TempDir static Path dataDir;

  @DynamicPropertySource
  static void sqliteProperties(DynamicPropertyRegistry registry) {
    registry.add(
        "spring.datasource.url", () -> "jdbc:sqlite:" + dataDir.resolve("neurons.db"));
    registry.add(
        "evomemory.evolution.snapshot-path", () -> dataDir.resolve("instinct.json").toString());
  }

  @Autowired private ApplicationContext applicationContext;
  @Autowired private EvoMemoryConfig evoMemoryConfig;
  @Autowired private RetrievalIndex retrievalIndex;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(NeuronStore.class)).isNotNull();
    assertThat(applicationContext.getBean(RetrievalIndex.class)).isNotNull();
    assertThat(applicationContext.getBean(ConfidenceScorer.class)).isNotNull();
    assertThat(applicationContext.getBean(RuleMiner.class)).isNotNull();
    assertThat(applicationContext.getBean(StatsService.class)).isNotNull();
    assertThat(applicationContext.getBean(SkillService.class)).isNotNull();
  }

  @Test
  @DisplayName("Configuration defaults should be bound")
  void configurationDefaultsShouldBeBound() {
    assertThat(evoMemoryConfig.getRetrieval().getMaxNeurons()).isEqualTo(1000);
    assertThat(evoMemoryConfig.getScoring().getBaseline()).isEqualTo(0.5);
    assertThat(evoMemoryConfig.getEvolution().getMinNeurons()).isEqualTo(50);
    assertThat(evoMemoryConfig.getPruning().getKeepDays()).isEqualTo(30);
  }

  @Test
  @DisplayName("Startup warm-up should build the retrieval snapshot")
  void warmupShouldBuildSnapshot() {
    assertThat(retrievalIndex.isIndexed()).isTrue();
  }
}
