package com.flamingo.ai.evomemory.config;

import com.flamingo.ai.evomemory.domain.repository.NeuronRepository;
import com.flamingo.ai.evomemory.domain.repository.RuleRepository;
import io.micrometer.core.aop.TimedAspect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for application metrics. */
@Configuration
public class MetricsConfig {

  /**
   * Enables the @Timed annotation for method-level timing metrics.
   *
   * @param registry the meter registry
   * @return the timed aspect bean
   */
  @Bean
  public TimedAspect timedAspect(MeterRegistry registry) {
    return new TimedAspect(registry);
  }

  /**
   * Gauges over the stored memory, evaluated on each scrape.
   *
   * @param neuronRepository the neuron repository
   * @param ruleRepository the rule repository
   * @return the binder registering the gauges
   */
  @Bean
  public MeterBinder evoMemoryGauges(
      NeuronRepository neuronRepository, RuleRepository ruleRepository) {
    return registry -> {
      Gauge.builder("evomemory.neurons.total", neuronRepository, NeuronRepository::count)
          .description("Stored neurons")
          .register(registry);
      Gauge.builder("evomemory.rules.active", ruleRepository, RuleRepository::countByEnabledTrue)
          .description("Enabled rules")
          .register(registry);
    };
  }
}
