package com.flamingo.ai.evomemory.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.evomemory.exception.StorageException;
import com.flamingo.ai.evomemory.service.rag.RetrievalIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetrievalIndexWarmupTest {

  @Mock private RetrievalIndex retrievalIndex;

  private EvoMemoryConfig config;
  private RetrievalIndexWarmup warmup;

  @BeforeEach
  void setUp() {
    config = new EvoMemoryConfig();
    warmup = new RetrievalIndexWarmup(retrievalIndex, config);
  }

  @Test
  @DisplayName("should build the startup snapshot with the smaller window")
  void shouldWarmUpWithStartupWindow() {
    when(retrievalIndex.reindex(500)).thenReturn(42);

    warmup.run();

    verify(retrievalIndex).reindex(500);
  }

  @Test
  @DisplayName("should skip warm-up when disabled")
  void shouldSkipWhenDisabled() {
    config.getRetrieval().setWarmupOnStartup(false);

    warmup.run();

    verify(retrievalIndex, never()).reindex(anyInt());
  }

  @Test
  @DisplayName("should not fail startup when the store is unavailable")
  void shouldSurviveStorageFailure() {
    when(retrievalIndex.reindex(500))
        .thenThrow(new StorageException("recent", new RuntimeException("locked")));

    assertThatCode(() -> warmup.run()).doesNotThrowAnyException();
  }
}
