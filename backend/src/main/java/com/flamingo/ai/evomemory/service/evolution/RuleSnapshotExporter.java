package com.flamingo.ai.evomemory.service.evolution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.evomemory.config.EvoMemoryConfig;
import com.flamingo.ai.evomemory.domain.entity.Rule;
import com.flamingo.ai.evomemory.exception.StorageException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Writes the JSON rule snapshot next to the database. */
@Component
@RequiredArgsConstructor
@Slf4j
public class RuleSnapshotExporter {

  private final ObjectMapper objectMapper;
  private final EvoMemoryConfig evoMemoryConfig;

  /**
   * Exports the rules, replacing any previous snapshot.
   *
   * @param rules the rules of the last evolution pass
   * @return path of the written file
   * @throws StorageException if the file cannot be written
   */
  public Path export(List<Rule> rules) {
    Path path = Path.of(evoMemoryConfig.getEvolution().getSnapshotPath());
    RuleSnapshot snapshot = RuleSnapshot.of(rules);
    try {
      Path parent = path.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), snapshot);
    } catch (IOException e) {
      log.error("Failed to export rule snapshot to {}: {}", path, e.getMessage(), e);
      throw new StorageException("export_rules", "Failed to write rule snapshot " + path, e);
    }
    log.info("Exported {} rules to {}", snapshot.rulesCount(), path);
    return path;
  }
}
