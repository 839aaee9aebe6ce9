package com.flamingo.ai.evomemory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the EvoMemory episodic memory service. */
@SpringBootApplication
public class EvoMemoryApplication {

  /** Default location of the SQLite database and the rule snapshot. */
  static final Path DATA_DIR = Path.of("data", "evomemory");

  public static void main(String[] args) throws IOException {
    // sqlite-jdbc does not create parent directories
    Files.createDirectories(DATA_DIR);
    SpringApplication.run(EvoMemoryApplication.class, args);
  }
}
