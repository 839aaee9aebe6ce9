package com.flamingo.ai.evomemory.service.memory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.springframework.util.DigestUtils;

/**
 * Short fingerprint of an input text used to bucket approximately equal questions. Not a security
 * primitive.
 */
public final class ContextHasher {

  static final int HASH_LENGTH = 8;

  private ContextHasher() {}

  /**
   * Computes the first 8 hex characters of the MD5 of the lower-cased, trimmed text.
   *
   * @param text the input text, may be null
   * @return the context hash
   */
  public static String hash(String text) {
    String normalized = text == null ? "" : text.toLowerCase(Locale.ROOT).strip();
    return DigestUtils.md5DigestAsHex(normalized.getBytes(StandardCharsets.UTF_8))
        .substring(0, HASH_LENGTH);
  }
}
