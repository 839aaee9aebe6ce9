package com.flamingo.ai.evomemory.service.evolution;

import com.flamingo.ai.evomemory.service.rag.TextTokenizer;
import java.util.List;
import org.springframework.stereotype.Component;

/** Keyword extraction by whitespace tokenization and a length filter. */
@Component
public class WhitespaceKeywordExtractor implements KeywordExtractor {

  @Override
  public List<String> words(String text) {
    return TextTokenizer.tokenize(text);
  }
}
