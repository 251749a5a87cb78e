package com.flamingo.ai.deepresearch.service.research.scoring;

import com.flamingo.ai.deepresearch.domain.model.Source;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic term-overlap scorer: {@code 0.4 * titleCoverage + 0.6 * bodyCoverage}, where
 * coverage is the fraction of distinct query terms found in the title, or in snippet plus page
 * text.
 */
@Component
@ConditionalOnProperty(
    name = "research.dedup.scoring",
    havingValue = "lexical",
    matchIfMissing = true)
public class LexicalRelevanceScorer implements RelevanceScorer {

  static final double TITLE_WEIGHT = 0.4;
  static final double BODY_WEIGHT = 0.6;

  private static final Pattern TOKEN = Pattern.compile("[\\p{L}\\p{N}]+");
  private static final int MIN_TOKEN_LENGTH = 2;

  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "have", "how",
          "in", "is", "it", "its", "of", "on", "or", "that", "the", "this", "to", "was", "were",
          "what", "when", "where", "which", "who", "why", "will", "with", "about", "into", "than",
          "then", "there", "these", "those", "do", "does", "did", "can", "could", "should",
          "would", "vs", "versus");

  @Override
  public String name() {
    return "lexical";
  }

  @Override
  public double score(String query, Source source) {
    Set<String> queryTerms = tokenize(query);
    if (queryTerms.isEmpty()) {
      return 0.0;
    }
    Set<String> titleTerms = tokenize(source.getTitle());
    Set<String> bodyTerms = tokenize(source.getSnippet());
    bodyTerms.addAll(tokenize(source.getRawContent()));

    double titleCoverage = coverage(queryTerms, titleTerms);
    double bodyCoverage = coverage(queryTerms, bodyTerms);
    double score = TITLE_WEIGHT * titleCoverage + BODY_WEIGHT * bodyCoverage;
    return Math.max(0.0, Math.min(1.0, score));
  }

  /** Lower-cased letter/digit tokens of at least two characters, stop words removed. */
  static Set<String> tokenize(String text) {
    Set<String> tokens = new LinkedHashSet<>();
    if (text == null || text.isBlank()) {
      return tokens;
    }
    Matcher matcher = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      String token = matcher.group();
      if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
        tokens.add(token);
      }
    }
    return tokens;
  }

  private static double coverage(Set<String> queryTerms, Set<String> candidateTerms) {
    long matched = queryTerms.stream().filter(candidateTerms::contains).count();
    return (double) matched / queryTerms.size();
  }
}
