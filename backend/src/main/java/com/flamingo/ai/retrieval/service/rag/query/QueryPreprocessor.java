package com.flamingo.ai.retrieval.service.rag.query;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Cleans raw user queries before retrieval: collapses whitespace, fixes a handful of common typos,
 * expands chat abbreviations and tidies punctuation. Also extracts highlight keywords.
 */
@Component
@Slf4j
public class QueryPreprocessor {

  private static final Map<String, String> TYPOS =
      Map.of(
          "teh", "the",
          "taht", "that",
          "waht", "what",
          "dont", "don't",
          "cant", "can't",
          "wont", "won't",
          "didnt", "didn't",
          "doesnt", "doesn't");

  private static final Map<String, String> ABBREVIATIONS =
      Map.ofEntries(
          Map.entry("pls", "please"),
          Map.entry("thx", "thanks"),
          Map.entry("ty", "thank you"),
          Map.entry("btw", "by the way"),
          Map.entry("fyi", "for your information"),
          Map.entry("asap", "as soon as possible"),
          Map.entry("imo", "in my opinion"),
          Map.entry("imho", "in my humble opinion"),
          Map.entry("tl;dr", "summary"),
          Map.entry("tldr", "summary"),
          Map.entry("afaik", "as far as I know"),
          Map.entry("iirc", "if I recall correctly"),
          Map.entry("etc", "et cetera"),
          Map.entry("vs", "versus"),
          Map.entry("e.g", "for example"),
          Map.entry("i.e", "that is"));

  private static final Set<String> STOPWORDS =
      Set.of(
          "a", "an", "the", "is", "are", "was", "were", "be", "been", "being", "have", "has", "had",
          "do", "does", "did", "will", "would", "should", "could", "may", "might", "must", "can",
          "of", "to", "in", "on", "at", "by", "for", "with", "about", "as", "from", "that", "this",
          "what", "which", "who", "when", "where", "why", "how", "it", "its");

  private static final Pattern REPEATED_PUNCTUATION = Pattern.compile("([.!?]){2,}");
  private static final Pattern SPACE_BEFORE_PUNCTUATION = Pattern.compile("\\s+([.!?,;:])");

  /** Returns the cleaned query; {@code null} and blank input are returned as-is. */
  public String preprocess(String query) {
    if (query == null || query.isBlank()) {
      return query;
    }
    String cleaned =
        Arrays.stream(query.strip().split("\\s+"))
            .map(word -> TYPOS.getOrDefault(word.toLowerCase(Locale.ROOT), word))
            .map(word -> ABBREVIATIONS.getOrDefault(word.toLowerCase(Locale.ROOT), word))
            .collect(Collectors.joining(" "));
    cleaned = REPEATED_PUNCTUATION.matcher(cleaned).replaceAll("$1");
    cleaned = SPACE_BEFORE_PUNCTUATION.matcher(cleaned).replaceAll("$1");
    cleaned = cleaned.strip();

    if (!cleaned.equals(query)) {
      log.debug("Query preprocessed: '{}' -> '{}'", query, cleaned);
    }
    return cleaned;
  }

  /** Lower-cased query words longer than two characters that are not stopwords. */
  public List<String> extractKeywords(String query) {
    if (query == null || query.isBlank()) {
      return List.of();
    }
    return Arrays.stream(query.toLowerCase(Locale.ROOT).strip().split("\\s+"))
        .filter(word -> !STOPWORDS.contains(word) && word.length() > 2)
        .toList();
  }
}
