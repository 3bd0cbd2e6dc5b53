package com.flamingo.ai.retrieval.service.rag.lexical;

import com.flamingo.ai.retrieval.config.RagConfig;
import com.flamingo.ai.retrieval.domain.model.Chunk;
import com.flamingo.ai.retrieval.domain.model.ScoredChunk;
import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Okapi BM25 over the in-scope candidate batch.
 *
 * <p>The index is built per call from the candidates' text; nothing is kept between queries. Text
 * and query are lower-cased and split on whitespace, with no stemming or stopword removal. IDF
 * values below zero (terms present in more than half the batch) are replaced by {@code epsilon}
 * times the average IDF.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Bm25Scorer {

  private final RagConfig ragConfig;

  /**
   * Scores every candidate and normalizes by the batch maximum, so results lie in {@code [0, 1]}
   * and the best match scores exactly {@code 1.0}. Sets {@code bm25Score} and the active {@code
   * score}; output order matches input order.
   */
  public List<ScoredChunk> score(String query, List<Chunk> candidates) {
    if (candidates.isEmpty()) {
      return List.of();
    }
    double[] raw = rawScores(query, candidates);

    double max = 0.0;
    for (double value : raw) {
      max = Math.max(max, value);
    }
    // A non-positive maximum means nothing matched; divide by 1 and floor at 0.
    double divisor = max > 0.0 ? max : 1.0;

    List<ScoredChunk> scored = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      double normalized = Math.max(0.0, raw[i] / divisor);
      ScoredChunk scoredChunk = new ScoredChunk(candidates.get(i), normalized);
      scoredChunk.setBm25Score(normalized);
      scored.add(scoredChunk);
    }
    log.debug("BM25 scored {} candidates, max raw score {}", candidates.size(), max);
    return scored;
  }

  @VisibleForTesting
  double[] rawScores(String query, List<Chunk> candidates) {
    RagConfig.Bm25 params = ragConfig.getBm25();
    double k1 = params.getK1();
    double b = params.getB();

    int corpusSize = candidates.size();
    List<Map<String, Integer>> termFrequencies = new ArrayList<>(corpusSize);
    int[] docLengths = new int[corpusSize];
    Map<String, Integer> documentFrequencies = new HashMap<>();
    long totalLength = 0;

    for (int i = 0; i < corpusSize; i++) {
      List<String> tokens = tokenize(candidates.get(i).text());
      docLengths[i] = tokens.size();
      totalLength += tokens.size();
      Map<String, Integer> frequencies = new HashMap<>();
      for (String token : tokens) {
        frequencies.merge(token, 1, Integer::sum);
      }
      termFrequencies.add(frequencies);
      for (String term : frequencies.keySet()) {
        documentFrequencies.merge(term, 1, Integer::sum);
      }
    }

    double[] scores = new double[corpusSize];
    if (totalLength == 0) {
      return scores;
    }
    double averageLength = (double) totalLength / corpusSize;
    Map<String, Double> idf = inverseDocumentFrequencies(documentFrequencies, corpusSize);

    for (String term : tokenize(query)) {
      double termIdf = idf.getOrDefault(term, 0.0);
      if (termIdf == 0.0) {
        continue;
      }
      for (int i = 0; i < corpusSize; i++) {
        int tf = termFrequencies.get(i).getOrDefault(term, 0);
        if (tf == 0) {
          continue;
        }
        double lengthNorm = 1 - b + b * docLengths[i] / averageLength;
        scores[i] += termIdf * (tf * (k1 + 1)) / (tf + k1 * lengthNorm);
      }
    }
    return scores;
  }

  private Map<String, Double> inverseDocumentFrequencies(
      Map<String, Integer> documentFrequencies, int corpusSize) {
    Map<String, Double> idf = new HashMap<>();
    List<String> negative = new ArrayList<>();
    double idfSum = 0.0;
    for (Map.Entry<String, Integer> entry : documentFrequencies.entrySet()) {
      int frequency = entry.getValue();
      double value = Math.log(corpusSize - frequency + 0.5) - Math.log(frequency + 0.5);
      idf.put(entry.getKey(), value);
      idfSum += value;
      if (value < 0) {
        negative.add(entry.getKey());
      }
    }
    if (!idf.isEmpty()) {
      double floor = ragConfig.getBm25().getEpsilon() * (idfSum / idf.size());
      negative.forEach(term -> idf.put(term, floor));
    }
    return idf;
  }

  /**
   * True when the text contains at least one query token. A term present in exactly half the batch
   * has an IDF of zero, so a zero score does not mean the chunk is unrelated to the query.
   */
  public static boolean sharesTerm(String query, String text) {
    Set<String> queryTerms = new HashSet<>(tokenize(query));
    return tokenize(text).stream().anyMatch(queryTerms::contains);
  }

  @VisibleForTesting
  static List<String> tokenize(String text) {
    String trimmed = text.toLowerCase(Locale.ROOT).strip();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    return List.of(trimmed.split("\\s+"));
  }
}
