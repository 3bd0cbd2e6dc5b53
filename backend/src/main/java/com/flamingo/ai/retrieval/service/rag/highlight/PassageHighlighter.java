package com.flamingo.ai.retrieval.service.rag.highlight;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Builds source previews with matched query terms wrapped in {@code **bold**}. */
@Component
public class PassageHighlighter {

  public static final int DEFAULT_MAX_LENGTH = 200;

  public String highlight(String text, List<String> terms) {
    return highlight(text, terms, DEFAULT_MAX_LENGTH);
  }

  /**
   * Highlights whole-word, case-insensitive matches of each term, then truncates to roughly {@code
   * maxLength} characters centered on the first highlight.
   */
  public String highlight(String text, List<String> terms, int maxLength) {
    if (text == null || text.isEmpty()) {
      return "";
    }
    if (terms == null || terms.isEmpty()) {
      return text.substring(0, Math.min(maxLength, text.length()));
    }

    String highlighted = text;
    for (String term : terms) {
      if (term.length() < 2) {
        continue;
      }
      Pattern pattern =
          Pattern.compile(
              "\\b(" + Pattern.quote(term) + ")\\b",
              Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
      Matcher matcher = pattern.matcher(highlighted);
      if (matcher.find()) {
        highlighted = matcher.replaceAll("**$1**");
      }
    }

    if (highlighted.length() <= maxLength) {
      return highlighted;
    }
    int firstHighlight = highlighted.indexOf("**");
    if (firstHighlight <= 0) {
      return highlighted.substring(0, maxLength) + "...";
    }
    int start = Math.max(0, firstHighlight - maxLength / 2);
    String window = highlighted.substring(start, Math.min(highlighted.length(), start + maxLength));
    boolean full = window.length() >= maxLength;
    if (start > 0) {
      window = "..." + window;
    }
    return full ? window + "..." : window;
  }
}
