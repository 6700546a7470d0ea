package com.flamingo.ai.research.domain.model;

/**
 * A candidate document returned by a search backend. Identity is the {@code url}.
 *
 * @param title document title
 * @param url canonical location, used for deduplication
 * @param snippet short description returned by the backend
 * @param content full text when the backend provides it, otherwise {@code null}
 */
public record SearchDocument(String title, String url, String snippet, String content) {

  public SearchDocument(String title, String url, String snippet) {
    this(title, url, snippet, null);
  }

  /** Text used when the document is shown to a model: snippet first, then content. */
  public String excerpt(int maxChars) {
    String text = snippet != null && !snippet.isBlank() ? snippet : content;
    if (text == null) {
      return "";
    }
    return text.length() > maxChars ? text.substring(0, maxChars) : text;
  }

  /** Full body for synthesis: content when present, otherwise the snippet. */
  public String body() {
    if (content != null && !content.isBlank()) {
      return content;
    }
    return snippet != null ? snippet : "";
  }
}
