package com.flamingo.ai.research.service.search;

import com.flamingo.ai.research.domain.model.SearchDocument;
import java.util.List;

/**
 * Web search collaborator. Implementations must return an empty list when nothing matches and
 * must tolerate being retried with the same query.
 */
public interface SearchBackend {

  /**
   * Runs one search.
   *
   * @param query query text
   * @return matching documents in backend rank order, never {@code null}
   * @throws com.flamingo.ai.research.exception.SearchException when the backend fails
   */
  List<SearchDocument> search(String query);
}
