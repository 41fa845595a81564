package com.joshlong.organizer.api.search;

/**
 * @param documents the number of indexed documents
 * @param indexedTokens the number of tokens with at least one live document
 * @param autocompleteTokens the number of tokens known to autocomplete, live or not
 * @param cachedQueries the number of memoized search results
 */
public record IndexStatistics(int documents, int indexedTokens, int autocompleteTokens, int cachedQueries) {
}
