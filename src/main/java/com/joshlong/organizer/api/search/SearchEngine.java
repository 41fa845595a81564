package com.joshlong.organizer.api.search;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * an in-memory keyword index over short text documents. Documents are identified by
 * ids assigned elsewhere; the engine only keeps what it needs to rank them.
 */
public interface SearchEngine {

	/**
	 * indexes the title, body and tags of a document, replacing anything previously
	 * indexed under the same id.
	 */
	void index(String id, String title, String body, List<String> tags);

	/**
	 * re-indexes a document, keeping the current value of any field passed as
	 * {@code null}.
	 * @return {@code false} if nothing is indexed under {@code id}
	 */
	boolean update(String id, @Nullable String title, @Nullable String body, @Nullable List<String> tags);

	void remove(String id);

	boolean contains(String id);

	/**
	 * records that a document was just read. This feeds the recency and usage parts of
	 * the relevance score.
	 */
	void recordAccess(String id);

	/**
	 * at most {@code topK} documents matching {@code query}, best first. Documents
	 * containing every query token are preferred; if there are none, documents
	 * containing any query token are returned instead.
	 */
	List<SearchHit> search(String query, int topK);

	List<String> autocomplete(String prefix, int limit);

	void clearCache();

	IndexStatistics statistics();

}
