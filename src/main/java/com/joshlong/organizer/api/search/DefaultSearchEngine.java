package com.joshlong.organizer.api.search;

import com.joshlong.organizer.api.autocomplete.PrefixIndex;
import com.joshlong.organizer.api.cache.BoundedResultCache;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * keeps an inverted index (token to document ids), a token frequency table per document
 * and an access history per document, all guarded by a single lock so that
 * {@link #update} and {@link #remove} always see the postings and the frequency tables
 * in agreement. The {@link PrefixIndex} and the result cache guard themselves.
 * <p>
 * Any change to the index clears the result cache, under the same lock, so a cached
 * result never outlives the index it was computed from.
 */
class DefaultSearchEngine implements SearchEngine {

	/**
	 * best first: higher score, then lower document id.
	 */
	private static final Comparator<Ranked> BEST_FIRST = Comparator.comparingDouble(Ranked::score)
		.reversed()
		.thenComparing(ranked -> ranked.document().id());

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final ReentrantLock lock = new ReentrantLock();

	private final Map<String, Set<String>> postings = new HashMap<>();

	private final Map<String, Map<String, Integer>> frequencies = new HashMap<>();

	private final Map<String, IndexedDocument> documents = new HashMap<>();

	private final Map<String, AccessHistory> accessHistories = new HashMap<>();

	private final PrefixIndex prefixIndex;

	private final BoundedResultCache<String, List<SearchHit>> resultCache;

	private final Clock clock;

	DefaultSearchEngine(PrefixIndex prefixIndex, BoundedResultCache<String, List<SearchHit>> resultCache,
			Clock clock) {
		this.prefixIndex = prefixIndex;
		this.resultCache = resultCache;
		this.clock = clock;
	}

	@Override
	public void index(String id, String title, String body, List<String> tags) {
		Assert.notNull(id, "the document id must not be null");
		var document = new IndexedDocument(id, Objects.requireNonNullElse(title, ""),
				Objects.requireNonNullElse(body, ""), tags);
		this.locked(() -> {
			if (this.documents.containsKey(id))
				this.doRemove(id);
			this.doIndex(document);
			this.resultCache.clear();
			return null;
		});
	}

	@Override
	public boolean update(String id, @Nullable String title, @Nullable String body, @Nullable List<String> tags) {
		Assert.notNull(id, "the document id must not be null");
		var updated = this.locked(() -> {
			var current = this.documents.get(id);
			if (current == null)
				return false;
			var merged = new IndexedDocument(id, title != null ? title : current.title(),
					body != null ? body : current.body(), tags != null ? tags : current.tags());
			this.doRemove(id);
			this.doIndex(merged);
			this.resultCache.clear();
			return true;
		});
		return updated;
	}

	@Override
	public void remove(String id) {
		this.locked(() -> {
			if (this.doRemove(id))
				this.resultCache.clear();
			return null;
		});
	}

	@Override
	public boolean contains(String id) {
		return this.locked(() -> this.documents.containsKey(id));
	}

	@Override
	public void recordAccess(String id) {
		this.locked(() -> {
			this.doRecordAccess(id);
			return null;
		});
	}

	@Override
	public List<SearchHit> search(String query, int topK) {
		if (!StringUtils.hasText(query) || topK <= 0)
			return List.of();

		var key = cacheKey(query, topK);
		var cached = this.resultCache.get(key);
		if (cached.isPresent()) {
			this.log.debug("returning cached results for [{}]", key);
			return cached.get();
		}

		var queryTokens = Tokenizer.tokenize(query);
		if (queryTokens.isEmpty())
			return List.of();

		var hits = this.locked(() -> {
			var now = this.clock.instant();
			var worstFirst = new PriorityQueue<Ranked>(BEST_FIRST.reversed());
			for (var id : this.candidates(queryTokens)) {
				var document = this.documents.get(id);
				if (document == null)
					continue;
				var score = RelevanceScorer.score(this.frequencies.get(id), queryTokens,
						this.accessHistories.get(id), now);
				this.doRecordAccess(id);
				worstFirst.offer(new Ranked(document, score));
				if (worstFirst.size() > topK)
					worstFirst.poll();
			}
			var ranked = new ArrayList<>(worstFirst);
			ranked.sort(BEST_FIRST);
			var results = ranked.stream().map(DefaultSearchEngine::hit).toList();
			this.resultCache.put(key, results);
			return results;
		});

		this.log.debug("found {} result(s) for [{}]", hits.size(), query);
		return hits;
	}

	@Override
	public List<String> autocomplete(String prefix, int limit) {
		return this.prefixIndex.autocomplete(prefix, limit);
	}

	@Override
	public void clearCache() {
		this.resultCache.clear();
	}

	@Override
	public IndexStatistics statistics() {
		var counts = this.locked(() -> new int[] { this.documents.size(), this.postings.size() });
		return new IndexStatistics(counts[0], counts[1], this.prefixIndex.size(), this.resultCache.size());
	}

	/**
	 * the documents containing every query token or, failing that, the documents
	 * containing at least one of them. Sorted by id so that access is recorded in a
	 * stable order.
	 */
	private Set<String> candidates(List<String> queryTokens) {
		var all = (Set<String>) null;
		for (var token : queryTokens) {
			var posting = this.postings.getOrDefault(token, Set.of());
			if (all == null)
				all = new HashSet<>(posting);
			else
				all.retainAll(posting);
		}
		if (all != null && !all.isEmpty())
			return new TreeSet<>(all);
		var any = new TreeSet<String>();
		for (var token : queryTokens)
			any.addAll(this.postings.getOrDefault(token, Set.of()));
		return any;
	}

	private void doIndex(IndexedDocument document) {
		var id = document.id();
		var tokenFrequencies = Tokenizer.frequencies(Tokenizer.tokenize(document.text()));
		for (var token : tokenFrequencies.keySet()) {
			this.postings.computeIfAbsent(token, t -> new HashSet<>()).add(id);
			this.prefixIndex.insert(token);
		}
		this.frequencies.put(id, tokenFrequencies);
		this.documents.put(id, document);
		this.log.debug("indexed document {} with {} distinct token(s)", id, tokenFrequencies.size());
	}

	private boolean doRemove(String id) {
		if (!this.documents.containsKey(id))
			return false;
		var tokenFrequencies = this.frequencies.remove(id);
		if (tokenFrequencies != null) {
			for (var token : tokenFrequencies.keySet()) {
				var posting = this.postings.get(token);
				if (posting == null)
					continue;
				posting.remove(id);
				if (posting.isEmpty())
					this.postings.remove(token);
			}
		}
		this.documents.remove(id);
		this.accessHistories.remove(id);
		this.log.debug("removed document {}", id);
		return true;
	}

	private void doRecordAccess(String id) {
		this.accessHistories.computeIfAbsent(id, i -> new AccessHistory()).record(this.clock.instant());
	}

	private <T> T locked(Supplier<T> supplier) {
		this.lock.lock();
		try {
			return supplier.get();
		}
		finally {
			this.lock.unlock();
		}
	}

	private static String cacheKey(String query, int topK) {
		return "search:" + query + ":" + topK;
	}

	private static SearchHit hit(Ranked ranked) {
		var document = ranked.document();
		return new SearchHit(document.id(), document.title(), document.body(), document.tags(),
				Math.round(ranked.score() * 10_000) / 10_000.0);
	}

	private record Ranked(IndexedDocument document, double score) {
	}

}
