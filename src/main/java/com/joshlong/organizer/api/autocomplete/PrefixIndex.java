package com.joshlong.organizer.api.autocomplete;

import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * a prefix tree (trie) of every token the search engine has ever seen. Each node is one
 * code point of some token; children are kept in a {@link TreeMap} so that a depth-first
 * walk visits them in sorted order and the suggestions come back alphabetically.
 * <p>
 * Tokens are never removed, so a token may still be suggested after the last document
 * containing it has gone away.
 */
public class PrefixIndex {

	private final Node root = new Node();

	private int size;

	public synchronized void insert(String token) {
		if (!StringUtils.hasLength(token))
			return;
		var word = token.toLowerCase(Locale.ROOT);
		var node = this.root;
		for (var codePoint : word.codePoints().toArray())
			node = node.children.computeIfAbsent(codePoint, cp -> new Node());
		if (!node.terminal) {
			node.terminal = true;
			this.size += 1;
		}
		node.occurrences += 1;
		node.words.add(word);
	}

	/**
	 * up to {@code limit} tokens starting with {@code prefix}, in alphabetical order.
	 * Returns an empty list for an empty prefix, a non-positive limit, or a prefix that
	 * no token starts with.
	 */
	public synchronized List<String> autocomplete(String prefix, int limit) {
		if (!StringUtils.hasLength(prefix) || limit <= 0)
			return List.of();
		var node = this.find(prefix.toLowerCase(Locale.ROOT));
		if (node == null)
			return List.of();
		var results = new LinkedHashSet<String>();
		collect(node, results, limit);
		return List.copyOf(results);
	}

	public synchronized boolean contains(String token) {
		if (!StringUtils.hasLength(token))
			return false;
		var node = this.find(token.toLowerCase(Locale.ROOT));
		return node != null && node.terminal;
	}

	/**
	 * how many times {@code token} has been inserted.
	 */
	public synchronized int occurrences(String token) {
		if (!StringUtils.hasLength(token))
			return 0;
		var node = this.find(token.toLowerCase(Locale.ROOT));
		return node == null || !node.terminal ? 0 : node.occurrences;
	}

	public synchronized List<String> tokens() {
		var results = new LinkedHashSet<String>();
		collect(this.root, results, Integer.MAX_VALUE);
		return new ArrayList<>(results);
	}

	/**
	 * the number of distinct tokens.
	 */
	public synchronized int size() {
		return this.size;
	}

	private Node find(String word) {
		var node = this.root;
		for (var codePoint : word.codePoints().toArray()) {
			node = node.children.get(codePoint);
			if (node == null)
				return null;
		}
		return node;
	}

	private static void collect(Node node, Set<String> results, int limit) {
		if (results.size() >= limit)
			return;
		if (node.terminal) {
			for (var word : node.words) {
				results.add(word);
				if (results.size() >= limit)
					return;
			}
		}
		for (var child : node.children.values()) {
			if (results.size() >= limit)
				return;
			collect(child, results, limit);
		}
	}

	private static class Node {

		private final Map<Integer, Node> children = new TreeMap<>();

		private final Set<String> words = new LinkedHashSet<>();

		private boolean terminal;

		private int occurrences;

	}

}
