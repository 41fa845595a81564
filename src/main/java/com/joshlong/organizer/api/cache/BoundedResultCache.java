package com.joshlong.organizer.api.cache;

import org.jspecify.annotations.Nullable;
import org.springframework.util.Assert;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * a least-recently-used cache with a fixed capacity. Lookups go through a {@link Map},
 * recency is tracked with a doubly linked list running from the most recently used
 * entry (just after {@code head}) to the least recently used one (just before
 * {@code tail}), so {@link #get(Object)} and {@link #put(Object, Object)} are both
 * O(1).
 * <p>
 * Every public method is {@code synchronized}: the cache is guarded independently of
 * whatever owns it.
 *
 * @param <K> the key type
 * @param <V> the cached value type
 */
public class BoundedResultCache<K, V> {

	private final int capacity;

	private final Map<K, Node<K, V>> entries;

	private final Node<K, V> head = new Node<>(null, null);

	private final Node<K, V> tail = new Node<>(null, null);

	public BoundedResultCache(int capacity) {
		Assert.isTrue(capacity > 0, "the capacity must be a positive integer, but was [" + capacity + "]");
		this.capacity = capacity;
		this.entries = new HashMap<>();
		this.head.next = this.tail;
		this.tail.previous = this.head;
	}

	public synchronized Optional<V> get(K key) {
		var node = this.entries.get(key);
		if (node == null)
			return Optional.empty();
		this.moveToFront(node);
		return Optional.ofNullable(node.value);
	}

	public synchronized void put(K key, V value) {
		var existing = this.entries.get(key);
		if (existing != null) {
			existing.value = value;
			this.moveToFront(existing);
			return;
		}
		if (this.entries.size() >= this.capacity) {
			var eldest = this.tail.previous;
			this.unlink(eldest);
			this.entries.remove(eldest.key);
		}
		var node = new Node<>(key, value);
		this.entries.put(key, node);
		this.linkAfterHead(node);
	}

	public synchronized boolean containsKey(K key) {
		return this.entries.containsKey(key);
	}

	public synchronized void clear() {
		this.entries.clear();
		this.head.next = this.tail;
		this.tail.previous = this.head;
	}

	public synchronized int size() {
		return this.entries.size();
	}

	public int capacity() {
		return this.capacity;
	}

	/**
	 * the keys currently cached, most recently used first. Reading the keys does not
	 * change their recency.
	 */
	public synchronized List<K> keys() {
		var keys = new ArrayList<K>(this.entries.size());
		for (var node = this.head.next; node != this.tail; node = node.next)
			keys.add(node.key);
		return keys;
	}

	private void moveToFront(Node<K, V> node) {
		this.unlink(node);
		this.linkAfterHead(node);
	}

	private void linkAfterHead(Node<K, V> node) {
		node.previous = this.head;
		node.next = this.head.next;
		this.head.next.previous = node;
		this.head.next = node;
	}

	private void unlink(Node<K, V> node) {
		node.previous.next = node.next;
		node.next.previous = node.previous;
	}

	private static class Node<K, V> {

		private final @Nullable K key;

		private @Nullable V value;

		private Node<K, V> previous;

		private Node<K, V> next;

		Node(@Nullable K key, @Nullable V value) {
			this.key = key;
			this.value = value;
		}

	}

}
