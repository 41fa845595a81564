package com.joshlong.organizer.api.folders;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * a hierarchical namespace of folders keyed by slash-separated paths. Every live node is
 * registered under its canonical path in {@code foldersByPath}, so lookups never walk
 * the tree. Missing ancestors are created on demand and deleting a folder takes its
 * whole subtree with it.
 * <p>
 * Paths are case-sensitive. Leading, trailing and repeated slashes are ignored and the
 * root is {@code /}. The document ids held by a folder are not touched when the folder
 * is deleted; relocating them is up to the caller.
 */
public class FolderIndex {

	public static final String ROOT_PATH = "/";

	public static final String ROOT_NAME = "root";

	static final String SEPARATOR = "/";

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final ReadWriteLock lock = new ReentrantReadWriteLock();

	private final FolderNode root = new FolderNode(ROOT_NAME, null);

	private final Map<String, FolderNode> foldersByPath = new HashMap<>();

	public FolderIndex() {
		this.foldersByPath.put(ROOT_PATH, this.root);
	}

	/**
	 * the canonical form of {@code path}: {@code /} followed by its non-empty segments
	 * joined with {@code /}.
	 */
	public static String normalize(String path) {
		var segments = segments(path);
		return segments.isEmpty() ? ROOT_PATH : SEPARATOR + String.join(SEPARATOR, segments);
	}

	static List<String> segments(String path) {
		if (!StringUtils.hasText(path))
			return List.of();
		return Arrays.stream(path.split(SEPARATOR)).filter(StringUtils::hasLength).toList();
	}

	public FolderNode root() {
		return this.root;
	}

	/**
	 * returns the folder at {@code path}, creating it and any missing ancestors first.
	 * Calling this for an existing path returns the existing node.
	 */
	public FolderNode addFolder(String path) {
		var normalized = normalize(path);
		return this.write(() -> {
			var existing = this.foldersByPath.get(normalized);
			if (existing != null)
				return existing;
			var current = this.root;
			for (var segment : segments(normalized)) {
				var child = current.children().get(segment);
				if (child == null) {
					child = current.addChild(segment);
					this.foldersByPath.put(child.path(), child);
					this.log.debug("created folder {}", child.path());
				}
				current = child;
			}
			return current;
		});
	}

	public Optional<FolderNode> getFolder(String path) {
		var normalized = normalize(path);
		return this.read(() -> Optional.ofNullable(this.foldersByPath.get(normalized)));
	}

	public Optional<FolderSummary> describeFolder(String path) {
		var normalized = normalize(path);
		return this.read(() -> Optional.ofNullable(this.foldersByPath.get(normalized)).map(FolderNode::summary));
	}

	/**
	 * removes the folder at {@code path} and all of its descendants. Returns
	 * {@code false} for the root or for a path that doesn't exist.
	 */
	public boolean deleteFolder(String path) {
		var normalized = normalize(path);
		if (ROOT_PATH.equals(normalized))
			return false;
		return this.write(() -> {
			var folder = this.foldersByPath.get(normalized);
			if (folder == null)
				return false;
			var parent = folder.parent();
			if (parent != null)
				parent.removeChild(folder.name());
			var removed = this.unregister(folder);
			this.log.debug("deleted folder {} and {} folder(s) in total", normalized, removed);
			return true;
		});
	}

	/**
	 * every document id held by the folder at {@code path} or by any folder beneath it.
	 */
	public Set<String> documentsInSubtree(String path) {
		var normalized = normalize(path);
		return this.read(() -> {
			var folder = this.foldersByPath.get(normalized);
			if (folder == null)
				return Set.of();
			var ids = new LinkedHashSet<String>();
			var stack = new ArrayDeque<FolderNode>();
			stack.push(folder);
			while (!stack.isEmpty()) {
				var node = stack.pop();
				ids.addAll(node.documentIds());
				node.children().values().forEach(stack::push);
			}
			return Collections.unmodifiableSet(ids);
		});
	}

	public boolean addDocumentToFolder(String path, String documentId) {
		var normalized = normalize(path);
		return this.write(() -> {
			var folder = this.foldersByPath.get(normalized);
			if (folder == null)
				return false;
			folder.addDocument(documentId);
			return true;
		});
	}

	public boolean removeDocumentFromFolder(String path, String documentId) {
		var normalized = normalize(path);
		return this.write(() -> {
			var folder = this.foldersByPath.get(normalized);
			if (folder == null)
				return false;
			folder.removeDocument(documentId);
			return true;
		});
	}

	/**
	 * a copy of the document ids held directly by the folder at {@code path}, or an
	 * empty set if there is no such folder.
	 */
	public Set<String> documentsInFolder(String path) {
		var normalized = normalize(path);
		return this.read(() -> {
			var folder = this.foldersByPath.get(normalized);
			return folder == null ? Set.of() : Set.copyOf(folder.documentIds());
		});
	}

	/**
	 * every live folder, starting at the root, each parent before its children.
	 */
	public List<FolderSummary> traverseDepthFirst() {
		return this.read(() -> {
			var result = new ArrayList<FolderSummary>();
			var stack = new ArrayDeque<FolderNode>();
			stack.push(this.root);
			while (!stack.isEmpty()) {
				var node = stack.pop();
				result.add(node.summary());
				var children = new ArrayList<>(node.children().values());
				for (var i = children.size() - 1; i >= 0; i--)
					stack.push(children.get(i));
			}
			return result;
		});
	}

	/**
	 * every live folder, level by level, starting at the root.
	 */
	public List<FolderSummary> traverseBreadthFirst() {
		return this.read(() -> {
			var result = new ArrayList<FolderSummary>();
			var queue = new ArrayDeque<FolderNode>();
			queue.add(this.root);
			while (!queue.isEmpty()) {
				var node = queue.poll();
				result.add(node.summary());
				queue.addAll(node.children().values());
			}
			return result;
		});
	}

	public int size() {
		return this.read(this.foldersByPath::size);
	}

	private int unregister(FolderNode folder) {
		var count = 0;
		var stack = new ArrayDeque<FolderNode>();
		stack.push(folder);
		while (!stack.isEmpty()) {
			var node = stack.pop();
			if (this.foldersByPath.remove(node.path()) != null)
				count += 1;
			node.children().values().forEach(stack::push);
		}
		return count;
	}

	private <T> T read(Supplier<T> supplier) {
		this.lock.readLock().lock();
		try {
			return supplier.get();
		}
		finally {
			this.lock.readLock().unlock();
		}
	}

	private <T> T write(Supplier<T> supplier) {
		this.lock.writeLock().lock();
		try {
			return supplier.get();
		}
		finally {
			this.lock.writeLock().unlock();
		}
	}

}
