package com.joshlong.organizer.api.folders;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * one folder in a {@link FolderIndex}. A node owns its children; the {@code parent} link
 * is only a back-reference used to detach the node on delete. Nodes never move, so the
 * canonical path is fixed when the node is created.
 * <p>
 * Nodes are mutated only by the {@link FolderIndex} that created them, under its lock.
 */
public final class FolderNode {

	private final String name;

	private final @Nullable FolderNode parent;

	private final String path;

	private final Map<String, FolderNode> children = new LinkedHashMap<>();

	private final Set<String> documentIds = new LinkedHashSet<>();

	FolderNode(String name, @Nullable FolderNode parent) {
		this.name = name;
		this.parent = parent;
		if (parent == null)
			this.path = FolderIndex.ROOT_PATH;
		else
			this.path = (parent.isRoot() ? parent.path : parent.path + FolderIndex.SEPARATOR) + name;
	}

	public String name() {
		return this.name;
	}

	public @Nullable FolderNode parent() {
		return this.parent;
	}

	public boolean isRoot() {
		return this.parent == null;
	}

	/**
	 * the canonical path: {@code /} for the root, otherwise the parent's path joined with
	 * this node's name.
	 */
	public String path() {
		return this.path;
	}

	public Map<String, FolderNode> children() {
		return Collections.unmodifiableMap(this.children);
	}

	public Set<String> documentIds() {
		return Collections.unmodifiableSet(this.documentIds);
	}

	FolderNode addChild(String childName) {
		return this.children.computeIfAbsent(childName, n -> new FolderNode(n, this));
	}

	boolean removeChild(String childName) {
		return this.children.remove(childName) != null;
	}

	boolean addDocument(String documentId) {
		return this.documentIds.add(documentId);
	}

	boolean removeDocument(String documentId) {
		return this.documentIds.remove(documentId);
	}

	public FolderSummary summary() {
		return new FolderSummary(this.path, this.name, this.documentIds.size(), this.children.size());
	}

	@Override
	public String toString() {
		return "FolderNode{path=" + this.path + ", documents=" + this.documentIds.size() + ", children="
				+ this.children.size() + '}';
	}

}
