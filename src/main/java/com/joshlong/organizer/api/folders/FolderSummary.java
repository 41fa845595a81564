package com.joshlong.organizer.api.folders;

/**
 * a snapshot of a single folder, as produced by the tree traversals.
 */
public record FolderSummary(String path, String name, int documentCount, int childCount) {
}
