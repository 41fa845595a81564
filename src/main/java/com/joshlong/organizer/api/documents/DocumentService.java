package com.joshlong.organizer.api.documents;

import com.joshlong.organizer.api.folders.FolderSummary;
import org.jspecify.annotations.Nullable;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * owns the canonical document records and their placement in the folder hierarchy.
 * Every change is published as an application event so that other modules (search, for
 * one) can keep their own view of the documents current.
 */
public interface DocumentService {

	/**
	 * stores a new document in {@code folderPath} (the root, if {@code null}), creating
	 * the folder if needed.
	 */
	Document addDocument(String title, String body, @Nullable List<String> tags, @Nullable String folderPath);

	/**
	 * looks up a document and records the access.
	 */
	Optional<Document> getDocument(String id);

	Optional<Document> updateDocument(String id, @Nullable String title, @Nullable String body,
			@Nullable List<String> tags);

	boolean deleteDocument(String id);

	boolean moveDocument(String id, String folderPath);

	/**
	 * every document, or only the documents directly in {@code folderPath}.
	 */
	Collection<Document> listDocuments(@Nullable String folderPath);

	FolderSummary createFolder(String path);

	Optional<FolderSummary> folder(String path);

	/**
	 * deletes a folder and everything beneath it, moving the documents held anywhere in
	 * that subtree to the deleted folder's parent first.
	 * @return {@code false} for the root or an unknown folder
	 */
	boolean deleteFolder(String path);

	List<FolderSummary> listFolders();

}
