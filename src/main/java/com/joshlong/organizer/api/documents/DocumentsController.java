package com.joshlong.organizer.api.documents;

import com.joshlong.organizer.api.folders.FolderSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;
import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.List;

@Controller
class DocumentsController {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final DocumentService documentService;

	DocumentsController(DocumentService documentService) {
		this.documentService = documentService;
	}

	@QueryMapping
	Document documentById(@Argument String id) {
		return this.documentService.getDocument(id).orElse(null);
	}

	@QueryMapping
	Collection<Document> documents(@Argument String folderPath) {
		return this.documentService.listDocuments(folderPath);
	}

	@QueryMapping
	Collection<FolderSummary> folders() {
		return this.documentService.listFolders();
	}

	@QueryMapping
	FolderSummary folder(@Argument String path) {
		return this.documentService.folder(path).orElse(null);
	}

	@MutationMapping
	Document createDocument(@Argument String title, @Argument String body, @Argument List<String> tags,
			@Argument String folderPath) {
		Assert.hasText(title, "the title must not be empty");
		return this.documentService.addDocument(title, body, tags, folderPath);
	}

	@MutationMapping
	Document updateDocument(@Argument String id, @Argument String title, @Argument String body,
			@Argument List<String> tags) {
		var updated = this.documentService.updateDocument(id, title, body, tags);
		if (updated.isEmpty())
			this.log.debug("could not update document {}, it does not exist", id);
		return updated.orElse(null);
	}

	@MutationMapping
	boolean deleteDocument(@Argument String id) {
		return this.documentService.deleteDocument(id);
	}

	@MutationMapping
	boolean moveDocument(@Argument String id, @Argument String folderPath) {
		Assert.hasText(folderPath, "the folderPath must not be empty");
		return this.documentService.moveDocument(id, folderPath);
	}

	@MutationMapping
	FolderSummary createFolder(@Argument String path) {
		Assert.isTrue(StringUtils.hasText(path), "the path must not be empty");
		return this.documentService.createFolder(path);
	}

	@MutationMapping
	boolean deleteFolder(@Argument String path) {
		return this.documentService.deleteFolder(path);
	}

}
