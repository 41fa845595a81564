package com.joshlong.organizer.api.documents;

import org.springframework.util.Assert;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * the canonical record of a document.
 */
public record Document(String id, String title, String body, List<String> tags, OffsetDateTime created,
		OffsetDateTime lastAccessed, String folderPath) {

	public Document {
		if (tags != null)
			Assert.noNullElements(tags, "the tags must not contain null elements");
		tags = tags == null ? List.of() : List.copyOf(tags);
	}

	Document withLastAccessed(OffsetDateTime lastAccessed) {
		return new Document(this.id, this.title, this.body, this.tags, this.created, lastAccessed, this.folderPath);
	}

	Document withFolderPath(String folderPath) {
		return new Document(this.id, this.title, this.body, this.tags, this.created, this.lastAccessed, folderPath);
	}

	Document withContent(String title, String body, List<String> tags) {
		return new Document(this.id, title, body, tags, this.created, this.lastAccessed, this.folderPath);
	}

}
