package com.joshlong.organizer.api.search;

import org.springframework.util.Assert;

import java.util.List;

/**
 * the metadata the search engine keeps for each indexed document.
 */
record IndexedDocument(String id, String title, String body, List<String> tags) {

	IndexedDocument {
		if (tags != null)
			Assert.noNullElements(tags, "the tags must not contain null elements");
		tags = tags == null ? List.of() : List.copyOf(tags);
	}

	String text() {
		return this.title + " " + this.body + " " + String.join(" ", this.tags);
	}

}
