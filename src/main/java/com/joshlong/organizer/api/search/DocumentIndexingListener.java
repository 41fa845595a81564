package com.joshlong.organizer.api.search;

import com.joshlong.organizer.api.documents.Document;
import com.joshlong.organizer.api.documents.DocumentAccessedEvent;
import com.joshlong.organizer.api.documents.DocumentCreatedEvent;
import com.joshlong.organizer.api.documents.DocumentDeletedEvent;
import com.joshlong.organizer.api.documents.DocumentUpdatedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * keeps the {@link SearchEngine} in step with the document store. The listeners run
 * synchronously, on the publishing thread, so a document can be searched as soon as the
 * call that created it returns.
 */
@Component
class DocumentIndexingListener {

	private final Logger log = LoggerFactory.getLogger(getClass());

	private final SearchEngine searchEngine;

	DocumentIndexingListener(SearchEngine searchEngine) {
		this.searchEngine = searchEngine;
	}

	@EventListener
	void documentCreated(DocumentCreatedEvent event) {
		this.indexDocument("created", event.document());
	}

	@EventListener
	void documentUpdated(DocumentUpdatedEvent event) {
		var document = event.document();
		if (!this.searchEngine.update(document.id(), document.title(), document.body(), document.tags()))
			this.indexDocument("updated", document);
		else
			this.log.debug("re-indexed updated document {}", document.id());
	}

	@EventListener
	void documentDeleted(DocumentDeletedEvent event) {
		this.log.debug("removing deleted document {} from the index", event.documentId());
		this.searchEngine.remove(event.documentId());
	}

	@EventListener
	void documentAccessed(DocumentAccessedEvent event) {
		this.searchEngine.recordAccess(event.documentId());
	}

	private void indexDocument(String message, Document document) {
		Assert.notNull(document, "the document cannot be null");
		this.log.debug("indexing {} document {}", message, document.id());
		this.searchEngine.index(document.id(), document.title(), document.body(), document.tags());
	}

}
