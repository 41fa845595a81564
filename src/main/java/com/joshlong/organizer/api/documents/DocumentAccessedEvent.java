package com.joshlong.organizer.api.documents;

/**
 * published every time a document is read through the {@link DocumentService}.
 */
public record DocumentAccessedEvent(String documentId) {
}
