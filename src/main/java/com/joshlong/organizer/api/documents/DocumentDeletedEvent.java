package com.joshlong.organizer.api.documents;

public record DocumentDeletedEvent(String documentId) {
}
