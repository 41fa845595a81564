package com.joshlong.organizer.api.documents;

public record DocumentCreatedEvent(Document document) {
}
