package com.joshlong.organizer.api.documents;

public record DocumentUpdatedEvent(Document document) {
}
