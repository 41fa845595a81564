package com.joshlong.organizer.api.search;

import java.util.List;

/**
 * one ranked search result: a copy of the indexed metadata plus its relevance score.
 */
public record SearchHit(String id, String title, String body, List<String> tags, double relevanceScore) {
}
