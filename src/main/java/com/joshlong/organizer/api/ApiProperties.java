package com.joshlong.organizer.api;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "organizer")
public record ApiProperties(Search search, Autocomplete autocomplete) {

	/**
	 * @param cacheCapacity how many distinct search results to keep
	 * @param defaultTopK how many results a search returns when the caller doesn't say
	 */
	public record Search(int cacheCapacity, int defaultTopK) {
	}

	public record Autocomplete(int defaultLimit) {
	}
}
