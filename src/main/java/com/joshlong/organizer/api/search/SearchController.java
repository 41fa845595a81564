package com.joshlong.organizer.api.search;

import com.joshlong.organizer.api.ApiProperties;
import org.springframework.graphql.data.method.annotation.Argument;
import org.springframework.graphql.data.method.annotation.MutationMapping;
import org.springframework.graphql.data.method.annotation.QueryMapping;
import org.springframework.stereotype.Controller;

import java.util.Collection;

@Controller
class SearchController {

	private final SearchEngine searchEngine;

	private final ApiProperties properties;

	SearchController(SearchEngine searchEngine, ApiProperties properties) {
		this.searchEngine = searchEngine;
		this.properties = properties;
	}

	@QueryMapping
	Collection<SearchHit> search(@Argument String query, @Argument Integer topK) {
		return this.searchEngine.search(query, topK == null ? this.properties.search().defaultTopK() : topK);
	}

	@QueryMapping
	Collection<String> autocomplete(@Argument String prefix, @Argument Integer limit) {
		return this.searchEngine.autocomplete(prefix,
				limit == null ? this.properties.autocomplete().defaultLimit() : limit);
	}

	@QueryMapping
	IndexStatistics searchStatistics() {
		return this.searchEngine.statistics();
	}

	@MutationMapping
	boolean clearSearchCache() {
		this.searchEngine.clearCache();
		return true;
	}

}
