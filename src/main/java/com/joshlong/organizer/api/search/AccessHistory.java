package com.joshlong.organizer.api.search;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * the most recent access timestamps for one document. Only the latest
 * {@link #CAPACITY} are kept; older ones fall off the front.
 */
class AccessHistory {

	static final int CAPACITY = 100;

	private final Deque<Instant> accesses = new ArrayDeque<>();

	void record(Instant when) {
		this.accesses.addLast(when);
		while (this.accesses.size() > CAPACITY)
			this.accesses.removeFirst();
	}

	Optional<Instant> lastAccess() {
		return this.accesses.stream().max(Instant::compareTo);
	}

	int count() {
		return this.accesses.size();
	}

}
