package com.joshlong.organizer.api.search;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

class TokenizerTest {

	@Test
	void tokenize() {
		Assertions.assertEquals(List.of("hello", "world", "42", "times"), Tokenizer.tokenize("Hello, World! 42 times..."));
		Assertions.assertEquals(List.of("café", "münchen"), Tokenizer.tokenize("Café -- MÜNCHEN"));
		Assertions.assertEquals(List.of("snake_case"), Tokenizer.tokenize("snake_case"));
	}

	@Test
	void emptyInputYieldsNoTokens() {
		Assertions.assertTrue(Tokenizer.tokenize("").isEmpty());
		Assertions.assertTrue(Tokenizer.tokenize(null).isEmpty());
		Assertions.assertTrue(Tokenizer.tokenize("  ,.;!? ").isEmpty());
	}

	@Test
	void retokenizingTheOutputIsStable() {
		var tokens = Tokenizer.tokenize("The quick-brown FOX, jumped over 2 lazy dogs!");
		Assertions.assertEquals(tokens, Tokenizer.tokenize(String.join(" ", tokens)));
	}

	@Test
	void frequencies() {
		var frequencies = Tokenizer.frequencies(Tokenizer.tokenize("to be or not to be"));
		Assertions.assertEquals(Map.of("to", 2, "be", 2, "or", 1, "not", 1), frequencies);
		Assertions.assertEquals(List.of("to", "be", "or", "not"), List.copyOf(frequencies.keySet()));
	}

}
