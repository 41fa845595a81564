package com.joshlong.organizer.api.search;

import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * splits text into lowercase runs of Unicode word characters. Everything else is a
 * delimiter and is dropped.
 */
public abstract class Tokenizer {

	private static final Pattern WORD = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

	public static List<String> tokenize(String text) {
		if (!StringUtils.hasLength(text))
			return List.of();
		var matcher = WORD.matcher(text.toLowerCase(Locale.ROOT));
		var tokens = new ArrayList<String>();
		while (matcher.find())
			tokens.add(matcher.group());
		return tokens;
	}

	/**
	 * token to occurrence count, in order of first appearance.
	 */
	public static Map<String, Integer> frequencies(List<String> tokens) {
		var frequencies = new LinkedHashMap<String, Integer>();
		for (var token : tokens)
			frequencies.merge(token, 1, Integer::sum);
		return frequencies;
	}

}
