package org.springaicommunity.github.audit;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.StringJoiner;

/**
 * Percent-encoding of values placed into REST API paths.
 */
final class GitHubPaths {

	private GitHubPaths() {
	}

	/**
	 * Encode a single path segment. A {@code /} in the value is encoded as well.
	 * @param value raw segment, e.g. an owner login
	 * @return the encoded segment
	 */
	static String segment(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
	}

	/**
	 * Encode a slash-separated value segment by segment, keeping the separators. Used for
	 * file paths and branch names, which GitHub accepts with literal slashes.
	 * @param value raw path, e.g. {@code .github/workflows/ci build.yml}
	 * @return the encoded path
	 */
	static String path(String value) {
		StringJoiner joiner = new StringJoiner("/");
		for (String part : value.split("/", -1)) {
			joiner.add(segment(part));
		}
		return joiner.toString();
	}

}
