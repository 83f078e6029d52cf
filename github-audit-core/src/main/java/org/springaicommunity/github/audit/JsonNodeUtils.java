package org.springaicommunity.github.audit;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static helpers for JsonNode navigation, shared by the JSON and YAML readers.
 */
public final class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	private JsonNodeUtils() {
	}

	/**
	 * Text at the given path, or the empty string when the node is missing or null.
	 */
	public static String text(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? "" : target.asText();
	}

	public static @Nullable String textOrNull(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return target.isMissingNode() || target.isNull() ? null : target.asText();
	}

	public static @Nullable Instant instant(JsonNode node, String... path) {
		String value = textOrNull(node, path);
		if (value == null || value.isEmpty()) {
			return null;
		}
		try {
			return Instant.parse(value);
		}
		catch (DateTimeParseException ex) {
			logger.warn("Failed to parse timestamp: {}", value);
			return null;
		}
	}

	public static List<JsonNode> array(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}
		return List.of();
	}

	/**
	 * Scalars at the given path as strings. A single scalar yields a one-element list,
	 * so {@code runs-on: ubuntu-24.04} and {@code runs-on: [ubuntu-24.04]} read the same.
	 */
	public static List<String> strings(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		List<String> result = new ArrayList<>();
		if (target.isArray()) {
			target.forEach(element -> {
				if (element.isValueNode() && !element.isNull()) {
					result.add(element.asText());
				}
			});
		}
		else if (target.isValueNode() && !target.isNull()) {
			result.add(target.asText());
		}
		return result;
	}

	/**
	 * Object at the given path as a string map. Nested values are rendered as their JSON
	 * text, so expressions like {@code ${{ secrets.TOKEN }}} survive unchanged.
	 */
	public static Map<String, String> stringMap(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		Map<String, String> result = new LinkedHashMap<>();
		if (target.isObject()) {
			target.fields().forEachRemaining(entry -> {
				JsonNode value = entry.getValue();
				if (!value.isNull()) {
					result.put(entry.getKey(), value.isValueNode() ? value.asText() : value.toString());
				}
			});
		}
		return result;
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

}
