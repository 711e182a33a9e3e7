package org.springaicommunity.github.contributions;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Null-tolerant navigation of GraphQL response trees.
 */
final class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	private JsonNodeUtils() {
	}

	static JsonNode at(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

	static Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = at(node, path);
		return target.isMissingNode() || target.isNull() ? Optional.empty() : Optional.of(target.asText());
	}

	static int getInt(JsonNode node, String... path) {
		return at(node, path).asInt(0);
	}

	static Optional<Integer> getOptionalInt(JsonNode node, String... path) {
		JsonNode target = at(node, path);
		return target.isNumber() ? Optional.of(target.asInt()) : Optional.empty();
	}

	static Optional<Instant> getInstant(JsonNode node, String... path) {
		return getString(node, path).flatMap(str -> {
			try {
				return Optional.of(Instant.parse(str));
			}
			catch (DateTimeParseException e) {
				logger.warn("Failed to parse timestamp: {}", str);
				return Optional.empty();
			}
		});
	}

	static List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = at(node, path);
		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}
		return List.of();
	}

}
