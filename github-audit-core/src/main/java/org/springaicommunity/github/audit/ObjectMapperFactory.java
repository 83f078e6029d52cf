package org.springaicommunity.github.audit;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for consistently configured Jackson mappers.
 *
 * <p>
 * API responses are read as trees, so the JSON mapper ignores unknown properties and
 * keeps dates in ISO-8601 form. Workflow and Dependabot files go through the YAML mapper,
 * {@code pyproject.toml} through the TOML mapper.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} for GitHub API JSON.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		return mapper;
	}

	/**
	 * Create a new {@link ObjectMapper} reading YAML documents.
	 * @return configured YAML ObjectMapper
	 */
	public static ObjectMapper createYaml() {
		ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		return mapper;
	}

	/**
	 * Create a new {@link ObjectMapper} reading TOML documents.
	 * @return configured TOML ObjectMapper
	 */
	public static ObjectMapper createToml() {
		TomlMapper mapper = new TomlMapper();
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		return mapper;
	}

}
