package org.springaicommunity.github.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses workflow and Dependabot YAML files and {@code pyproject.toml} fetched from a
 * repository into immutable values. Unparseable files yield empty values and a warning
 * rather than an error.
 */
public class RepositoryFileParser {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryFileParser.class);

	private final ObjectMapper yamlMapper;

	private final ObjectMapper tomlMapper;

	public RepositoryFileParser(ObjectMapper yamlMapper) {
		this(yamlMapper, ObjectMapperFactory.createToml());
	}

	public RepositoryFileParser(ObjectMapper yamlMapper, ObjectMapper tomlMapper) {
		this.yamlMapper = yamlMapper;
		this.tomlMapper = tomlMapper;
	}

	public Workflow parseWorkflow(String path, String content) {
		JsonNode root;
		try {
			root = yamlMapper.readTree(content);
		}
		catch (JsonProcessingException e) {
			logger.warn("Failed to parse workflow {}: {}", path, e.getOriginalMessage());
			return Workflow.empty(path);
		}
		if (root == null || !root.isObject()) {
			logger.warn("Workflow {} is not a YAML mapping", path);
			return Workflow.empty(path);
		}

		List<WorkflowJob> jobs = new ArrayList<>();
		root.path("jobs").fields().forEachRemaining(entry -> jobs.add(parseJob(entry.getKey(), entry.getValue())));

		return new Workflow(path, JsonNodeUtils.text(root, "name"), JsonNodeUtils.stringMap(root, "env"),
				permissions(root.path("permissions")), root.has("concurrency"), jobs);
	}

	/**
	 * Parse {@code .github/dependabot.yml}.
	 * @param content raw file content
	 * @return the configuration, without updates if the file cannot be parsed
	 */
	public DependabotConfig parseDependabotConfig(String content) {
		JsonNode root;
		try {
			root = yamlMapper.readTree(content);
		}
		catch (JsonProcessingException e) {
			logger.warn("Failed to parse Dependabot configuration: {}", e.getOriginalMessage());
			return new DependabotConfig(List.of());
		}
		if (root == null) {
			return new DependabotConfig(List.of());
		}

		List<DependabotConfig.Update> updates = new ArrayList<>();
		for (JsonNode update : JsonNodeUtils.array(root, "updates")) {
			List<String> ignored = new ArrayList<>();
			for (JsonNode ignore : JsonNodeUtils.array(update, "ignore")) {
				String name = JsonNodeUtils.textOrNull(ignore, "dependency-name");
				if (name != null) {
					ignored.add(name);
				}
			}
			updates.add(new DependabotConfig.Update(JsonNodeUtils.text(update, "package-ecosystem"),
					JsonNodeUtils.textOrNull(update, "schedule", "interval"), ignored));
		}
		return new DependabotConfig(updates);
	}

	/**
	 * Parse {@code pyproject.toml}.
	 * @param content raw file content
	 * @return the project, or null if the file is empty or not valid TOML
	 */
	public @Nullable PythonProject parsePyproject(String content) {
		JsonNode root;
		try {
			root = tomlMapper.readTree(content);
		}
		catch (JsonProcessingException e) {
			logger.warn("Failed to parse pyproject.toml: {}", e.getOriginalMessage());
			return null;
		}
		if (root == null || !root.isObject() || root.isEmpty()) {
			return null;
		}

		JsonNode project = root.path("project");
		List<String> authorNames = new ArrayList<>();
		List<String> authorEmails = new ArrayList<>();
		for (JsonNode author : JsonNodeUtils.array(project, "authors")) {
			String name = JsonNodeUtils.text(author, "name");
			if (!name.isEmpty()) {
				authorNames.add(name);
			}
			String email = JsonNodeUtils.text(author, "email");
			if (!email.isEmpty()) {
				authorEmails.add(email);
			}
		}

		List<PythonProject.OptionalDependencies> optional = new ArrayList<>();
		JsonNode extras = project.path("optional-dependencies");
		if (extras.isObject()) {
			extras.fields()
				.forEachRemaining(entry -> optional.add(new PythonProject.OptionalDependencies(entry.getKey(),
						JsonNodeUtils.strings(entry.getValue()))));
		}

		JsonNode strict = root.path("tool").path("mypy").path("strict");
		Boolean mypyStrict = strict.isMissingNode() || strict.isNull() ? null : strict.asBoolean(true);

		return new PythonProject(JsonNodeUtils.textOrNull(project, "name"), hasValue(project, "readme"),
				JsonNodeUtils.text(project, "requires-python"), JsonNodeUtils.strings(project, "classifiers"),
				authorNames, authorEmails, project.has("license"), JsonNodeUtils.strings(project, "dependencies"),
				optional, JsonNodeUtils.strings(root, "tool", "ruff", "lint", "extend-select"), mypyStrict);
	}

	private static boolean hasValue(JsonNode node, String field) {
		JsonNode value = node.path(field);
		return !value.isMissingNode() && !value.isNull();
	}

	private WorkflowJob parseJob(String id, JsonNode job) {
		List<String> matrixValues = new ArrayList<>();
		JsonNode matrix = job.path("strategy").path("matrix");
		if (matrix.isObject()) {
			matrix.fields().forEachRemaining(entry -> {
				if (entry.getValue().isArray()) {
					entry.getValue().forEach(value -> {
						if (value.isTextual()) {
							matrixValues.add(value.asText());
						}
					});
				}
			});
		}

		List<WorkflowStep> steps = new ArrayList<>();
		for (JsonNode step : JsonNodeUtils.array(job, "steps")) {
			steps.add(new WorkflowStep(JsonNodeUtils.text(step, "name"), JsonNodeUtils.text(step, "uses"),
					JsonNodeUtils.text(step, "run"), JsonNodeUtils.stringMap(step, "with"), step.has("if")));
		}

		return new WorkflowJob(id, JsonNodeUtils.strings(job, "runs-on"), matrixValues,
				JsonNodeUtils.stringMap(job, "env"), permissions(job.path("permissions")), job.has("concurrency"),
				steps);
	}

	// "write-all" grants every scope, including contents
	private Map<String, String> permissions(JsonNode node) {
		if (node.isTextual()) {
			return "write-all".equals(node.asText()) ? Map.of("contents", "write") : Map.of();
		}
		return JsonNodeUtils.stringMap(node);
	}

}
