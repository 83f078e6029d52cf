package org.springaicommunity.github.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * {@link RepositoryMetadataService} backed by the GitHub REST API.
 *
 * <p>
 * Converts GitHub API JSON responses to immutable snapshot values at the service
 * boundary. Retries, rate limit waits and pacing are the concern of the supplied
 * {@link GitHubClient}, normally a {@link RetryingGitHubClient}.
 */
public class GitHubRepositoryMetadataService implements RepositoryMetadataService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRepositoryMetadataService.class);

	private static final String WORKFLOWS_DIR = ".github/workflows/";

	private static final List<String> DEPENDABOT_PATHS = List.of(".github/dependabot.yml", ".github/dependabot.yaml");

	private static final String PYPROJECT = "pyproject.toml";

	private static final String REQUIREMENTS = "requirements.txt";

	// repositories younger than this are not checked for releases
	private static final Duration RELEASE_CHECK_MIN_AGE = Duration.ofDays(90);

	private final GitHubClient client;

	private final ObjectMapper objectMapper;

	private final RepositoryFileParser fileParser;

	private final int pageSize;

	private final Clock clock;

	private volatile @Nullable String login;

	public GitHubRepositoryMetadataService(GitHubClient client, ObjectMapper objectMapper,
			RepositoryFileParser fileParser, int pageSize) {
		this(client, objectMapper, fileParser, pageSize, Clock.systemUTC());
	}

	public GitHubRepositoryMetadataService(GitHubClient client, ObjectMapper objectMapper,
			RepositoryFileParser fileParser, int pageSize, Clock clock) {
		if (pageSize < 1 || pageSize > 100) {
			throw new IllegalArgumentException("pageSize must be between 1 and 100");
		}
		this.client = client;
		this.objectMapper = objectMapper;
		this.fileParser = fileParser;
		this.pageSize = pageSize;
		this.clock = clock;
	}

	@Override
	public String authenticatedLogin() {
		String cached = login;
		if (cached != null) {
			return cached;
		}
		String resolved = JsonNodeUtils.text(readTree(client.get("/user")), "login");
		if (resolved.isEmpty()) {
			throw new GitHubApiException("GitHub did not report a login for the supplied token", 200, null);
		}
		login = resolved;
		return resolved;
	}

	@Override
	public Stream<RepositoryRef> listRepositories(@Nullable String owner, boolean activeOnly) {
		String path;
		String baseQuery;
		String requiredOwner;
		if (owner == null) {
			path = "/user/repos";
			baseQuery = "affiliation=owner";
			requiredOwner = authenticatedLogin();
		}
		else {
			path = "/users/" + GitHubPaths.segment(owner) + "/repos";
			baseQuery = "type=owner";
			requiredOwner = owner;
		}
		logger.debug("Listing repositories of {} (activeOnly={})", requiredOwner, activeOnly);

		return PagedIterator.<JsonNode>stream(page -> {
			String query = baseQuery + "&per_page=" + pageSize + "&page=" + page;
			List<JsonNode> items = JsonNodeUtils.array(readTree(client.getWithQuery(path, query)));
			return Page.of(items, page, pageSize);
		})
			.filter(node -> requiredOwner.equalsIgnoreCase(JsonNodeUtils.text(node, "owner", "login")))
			.filter(node -> !activeOnly || isActive(node))
			.map(node -> new RepositoryRef(JsonNodeUtils.text(node, "owner", "login"),
					JsonNodeUtils.text(node, "name")));
	}

	private static boolean isActive(JsonNode repository) {
		return !repository.path("archived").asBoolean(false) && !repository.path("fork").asBoolean(false);
	}

	@Override
	public RepositorySnapshot fetch(RepositoryRef ref) {
		logger.debug("Fetching metadata for {}", ref);
		String base = ref.apiPath();
		JsonNode repo = readTree(client.get(base));
		Instant fetchedAt = clock.instant();

		String defaultBranch = JsonNodeUtils.text(repo, "default_branch");
		boolean isPrivate = repo.path("private").asBoolean(false);
		@Nullable Instant createdAt = JsonNodeUtils.instant(repo, "created_at");
		RepositorySnapshot.Builder builder = RepositorySnapshot.builder(ref)
			.description(JsonNodeUtils.textOrNull(repo, "description"))
			.visibility(isPrivate ? "private" : repo.path("visibility").asText("public"))
			.fork(repo.path("fork").asBoolean(false))
			.archived(repo.path("archived").asBoolean(false))
			.defaultBranch(defaultBranch)
			.topics(JsonNodeUtils.strings(repo, "topics"))
			.hasIssues(repo.path("has_issues").asBoolean(false))
			.hasProjects(repo.path("has_projects").asBoolean(false))
			.hasWiki(repo.path("has_wiki").asBoolean(false))
			.hasDiscussions(repo.path("has_discussions").asBoolean(false))
			.sizeKb(repo.path("size").asLong(0))
			.deleteBranchOnMerge(repo.path("delete_branch_on_merge").asBoolean(false))
			.allowMergeCommit(repo.path("allow_merge_commit").asBoolean(false))
			.allowAutoMerge(repo.path("allow_auto_merge").asBoolean(false))
			.license(parseLicense(repo.path("license")))
			.language(JsonNodeUtils.textOrNull(repo, "language"))
			.createdAt(createdAt)
			.fetchedAt(fetchedAt);

		builder.hasReadme(exists(base + "/readme"));

		Set<String> files = fetchTree(base, defaultBranch);
		builder.files(files);
		for (String path : files) {
			if (isWorkflowFile(path)) {
				builder.workflow(fileParser.parseWorkflow(path, fetchContent(base, path)));
			}
		}
		for (String path : DEPENDABOT_PATHS) {
			if (files.contains(path)) {
				builder.dependabotConfig(fileParser.parseDependabotConfig(fetchContent(base, path)));
				break;
			}
		}
		if (files.contains(PYPROJECT)) {
			builder.pyproject(fileParser.parsePyproject(fetchContent(base, PYPROJECT)));
		}
		if (files.contains(REQUIREMENTS)) {
			builder.requirementsTxt(fetchContent(base, REQUIREMENTS));
		}

		if (!isPrivate && createdAt != null && createdAt.isBefore(fetchedAt.minus(RELEASE_CHECK_MIN_AGE))) {
			builder.latestReleaseAt(fetchLatestReleaseAt(base));
			builder.lastOwnerCommitAt(fetchLastOwnerCommitAt(base, ref.owner()));
		}

		builder.defaultBranchProtection(fetchBranchProtection(base, defaultBranch));
		builder.defaultBranchRules(fetchBranchRules(base, defaultBranch));

		ActionsPermissions actions = fetchActionsPermissions(base);
		builder.actionsPermissions(actions);
		if (actions.enabled()) {
			JsonNode workflowPermissions = readTree(client.get(base + "/actions/permissions/workflow"));
			builder.workflowPermissions(
					new WorkflowPermissions(JsonNodeUtils.text(workflowPermissions, "default_workflow_permissions"),
							workflowPermissions.path("can_approve_pull_request_reviews").asBoolean(false)));
		}

		if (repo.path("has_pages").asBoolean(false)) {
			builder.pagesBranch(fetchPagesBranch(base));
		}

		return builder.build();
	}

	private @Nullable LicenseInfo parseLicense(JsonNode license) {
		if (license.isMissingNode() || license.isNull()) {
			return null;
		}
		return new LicenseInfo(JsonNodeUtils.text(license, "spdx_id"), JsonNodeUtils.text(license, "name"));
	}

	private boolean exists(String path) {
		try {
			client.get(path);
			return true;
		}
		catch (NotFoundException e) {
			return false;
		}
	}

	private Set<String> fetchTree(String base, String branch) {
		Set<String> files = new LinkedHashSet<>();
		if (branch.isEmpty()) {
			return files;
		}
		JsonNode tree;
		try {
			tree = readTree(client.getWithQuery(base + "/git/trees/" + GitHubPaths.path(branch), "recursive=1"));
		}
		catch (NotFoundException e) {
			return files;
		}
		catch (GitHubApiException e) {
			// 409: repository is empty
			if (e.getStatusCode() == 409) {
				return files;
			}
			throw e;
		}
		if (tree.path("truncated").asBoolean(false)) {
			logger.warn("File tree of {} is truncated; file-based rules may be incomplete", base);
		}
		for (JsonNode entry : JsonNodeUtils.array(tree, "tree")) {
			if ("blob".equals(JsonNodeUtils.text(entry, "type"))) {
				files.add(JsonNodeUtils.text(entry, "path"));
			}
		}
		return files;
	}

	private static boolean isWorkflowFile(String path) {
		if (!path.startsWith(WORKFLOWS_DIR)) {
			return false;
		}
		String name = path.substring(WORKFLOWS_DIR.length());
		return !name.contains("/") && (name.endsWith(".yml") || name.endsWith(".yaml"));
	}

	private String fetchContent(String base, String path) {
		JsonNode node = readTree(client.get(base + "/contents/" + GitHubPaths.path(path)));
		String content = JsonNodeUtils.text(node, "content");
		if ("base64".equals(JsonNodeUtils.text(node, "encoding"))) {
			return new String(Base64.getMimeDecoder().decode(content), StandardCharsets.UTF_8);
		}
		return content;
	}

	private @Nullable Instant fetchLatestReleaseAt(String base) {
		try {
			return JsonNodeUtils.instant(readTree(client.get(base + "/releases/latest")), "created_at");
		}
		catch (NotFoundException e) {
			return null;
		}
	}

	/**
	 * Newest commit on the default branch authored by the owner, skipping merge commits.
	 * Pages are requested only until one is found.
	 */
	private @Nullable Instant fetchLastOwnerCommitAt(String base, String owner) {
		String path = base + "/commits";
		String baseQuery = "author=" + URLEncoder.encode(owner, StandardCharsets.UTF_8) + "&per_page=" + pageSize;
		try {
			return PagedIterator.<JsonNode>stream(page -> Page
				.of(JsonNodeUtils.array(readTree(client.getWithQuery(path, baseQuery + "&page=" + page))), page,
						pageSize))
				.filter(commit -> JsonNodeUtils.array(commit, "parents").size() <= 1)
				.map(commit -> JsonNodeUtils.instant(commit, "commit", "committer", "date"))
				.filter(Objects::nonNull)
				.findFirst()
				.orElse(null);
		}
		catch (GitHubApiException e) {
			// 409: repository is empty
			if (e.getStatusCode() == 409) {
				return null;
			}
			throw e;
		}
	}

	private BranchProtection fetchBranchProtection(String base, String branch) {
		if (branch.isEmpty()) {
			return BranchProtection.unprotected();
		}
		try {
			client.get(base + "/branches/" + GitHubPaths.path(branch) + "/protection");
		}
		catch (NotFoundException e) {
			return BranchProtection.unprotected();
		}
		catch (RateLimitExceededException e) {
			throw e;
		}
		catch (ForbiddenException e) {
			logger.debug("Branch protection of {} unavailable: {}", base, e.getMessage());
			return BranchProtection.unavailable();
		}

		return BranchProtection.protectedBranch();
	}

	private BranchRules fetchBranchRules(String base, String branch) {
		if (branch.isEmpty()) {
			return BranchRules.none();
		}
		JsonNode rules;
		try {
			rules = readTree(client.get(base + "/rules/branches/" + GitHubPaths.path(branch)));
		}
		catch (NotFoundException e) {
			return BranchRules.none();
		}
		List<String> types = new ArrayList<>();
		List<String> contexts = new ArrayList<>();
		for (JsonNode rule : JsonNodeUtils.array(rules)) {
			String type = JsonNodeUtils.text(rule, "type");
			types.add(type);
			if ("required_status_checks".equals(type)) {
				for (JsonNode check : JsonNodeUtils.array(rule, "parameters", "required_status_checks")) {
					contexts.add(JsonNodeUtils.text(check, "context"));
				}
			}
		}
		return new BranchRules(types, contexts);
	}

	private ActionsPermissions fetchActionsPermissions(String base) {
		JsonNode node = readTree(client.get(base + "/actions/permissions"));
		if (!node.path("enabled").asBoolean(false)) {
			return ActionsPermissions.disabled();
		}
		String allowedActions = JsonNodeUtils.text(node, "allowed_actions");
		if (!"selected".equals(allowedActions)) {
			return new ActionsPermissions(true, allowedActions, false, false, List.of());
		}
		JsonNode selected = readTree(client.get(base + "/actions/permissions/selected-actions"));
		return new ActionsPermissions(true, allowedActions, selected.path("github_owned_allowed").asBoolean(false),
				selected.path("verified_allowed").asBoolean(false),
				JsonNodeUtils.strings(selected, "patterns_allowed"));
	}

	private @Nullable String fetchPagesBranch(String base) {
		JsonNode pages;
		try {
			pages = readTree(client.get(base + "/pages"));
		}
		catch (NotFoundException e) {
			return null;
		}
		String branch = JsonNodeUtils.text(pages, "source", "branch");
		if (branch.isEmpty()) {
			branch = "gh-pages";
		}
		return exists(base + "/branches/" + GitHubPaths.path(branch)) ? branch : null;
	}

	private JsonNode readTree(String json) {
		try {
			return objectMapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			throw new GitHubApiException("Failed to parse GitHub response: " + e.getOriginalMessage(), e);
		}
	}

}
