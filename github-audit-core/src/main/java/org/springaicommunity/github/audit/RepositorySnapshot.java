package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable view of one repository's configuration, hydrated once per audit pass.
 *
 * <p>
 * Rules only see this value, never raw API responses. Sub-resources that do not exist on
 * the remote side (no README, no workflows, unprotected default branch) are represented
 * here rather than raised as errors.
 *
 * @param ref the repository identifier
 * @param description repository description, empty when unset
 * @param visibility {@code public}, {@code private} or {@code internal}
 * @param fork whether the repository is a fork
 * @param archived whether the repository is archived
 * @param defaultBranch the default branch name
 * @param topics repository topics
 * @param hasIssues whether Issues are enabled
 * @param hasProjects whether Projects are enabled
 * @param hasWiki whether the Wiki is enabled
 * @param hasDiscussions whether Discussions are enabled
 * @param sizeKb repository size in kilobytes as reported by GitHub
 * @param deleteBranchOnMerge whether head branches are deleted after merge
 * @param allowMergeCommit whether merge commits are allowed
 * @param allowAutoMerge whether auto-merge is allowed
 * @param license detected license, if any
 * @param hasReadme whether a README was found
 * @param files paths of all files in the default branch tree
 * @param pagesBranch branch GitHub Pages is built from, if Pages is enabled and the branch
 * exists
 * @param defaultBranchProtection classic protection of the default branch
 * @param defaultBranchRules ruleset rules applying to the default branch
 * @param actionsPermissions GitHub Actions permissions
 * @param workflowPermissions default workflow token permissions, null when Actions are
 * disabled
 * @param workflows parsed workflow files
 * @param dependabotConfig parsed Dependabot configuration, if present
 * @param language primary language detected by GitHub, if any
 * @param pyproject parsed {@code pyproject.toml}, null when absent, empty or unparseable
 * @param requirementsTxt content of {@code requirements.txt}, if present
 * @param createdAt creation time of the repository, if known
 * @param latestReleaseAt creation time of the latest release, null when there is none or
 * it was not fetched
 * @param lastOwnerCommitAt time of the newest non-merge commit authored by the owner, null
 * when there is none or it was not fetched
 * @param fetchedAt when the snapshot was taken, the reference point for age checks
 */
public record RepositorySnapshot(RepositoryRef ref, String description, String visibility, boolean fork,
		boolean archived, String defaultBranch, List<String> topics, boolean hasIssues, boolean hasProjects,
		boolean hasWiki, boolean hasDiscussions, long sizeKb, boolean deleteBranchOnMerge, boolean allowMergeCommit,
		boolean allowAutoMerge, @Nullable LicenseInfo license, boolean hasReadme, Set<String> files,
		@Nullable String pagesBranch, BranchProtection defaultBranchProtection,
		BranchRules defaultBranchRules, ActionsPermissions actionsPermissions,
		@Nullable WorkflowPermissions workflowPermissions, List<Workflow> workflows,
		@Nullable DependabotConfig dependabotConfig, @Nullable String language, @Nullable PythonProject pyproject,
		@Nullable String requirementsTxt, @Nullable Instant createdAt, @Nullable Instant latestReleaseAt,
		@Nullable Instant lastOwnerCommitAt, Instant fetchedAt) {

	public RepositorySnapshot {
		topics = List.copyOf(topics);
		files = Set.copyOf(files);
		workflows = List.copyOf(workflows);
	}

	public static Builder builder(RepositoryRef ref) {
		return new Builder(ref);
	}

	public boolean isPrivate() {
		return "private".equals(visibility);
	}

	public boolean hasFile(String path) {
		return files.contains(path);
	}

	public boolean hasWorkflowFiles() {
		return files.stream().anyMatch(path -> path.startsWith(".github/workflows/"));
	}

	public boolean hasDescription() {
		return !description.isBlank();
	}

	public boolean hasRequirementsTxt() {
		return requirementsTxt != null;
	}

	/**
	 * Returns the non-comment lines of {@code requirements.txt}.
	 * @return requirement lines, empty when the file is absent
	 */
	public List<String> requirementLines() {
		if (requirementsTxt == null) {
			return List.of();
		}
		return requirementsTxt.lines().filter(line -> !line.stripLeading().startsWith("#")).toList();
	}

	/**
	 * Returns a builder pre-populated with this snapshot's values.
	 * @return builder
	 */
	public Builder toBuilder() {
		return new Builder(ref).description(description)
			.visibility(visibility)
			.fork(fork)
			.archived(archived)
			.defaultBranch(defaultBranch)
			.topics(topics)
			.hasIssues(hasIssues)
			.hasProjects(hasProjects)
			.hasWiki(hasWiki)
			.hasDiscussions(hasDiscussions)
			.sizeKb(sizeKb)
			.deleteBranchOnMerge(deleteBranchOnMerge)
			.allowMergeCommit(allowMergeCommit)
			.allowAutoMerge(allowAutoMerge)
			.license(license)
			.hasReadme(hasReadme)
			.files(files)
			.pagesBranch(pagesBranch)
			.defaultBranchProtection(defaultBranchProtection)
			.defaultBranchRules(defaultBranchRules)
			.actionsPermissions(actionsPermissions)
			.workflowPermissions(workflowPermissions)
			.workflows(workflows)
			.dependabotConfig(dependabotConfig)
			.language(language)
			.pyproject(pyproject)
			.requirementsTxt(requirementsTxt)
			.createdAt(createdAt)
			.latestReleaseAt(latestReleaseAt)
			.lastOwnerCommitAt(lastOwnerCommitAt)
			.fetchedAt(fetchedAt);
	}

	/**
	 * Builder for {@link RepositorySnapshot}. Defaults describe a public repository on
	 * {@code main} with every optional sub-resource absent.
	 */
	public static final class Builder {

		private final RepositoryRef ref;

		private String description = "";

		private String visibility = "public";

		private boolean fork;

		private boolean archived;

		private String defaultBranch = "main";

		private List<String> topics = new ArrayList<>();

		private boolean hasIssues = true;

		private boolean hasProjects;

		private boolean hasWiki;

		private boolean hasDiscussions;

		private long sizeKb;

		private boolean deleteBranchOnMerge;

		private boolean allowMergeCommit = true;

		private boolean allowAutoMerge;

		private @Nullable LicenseInfo license;

		private boolean hasReadme;

		private Set<String> files = new LinkedHashSet<>();

		private @Nullable String pagesBranch;

		private BranchProtection defaultBranchProtection = BranchProtection.unprotected();

		private BranchRules defaultBranchRules = BranchRules.none();

		private ActionsPermissions actionsPermissions = ActionsPermissions.disabled();

		private @Nullable WorkflowPermissions workflowPermissions;

		private List<Workflow> workflows = new ArrayList<>();

		private @Nullable DependabotConfig dependabotConfig;

		private @Nullable String language;

		private @Nullable PythonProject pyproject;

		private @Nullable String requirementsTxt;

		private @Nullable Instant createdAt;

		private @Nullable Instant latestReleaseAt;

		private @Nullable Instant lastOwnerCommitAt;

		private Instant fetchedAt = Instant.now();

		private Builder(RepositoryRef ref) {
			this.ref = ref;
		}

		public Builder description(@Nullable String description) {
			this.description = description != null ? description : "";
			return this;
		}

		public Builder visibility(String visibility) {
			this.visibility = visibility;
			return this;
		}

		public Builder fork(boolean fork) {
			this.fork = fork;
			return this;
		}

		public Builder archived(boolean archived) {
			this.archived = archived;
			return this;
		}

		public Builder defaultBranch(String defaultBranch) {
			this.defaultBranch = defaultBranch;
			return this;
		}

		public Builder topics(List<String> topics) {
			this.topics = new ArrayList<>(topics);
			return this;
		}

		public Builder hasIssues(boolean hasIssues) {
			this.hasIssues = hasIssues;
			return this;
		}

		public Builder hasProjects(boolean hasProjects) {
			this.hasProjects = hasProjects;
			return this;
		}

		public Builder hasWiki(boolean hasWiki) {
			this.hasWiki = hasWiki;
			return this;
		}

		public Builder hasDiscussions(boolean hasDiscussions) {
			this.hasDiscussions = hasDiscussions;
			return this;
		}

		public Builder sizeKb(long sizeKb) {
			this.sizeKb = sizeKb;
			return this;
		}

		public Builder deleteBranchOnMerge(boolean deleteBranchOnMerge) {
			this.deleteBranchOnMerge = deleteBranchOnMerge;
			return this;
		}

		public Builder allowMergeCommit(boolean allowMergeCommit) {
			this.allowMergeCommit = allowMergeCommit;
			return this;
		}

		public Builder allowAutoMerge(boolean allowAutoMerge) {
			this.allowAutoMerge = allowAutoMerge;
			return this;
		}

		public Builder license(@Nullable LicenseInfo license) {
			this.license = license;
			return this;
		}

		public Builder hasReadme(boolean hasReadme) {
			this.hasReadme = hasReadme;
			return this;
		}

		public Builder files(Set<String> files) {
			this.files = new LinkedHashSet<>(files);
			return this;
		}

		public Builder file(String path) {
			this.files.add(path);
			return this;
		}

		public Builder pagesBranch(@Nullable String pagesBranch) {
			this.pagesBranch = pagesBranch;
			return this;
		}

		public Builder defaultBranchProtection(BranchProtection defaultBranchProtection) {
			this.defaultBranchProtection = defaultBranchProtection;
			return this;
		}

		public Builder defaultBranchRules(BranchRules defaultBranchRules) {
			this.defaultBranchRules = defaultBranchRules;
			return this;
		}

		public Builder actionsPermissions(ActionsPermissions actionsPermissions) {
			this.actionsPermissions = actionsPermissions;
			return this;
		}

		public Builder workflowPermissions(@Nullable WorkflowPermissions workflowPermissions) {
			this.workflowPermissions = workflowPermissions;
			return this;
		}

		public Builder workflows(List<Workflow> workflows) {
			this.workflows = new ArrayList<>(workflows);
			return this;
		}

		/**
		 * Add a workflow and register its path as a file of the repository.
		 * @param workflow the parsed workflow
		 * @return this builder
		 */
		public Builder workflow(Workflow workflow) {
			this.workflows.add(workflow);
			this.files.add(workflow.path());
			return this;
		}

		public Builder dependabotConfig(@Nullable DependabotConfig dependabotConfig) {
			this.dependabotConfig = dependabotConfig;
			return this;
		}

		public Builder language(@Nullable String language) {
			this.language = language;
			return this;
		}

		public Builder pyproject(@Nullable PythonProject pyproject) {
			this.pyproject = pyproject;
			return this;
		}

		public Builder requirementsTxt(@Nullable String requirementsTxt) {
			this.requirementsTxt = requirementsTxt;
			return this;
		}

		public Builder createdAt(@Nullable Instant createdAt) {
			this.createdAt = createdAt;
			return this;
		}

		public Builder latestReleaseAt(@Nullable Instant latestReleaseAt) {
			this.latestReleaseAt = latestReleaseAt;
			return this;
		}

		public Builder lastOwnerCommitAt(@Nullable Instant lastOwnerCommitAt) {
			this.lastOwnerCommitAt = lastOwnerCommitAt;
			return this;
		}

		public Builder fetchedAt(Instant fetchedAt) {
			this.fetchedAt = fetchedAt;
			return this;
		}

		public RepositorySnapshot build() {
			return new RepositorySnapshot(ref, description, visibility, fork, archived, defaultBranch, topics,
					hasIssues, hasProjects, hasWiki, hasDiscussions, sizeKb, deleteBranchOnMerge, allowMergeCommit,
					allowAutoMerge, license, hasReadme, files, pagesBranch, defaultBranchProtection, defaultBranchRules,
					actionsPermissions, workflowPermissions, workflows, dependabotConfig, language, pyproject,
					requirementsTxt, createdAt, latestReleaseAt, lastOwnerCommitAt, fetchedAt);
		}

	}

}
