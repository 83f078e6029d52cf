package org.springaicommunity.github.audit;

/**
 * The wired components of an audit, as produced by {@link GitHubAuditBuilder}.
 *
 * @param metadataService access to repository metadata
 * @param selector resolves the repositories to audit
 * @param engine runs rules over the selected repositories
 */
public record GitHubAudit(RepositoryMetadataService metadataService, RepositorySelector selector,
		AuditEngine engine) {

}
