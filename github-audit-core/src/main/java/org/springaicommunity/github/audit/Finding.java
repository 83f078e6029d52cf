package org.springaicommunity.github.audit;

/**
 * One rule violation reported against one repository.
 *
 * @param ruleId id of the rule that produced the finding
 * @param repository the repository the finding applies to
 * @param severity severity of the violation
 * @param message human-readable description of the violation
 * @param fixable whether the violation is a repository setting that can be changed in
 * place
 */
public record Finding(String ruleId, RepositoryRef repository, Severity severity, String message, boolean fixable) {

}
