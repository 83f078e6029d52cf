package org.springaicommunity.github.audit.rules;

import org.springaicommunity.github.audit.Finding;
import org.springaicommunity.github.audit.RepositorySnapshot;
import org.springaicommunity.github.audit.Rule;
import org.springaicommunity.github.audit.Severity;

import java.util.List;

/**
 * Flags large repositories: an error above 1 GiB, a warning above 50 MiB.
 */
public final class GitSizeRule implements Rule {

	static final long ERROR_THRESHOLD_KB = 1024 * 1024;

	static final long WARNING_THRESHOLD_KB = 50 * 1024;

	@Override
	public String id() {
		return "git-size";
	}

	@Override
	public String description() {
		return "Repository size is too large";
	}

	@Override
	public List<Finding> evaluate(RepositorySnapshot snapshot) {
		long size = snapshot.sizeKb();
		if (size > ERROR_THRESHOLD_KB) {
			return List.of(new Finding(id(), snapshot.ref(), Severity.ERROR, description(), false));
		}
		if (size > WARNING_THRESHOLD_KB) {
			return List.of(new Finding(id(), snapshot.ref(), Severity.WARNING, description(), false));
		}
		return List.of();
	}

}
