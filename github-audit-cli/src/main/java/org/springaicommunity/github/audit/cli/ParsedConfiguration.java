package org.springaicommunity.github.audit.cli;

import org.jspecify.annotations.Nullable;
import org.springaicommunity.github.audit.AuditProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Repository selection
	public List<String> repositories = new ArrayList<>();

	public boolean active = false;

	// Credentials, never printed
	public @Nullable String githubToken;

	// Rule selection and output
	public List<String> rules = new ArrayList<>();

	public ReportFormat format = ReportFormat.REPO;

	public int workers;

	// Mode flags
	public boolean verbose = false;

	public boolean helpRequested = false;

	public boolean listRules = false;

	public boolean versionRequested = false;

	public ParsedConfiguration(AuditProperties defaults) {
		this.workers = defaults.getWorkerThreads();
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "repositories=" + repositories + ", active=" + active + ", githubToken="
				+ (githubToken != null ? "****" : "null") + ", rules=" + rules + ", format=" + format + ", workers="
				+ workers + ", verbose=" + verbose + ", helpRequested=" + helpRequested + ", listRules=" + listRules
				+ ", versionRequested=" + versionRequested + '}';
	}

}
