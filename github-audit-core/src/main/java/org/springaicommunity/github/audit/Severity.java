package org.springaicommunity.github.audit;

/**
 * Severity of a finding.
 */
public enum Severity {

	ERROR("error"),

	WARNING("warn");

	private final String label;

	Severity(String label) {
		this.label = label;
	}

	/**
	 * Short lowercase label used in report lines.
	 * @return the label
	 */
	public String label() {
		return label;
	}

}
