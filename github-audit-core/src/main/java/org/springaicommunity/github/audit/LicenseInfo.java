package org.springaicommunity.github.audit;

/**
 * License detected by GitHub for a repository.
 *
 * @param spdxId SPDX identifier, e.g. {@code MIT}
 * @param name display name, e.g. {@code MIT License}
 */
public record LicenseInfo(String spdxId, String name) {

	public boolean isMit() {
		return "MIT".equals(spdxId) || "MIT License".equals(name);
	}

}
