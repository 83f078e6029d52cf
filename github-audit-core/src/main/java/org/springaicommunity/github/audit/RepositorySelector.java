package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Resolves the set of repositories to audit: explicit references first, then, if
 * requested, every active repository owned by the authenticated user. Duplicates are
 * dropped, keeping the first occurrence. GitHub names are case-insensitive, so
 * {@code Octocat/Hello} and {@code octocat/hello} are the same repository.
 */
public class RepositorySelector {

	private static final Logger logger = LoggerFactory.getLogger(RepositorySelector.class);

	private final RepositoryMetadataService metadataService;

	public RepositorySelector(RepositoryMetadataService metadataService) {
		this.metadataService = metadataService;
	}

	/**
	 * Select repositories. The listing of active repositories is only requested once the
	 * explicit references have been consumed.
	 * @param explicit repositories named by the caller, in order
	 * @param includeActive whether to add the authenticated user's active repositories
	 * @return lazy, sequential stream of distinct references
	 * @throws IllegalArgumentException if nothing is selected
	 */
	public Stream<RepositoryRef> select(List<RepositoryRef> explicit, boolean includeActive) {
		if (explicit.isEmpty() && !includeActive) {
			throw new IllegalArgumentException("No repositories given and active repository selection not requested");
		}
		logger.debug("Selecting {} explicit repositories (includeActive={})", explicit.size(), includeActive);

		Iterator<RepositoryRef> selection = new SelectionIterator(List.copyOf(explicit).iterator(),
				includeActive ? metadataService : null);
		Set<String> seen = new HashSet<>();
		return StreamSupport
			.stream(Spliterators.spliteratorUnknownSize(selection, Spliterator.ORDERED | Spliterator.NONNULL), false)
			.filter(ref -> seen.add(ref.fullName().toLowerCase(Locale.ROOT)));
	}

	private static final class SelectionIterator implements Iterator<RepositoryRef> {

		private final Iterator<RepositoryRef> explicit;

		private @Nullable RepositoryMetadataService activeSource;

		private @Nullable Iterator<RepositoryRef> active;

		SelectionIterator(Iterator<RepositoryRef> explicit, @Nullable RepositoryMetadataService activeSource) {
			this.explicit = explicit;
			this.activeSource = activeSource;
		}

		@Override
		public boolean hasNext() {
			if (explicit.hasNext()) {
				return true;
			}
			if (active == null) {
				if (activeSource == null) {
					return false;
				}
				logger.debug("Explicit repositories exhausted, listing active repositories");
				active = activeSource.listRepositories(null, true).iterator();
				activeSource = null;
			}
			return active.hasNext();
		}

		@Override
		public RepositoryRef next() {
			if (!hasNext()) {
				throw new NoSuchElementException();
			}
			return explicit.hasNext() ? explicit.next() : active.next();
		}

	}

}
