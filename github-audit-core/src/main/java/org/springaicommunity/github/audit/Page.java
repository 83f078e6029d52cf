package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One page of a paginated listing.
 *
 * @param <T> the type of items in the page
 * @param items the items returned for this page
 * @param nextPage number of the following page, or null if this is the last page
 */
public record Page<T>(List<T> items, @Nullable Integer nextPage) {

	/**
	 * Build a page using the GitHub convention that a page shorter than the requested size
	 * is the last one.
	 * @param <T> the item type
	 * @param items items parsed from the response (before any filtering)
	 * @param page the number of this page
	 * @param pageSize the requested page size
	 * @return the page
	 */
	public static <T> Page<T> of(List<T> items, int page, int pageSize) {
		return new Page<>(List.copyOf(items), items.size() >= pageSize ? page + 1 : null);
	}

}
