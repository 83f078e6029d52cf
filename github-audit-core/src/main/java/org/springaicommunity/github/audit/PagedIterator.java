package org.springaicommunity.github.audit;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.IntFunction;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Walks a paginated listing one page at a time, fetching the next page only when the
 * current one is drained. The sequence is finite and cannot be restarted.
 *
 * @param <T> the item type
 */
public final class PagedIterator<T> implements Iterator<T> {

	private final IntFunction<Page<T>> pageFetcher;

	private Iterator<T> current = Collections.emptyIterator();

	private @Nullable Integer nextPage = 1;

	public PagedIterator(IntFunction<Page<T>> pageFetcher) {
		this.pageFetcher = pageFetcher;
	}

	/**
	 * Expose a paginated listing as a lazy, ordered stream.
	 * @param <T> the item type
	 * @param pageFetcher fetches the page with the given 1-based number
	 * @return stream that requests pages as it is consumed
	 */
	public static <T> Stream<T> stream(IntFunction<Page<T>> pageFetcher) {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(new PagedIterator<>(pageFetcher),
				Spliterator.ORDERED | Spliterator.NONNULL), false);
	}

	@Override
	public boolean hasNext() {
		while (!current.hasNext() && nextPage != null) {
			Page<T> page = pageFetcher.apply(nextPage);
			current = page.items().iterator();
			nextPage = page.nextPage();
		}
		return current.hasNext();
	}

	@Override
	public T next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		return current.next();
	}

}
