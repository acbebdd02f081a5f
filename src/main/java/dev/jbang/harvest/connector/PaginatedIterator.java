package dev.jbang.harvest.connector;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Abstract base class for paginated iteration over API results. Pages are requested lazily, one at
 * a time, as the iterator is consumed: page 1 first, then the next page for as long as the previous
 * one reported more results. A page without items ends the iteration.
 *
 * <p>Failures of {@link #fetchPage(int)} are not handled here. They reach the caller of
 * {@code hasNext()} and leave the iterator exhausted.
 */
public abstract class PaginatedIterator<T> implements Iterator<T> {
	private int currentPage = 1;
	private Iterator<T> currentBatch = null;
	private boolean hasMore = true;
	private int requestCount = 0;

	/** One page of results */
	public record Page<T>(List<T> items, boolean hasMore) {}

	@Override
	public boolean hasNext() {
		while (currentBatch == null || !currentBatch.hasNext()) {
			if (!hasMore) {
				return false;
			}
			fetchNextBatch();
		}
		return true;
	}

	@Override
	public T next() {
		if (!hasNext()) {
			throw new NoSuchElementException();
		}
		return currentBatch.next();
	}

	/** Number of pages requested so far */
	public int requestCount() {
		return requestCount;
	}

	private void fetchNextBatch() {
		// stop first so a failing request is never repeated by a later hasNext()
		hasMore = false;
		currentBatch = null;
		requestCount++;
		Page<T> page = fetchPage(currentPage);

		if (page == null || page.items() == null || page.items().isEmpty()) {
			return;
		}

		currentBatch = page.items().iterator();
		hasMore = page.hasMore();
		currentPage++;
	}

	/**
	 * Fetch a page of results from an API.
	 *
	 * @param pageNumber The page number to fetch (1-based)
	 * @return The items of this page and whether another page follows, or null if there are no more
	 *     pages
	 */
	protected abstract Page<T> fetchPage(int pageNumber);
}
