package com.strata.eventstore;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.Function;

/**
 * Lazy, restartable view over a stream that is fetched one page at a time.
 *
 * <p>Each {@link #iterator()} starts again at the first position. A page shorter than requested
 * marks the end of the stream.
 *
 * @param <R> raw row type returned by the fetch
 * @param <T> element type
 */
public final class StreamPages<R, T> implements Iterable<T> {

    /** Fetches up to {@code count} rows starting at stream position {@code from}. */
    @FunctionalInterface
    public interface PageFetcher<R> {
        List<R> fetch(long from, int count);
    }

    private final long from;
    private final int maxCount;
    private final int pageSize;
    private final PageFetcher<R> fetcher;
    private final Function<R, Long> positionOf;
    private final Function<R, T> mapper;

    public StreamPages(
            long from,
            int maxCount,
            int pageSize,
            PageFetcher<R> fetcher,
            Function<R, Long> positionOf,
            Function<R, T> mapper) {
        if (maxCount <= 0) {
            throw new IllegalArgumentException("maxCount must be positive");
        }
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive");
        }
        this.from = from;
        this.maxCount = maxCount;
        this.pageSize = pageSize;
        this.fetcher = fetcher;
        this.positionOf = positionOf;
        this.mapper = mapper;
    }

    @Override
    public Iterator<T> iterator() {
        return new PageIterator();
    }

    private final class PageIterator implements Iterator<T> {

        private long next = from;
        private int remaining = maxCount;
        private Iterator<R> page = List.<R>of().iterator();
        private boolean exhausted;

        @Override
        public boolean hasNext() {
            if (remaining <= 0) {
                return false;
            }
            if (!page.hasNext() && !exhausted) {
                int count = Math.min(pageSize, remaining);
                List<R> rows = fetcher.fetch(next, count);
                exhausted = rows.size() < count;
                page = rows.iterator();
            }
            return page.hasNext();
        }

        @Override
        public T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            R row = page.next();
            next = positionOf.apply(row) + 1;
            remaining--;
            return mapper.apply(row);
        }
    }
}
