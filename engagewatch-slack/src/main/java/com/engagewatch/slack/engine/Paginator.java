package com.engagewatch.slack.engine;

import com.engagewatch.slack.api.SlackTypes.SlackPage;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy cursor-following walk over a paginated Slack listing.
 * <p>
 * Pages are fetched on demand, one call per page. The first call passes a
 * {@code null} cursor; the walk ends when a page carries no next cursor. Each
 * {@link #iterator()} starts a new walk from the first page. A collaborator
 * that keeps returning cursors will be followed forever.
 */
public final class Paginator<T> implements Iterable<SlackPage<T>> {

    private final Function<String, SlackPage<T>> fetch;

    private Paginator(Function<String, SlackPage<T>> fetch) {
        this.fetch = fetch;
    }

    public static <T> Paginator<T> over(Function<String, SlackPage<T>> fetch) {
        return new Paginator<>(fetch);
    }

    @Override
    public Iterator<SlackPage<T>> iterator() {
        return new Iterator<>() {
            private String cursor;
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done;
            }

            @Override
            public SlackPage<T> next() {
                if (done) {
                    throw new NoSuchElementException();
                }
                SlackPage<T> page = fetch.apply(cursor);
                if (page.hasMore()) {
                    cursor = page.nextCursor();
                } else {
                    done = true;
                }
                return page;
            }
        };
    }

    /**
     * Items of every page, in page order.
     */
    public Stream<T> items() {
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED), false)
                .flatMap(page -> page.items().stream());
    }
}
