package io.surfworks.spectrastack.core.view;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Lockstep traversal of several iterators, typically the {@link ChunkIterator}s of views
 * over related stacks (data and fit results of the same scan).
 *
 * <p>The combined sequence ends as soon as one iterator is exhausted. No iterator is
 * advanced unless all of them have a next element, so chunks past the end of the shortest
 * traversal are never read. At the end every {@link ChunkIterator} flushes the chunk it
 * handed out last.
 */
public final class ChunkZip {

    private ChunkZip() {
        // Utility class
    }

    @SafeVarargs
    public static <T> Iterator<List<T>> zip(Iterator<? extends T>... iterators) {
        return zip(Arrays.asList(iterators));
    }

    public static <T> Iterator<List<T>> zip(List<? extends Iterator<? extends T>> iterators) {
        List<Iterator<? extends T>> its = new ArrayList<>(iterators);
        return new Iterator<>() {
            private List<T> next;
            private boolean done = its.isEmpty();

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (done) {
                    return false;
                }
                boolean exhausted = false;
                for (Iterator<? extends T> it : its) {
                    if (!it.hasNext()) {
                        exhausted = true;
                    }
                }
                if (exhausted) {
                    done = true;
                    for (Iterator<? extends T> it : its) {
                        if (it instanceof ChunkIterator chunks) {
                            chunks.flush();
                        }
                    }
                    return false;
                }
                List<T> items = new ArrayList<>(its.size());
                for (Iterator<? extends T> it : its) {
                    items.add(it.next());
                }
                next = items;
                return true;
            }

            @Override
            public List<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                List<T> result = next;
                next = null;
                return result;
            }
        };
    }
}
