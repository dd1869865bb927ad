package com.gt.srs.due;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * The due cards for one query. Nothing is read until iteration starts and rows are fetched as iteration
 * advances. Every call to {@link #iterator()} restarts the query from the beginning with the same
 * parameters.
 */
public class DueCardSequence implements Iterable<DueCard> {

    public static final DueCardSequence EMPTY = new DueCardSequence(Collections::emptyIterator);

    private final Supplier<Iterator<DueCard>> iteratorSupplier;

    public DueCardSequence(Supplier<Iterator<DueCard>> iteratorSupplier) {
        this.iteratorSupplier = iteratorSupplier;
    }

    @Override
    public Iterator<DueCard> iterator() {
        return iteratorSupplier.get();
    }

    public Stream<DueCard> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    public List<DueCard> toList() {
        return stream().toList();
    }
}
