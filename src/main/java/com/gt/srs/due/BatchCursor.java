package com.gt.srs.due;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;

// Walks a keyset paged query one batch at a time, loading the next batch only when the current one runs out
class BatchCursor<T> {

    private final BiFunction<T, Integer, List<T>> batchLoader;
    private final int batchSize;

    private List<T> batch = List.of();
    private int index = 0;
    private T lastItem = null;
    private boolean exhausted = false;

    BatchCursor(BiFunction<T, Integer, List<T>> batchLoader, int batchSize) {
        this.batchLoader = batchLoader;
        this.batchSize = batchSize;
    }

    boolean hasNext() {
        if (index < batch.size()) {
            return true;
        }
        if (exhausted) {
            return false;
        }

        List<T> nextBatch = batchLoader.apply(lastItem, batchSize);
        batch = nextBatch == null ? List.of() : nextBatch;
        index = 0;
        exhausted = batch.size() < batchSize;

        return !batch.isEmpty();
    }

    T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }

        lastItem = batch.get(index++);
        return lastItem;
    }
}
