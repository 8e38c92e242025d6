package com.keystone.parallel;

/** First failing item of {@link ParallelExecutor#executeMap}; remaining items are cancelled. */
public final class MapExecutionException extends RuntimeException {

    private final int index;

    public MapExecutionException(int index, Throwable cause) {
        super("Map item " + index + " failed: " + cause.getMessage(), cause);
        this.index = index;
    }

    /** Input index of the failed item. */
    public int getIndex() {
        return index;
    }
}
