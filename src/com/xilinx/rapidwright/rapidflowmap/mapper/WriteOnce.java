package com.xilinx.rapidwright.rapidflowmap.mapper;

import java.util.concurrent.atomic.AtomicReference;

/**
 * A cell that accepts exactly one value. Concurrent writers race on {@link #trySet(Object)}
 * and only the first one wins.
 */
public final class WriteOnce<T> {
    private final AtomicReference<T> value = new AtomicReference<>();

    public boolean trySet(T newValue) {
        assert newValue != null;
        return value.compareAndSet(null, newValue);
    }

    public void set(T newValue) {
        if (!trySet(newValue)) {
            throw new IllegalStateException("Value already written: " + value.get());
        }
    }

    public boolean isSet() {
        return value.get() != null;
    }

    public T get() {
        T current = value.get();
        if (current == null) {
            throw new IllegalStateException("Value read before it was written");
        }
        return current;
    }
}
