package WFST.Model;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Holder of one implementation shared by several transducer handles.
 * Only a handle whose cell is unique may mutate the implementation in place.
 * @param <I> implementation type
 */
public final class ImplCell<I> {
    private final I impl;
    private final AtomicInteger holders = new AtomicInteger(1);

    ImplCell(I impl) {
        this.impl = impl;
    }

    I get() {
        return impl;
    }

    void acquire() {
        holders.incrementAndGet();
    }

    /**
     * @return true if this was the last holder
     */
    boolean release() {
        return holders.decrementAndGet() == 0;
    }

    boolean unique() {
        return holders.get() == 1;
    }

    int holders() {
        return holders.get();
    }
}
