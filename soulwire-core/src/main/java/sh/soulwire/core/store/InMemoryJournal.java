// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.store;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Volatile journal for tests and ephemeral nodes.
 *
 * @param <T> record type
 * @since 0.1.0
 */
public final class InMemoryJournal<T> implements Journal<T> {

    private final List<T> records = new ArrayList<>();

    @Override
    public synchronized void append(final T record) {
        records.add(record);
    }

    @Override
    public void replay(final Consumer<? super T> consumer) {
        for (T record : snapshot()) {
            consumer.accept(record);
        }
    }

    /**
     * Returns a copy of the records appended so far.
     */
    public synchronized List<T> snapshot() {
        return List.copyOf(records);
    }

    @Override
    public void close() {
    }
}
