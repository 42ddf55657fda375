// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.store;

import java.util.function.Consumer;

/**
 * Append-only record log backing one of the node's persistent components.
 *
 * <p>
 * A component replays its journal once at construction and appends every accepted
 * mutation before making it visible. Implementations must be safe for concurrent
 * {@link #append(Object)} calls; each append is durable (flushed) when it returns.
 *
 * @param <T> record type
 * @since 0.1.0
 */
public interface Journal<T> extends AutoCloseable {

    /**
     * Appends one record.
     *
     * @throws sh.soulwire.core.error.PersistenceException if the record cannot be written
     */
    void append(T record);

    /**
     * Feeds every stored record, oldest first, to {@code consumer}.
     *
     * @throws sh.soulwire.core.error.PersistenceException if the log is unreadable
     */
    void replay(Consumer<? super T> consumer);

    @Override
    void close();
}
