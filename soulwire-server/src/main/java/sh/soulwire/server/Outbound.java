// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

/**
 * Write side of one client connection.
 *
 * @since 0.1.0
 */
public interface Outbound {

    /**
     * Queues one line for the client. The transport appends the line terminator.
     */
    void send(String line);

    /**
     * Closes the connection after pending lines are flushed.
     */
    default void close() {
    }
}
