// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import sh.soulwire.core.auth.Session;

/**
 * The base messaging transport. Receives every line that is not an extension
 * command.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Relay {

    /**
     * Handles a base-transport line from {@code session}.
     *
     * @param session the sending session
     * @param line    the parsed line
     * @param reply   the sender's connection
     */
    void relay(Session session, CommandLine line, Outbound reply);
}
