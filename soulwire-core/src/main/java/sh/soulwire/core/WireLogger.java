// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wire trace logger. Every line is passed through {@link LogSanitizer} first.
 */
public final class WireLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.soulwire.wire");

    private WireLogger() {
    }

    /**
     * Traces a line received from a session.
     */
    public static void logInbound(final String sessionId, final String line) {
        if (!WireDebug.isInboundLoggingEnabled()) {
            return;
        }
        LOG.info("{} <- {}", sessionId, LogSanitizer.sanitize(line));
    }

    /**
     * Traces a line sent to a session.
     */
    public static void logOutbound(final String sessionId, final String line) {
        if (!WireDebug.isOutboundLoggingEnabled()) {
            return;
        }
        LOG.info("{} -> {}", sessionId, LogSanitizer.sanitize(line));
    }
}
