// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core;

/**
 * Global toggle for wire-level trace logging.
 *
 * <p>Inbound and outbound tracing are separate flags so an operator can follow
 * one direction of a busy node. The compound check in {@link #isEnabled()} reads two
 * volatile fields non-atomically, which is fine for best-effort logging.
 */
public final class WireDebug {

    private static volatile boolean inboundLogging = false;
    private static volatile boolean outboundLogging = false;

    private WireDebug() {
    }

    /**
     * @return true if either direction is traced
     */
    public static boolean isEnabled() {
        return inboundLogging || outboundLogging;
    }

    public static void setEnabled(final boolean enabled) {
        inboundLogging = enabled;
        outboundLogging = enabled;
    }

    public static void setInboundLogging(final boolean enabled) {
        inboundLogging = enabled;
    }

    public static boolean isInboundLoggingEnabled() {
        return inboundLogging;
    }

    public static void setOutboundLogging(final boolean enabled) {
        outboundLogging = enabled;
    }

    public static boolean isOutboundLoggingEnabled() {
        return outboundLogging;
    }
}
