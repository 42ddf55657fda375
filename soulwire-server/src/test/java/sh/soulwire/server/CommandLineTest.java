// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import sh.soulwire.core.error.ProtocolException;

class CommandLineTest {

    @Test
    void splitsVerbAndArguments() {
        final CommandLine line = CommandLine.parse("service  offer translation 50");

        assertEquals("SERVICE", line.verb());
        assertEquals(List.of("offer", "translation", "50"), line.args());
        assertEquals("OFFER", line.subcommand());
        assertEquals("offer translation 50", line.rest());
    }

    @Test
    void trailingArgumentKeepsSpaces() {
        final CommandLine line = CommandLine.parse("PRIVMSG #market :hello   there: friend");

        assertEquals(List.of("#market", "hello   there: friend"), line.args());
    }

    @Test
    void restDropsLeadingColon() {
        assertEquals("sign me please", CommandLine.parse("SIGN :sign me please").rest());
        assertEquals("sign me", CommandLine.parse("SIGN sign me").rest());
    }

    @Test
    void stripsLineTerminator() {
        final CommandLine line = CommandLine.parse("PING abc\r\n");

        assertEquals(List.of("abc"), line.args());
        assertEquals("abc", line.rest());
    }

    @Test
    void verbOnly() {
        final CommandLine line = CommandLine.parse("LIST");

        assertEquals(0, line.argCount());
        assertEquals("", line.subcommand());
        assertEquals("", line.rest());
    }

    @Test
    void missingArgumentIsNamed() {
        final ProtocolException ex =
                assertThrows(ProtocolException.class, () -> CommandLine.parse("SERVICE OFFER").arg(1, "category"));
        assertEquals("SERVICE: missing category", ex.getMessage());
    }

    @Test
    void blankLineIsRejected() {
        assertThrows(ProtocolException.class, () -> CommandLine.parse("  "));
    }
}
