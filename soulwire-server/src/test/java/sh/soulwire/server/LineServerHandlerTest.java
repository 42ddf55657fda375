// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import sh.soulwire.core.SoulwireConfig;
import sh.soulwire.core.crypto.SoulSigner;

class LineServerHandlerTest {

    private static final int MAX_LINE = 512;

    private TestNode node;
    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        node = new TestNode(SoulwireConfig.defaults());
        channel = open();
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private EmbeddedChannel open() {
        return new EmbeddedChannel(new ChannelInitializer<Channel>() {
            @Override
            protected void initChannel(final Channel ch) {
                SoulwireServer.configure(ch.pipeline(), MAX_LINE, node.dispatcher);
            }
        });
    }

    private static void write(final EmbeddedChannel ch, final String data) {
        ch.writeInbound(Unpooled.copiedBuffer(data, StandardCharsets.UTF_8));
    }

    private static String read(final EmbeddedChannel ch) {
        final ByteBuf buf = ch.readOutbound();
        if (buf == null) {
            return null;
        }
        try {
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    void connectionOpensSession() {
        assertEquals(1, node.sessions.size());
    }

    @Test
    void repliesAreCrlfTerminated() {
        write(channel, "PING abc\n");
        assertEquals("PONG abc\r\n", read(channel));
    }

    @Test
    void acceptsCrlfAndSplitPackets() {
        write(channel, "PI");
        assertNull(read(channel));
        write(channel, "NG one\r\nPING two\r\n");

        assertEquals("PONG one\r\n", read(channel));
        assertEquals("PONG two\r\n", read(channel));
    }

    @Test
    void overLongLineIsReportedAndConnectionSurvives() {
        write(channel, "PRIVMSG #market :" + "x".repeat(MAX_LINE + 100) + "\nPING after\n");

        assertEquals("ERR_LINE_TOO_LONG\r\n", read(channel));
        assertEquals("PONG after\r\n", read(channel));
        assertTrue(channel.isOpen());
    }

    @Test
    void failedCommandKeepsConnectionOpen() {
        write(channel, "SERVICE LIST\n");

        assertTrue(read(channel).startsWith("ERR_NOT_AUTHENTICATED"));
        assertTrue(channel.isOpen());
    }

    @Test
    void authenticatesOverTheChannel() {
        final String key = TestNode.key(11).publicKey().toHex();
        final String proof = SoulSigner.sign(TestNode.key(11), "register:alice").toHex();
        write(channel, "SOUL REGISTER alice " + key + " " + proof + "\n");
        assertEquals("SOUL_REGISTERED alice\r\n", read(channel));

        write(channel, "SOUL alice\n");
        final String nonce = read(channel).trim().split(" ")[2];
        write(channel, "SOUL alice " + SoulSigner.sign(TestNode.key(11), nonce).toHex() + "\n");

        assertEquals("AUTH_OK alice\r\n", read(channel));
    }

    @Test
    void relayReachesOtherChannels() {
        final EmbeddedChannel other = open();
        try {
            write(channel, "PRIVMSG #market :hi\n");

            assertEquals(":S1 PRIVMSG #market :hi\r\n", read(channel));
            assertEquals(":S1 PRIVMSG #market :hi\r\n", read(other));
        } finally {
            other.finishAndReleaseAll();
        }
    }

    @Test
    void closingChannelEndsSession() {
        write(channel, "PING x\n");
        read(channel);

        channel.close();

        assertEquals(0, node.sessions.size());
    }
}
