// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import sh.soulwire.core.SoulwireConfig;
import sh.soulwire.core.crypto.InMemoryKeyCustody;
import sh.soulwire.core.crypto.Signature;
import sh.soulwire.core.crypto.SoulSigner;
import sh.soulwire.core.identity.SoulId;

@Timeout(30)
class SoulwireNodeTest {

    @TempDir
    Path dataDir;

    private SoulwireConfig config() {
        return SoulwireConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .dataDir(dataDir)
                .sweepInterval(Duration.ofMillis(200))
                .build();
    }

    private static final class LineClient implements AutoCloseable {
        private final Socket socket;
        private final BufferedReader in;
        private final OutputStream out;

        LineClient(final int port) throws Exception {
            socket = new Socket("127.0.0.1", port);
            socket.setSoTimeout(5000);
            in = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            out = socket.getOutputStream();
        }

        String call(final String line) throws Exception {
            out.write((line + "\r\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
            return in.readLine();
        }

        @Override
        public void close() throws Exception {
            socket.close();
        }
    }

    @Test
    void servesLineProtocolAndPersistsSouls() throws Exception {
        final String key = TestNode.key(11).publicKey().toHex();
        final String proof = SoulSigner.sign(TestNode.key(11), "register:alice").toHex();

        try (SoulwireNode node = SoulwireNode.create(config(), new InMemoryKeyCustody(), Clock.systemUTC())) {
            final int port = node.start();
            assertTrue(port > 0);
            try (LineClient client = new LineClient(port)) {
                assertEquals("PONG ready", client.call("PING ready"));
                assertEquals("SOUL_REGISTERED alice", client.call("SOUL REGISTER alice " + key + " " + proof));

                final String nonce = client.call("SOUL alice").split(" ")[2];
                assertEquals("AUTH_OK alice",
                        client.call("SOUL alice " + SoulSigner.sign(TestNode.key(11), nonce).toHex()));
                assertTrue(client.call("SERVICE OFFER translation 50").startsWith("LISTED L1"));
            }
        }

        assertTrue(Files.exists(dataDir.resolve(SoulwireNode.SOULS_JOURNAL)));
        assertTrue(Files.exists(dataDir.resolve(SoulwireNode.MARKET_JOURNAL)));

        try (SoulwireNode restarted = SoulwireNode.create(config(), new InMemoryKeyCustody(), Clock.systemUTC())) {
            assertTrue(restarted.registry().contains(SoulId.of("alice")));
            assertTrue(restarted.market().openListings().isEmpty());
            assertTrue(restarted.market().listing("L1").isPresent());
        }
    }

    @Test
    void signsWithKeysLoadedFromKeysDir() throws Exception {
        final Path keysDir = Files.createDirectories(dataDir.resolve("keys"));
        Files.writeString(keysDir.resolve("alice.key"), String.format("%064x", 11));
        final SoulwireConfig config = SoulwireConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .dataDir(dataDir)
                .keysDir(keysDir)
                .build();
        final String key = TestNode.key(11).publicKey().toHex();
        final String proof = SoulSigner.sign(TestNode.key(11), "register:alice").toHex();

        try (SoulwireNode node = SoulwireNode.create(config, Clock.systemUTC())) {
            final int port = node.start();
            try (LineClient client = new LineClient(port)) {
                client.call("SOUL REGISTER alice " + key + " " + proof);
                final String nonce = client.call("SOUL alice").split(" ")[2];
                client.call("SOUL alice " + SoulSigner.sign(TestNode.key(11), nonce).toHex());

                final String[] reply = client.call("SIGN hello world").split(" ");
                assertEquals("SIGNATURE", reply[0]);
                assertTrue(SoulSigner.verify(TestNode.key(11).publicKey(), "hello world",
                        Signature.tryParse(reply[1])));
            }
        }
    }

    @Test
    void invalidKeyFileFailsNodeCreation() throws Exception {
        final Path keysDir = Files.createDirectories(dataDir.resolve("keys"));
        Files.writeString(keysDir.resolve("alice.key"), "not-hex");
        final SoulwireConfig config = SoulwireConfig.builder().dataDir(dataDir).keysDir(keysDir).build();

        assertThrows(IllegalArgumentException.class, () -> SoulwireNode.create(config, Clock.systemUTC()));
    }
}
