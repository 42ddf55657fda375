// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import sh.soulwire.core.TestSouls;
import sh.soulwire.core.error.PersistenceException;
import sh.soulwire.core.identity.SoulId;

class InMemoryKeyCustodyTest {

    @TempDir
    Path dir;

    @Test
    void loadsOneKeyPerKeyFile() throws Exception {
        Files.writeString(dir.resolve("alice.key"), "0x" + String.format("%064x", 11) + "\n");
        Files.writeString(dir.resolve("bob.key"), String.format("%064x", 12));
        Files.writeString(dir.resolve("README"), "not a key");

        final InMemoryKeyCustody custody = InMemoryKeyCustody.fromDirectory(dir);

        assertEquals(2, custody.size());
        assertEquals(TestSouls.key(11).publicKey().toHex(),
                custody.keyFor(SoulId.of("alice")).orElseThrow().publicKey().toHex());
        assertEquals(TestSouls.key(12).publicKey().toHex(),
                custody.keyFor(SoulId.of("bob")).orElseThrow().publicKey().toHex());
        assertTrue(custody.keyFor(SoulId.of("carol")).isEmpty());
    }

    @Test
    void badKeyFileIsNamed() throws Exception {
        Files.writeString(dir.resolve("alice.key"), "0x1234");

        final IllegalArgumentException ex =
                assertThrows(IllegalArgumentException.class, () -> InMemoryKeyCustody.fromDirectory(dir));
        assertTrue(ex.getMessage().contains("alice.key"));
    }

    @Test
    void reservedSoulIdIsRejected() throws Exception {
        Files.writeString(dir.resolve("info.key"), String.format("%064x", 11));
        assertThrows(IllegalArgumentException.class, () -> InMemoryKeyCustody.fromDirectory(dir));
    }

    @Test
    void missingDirectoryIsPersistenceFailure() {
        assertThrows(PersistenceException.class, () -> InMemoryKeyCustody.fromDirectory(dir.resolve("absent")));
    }

    @Test
    void revokeDestroysKey() {
        final InMemoryKeyCustody custody = new InMemoryKeyCustody();
        final PrivateKey key = TestSouls.key(11);
        custody.deposit(SoulId.of("alice"), key);

        assertTrue(custody.revoke(SoulId.of("alice")));
        assertTrue(key.isDestroyed());
        assertTrue(custody.keyFor(SoulId.of("alice")).isEmpty());
        assertFalse(custody.revoke(SoulId.of("alice")));
    }
}
