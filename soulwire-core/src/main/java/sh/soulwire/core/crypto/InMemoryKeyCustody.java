// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.crypto;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.error.PersistenceException;
import sh.soulwire.core.identity.SoulId;

/**
 * Process-local key custody for development nodes and tests.
 * Production deployments plug in a custodian backed by a keystore or HSM.
 *
 * <p>
 * {@link #fromDirectory(Path)} loads one key per {@code <soul-id>.key} file, each
 * holding the hex private key (with or without {@code 0x}).
 *
 * @since 0.1.0
 */
public final class InMemoryKeyCustody implements KeyCustody {

    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyCustody.class);

    static final String KEY_SUFFIX = ".key";

    private final Map<SoulId, PrivateKey> keys = new ConcurrentHashMap<>();

    /**
     * Loads every {@code <soul-id>.key} file in {@code dir}. Other files are ignored.
     *
     * @throws IllegalArgumentException if a key file names an invalid soul id or holds
     *                                  an invalid key; the message names the file
     * @throws PersistenceException     if the directory cannot be read
     */
    public static InMemoryKeyCustody fromDirectory(final Path dir) {
        Objects.requireNonNull(dir, "dir");
        final InMemoryKeyCustody custody = new InMemoryKeyCustody();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*" + KEY_SUFFIX)) {
            for (Path file : files) {
                if (!Files.isRegularFile(file)) {
                    continue;
                }
                final String name = file.getFileName().toString();
                final String id = name.substring(0, name.length() - KEY_SUFFIX.length());
                if (!SoulId.isValid(id)) {
                    throw new IllegalArgumentException("Key file " + name + " does not name a valid soul id");
                }
                final PrivateKey key;
                try {
                    key = PrivateKey.fromHex(Files.readString(file, StandardCharsets.UTF_8).trim());
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Key file " + name + " does not hold a valid private key", e);
                }
                custody.deposit(SoulId.of(id), key);
            }
        } catch (IOException e) {
            throw new PersistenceException("Cannot read key directory " + dir, e);
        }
        log.info("Loaded {} signing keys from {}", custody.keys.size(), dir.toAbsolutePath());
        return custody;
    }

    /**
     * Deposits a key for a soul, replacing and destroying any previous one.
     */
    public void deposit(final SoulId soul, final PrivateKey key) {
        Objects.requireNonNull(soul, "soul");
        Objects.requireNonNull(key, "key");
        final PrivateKey previous = keys.put(soul, key);
        if (previous != null && previous != key) {
            previous.destroy();
        }
        log.debug("Key deposited for soul {}", soul);
    }

    /**
     * Removes and destroys the key held for a soul.
     *
     * @return true if a key was held
     */
    public boolean revoke(final SoulId soul) {
        final PrivateKey removed = keys.remove(soul);
        if (removed == null) {
            return false;
        }
        removed.destroy();
        log.debug("Key revoked for soul {}", soul);
        return true;
    }

    /**
     * Returns the number of keys held.
     */
    public int size() {
        return keys.size();
    }

    @Override
    public Optional<PrivateKey> keyFor(final SoulId soul) {
        final PrivateKey key = keys.get(soul);
        if (key == null || key.isDestroyed()) {
            return Optional.empty();
        }
        return Optional.of(key);
    }
}
