// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.auth;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import org.jspecify.annotations.Nullable;

import sh.soulwire.core.crypto.SignedMessage;
import sh.soulwire.core.identity.Soul;
import sh.soulwire.core.identity.SoulId;

/**
 * One client connection as seen by the extension layer.
 *
 * <p>
 * The transport creates a session on connect and discards it on disconnect. A
 * session starts anonymous; only {@link SoulAuthenticator} binds a soul to it. A
 * session may also carry one pending signature produced by {@code SIGN}, consumed by
 * the next relayed message.
 *
 * @since 0.1.0
 */
public final class Session {

    private final String id;
    private volatile String nickname;
    private final AtomicReference<Soul> soul = new AtomicReference<>();
    private final AtomicReference<SignedMessage> pendingSignature = new AtomicReference<>();

    public Session(final String id) {
        this.id = Objects.requireNonNull(id, "id");
        this.nickname = id;
    }

    public String id() {
        return id;
    }

    public String nickname() {
        return nickname;
    }

    public void setNickname(final String nickname) {
        this.nickname = Objects.requireNonNull(nickname, "nickname");
    }

    public Optional<Soul> soul() {
        return Optional.ofNullable(soul.get());
    }

    public Optional<SoulId> soulId() {
        return soul().map(Soul::id);
    }

    public boolean isAuthenticated() {
        return soul.get() != null;
    }

    /**
     * Binds a soul, returning the previously bound one.
     */
    @Nullable
    Soul bind(final Soul newSoul) {
        return soul.getAndSet(Objects.requireNonNull(newSoul, "soul"));
    }

    @Nullable
    Soul unbind() {
        pendingSignature.set(null);
        return soul.getAndSet(null);
    }

    /**
     * Stores a signature to attach to the next relayed message, replacing any earlier one.
     */
    public void attachSignature(final SignedMessage message) {
        pendingSignature.set(Objects.requireNonNull(message, "message"));
    }

    /**
     * Removes and returns the pending signature, so each one is attached at most once.
     */
    public Optional<SignedMessage> takeSignature() {
        return Optional.ofNullable(pendingSignature.getAndSet(null));
    }

    @Override
    public String toString() {
        final Soul bound = soul.get();
        return "Session[" + id + (bound == null ? "" : ", soul=" + bound.id()) + "]";
    }
}
