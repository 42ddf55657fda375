// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.auth;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.crypto.Signature;
import sh.soulwire.core.crypto.SoulSigner;
import sh.soulwire.core.identity.IdentityRegistry;
import sh.soulwire.core.identity.Soul;
import sh.soulwire.core.identity.SoulId;
import sh.soulwire.primitives.Hex;

/**
 * Challenge/response state machine that upgrades an anonymous session to a soul.
 *
 * <p>
 * Each session holds at most one outstanding challenge; issuing a new one replaces
 * the old. A challenge is consumed exactly once: the response removes it before the
 * proof is checked, so a second answer to the same challenge always reports
 * {@link AuthResult.Status#CHALLENGE_EXPIRED}. State is keyed by session id in
 * concurrent maps, and nothing blocks between the challenge and the response.
 *
 * <p>
 * Re-authenticating an authenticated session is allowed; the result names the soul
 * that was replaced.
 *
 * @since 0.1.0
 */
public final class SoulAuthenticator implements AuthenticationStatus {

    private static final Logger log = LoggerFactory.getLogger(SoulAuthenticator.class);

    private static final int NONCE_BYTES = 32;

    private final IdentityRegistry registry;
    private final Clock clock;
    private final Duration challengeTtl;
    private final SecureRandom random = new SecureRandom();
    private final AtomicLong challengeCounter = new AtomicLong();
    private final Map<String, AuthChallenge> challenges = new ConcurrentHashMap<>();
    private final Map<SoulId, Set<String>> boundSessions = new ConcurrentHashMap<>();

    public SoulAuthenticator(final IdentityRegistry registry, final Clock clock, final Duration challengeTtl) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.challengeTtl = Objects.requireNonNull(challengeTtl, "challengeTtl");
    }

    /**
     * Issues a fresh challenge for {@code soulId}, replacing any outstanding one.
     *
     * @throws sh.soulwire.core.error.UnknownSoulException if the soul is not registered
     */
    public AuthChallenge beginAuth(final Session session, final SoulId soulId) {
        Objects.requireNonNull(session, "session");
        registry.require(soulId);

        final byte[] nonce = new byte[NONCE_BYTES];
        random.nextBytes(nonce);
        final Instant now = clock.instant();
        final AuthChallenge challenge = new AuthChallenge(
                "C" + challengeCounter.incrementAndGet(),
                soulId,
                Hex.encode(nonce),
                now,
                now.plus(challengeTtl));

        final AuthChallenge previous = challenges.put(session.id(), challenge);
        if (previous != null) {
            log.debug("Session {} replaced challenge {} with {}", session.id(), previous.challengeId(),
                    challenge.challengeId());
        }
        log.debug("Issued challenge {} to session {} for soul {}", challenge.challengeId(), session.id(), soulId);
        return challenge;
    }

    /**
     * Answers the challenge with the given id.
     *
     * @param proof signature over the nonce; null counts as a failed proof
     */
    public AuthResult respond(final Session session, final String challengeId, @Nullable final Signature proof) {
        Objects.requireNonNull(challengeId, "challengeId");
        return complete(session, c -> c.challengeId().equals(challengeId), proof);
    }

    /**
     * Answers the session's outstanding challenge for {@code soulId}. This is the
     * wire form, where the response names the soul rather than the challenge.
     */
    public AuthResult respond(final Session session, final SoulId soulId, @Nullable final Signature proof) {
        Objects.requireNonNull(soulId, "soulId");
        return complete(session, c -> c.soulId().equals(soulId), proof);
    }

    private AuthResult complete(
            final Session session,
            final Predicate<AuthChallenge> matches,
            @Nullable final Signature proof) {
        Objects.requireNonNull(session, "session");
        final AuthChallenge challenge = challenges.get(session.id());
        if (challenge == null || !matches.test(challenge)) {
            return AuthResult.expired();
        }
        // Lost the race to a concurrent response or a replacement.
        if (!challenges.remove(session.id(), challenge)) {
            return AuthResult.expired();
        }
        if (challenge.isExpired(clock.instant())) {
            log.debug("Challenge {} for session {} expired", challenge.challengeId(), session.id());
            return AuthResult.expired();
        }

        final Optional<Soul> soul = registry.find(challenge.soulId());
        if (soul.isEmpty() || proof == null || !SoulSigner.verify(soul.get().key(), challenge.nonce(), proof)) {
            log.info("Authentication failed for soul {} on session {}", challenge.soulId(), session.id());
            return AuthResult.failed();
        }

        final Soul bound = soul.get();
        final Soul previous = session.bind(bound);
        if (previous != null) {
            untrack(previous.id(), session.id());
        }
        track(bound.id(), session.id());

        final Soul replaced = previous != null && !previous.id().equals(bound.id()) ? previous : null;
        if (replaced != null) {
            log.info("Session {} re-authenticated as {}, replacing {}", session.id(), bound.id(), replaced.id());
        } else {
            log.info("Session {} authenticated as {}", session.id(), bound.id());
        }
        return AuthResult.authenticated(bound, replaced);
    }

    /**
     * Discards the session's challenge and unbinds its soul.
     */
    public void sessionClosed(final Session session) {
        challenges.remove(session.id());
        final Soul previous = session.unbind();
        if (previous != null) {
            untrack(previous.id(), session.id());
            log.debug("Session {} closed, unbound soul {}", session.id(), previous.id());
        }
    }

    /**
     * Drops every expired challenge.
     *
     * @return number of challenges dropped
     */
    public int sweepExpired() {
        final Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, AuthChallenge> entry : challenges.entrySet()) {
            if (entry.getValue().isExpired(now) && challenges.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired challenges", removed);
        }
        return removed;
    }

    /**
     * Returns the session's outstanding challenge, if any.
     */
    public Optional<AuthChallenge> outstanding(final Session session) {
        return Optional.ofNullable(challenges.get(session.id()));
    }

    @Override
    public boolean isAuthenticated(final SoulId soul) {
        final Set<String> sessions = boundSessions.get(soul);
        return sessions != null && !sessions.isEmpty();
    }

    /**
     * Returns the display annotation for a session's bound soul, or an empty string
     * for anonymous sessions. The annotation is informational and carries no trust.
     */
    public String annotate(final Session session) {
        return session.soul().map(Soul::annotation).orElse("");
    }

    private void track(final SoulId soul, final String sessionId) {
        boundSessions.compute(soul, (id, sessions) -> {
            final Set<String> result = sessions != null ? sessions : ConcurrentHashMap.newKeySet();
            result.add(sessionId);
            return result;
        });
    }

    private void untrack(final SoulId soul, final String sessionId) {
        boundSessions.computeIfPresent(soul, (id, sessions) -> {
            sessions.remove(sessionId);
            return sessions.isEmpty() ? null : sessions;
        });
    }
}
