// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.auth.Session;
import sh.soulwire.core.identity.SoulId;

/**
 * Live connections of this node, keyed by session id.
 *
 * @since 0.1.0
 */
public final class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final AtomicLong counter = new AtomicLong();

    /**
     * A session and the channel that delivers lines to it.
     */
    public record Connection(Session session, Outbound outbound) {
        public Connection {
            Objects.requireNonNull(session, "session");
            Objects.requireNonNull(outbound, "outbound");
        }
    }

    /**
     * Creates an anonymous session for a new connection.
     */
    public Session open(final Outbound outbound) {
        final Session session = new Session("S" + counter.incrementAndGet());
        connections.put(session.id(), new Connection(session, outbound));
        log.debug("Opened session {} ({} connected)", session.id(), connections.size());
        return session;
    }

    public void close(final Session session) {
        if (connections.remove(session.id()) != null) {
            log.debug("Closed session {} ({} connected)", session.id(), connections.size());
        }
    }

    public Optional<Connection> find(final String sessionId) {
        return Optional.ofNullable(connections.get(sessionId));
    }

    public Collection<Connection> all() {
        return List.copyOf(connections.values());
    }

    /**
     * Returns the connections currently bound to {@code soul}.
     */
    public List<Connection> boundTo(final SoulId soul) {
        final List<Connection> result = new ArrayList<>();
        for (Connection connection : connections.values()) {
            if (connection.session().soulId().filter(soul::equals).isPresent()) {
                result.add(connection);
            }
        }
        return result;
    }

    /**
     * Sends {@code line} to every session bound to {@code soul}.
     *
     * @return number of sessions reached
     */
    public int sendTo(final SoulId soul, final String line) {
        final List<Connection> targets = boundTo(soul);
        for (Connection connection : targets) {
            connection.outbound().send(line);
        }
        return targets.size();
    }

    public int size() {
        return connections.size();
    }
}
