// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.soulwire.core.auth.Session;
import sh.soulwire.core.auth.SoulAuthenticator;
import sh.soulwire.core.crypto.SignedMessage;
import sh.soulwire.core.error.ProtocolException;
import sh.soulwire.core.error.ReplyCode;

/**
 * Minimal stand-in for the base chat transport, for local runs and tests.
 *
 * <p>
 * Answers {@code PING}, records {@code NICK}, closes on {@code QUIT} and delivers
 * {@code PRIVMSG} to every connected session, sender included. There are no
 * channels: the target is echoed but not used for routing. Relayed text is
 * decorated with the sender's soul annotation and with the signature a preceding
 * {@code SIGN} left on the session, which is consumed by this message.
 *
 * <p>
 * {@code USER}, {@code JOIN}, {@code PART} and {@code PONG} are accepted and ignored.
 *
 * @since 0.1.0
 */
public final class BasicRelay implements Relay {

    private static final Logger log = LoggerFactory.getLogger(BasicRelay.class);

    private final SessionRegistry sessions;
    private final SoulAuthenticator authenticator;

    public BasicRelay(final SessionRegistry sessions, final SoulAuthenticator authenticator) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.authenticator = Objects.requireNonNull(authenticator, "authenticator");
    }

    @Override
    public void relay(final Session session, final CommandLine line, final Outbound reply) {
        switch (line.verb()) {
            case "PING" -> reply.send(line.rest().isEmpty() ? "PONG" : "PONG " + line.rest());
            case "NICK" -> {
                final String nick = line.arg(0, "nickname");
                session.setNickname(nick);
                log.debug("Session {} is now known as {}", session.id(), nick);
            }
            case "PRIVMSG" -> privmsg(session, line);
            case "QUIT" -> reply.close();
            case "USER", "JOIN", "PART", "PONG" -> {
            }
            default -> throw new ProtocolException(ReplyCode.ERR_UNKNOWN_COMMAND, line.verb());
        }
    }

    private void privmsg(final Session session, final CommandLine line) {
        final String target = line.arg(0, "target");
        final String text = line.arg(1, "text");

        final StringBuilder sb = new StringBuilder()
                .append(':').append(session.nickname())
                .append(" PRIVMSG ").append(target).append(" :");
        final String annotation = authenticator.annotate(session);
        if (!annotation.isEmpty()) {
            sb.append(annotation).append(' ');
        }
        sb.append(text);
        session.takeSignature().map(SignedMessage::signature)
                .ifPresent(signature -> sb.append(" [Sig:").append(signature.toHex()).append(']'));

        final String delivered = sb.toString();
        for (SessionRegistry.Connection connection : sessions.all()) {
            connection.outbound().send(delivered);
        }
    }
}
