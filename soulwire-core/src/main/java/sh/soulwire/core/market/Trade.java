// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

import sh.soulwire.core.crypto.Signature;
import sh.soulwire.core.error.MarketStateException;
import sh.soulwire.core.identity.SoulId;

/**
 * A matched offer/request pair moving through the acceptance handshake.
 *
 * <p>
 * Each party accepts by signing the reputation endorsement it issues for the other
 * party; the signatures are kept on the trade so the settlement events can be
 * submitted without asking either party again.
 *
 * @param tradeId           unique trade id
 * @param offerId           the provider's listing
 * @param requestId         the seeker's listing
 * @param category          shared category of both listings
 * @param price             execution price
 * @param provider          owner of the offer
 * @param seeker            owner of the request
 * @param status            handshake state
 * @param createdAt         match time
 * @param deadline          time by which both parties must accept
 * @param providerSignature provider's endorsement signature once accepted
 * @param seekerSignature   seeker's endorsement signature once accepted
 * @since 0.1.0
 */
public record Trade(
        String tradeId,
        String offerId,
        String requestId,
        Category category,
        Price price,
        SoulId provider,
        SoulId seeker,
        TradeStatus status,
        Instant createdAt,
        Instant deadline,
        @Nullable Signature providerSignature,
        @Nullable Signature seekerSignature) {

    public Trade {
        Objects.requireNonNull(tradeId, "tradeId");
        Objects.requireNonNull(offerId, "offerId");
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(price, "price");
        Objects.requireNonNull(provider, "provider");
        Objects.requireNonNull(seeker, "seeker");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(deadline, "deadline");
        if (provider.equals(seeker)) {
            throw new IllegalArgumentException("provider and seeker must differ");
        }
    }

    /**
     * Returns the role {@code soul} plays in this trade, if it is a party.
     */
    public Optional<Role> roleOf(final SoulId soul) {
        if (provider.equals(soul)) {
            return Optional.of(Role.PROVIDER);
        }
        if (seeker.equals(soul)) {
            return Optional.of(Role.SEEKER);
        }
        return Optional.empty();
    }

    public SoulId party(final Role role) {
        return role == Role.PROVIDER ? provider : seeker;
    }

    public boolean hasAccepted(final Role role) {
        return signatureOf(role) != null;
    }

    @Nullable
    public Signature signatureOf(final Role role) {
        return role == Role.PROVIDER ? providerSignature : seekerSignature;
    }

    public boolean isExpired(final Instant now) {
        return !now.isBefore(deadline);
    }

    /**
     * Records {@code role}'s acceptance. The trade settles once both parties have accepted.
     *
     * @throws MarketStateException if the trade is already final
     */
    public Trade withAcceptance(final Role role, final Signature signature) {
        Objects.requireNonNull(signature, "signature");
        if (status.isTerminal()) {
            throw new MarketStateException("Trade " + tradeId + " is " + status);
        }
        final Signature provSig = role == Role.PROVIDER ? signature : providerSignature;
        final Signature seekSig = role == Role.SEEKER ? signature : seekerSignature;
        final TradeStatus next;
        if (provSig != null && seekSig != null) {
            next = TradeStatus.SETTLED;
        } else if (provSig != null) {
            next = TradeStatus.ACCEPTED_BY_PROVIDER;
        } else {
            next = TradeStatus.ACCEPTED_BY_SEEKER;
        }
        return new Trade(tradeId, offerId, requestId, category, price, provider, seeker, next, createdAt, deadline,
                provSig, seekSig);
    }

    /**
     * Returns this trade aborted.
     *
     * @throws MarketStateException if the trade is already final
     */
    public Trade aborted() {
        if (status.isTerminal()) {
            throw new MarketStateException("Trade " + tradeId + " is " + status);
        }
        return new Trade(tradeId, offerId, requestId, category, price, provider, seeker, TradeStatus.ABORTED,
                createdAt, deadline, providerSignature, seekerSignature);
    }
}
