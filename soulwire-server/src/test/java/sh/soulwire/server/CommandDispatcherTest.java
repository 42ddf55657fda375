// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.server;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import sh.soulwire.core.SoulwireConfig;
import sh.soulwire.core.crypto.SoulSigner;
import sh.soulwire.core.identity.SoulId;
import sh.soulwire.core.reputation.ReputationEvent;

@ExtendWith(MockitoExtension.class)
class CommandDispatcherTest {

    private final SoulwireConfig config = SoulwireConfig.builder().maxOpenListings(2).build();

    @Mock
    private Relay relay;

    private TestNode node;

    @BeforeEach
    void setUp() {
        node = new TestNode(config, relay);
    }

    // Authentication

    @Test
    void registeredSoulAuthenticates() {
        final TestNode.Client client = node.connect();

        assertEquals("SOUL_REGISTERED alice", client.register("alice", 11));
        assertEquals("AUTH_OK alice", client.authenticate("alice", 11));
        assertTrue(client.session.isAuthenticated());
    }

    @Test
    void challengeCarriesNonce() {
        final TestNode.Client client = node.connect();
        client.register("alice", 11);

        final String[] reply = client.send("soul alice").split(" ");

        assertEquals("SOUL_CHALLENGE", reply[0]);
        assertEquals("alice", reply[1]);
        assertEquals(66, reply[2].length());
    }

    @Test
    void wrongKeyIsRejected() {
        final TestNode.Client client = node.connect();
        client.register("alice", 11);

        assertEquals("ERR_AUTH_FAILED alice", client.authenticate("alice", 12));
        assertFalse(client.session.isAuthenticated());
    }

    @Test
    void malformedProofCountsAsFailure() {
        final TestNode.Client client = node.connect();
        client.register("alice", 11);
        client.send("SOUL alice");

        assertEquals("ERR_AUTH_FAILED alice", client.send("SOUL alice 0xnothex"));
    }

    @Test
    void replayedResponseIsExpired() {
        final TestNode.Client client = node.connect();
        client.register("alice", 11);
        final String nonce = client.send("SOUL alice").split(" ")[2];
        final String response = "SOUL alice " + SoulSigner.sign(TestNode.key(11), nonce).toHex();

        assertEquals("AUTH_OK alice", client.send(response));
        assertEquals("ERR_CHALLENGE_EXPIRED alice", client.send(response));
    }

    @Test
    void responseWithoutChallengeIsExpired() {
        final TestNode.Client client = node.connect();
        client.register("alice", 11);
        final String sig = SoulSigner.sign(TestNode.key(11), "0x00").toHex();

        assertEquals("ERR_CHALLENGE_EXPIRED alice", client.send("SOUL alice " + sig));
    }

    @Test
    void unknownSoulCannotAuthenticate() {
        assertTrue(node.connect().send("SOUL ghost").startsWith("ERR_UNKNOWN_SOUL"));
    }

    @Test
    void reauthenticationReportsReplacedSoul() {
        final TestNode.Client client = node.login("alice", 11);
        node.connect().register("bob", 12);

        assertEquals("AUTH_OK bob REPLACED alice", client.authenticate("bob", 12));
        assertEquals(SoulId.of("bob"), client.session.soulId().orElseThrow());
    }

    @Test
    void soulWithoutArgumentsIsSyntaxError() {
        assertTrue(node.connect().send("SOUL").startsWith("ERR_SYNTAX"));
    }

    // Registration

    @Test
    void duplicateRegistrationIsRejected() {
        node.connect().register("alice", 11);
        assertTrue(node.connect().register("alice", 12).startsWith("ERR_DUPLICATE_SOUL"));
    }

    @Test
    void registrationRequiresProofOfPossession() {
        final TestNode.Client client = node.connect();
        final String key = TestNode.key(11).publicKey().toHex();
        final String proofForOtherId = SoulSigner.sign(TestNode.key(11), "register:bob").toHex();

        assertTrue(client.send("SOUL REGISTER alice " + key + " " + proofForOtherId)
                .startsWith("ERR_INVALID_SIGNATURE"));
        assertFalse(node.registry.contains(SoulId.of("alice")));
    }

    @Test
    void registrationCarriesTags() {
        final TestNode.Client client = node.connect();
        final String key = TestNode.key(11).publicKey().toHex();
        final String proof = SoulSigner.sign(TestNode.key(11), "register:alice").toHex();

        assertEquals("SOUL_REGISTERED alice", client.send("SOUL REGISTER alice " + key + " " + proof + " Oracle real"));
        client.authenticate("alice", 11);

        assertEquals("SOUL_INFO alice 0 [Soul:alice] [Paradigm:Oracle] [Mode:REAL]", client.send("SOUL INFO alice"));
    }

    @Test
    void malformedKeyIsSyntaxError() {
        assertTrue(node.connect().send("SOUL REGISTER alice 0x1234 0x00").startsWith("ERR_SYNTAX"));
    }

    @Test
    void subcommandNamesCannotBeRegistered() {
        final TestNode.Client client = node.connect();
        for (String id : new String[] {"info", "REGISTER", "Endorse"}) {
            assertTrue(client.register(id, 11).startsWith("ERR_SYNTAX"), id);
        }
        assertEquals(0, node.registry.size());
    }

    @Test
    void closedRegistrationRefusesNewSouls() {
        final TestNode closed = new TestNode(SoulwireConfig.builder().registrationOpen(false).build(), relay);
        assertEquals("ERR_REGISTRATION_CLOSED", closed.connect().register("alice", 11).split(" ")[0]);
    }

    // Authentication gate

    @Test
    void extensionCommandsRequireAuthentication() {
        final TestNode.Client anon = node.connect();

        assertTrue(anon.send("SERVICE LIST").startsWith("ERR_NOT_AUTHENTICATED"));
        assertTrue(anon.send("SERVICE OFFER translation 5").startsWith("ERR_NOT_AUTHENTICATED"));
        assertTrue(anon.send("SIGN hello").startsWith("ERR_NOT_AUTHENTICATED"));
        assertTrue(anon.send("SOUL INFO alice").startsWith("ERR_NOT_AUTHENTICATED"));
        assertTrue(node.market.openListings().isEmpty());
        verify(relay, never()).relay(any(), any(), any());
    }

    // Marketplace

    @Test
    void matchedTradeSettlesOverTheWire() {
        final TestNode.Client bob = node.login("bob", 12);
        final TestNode.Client alice = node.login("alice", 11);

        assertEquals("LISTED L1 OPEN", bob.send("SERVICE OFFER translation 50"));
        assertEquals("LISTED L2 MATCHED", alice.send("service request Translation 60"));

        final String[] toBob = bob.out.find("TRADE T1 PROPOSED").split(" ");
        final String[] toAlice = alice.out.find("TRADE T1 PROPOSED").split(" ");
        assertEquals("translation", toBob[3]);
        assertEquals("50", toBob[4]);
        assertEquals("PROVIDER", toBob[5]);
        assertEquals("SEEKER", toAlice[5]);
        assertEquals(
                ReputationEvent.canonicalPayload("trade:T1:alice", SoulId.of("bob"), 1, "TRADE_SETTLED",
                        SoulId.of("alice")),
                toAlice[6]);

        final String bobSig = SoulSigner.sign(TestNode.key(12), toBob[6]).toHex();
        final String aliceSig = SoulSigner.sign(TestNode.key(11), toAlice[6]).toHex();
        assertEquals("ACCEPTED T1 ACCEPTED_BY_PROVIDER", bob.send("SERVICE ACCEPT T1 " + bobSig));
        assertEquals("ACCEPTED T1 SETTLED", alice.send("SERVICE ACCEPT T1 " + aliceSig));

        assertTrue(bob.out.lines.contains("TRADE T1 SETTLED"));
        assertTrue(alice.out.lines.contains("TRADE T1 SETTLED"));
        assertEquals(1, node.ledger.scoreOf(SoulId.of("bob")));
        assertEquals(1, node.ledger.scoreOf(SoulId.of("alice")));
        assertEquals("SOUL_INFO bob 1 [Soul:bob]", alice.send("SOUL INFO bob"));
    }

    @Test
    void acceptWithoutSignatureSignsThroughCustody() {
        final TestNode.Client bob = node.login("bob", 12);
        final TestNode.Client alice = node.login("alice", 11);
        bob.send("SERVICE OFFER translation 50");
        alice.send("SERVICE REQUEST translation 60");

        assertTrue(bob.send("SERVICE ACCEPT T1").startsWith("ERR_NO_KEY"));

        node.custody.deposit(SoulId.of("bob"), TestNode.key(12));
        assertEquals("ACCEPTED T1 ACCEPTED_BY_PROVIDER", bob.send("SERVICE ACCEPT T1"));
    }

    @Test
    void forgedAcceptanceIsRejected() {
        final TestNode.Client bob = node.login("bob", 12);
        final TestNode.Client alice = node.login("alice", 11);
        bob.send("SERVICE OFFER translation 50");
        alice.send("SERVICE REQUEST translation 60");
        final String payload = bob.out.find("TRADE T1 PROPOSED").split(" ")[6];

        final String forged = SoulSigner.sign(TestNode.key(11), payload).toHex();

        assertTrue(bob.send("SERVICE ACCEPT T1 " + forged).startsWith("ERR_INVALID_SIGNATURE"));
        assertTrue(bob.send("SERVICE ACCEPT T1 0x12").startsWith("ERR_INVALID_SIGNATURE"));
        assertTrue(bob.send("SERVICE ACCEPT T9 " + forged).startsWith("ERR_UNKNOWN_TRADE"));
    }

    @Test
    void nonPartyCannotAccept() {
        final TestNode.Client bob = node.login("bob", 12);
        final TestNode.Client alice = node.login("alice", 11);
        final TestNode.Client carol = node.login("carol", 13);
        bob.send("SERVICE OFFER translation 50");
        alice.send("SERVICE REQUEST translation 60");

        assertTrue(carol.send("SERVICE ACCEPT T1").startsWith("ERR_INVALID_STATE"));
    }

    @Test
    void listShowsOpenListings() {
        final TestNode.Client bob = node.login("bob", 12);
        bob.send("SERVICE OFFER translation 50");
        bob.send("SERVICE REQUEST review 20");
        bob.out.drain();

        assertEquals("LIST_END 2", bob.send("SERVICE LIST"));
        assertEquals(
                List.of("LISTING L2 REQUEST review 20 bob", "LISTING L1 OFFER translation 50 bob",
                        "LIST_END 2"),
                bob.out.lines);
    }

    @Test
    void badListingsAreRejected() {
        final TestNode.Client bob = node.login("bob", 12);

        assertTrue(bob.send("SERVICE OFFER translation -5").startsWith("ERR_INVALID_PRICE"));
        assertTrue(bob.send("SERVICE OFFER translation 1.5").startsWith("ERR_INVALID_PRICE"));
        assertTrue(bob.send("SERVICE OFFER translation").startsWith("ERR_SYNTAX"));
        assertTrue(bob.send("SERVICE OFFER bad!cat 5").startsWith("ERR_SYNTAX"));
        assertTrue(bob.send("SERVICE BARTER x").startsWith("ERR_UNKNOWN_COMMAND"));
        assertTrue(node.market.openListings().isEmpty());
    }

    @Test
    void openListingLimitIsReported() {
        final TestNode.Client bob = node.login("bob", 12);
        bob.send("SERVICE OFFER translation 50");
        bob.send("SERVICE OFFER translation 51");

        assertTrue(bob.send("SERVICE OFFER translation 52").startsWith("ERR_LIMIT"));
    }

    @Test
    void cancelWithdrawsOwnListing() {
        final TestNode.Client bob = node.login("bob", 12);
        final TestNode.Client alice = node.login("alice", 11);
        bob.send("SERVICE OFFER translation 50");

        assertTrue(alice.send("SERVICE CANCEL L1").startsWith("ERR_INVALID_STATE"));
        assertEquals("CANCELLED L1", bob.send("SERVICE CANCEL L1"));
        assertTrue(bob.out.lines.contains("LISTING_CLOSED L1 CANCELLED"));
        assertTrue(bob.send("SERVICE CANCEL L7").startsWith("ERR_UNKNOWN_LISTING"));
    }

    @Test
    void disconnectCancelsListingsAndUnbinds() {
        final TestNode.Client bob = node.login("bob", 12);
        bob.send("SERVICE OFFER translation 50");

        bob.disconnect();

        assertTrue(node.market.openListings().isEmpty());
        assertFalse(node.authenticator.isAuthenticated(SoulId.of("bob")));
        assertEquals(0, node.sessions.size());
    }

    // Reputation

    @Test
    void endorsementsAreDeduplicated() {
        final TestNode.Client alice = node.login("alice", 11);
        node.login("bob", 12);
        final String payload = ReputationEvent.canonicalPayload("e1", SoulId.of("bob"), 5, "HELPFUL",
                SoulId.of("alice"));
        final String line = "SOUL ENDORSE e1 bob 5 HELPFUL " + SoulSigner.sign(TestNode.key(11), payload).toHex();

        assertEquals("ENDORSE_ACCEPTED e1", alice.send(line));
        assertEquals("ENDORSE_DUPLICATE e1", alice.send(line));
        assertEquals(5, node.ledger.scoreOf(SoulId.of("bob")));
    }

    @Test
    void invalidEndorsementsAreRejected() {
        final TestNode.Client alice = node.login("alice", 11);
        node.login("bob", 12);
        final String selfPayload = ReputationEvent.canonicalPayload("e2", SoulId.of("alice"), 5, "HELPFUL",
                SoulId.of("alice"));
        final String selfSig = SoulSigner.sign(TestNode.key(11), selfPayload).toHex();

        assertEquals("ERR_REJECTED e2", alice.send("SOUL ENDORSE e2 alice 5 HELPFUL " + selfSig));
        assertTrue(alice.send("SOUL ENDORSE e3 bob five HELPFUL " + selfSig).startsWith("ERR_SYNTAX"));
        assertTrue(alice.send("SOUL ENDORSE e3 ghost 5 HELPFUL " + selfSig).startsWith("ERR_UNKNOWN_SOUL"));
        assertTrue(alice.send("SOUL ENDORSE e3 bob 5 helpful " + selfSig).startsWith("ERR_SYNTAX"));
        assertTrue(alice.send("SOUL ENDORSE e3 bob 5").startsWith("ERR_SYNTAX"));
    }

    @Test
    void settlementIdsCannotBeEndorsedDirectly() {
        final TestNode.Client carol = node.login("carol", 13);
        node.login("dave", 14);
        final String payload = ReputationEvent.canonicalPayload("trade:T1:alice", SoulId.of("dave"), 1, "HELPFUL",
                SoulId.of("carol"));
        final String sig = SoulSigner.sign(TestNode.key(13), payload).toHex();

        assertEquals("ERR_REJECTED trade:T1:alice",
                carol.send("SOUL ENDORSE trade:T1:alice dave 1 HELPFUL " + sig));
        assertFalse(node.ledger.contains("trade:T1:alice"));

        final TestNode.Client bob = node.login("bob", 12);
        final TestNode.Client alice = node.login("alice", 11);
        bob.send("SERVICE OFFER translation 10");
        alice.send("SERVICE REQUEST translation 10");
        final String bobPayload = bob.out.find("TRADE T1 PROPOSED").split(" ")[6];
        final String alicePayload = alice.out.find("TRADE T1 PROPOSED").split(" ")[6];
        bob.send("SERVICE ACCEPT T1 " + SoulSigner.sign(TestNode.key(12), bobPayload).toHex());
        assertEquals("ACCEPTED T1 SETTLED",
                alice.send("SERVICE ACCEPT T1 " + SoulSigner.sign(TestNode.key(11), alicePayload).toHex()));

        assertEquals(1, node.ledger.scoreOf(SoulId.of("bob")));
        assertEquals(1, node.ledger.scoreOf(SoulId.of("alice")));
    }

    // SIGN and relay

    @Test
    void signUsesCustodyKey() {
        final TestNode.Client alice = node.login("alice", 11);

        assertTrue(alice.send("SIGN hello world").startsWith("ERR_NO_KEY"));

        node.custody.deposit(SoulId.of("alice"), TestNode.key(11));
        final String reply = alice.send("SIGN hello world");
        assertEquals("SIGNATURE " + SoulSigner.sign(TestNode.key(11), "hello world").toHex(), reply);
        assertTrue(alice.session.takeSignature().isPresent());
    }

    @Test
    void signWithoutPayloadIsSyntaxError() {
        assertTrue(node.login("alice", 11).send("SIGN").startsWith("ERR_SYNTAX"));
    }

    @Test
    void otherLinesGoToRelay() {
        final TestNode.Client client = node.connect();

        client.send("PRIVMSG #market :hello there");

        verify(relay).relay(eq(client.session), argThat(line -> line.verb().equals("PRIVMSG")
                && line.args().get(1).equals("hello there")), eq(client.out));
    }

    @Test
    void unexpectedFailureBecomesInternalError() {
        doThrow(new IllegalStateException("boom")).when(relay).relay(any(), any(), any());
        final TestNode.Client client = node.connect();

        assertEquals("ERR_INTERNAL internal error", client.send("PING x"));
        assertEquals("ERR_INTERNAL internal error", client.send("PING y"));
    }

    @Test
    void blankLinesAreIgnored() {
        final TestNode.Client client = node.connect();
        client.send("   ");
        assertTrue(client.out.lines.isEmpty());
        verify(relay, never()).relay(any(), any(), any());
    }
}
