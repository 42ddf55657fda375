// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.identity;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import sh.soulwire.core.TestSouls;
import sh.soulwire.core.error.DuplicateSoulException;
import sh.soulwire.core.error.PersistenceException;
import sh.soulwire.core.error.ReplyCode;
import sh.soulwire.core.error.UnknownSoulException;
import sh.soulwire.core.store.InMemoryJournal;
import sh.soulwire.core.store.Journal;
import sh.soulwire.core.store.JsonLinesJournal;
import sh.soulwire.core.store.SoulRecord;

class IdentityRegistryTest {

    @Test
    void registersAndLooksUp() {
        final IdentityRegistry registry = new IdentityRegistry(new InMemoryJournal<>());
        final Soul alice = registry.register(TestSouls.soul("alice", 1));

        assertEquals(alice, registry.require(SoulId.of("alice")));
        assertTrue(registry.find(SoulId.of("alice")).isPresent());
        assertTrue(registry.contains(SoulId.of("alice")));
        assertEquals(1, registry.size());
    }

    @Test
    void duplicateRegistrationKeepsOriginalKey() {
        final IdentityRegistry registry = new IdentityRegistry(new InMemoryJournal<>());
        registry.register(TestSouls.soul("alice", 1));

        final DuplicateSoulException ex =
                assertThrows(DuplicateSoulException.class, () -> registry.register(TestSouls.soul("alice", 2)));

        assertEquals(ReplyCode.ERR_DUPLICATE_SOUL, ex.replyCode());
        assertEquals(TestSouls.key(1).publicKey(), registry.require(SoulId.of("alice")).key());
    }

    @Test
    void requireUnknownThrows() {
        final IdentityRegistry registry = new IdentityRegistry(new InMemoryJournal<>());

        final UnknownSoulException ex =
                assertThrows(UnknownSoulException.class, () -> registry.require(SoulId.of("ghost")));

        assertEquals("ghost", ex.soulId());
        assertEquals(ReplyCode.ERR_UNKNOWN_SOUL, ex.replyCode());
    }

    @Test
    @SuppressWarnings("unchecked")
    void failedJournalAppendLeavesRegistryUnchanged() {
        final Journal<SoulRecord> journal = mock(Journal.class);
        doThrow(new PersistenceException("disk full")).when(journal).append(any());
        final IdentityRegistry registry = new IdentityRegistry(journal);

        assertThrows(PersistenceException.class, () -> registry.register(TestSouls.soul("alice", 1)));
        assertFalse(registry.contains(SoulId.of("alice")));
    }

    @Test
    void survivesRestart(@TempDir Path dir) {
        final Path file = dir.resolve("souls.jsonl");
        final Soul tagged = new Soul(SoulId.of("bob"), TestSouls.key(2).publicKey(), "oracle", "real",
                Instant.parse("2026-02-03T04:05:06Z"));
        try (JsonLinesJournal<SoulRecord> journal = JsonLinesJournal.open(file, SoulRecord.class)) {
            final IdentityRegistry registry = new IdentityRegistry(journal);
            registry.register(TestSouls.soul("alice", 1));
            registry.register(tagged);
        }

        try (JsonLinesJournal<SoulRecord> journal = JsonLinesJournal.open(file, SoulRecord.class)) {
            final IdentityRegistry reloaded = new IdentityRegistry(journal);
            assertEquals(2, reloaded.size());
            assertEquals(tagged, reloaded.require(SoulId.of("bob")));
            assertEquals("REAL", reloaded.require(SoulId.of("bob")).mode());
            assertEquals(
                    List.of(SoulId.of("alice"), SoulId.of("bob")),
                    reloaded.all().stream().map(Soul::id).toList());
        }
    }

    @Test
    void annotationOmitsAbsentTags() {
        assertEquals("[Soul:alice]", TestSouls.soul("alice", 1).annotation());
        final Soul tagged = new Soul(SoulId.of("bob"), TestSouls.key(2).publicKey(), "oracle", "light", Instant.EPOCH);
        assertEquals("[Soul:bob] [Paradigm:oracle] [Mode:LIGHT]", tagged.annotation());
    }
}
