package com.contact.resolution.similarity;

import com.contact.resolution.core.model.IdentityTuple;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BlockingKeyStrategyTest {

    private DefaultBlockingKeyStrategy strategy;

    @BeforeEach
    void setUp() {
        strategy = new DefaultBlockingKeyStrategy();
    }

    @Test
    @DisplayName("Email and phone produce exact keys in normalized form")
    void testExactKeys() {
        BlockingKeys keys = strategy.generateKeys(
                IdentityTuple.of(null, null, " John@Example.com ", "(415) 555-0100"));

        assertEquals(Set.of("email:john@example.com", "phone:+14155550100"), keys.exactKeys());
        assertTrue(keys.fuzzyKeys().isEmpty());
    }

    @Test
    @DisplayName("Full name produces prefix, sorted token, bigram and per-token keys")
    void testNameKeys() {
        BlockingKeys keys = strategy.generateKeys(IdentityTuple.of("John", "Smith", null, null));

        assertTrue(keys.fuzzyKeys().contains("pfx:joh"));
        assertTrue(keys.fuzzyKeys().contains("tok:john|smith"));
        assertTrue(keys.fuzzyKeys().contains("bg:jo"));
        assertTrue(keys.fuzzyKeys().contains("nt:john"));
        assertTrue(keys.fuzzyKeys().contains("nt:smith"));
    }

    @Test
    @DisplayName("Typo in first name still shares a key through the last name")
    void testTypoSharesKey() {
        Set<String> jon = strategy.generateKeys(IdentityTuple.of("Jon", "Smith", null, null)).fuzzyKeys();
        Set<String> john = strategy.generateKeys(IdentityTuple.of("John", "Smith", null, null)).fuzzyKeys();

        Set<String> shared = new HashSet<>(jon);
        shared.retainAll(john);
        assertTrue(shared.contains("nt:smith"));
        assertTrue(shared.contains("bg:jo"));
    }

    @Test
    @DisplayName("Swapped first and last name share the sorted token key")
    void testSwappedNames() {
        BlockingKeys a = strategy.generateKeys(IdentityTuple.of("John", "Smith", null, null));
        BlockingKeys b = strategy.generateKeys(IdentityTuple.of("Smith", "John", null, null));

        assertTrue(b.fuzzyKeys().contains("tok:john|smith"));
        assertTrue(a.fuzzyKeys().contains("tok:john|smith"));
    }

    @Test
    @DisplayName("Identity without fields produces no keys")
    void testNoKeys() {
        assertTrue(strategy.generateKeys(IdentityTuple.of(null, "", null, "n/a")).isEmpty());
        assertTrue(strategy.generateKeys(null).isEmpty());
    }
}
