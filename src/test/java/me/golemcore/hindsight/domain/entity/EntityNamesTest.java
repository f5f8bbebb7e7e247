package me.golemcore.hindsight.domain.entity;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EntityNamesTest {

    @Test
    void shouldCanonicalizeCasePunctuationAccentsAndLeadingArticle() {
        assertEquals("google inc", EntityNames.canonicalize("  Google, Inc. "));
        assertEquals("jose garcia", EntityNames.canonicalize("José García"));
        assertEquals("beatles", EntityNames.canonicalize("The Beatles"));
        assertEquals("", EntityNames.canonicalize("!!!"));
    }

    @Test
    void shouldScoreIdenticalNamesAsOne() {
        assertEquals(1.0, EntityNames.similarity("alice", "alice"));
        assertEquals(0.0, EntityNames.similarity("", "alice"));
    }

    @Test
    void shouldUseBetterOfTokenOverlapAndEditDistance() {
        // "jon" -> "john" is one insertion over four characters
        assertEquals(0.75, EntityNames.similarity("jon", "john"), 1e-9);
        // shares one of two tokens
        assertEquals(0.5, EntityNames.similarity("alice smith", "alice"), 1e-9);
    }

    @Test
    void shouldComputeLevenshteinDistance() {
        assertEquals(3, EntityNames.levenshtein("kitten", "sitting"));
        assertEquals(0, EntityNames.levenshtein("same", "same"));
        assertEquals(4, EntityNames.levenshtein("", "abcd"));
    }

    @Test
    void shouldTreatUnknownTypesAsCompatible() {
        assertTrue(EntityNames.typesCompatible("person", "PERSON"));
        assertTrue(EntityNames.typesCompatible(null, "organization"));
        assertTrue(EntityNames.typesCompatible("other", "place"));
        assertFalse(EntityNames.typesCompatible("person", "organization"));
    }
}
