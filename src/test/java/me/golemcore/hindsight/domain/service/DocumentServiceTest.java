package me.golemcore.hindsight.domain.service;

import me.golemcore.hindsight.domain.exception.NotFoundException;
import me.golemcore.hindsight.domain.model.Document;
import me.golemcore.hindsight.domain.model.DocumentSummary;
import me.golemcore.hindsight.domain.model.MemoryPage;
import me.golemcore.hindsight.domain.model.RetainItem;
import me.golemcore.hindsight.testsupport.MemoryEngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentServiceTest {

    private static final String BANK = "agent-1";
    private static final String NOTES = "Alice works at Google. Bob plays tennis.";

    private MemoryEngineFixture engine;
    private DocumentService documentService;

    @BeforeEach
    void setUp() {
        engine = new MemoryEngineFixture();
        documentService = engine.documentService;
        retainDocument("notes", NOTES);
        engine.clock.advance(Duration.ofHours(1));
        retainDocument("diary", "I love bread.");
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        engine.close();
    }

    @Test
    void shouldListMostRecentlyUpdatedFirst() {
        MemoryPage<DocumentSummary> page = documentService.listDocuments(BANK, null, null, null);

        assertEquals(List.of("diary", "notes"), page.items().stream().map(DocumentSummary::id).toList());
        assertEquals(2, page.total());
    }

    @Test
    void shouldFilterDocumentsByIdOrText() {
        assertEquals(List.of("diary"), ids(documentService.listDocuments(BANK, "DIARY", null, null)));
        assertEquals(List.of("notes"), ids(documentService.listDocuments(BANK, "tennis", null, null)));
        assertEquals(List.of("notes"), ids(documentService.listDocuments(BANK, null, 1, 1)));
    }

    @Test
    void shouldSummarizeDocument() {
        DocumentSummary summary = documentService.getDocumentSummary(BANK, "notes");

        assertEquals(NOTES.length(), summary.textLength());
        assertEquals(2, summary.unitCount());
        assertEquals(MemoryEngineFixture.START, summary.createdAt());
    }

    @Test
    void shouldKeepCreationTimeWhenDocumentIsReplaced() {
        engine.clock.advance(Duration.ofHours(1));
        retainDocument("notes", "Bob plays squash.");

        Document document = documentService.getDocument(BANK, "notes");

        assertEquals("Bob plays squash.", document.getText());
        assertEquals(MemoryEngineFixture.START, document.getCreatedAt());
        assertEquals(MemoryEngineFixture.START.plus(Duration.ofHours(2)), document.getUpdatedAt());
        assertEquals(1, documentService.getDocumentSummary(BANK, "notes").unitCount());
    }

    @Test
    void shouldDeleteDocumentWithItsUnits() {
        assertEquals(2, documentService.deleteDocument(BANK, "notes"));

        assertThrows(NotFoundException.class, () -> documentService.getDocument(BANK, "notes"));
        assertEquals(1, engine.repository.snapshot(BANK).units().size());
        assertEquals(List.of("diary"), ids(documentService.listDocuments(BANK, null, null, null)));
    }

    @Test
    void shouldRejectUnknownDocument() {
        assertThrows(NotFoundException.class, () -> documentService.getDocument(BANK, "missing"));
        assertThrows(NotFoundException.class, () -> documentService.getDocumentSummary(BANK, "missing"));
        assertThrows(NotFoundException.class, () -> documentService.deleteDocument(BANK, "missing"));
        assertThrows(NotFoundException.class, () -> documentService.listDocuments("unknown", null, null, null));
    }

    private void retainDocument(String documentId, String content) {
        engine.retainService.retain(BANK, RetainItem.builder().documentId(documentId).content(content).build());
    }

    private static List<String> ids(MemoryPage<DocumentSummary> page) {
        return page.items().stream().map(DocumentSummary::id).toList();
    }
}
