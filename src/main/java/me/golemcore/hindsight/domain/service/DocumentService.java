package me.golemcore.hindsight.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.hindsight.domain.exception.NotFoundException;
import me.golemcore.hindsight.domain.model.Document;
import me.golemcore.hindsight.domain.model.DocumentSummary;
import me.golemcore.hindsight.domain.model.MemoryPage;
import me.golemcore.hindsight.port.outbound.BankReadView;
import me.golemcore.hindsight.port.outbound.MemoryRepositoryPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Source documents of a bank. Deleting a document cascades to the units that
 * only it asserts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentService {

    private final BankService bankService;
    private final MemoryRepositoryPort repository;
    private final BankWriteCoordinator writeCoordinator;

    /**
     * Documents, most recently updated first, optionally filtered by a
     * case-insensitive substring of the id or text.
     */
    public MemoryPage<DocumentSummary> listDocuments(String bankId, String textFilter, Integer limit,
            Integer offset) {
        bankService.requireExisting(bankId);
        int pageLimit = MemoryBrowseService.pageLimit(limit);
        int pageOffset = MemoryBrowseService.pageOffset(offset);
        String needle = textFilter != null && !textFilter.isBlank()
                ? textFilter.trim().toLowerCase(Locale.ROOT)
                : null;

        BankReadView view = repository.snapshot(bankId);
        List<DocumentSummary> matching = view.documents().stream()
                .filter(document -> needle == null || matches(document, needle))
                .sorted(Comparator.comparing(Document::getUpdatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                        .thenComparing(Document::getId))
                .map(document -> summarize(view, document))
                .toList();
        return new MemoryPage<>(MemoryBrowseService.page(matching, pageLimit, pageOffset), matching.size(),
                pageLimit, pageOffset);
    }

    public Document getDocument(String bankId, String documentId) {
        bankService.requireExisting(bankId);
        return repository.snapshot(bankId).findDocument(documentId)
                .orElseThrow(() -> new NotFoundException("Document not found: " + documentId));
    }

    public DocumentSummary getDocumentSummary(String bankId, String documentId) {
        bankService.requireExisting(bankId);
        BankReadView view = repository.snapshot(bankId);
        Document document = view.findDocument(documentId)
                .orElseThrow(() -> new NotFoundException("Document not found: " + documentId));
        return summarize(view, document);
    }

    /**
     * Deletes the document and the units derived only from it.
     *
     * @return number of units deleted
     */
    public int deleteDocument(String bankId, String documentId) {
        bankService.requireExisting(bankId);
        int deleted = writeCoordinator.write(bankId, "delete document", tx -> {
            if (tx.findDocument(documentId).isEmpty()) {
                throw new NotFoundException("Document not found: " + documentId);
            }
            return tx.deleteDocumentCascade(documentId);
        });
        log.info("[Repository] Deleted document {} from bank {} with {} unit(s)", documentId, bankId, deleted);
        return deleted;
    }

    private static boolean matches(Document document, String needle) {
        return document.getId().toLowerCase(Locale.ROOT).contains(needle)
                || (document.getText() != null && document.getText().toLowerCase(Locale.ROOT).contains(needle));
    }

    private static DocumentSummary summarize(BankReadView view, Document document) {
        int textLength = document.getText() != null ? document.getText().length() : 0;
        return new DocumentSummary(document.getId(), textLength, view.unitsOfDocument(document.getId()).size(),
                document.getCreatedAt(), document.getUpdatedAt());
    }
}
