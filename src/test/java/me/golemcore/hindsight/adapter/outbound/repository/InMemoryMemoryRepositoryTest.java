package me.golemcore.hindsight.adapter.outbound.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hindsight.domain.model.Bank;
import me.golemcore.hindsight.domain.model.FactType;
import me.golemcore.hindsight.domain.model.MemoryUnit;
import me.golemcore.hindsight.infrastructure.config.AutoConfiguration;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.BankReadView;
import me.golemcore.hindsight.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class InMemoryMemoryRepositoryTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    private HindsightProperties properties;
    private StoragePort storagePort;
    private InMemoryMemoryRepository repository;

    @BeforeEach
    void setUp() {
        properties = new HindsightProperties();
        storagePort = mock(StoragePort.class);
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.ensureDirectory(anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(storagePort.listObjects(anyString(), isNull())).thenReturn(CompletableFuture.completedFuture(List.of()));
        repository = new InMemoryMemoryRepository(new BankSnapshotStore(storagePort, objectMapper, properties));
        repository.init();
    }

    @Test
    void shouldPublishTransactionOnlyOnSuccess() {
        repository.inTransaction("a", tx -> {
            tx.putUnit(unit("a", "u1", "kept"));
            return null;
        });

        assertThrows(IllegalStateException.class, () -> repository.inTransaction("a", tx -> {
            tx.putUnit(unit("a", "u2", "rolled back"));
            throw new IllegalStateException("boom");
        }));

        BankReadView view = repository.snapshot("a");
        assertTrue(view.findUnit("u1").isPresent());
        assertTrue(view.findUnit("u2").isEmpty());
    }

    @Test
    void shouldKeepEarlierSnapshotStableAcrossCommits() {
        repository.inTransaction("a", tx -> {
            tx.putUnit(unit("a", "u1", "first"));
            return null;
        });
        BankReadView before = repository.snapshot("a");

        repository.inTransaction("a", tx -> {
            tx.putUnit(unit("a", "u2", "second"));
            return tx.deleteUnit("u1");
        });

        assertEquals(List.of("u1"), before.units().stream().map(MemoryUnit::getId).toList());
        assertEquals(List.of("u2"), repository.snapshot("a").units().stream().map(MemoryUnit::getId).toList());
    }

    @Test
    void shouldIsolateBanks() {
        repository.inTransaction("a", tx -> {
            tx.putUnit(unit("a", "u1", "bank a fact"));
            return null;
        });

        assertTrue(repository.snapshot("b").units().isEmpty());
        assertTrue(repository.snapshot("b").findUnit("u1").isEmpty());
    }

    @Test
    void shouldStoreOwnCopyOfEmbedding() {
        float[] vector = { 0.6f, 0.8f };
        repository.inTransaction("a", tx -> {
            tx.putUnit(unit("a", "u1", "vector fact").toBuilder().embedding(vector).build());
            return null;
        });

        vector[0] = 1.0f;

        assertArrayEquals(new float[] { 0.6f, 0.8f },
                repository.snapshot("a").findUnit("u1").orElseThrow().getEmbedding());
        assertEquals(1, repository.snapshot("a").nearest(new float[] { 0.6f, 0.8f }, 1, 0.99, u -> true).size());
    }

    @Test
    void shouldReturnDefensiveCopiesOfBanks() {
        repository.saveBank(Bank.builder().bankId("a").background("original").build());

        Bank loaded = repository.findBank("a").orElseThrow();
        loaded.setBackground("changed");
        loaded.getDisposition().setSkepticism(5);

        Bank reloaded = repository.findBank("a").orElseThrow();
        assertEquals("original", reloaded.getBackground());
        assertEquals(3, reloaded.getDisposition().getSkepticism());
    }

    @Test
    void shouldNotTouchStorageWhenSnapshotsDisabled() {
        repository.saveBank(Bank.builder().bankId("a").build());
        repository.inTransaction("a", tx -> {
            tx.putUnit(unit("a", "u1", "fact"));
            return null;
        });

        verify(storagePort, never()).putTextAtomic(anyString(), anyString(), anyString());
    }

    @Test
    void shouldAbortCommitWhenSnapshotCannotBeWritten() {
        properties.getStorage().setSnapshotsEnabled(true);
        repository.saveBank(Bank.builder().bankId("a").build());
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("disk full")));

        assertThrows(IllegalStateException.class, () -> repository.inTransaction("a", tx -> {
            tx.putUnit(unit("a", "u1", "fact"));
            return null;
        }));

        assertTrue(repository.snapshot("a").units().isEmpty());
    }

    @Test
    void shouldRestoreBanksFromSnapshots() {
        properties.getStorage().setSnapshotsEnabled(true);
        repository.saveBank(Bank.builder().bankId("team/a").background("bg").build());
        repository.inTransaction("team/a", tx -> {
            tx.putUnit(unit("team/a", "u1", "Alice joined the team").toBuilder()
                    .embedding(new float[] { 0.6f, 0.8f })
                    .build());
            return null;
        });

        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(storagePort, times(2))
                .putTextAtomic(eq("banks"), eq(BankSnapshotStore.fileName("team/a")), json.capture());
        String fileName = BankSnapshotStore.fileName("team/a");
        when(storagePort.listObjects("banks", null))
                .thenReturn(CompletableFuture.completedFuture(List.of(fileName, "notes.txt")));
        when(storagePort.getText("banks", fileName))
                .thenReturn(CompletableFuture.completedFuture(json.getValue()));

        InMemoryMemoryRepository restored = new InMemoryMemoryRepository(
                new BankSnapshotStore(storagePort, objectMapper, properties));
        restored.init();

        assertEquals("bg", restored.findBank("team/a").orElseThrow().getBackground());
        MemoryUnit unit = restored.snapshot("team/a").findUnit("u1").orElseThrow();
        assertEquals("Alice joined the team", unit.getText());
        assertArrayEquals(new float[] { 0.6f, 0.8f }, unit.getEmbedding());
        assertEquals(1, restored.snapshot("team/a").fullText("alice", 5, u -> true).size());
    }

    @Test
    void shouldSkipCorruptSnapshotFiles() {
        properties.getStorage().setSnapshotsEnabled(true);
        when(storagePort.listObjects("banks", null))
                .thenReturn(CompletableFuture.completedFuture(List.of("broken.json")));
        when(storagePort.getText("banks", "broken.json"))
                .thenReturn(CompletableFuture.completedFuture("{not json"));

        InMemoryMemoryRepository restored = new InMemoryMemoryRepository(
                new BankSnapshotStore(storagePort, objectMapper, properties));
        restored.init();

        assertTrue(restored.listBanks().isEmpty());
    }

    private static MemoryUnit unit(String bankId, String id, String text) {
        return MemoryUnit.builder()
                .id(id)
                .bankId(bankId)
                .text(text)
                .factType(FactType.WORLD)
                .confidence(0.8)
                .mentionedAt(Instant.parse("2024-06-15T12:00:00Z"))
                .build();
    }
}
