package me.golemcore.hindsight.testsupport;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.hindsight.adapter.outbound.llm.NoOpLlmAdapter;
import me.golemcore.hindsight.adapter.outbound.repository.BankSnapshotStore;
import me.golemcore.hindsight.adapter.outbound.repository.InMemoryMemoryRepository;
import me.golemcore.hindsight.adapter.outbound.temporal.RuleBasedTemporalParser;
import me.golemcore.hindsight.domain.entity.CanonicalNameResolutionStrategy;
import me.golemcore.hindsight.domain.entity.EntityResolutionService;
import me.golemcore.hindsight.domain.model.Capability;
import me.golemcore.hindsight.domain.recall.GraphRecallStrategy;
import me.golemcore.hindsight.domain.recall.LexicalRecallStrategy;
import me.golemcore.hindsight.domain.recall.SemanticRecallStrategy;
import me.golemcore.hindsight.domain.recall.TemporalRecallStrategy;
import me.golemcore.hindsight.domain.reflect.LinearDispositionPolicy;
import me.golemcore.hindsight.domain.reflect.PersonalityStyleGuide;
import me.golemcore.hindsight.domain.service.BankService;
import me.golemcore.hindsight.domain.service.BankWriteCoordinator;
import me.golemcore.hindsight.domain.service.CapabilityInvoker;
import me.golemcore.hindsight.domain.service.DocumentService;
import me.golemcore.hindsight.domain.service.FactLinker;
import me.golemcore.hindsight.domain.service.FactWriter;
import me.golemcore.hindsight.domain.service.MemoryBrowseService;
import me.golemcore.hindsight.domain.service.RecallService;
import me.golemcore.hindsight.domain.service.ReflectService;
import me.golemcore.hindsight.domain.service.RetainService;
import me.golemcore.hindsight.domain.service.RetainTaskQueue;
import me.golemcore.hindsight.infrastructure.config.AutoConfiguration;
import me.golemcore.hindsight.infrastructure.config.HindsightProperties;
import me.golemcore.hindsight.port.outbound.StoragePort;
import me.golemcore.hindsight.ratelimit.TokenBucketRateLimiter;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.mockito.Mockito.mock;

/**
 * The whole engine wired by hand around deterministic capability stubs, with
 * snapshots disabled and single-attempt capability calls.
 */
public class MemoryEngineFixture implements AutoCloseable {

    public static final Instant START = Instant.parse("2024-06-15T12:00:00Z");

    public final HindsightProperties properties;
    public final MutableClock clock = new MutableClock(START);
    public final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    public final BagOfWordsEmbedding embedding = new BagOfWordsEmbedding();
    public final SentenceExtraction extraction = new SentenceExtraction();
    public final ScriptedReasoning reasoning = new ScriptedReasoning();
    public final TokenOverlapReranker reranker = new TokenOverlapReranker();

    public final InMemoryMemoryRepository repository;
    public final CapabilityInvoker capabilityInvoker;
    public final BankService bankService;
    public final BankWriteCoordinator writeCoordinator;
    public final EntityResolutionService entityResolutionService;
    public final FactWriter factWriter;
    public final RetainService retainService;
    public final RecallService recallService;
    public final ReflectService reflectService;
    public final RetainTaskQueue taskQueue;
    public final MemoryBrowseService browseService;
    public final DocumentService documentService;

    private final ExecutorService recallExecutor = Executors.newFixedThreadPool(4);
    private final ExecutorService queueExecutor;

    public MemoryEngineFixture() {
        this(new HindsightProperties(), Executors.newFixedThreadPool(2));
    }

    public MemoryEngineFixture(HindsightProperties properties, ExecutorService queueExecutor) {
        this.properties = properties;
        this.queueExecutor = queueExecutor;
        properties.getEmbedding().setDimension(BagOfWordsEmbedding.DIMENSION);
        for (Capability capability : Capability.values()) {
            properties.capability(capability).setMaxAttempts(1);
            properties.capability(capability).setTimeoutMs(5_000);
        }

        repository = new InMemoryMemoryRepository(
                new BankSnapshotStore(mock(StoragePort.class), objectMapper, properties));
        repository.init();
        capabilityInvoker = new CapabilityInvoker(properties, new TokenBucketRateLimiter(properties));
        writeCoordinator = new BankWriteCoordinator(repository, properties);
        bankService = new BankService(repository, writeCoordinator, new NoOpLlmAdapter(), capabilityInvoker,
                objectMapper, clock);
        entityResolutionService = new EntityResolutionService(new CanonicalNameResolutionStrategy(properties), clock);
        factWriter = new FactWriter(entityResolutionService, new FactLinker(properties), properties);
        retainService = new RetainService(bankService, writeCoordinator, factWriter, extraction, embedding,
                capabilityInvoker, properties, clock);
        recallService = new RecallService(bankService, repository, embedding, reranker,
                new RuleBasedTemporalParser(clock), capabilityInvoker,
                List.of(new SemanticRecallStrategy(), new LexicalRecallStrategy(),
                        new GraphRecallStrategy(entityResolutionService, properties), new TemporalRecallStrategy()),
                recallExecutor, properties);
        reflectService = new ReflectService(bankService, recallService, reasoning, embedding, capabilityInvoker,
                new LinearDispositionPolicy(), new PersonalityStyleGuide(), writeCoordinator, factWriter, properties,
                clock);
        taskQueue = new RetainTaskQueue(retainService, queueExecutor, properties, clock);
        browseService = new MemoryBrowseService(bankService, repository, writeCoordinator, taskQueue);
        documentService = new DocumentService(bankService, repository, writeCoordinator);
    }

    @Override
    public void close() throws InterruptedException {
        recallExecutor.shutdownNow();
        queueExecutor.shutdown();
        queueExecutor.awaitTermination(5, TimeUnit.SECONDS);
    }
}
