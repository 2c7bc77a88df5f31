package com.caseflow.orchestrator.core.engine.store.impl;

import com.caseflow.orchestrator.core.engine.misc.CaseFlowObjectMapper;
import com.caseflow.orchestrator.integration.models.intervention.CaseFlowInterventionRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.List;
import java.util.stream.Stream;

/**
 * Case store keeping one JSON document per case and one per case's intervention list.
 *
 * <h2>Layout</h2>
 * <pre>
 * {baseDir}/cases/{caseId}.json
 * {baseDir}/interventions/{caseId}.json
 * </pre>
 *
 * <p>Each write goes to a temporary file that is then moved over the target, so a crash leaves
 * either the previous or the new document, never a partial one. All documents are loaded into
 * memory on {@link #initialize()} and reads are served from there.
 */
@Slf4j
public class FileBasedCaseStore extends AbstractCaseFlowCaseStore {

    private static final String CASES_DIR = "cases";
    private static final String INTERVENTIONS_DIR = "interventions";
    private static final String EXTENSION = ".json";

    private final Path baseDir;
    private final Path casesDir;
    private final Path interventionsDir;
    private final ObjectMapper objectMapper;

    private volatile boolean initialized = false;

    public FileBasedCaseStore(Path baseDir) {
        this(baseDir, Clock.systemUTC());
    }

    public FileBasedCaseStore(Path baseDir, Clock clock) {
        super(clock);
        this.baseDir = baseDir;
        this.casesDir = baseDir.resolve(CASES_DIR);
        this.interventionsDir = baseDir.resolve(INTERVENTIONS_DIR);
        this.objectMapper = CaseFlowObjectMapper.getInstance().getObjectMapper();
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public Mono<Void> initialize() {
        return Mono.fromCallable(() -> {
            if (initialized) {
                return null;
            }
            log.info("Initializing file-based case store at: {}", baseDir);
            Files.createDirectories(casesDir);
            Files.createDirectories(interventionsDir);
            loadCases();
            loadInterventions();
            initialized = true;
            log.info("File-based case store initialized. Loaded {} cases.", records.size());
            return null;
        }).then();
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down file-based case store");
            records.clear();
            interventions.clear();
            initialized = false;
        });
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.fromCallable(() -> initialized && Files.isWritable(casesDir) && Files.isWritable(interventionsDir));
    }

    // ========================================================================
    // PERSISTENCE HOOKS
    // ========================================================================

    @Override
    protected void persistRecord(CaseFlowCaseRecord record) throws IOException {
        ensureInitialized();
        writeAtomically(casesDir, record.getCaseFlowCase().getCaseId(), record);
    }

    @Override
    protected void removeRecord(String caseId) throws IOException {
        ensureInitialized();
        Files.deleteIfExists(casesDir.resolve(fileName(caseId)));
    }

    @Override
    protected void persistInterventions(String caseId, List<CaseFlowInterventionRecord> records) throws IOException {
        ensureInitialized();
        writeAtomically(interventionsDir, caseId, records);
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    private void writeAtomically(Path directory, String caseId, Object document) throws IOException {
        Path target = directory.resolve(fileName(caseId));
        Path temp = Files.createTempFile(directory, caseId + "-", ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), document);
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    private void loadCases() throws IOException {
        try (Stream<Path> files = Files.list(casesDir)) {
            files.filter(path -> path.toString().endsWith(EXTENSION)).forEach(path -> {
                try {
                    CaseFlowCaseRecord record = objectMapper.readValue(path.toFile(), CaseFlowCaseRecord.class);
                    records.put(record.getCaseFlowCase().getCaseId(), record);
                } catch (IOException e) {
                    log.warn("Could not load case file {}: {}", path, e.getMessage());
                }
            });
        }
    }

    private void loadInterventions() throws IOException {
        TypeReference<List<CaseFlowInterventionRecord>> listType = new TypeReference<>() {};
        try (Stream<Path> files = Files.list(interventionsDir)) {
            files.filter(path -> path.toString().endsWith(EXTENSION)).forEach(path -> {
                try {
                    List<CaseFlowInterventionRecord> list = objectMapper.readValue(path.toFile(), listType);
                    if (!list.isEmpty()) {
                        interventions.put(list.get(0).getCaseId(), list);
                    }
                } catch (IOException e) {
                    log.warn("Could not load intervention file {}: {}", path, e.getMessage());
                }
            });
        }
    }

    private void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException("File-based case store not initialized. Call initialize() first.");
        }
    }

    private static String fileName(String caseId) {
        return caseId + EXTENSION;
    }
}
