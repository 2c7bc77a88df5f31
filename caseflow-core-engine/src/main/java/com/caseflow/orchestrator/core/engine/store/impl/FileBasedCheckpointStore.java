package com.caseflow.orchestrator.core.engine.store.impl;

import com.caseflow.orchestrator.core.engine.misc.CaseFlowObjectMapper;
import com.caseflow.orchestrator.core.exception.store.CaseFlowPersistenceException;
import com.caseflow.orchestrator.integration.models.checkpoint.CaseFlowWorkflowCheckpoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.stream.Stream;

/**
 * Checkpoint store writing {@code {baseDir}/checkpoints/{caseId}.json}, replaced atomically on save.
 */
@Slf4j
public class FileBasedCheckpointStore extends InMemoryCheckpointStore {

    private static final String CHECKPOINTS_DIR = "checkpoints";
    private static final String EXTENSION = ".json";

    private final Path checkpointsDir;
    private final ObjectMapper objectMapper = CaseFlowObjectMapper.getInstance().getObjectMapper();

    public FileBasedCheckpointStore(Path baseDir) {
        this.checkpointsDir = baseDir.resolve(CHECKPOINTS_DIR);
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.fromCallable(() -> {
            Files.createDirectories(checkpointsDir);
            try (Stream<Path> files = Files.list(checkpointsDir)) {
                files.filter(path -> path.toString().endsWith(EXTENSION)).forEach(path -> {
                    try {
                        CaseFlowWorkflowCheckpoint checkpoint = objectMapper.readValue(path.toFile(), CaseFlowWorkflowCheckpoint.class);
                        checkpoints.put(checkpoint.getCaseId(), checkpoint);
                    } catch (IOException e) {
                        log.warn("Could not load checkpoint file {}: {}", path, e.getMessage());
                    }
                });
            }
            log.info("File-based checkpoint store initialized at {} with {} checkpoints", checkpointsDir, checkpoints.size());
            return null;
        }).then();
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(checkpoints::clear);
    }

    @Override
    protected void persist(CaseFlowWorkflowCheckpoint checkpoint) {
        Path target = checkpointsDir.resolve(checkpoint.getCaseId() + EXTENSION);
        try {
            Path temp = Files.createTempFile(checkpointsDir, checkpoint.getCaseId() + "-", ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), checkpoint);
                try {
                    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
                }
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new CaseFlowPersistenceException(checkpoint.getCaseId(), "saveCheckpoint", e);
        }
    }

    @Override
    protected void unpersist(String caseId) {
        try {
            Files.deleteIfExists(checkpointsDir.resolve(caseId + EXTENSION));
        } catch (IOException e) {
            throw new CaseFlowPersistenceException(caseId, "deleteCheckpoint", e);
        }
    }
}
