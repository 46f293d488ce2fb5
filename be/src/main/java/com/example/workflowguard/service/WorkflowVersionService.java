package com.example.workflowguard.service;

import com.example.workflowguard.api.VersionNotFoundException;
import com.example.workflowguard.client.WorkflowStore;
import com.example.workflowguard.domain.VersionMeta;
import com.example.workflowguard.domain.VersionSnapshot;
import com.example.workflowguard.domain.VersionStats;
import com.example.workflowguard.domain.Workflow;
import com.example.workflowguard.version.VersionStore;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot listing, manual saves, rollback and diff on top of {@link VersionStore}.
 * <p>
 * I/O failures of the store surface as {@link UncheckedIOException}.
 * </p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WorkflowVersionService {

    /** Stands for the live workflow on the older side of a diff. */
    public static final String CURRENT = "current";
    static final String MANUAL = "manual";
    static final String BEFORE_ROLLBACK = "before_rollback";

    private final VersionStore versionStore;
    private final WorkflowStore store;

    public List<VersionMeta> list(String workflowId) {
        try {
            return versionStore.list(workflowId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list versions of workflow " + workflowId, e);
        }
    }

    public VersionSnapshot get(String workflowId, String versionId) {
        try {
            return versionStore.get(workflowId, versionId)
                    .orElseThrow(() -> new VersionNotFoundException(workflowId, versionId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read version " + versionId + " of workflow " + workflowId, e);
        }
    }

    public VersionSnapshot latest(String workflowId) {
        try {
            return versionStore.latest(workflowId)
                    .orElseThrow(() -> new VersionNotFoundException(workflowId, "latest"));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read latest version of workflow " + workflowId, e);
        }
    }

    /**
     * Snapshots the live workflow.
     *
     * @return the new snapshot, or empty when nothing changed since the newest one
     */
    public Optional<VersionMeta> save(String workflowId, String reason) {
        Workflow live = store.get(workflowId);
        return snapshot(live, reason != null && !reason.isBlank() ? reason : MANUAL);
    }

    /**
     * Snapshots the given workflow state; used before every write.
     */
    public Optional<VersionMeta> snapshot(Workflow workflow, String reason) {
        try {
            Optional<VersionMeta> saved = versionStore.save(workflow, reason);
            saved.ifPresent(meta -> log.debug("Snapshot workflow id={} version={} reason={}", workflow.getId(), meta.id(), reason));
            return saved;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save version of workflow " + workflow.getId(), e);
        }
    }

    /**
     * Writes a stored snapshot back to the store after snapshotting the live state.
     */
    public RollbackResult rollback(String workflowId, String versionId) {
        VersionSnapshot target = get(workflowId, versionId);
        Workflow live = store.get(workflowId);
        snapshot(live, BEFORE_ROLLBACK);
        Workflow restored = store.update(workflowId, target.workflow());
        log.debug("Rolled back workflow id={} to version={}", workflowId, versionId);
        return new RollbackResult(target.meta(), restored);
    }

    /**
     * @param fromVersionId older side; null or blank compares against the live workflow
     * @param toVersionId   newer side
     */
    public VersionDiffResult diff(String workflowId, String fromVersionId, String toVersionId) {
        VersionSnapshot to = get(workflowId, toVersionId);
        boolean fromLive = fromVersionId == null || fromVersionId.isBlank();
        Workflow from = fromLive ? store.get(workflowId) : get(workflowId, fromVersionId).workflow();
        return new VersionDiffResult(fromLive ? CURRENT : fromVersionId, toVersionId, versionStore.diff(from, to.workflow()));
    }

    public int deleteAll(String workflowId) {
        try {
            return versionStore.deleteAll(workflowId);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete versions of workflow " + workflowId, e);
        }
    }

    public VersionStats stats() {
        try {
            return versionStore.stats();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read version store statistics", e);
        }
    }
}
