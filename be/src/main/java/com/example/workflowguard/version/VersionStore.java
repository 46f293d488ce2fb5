package com.example.workflowguard.version;

import com.example.workflowguard.domain.JsonValues;
import com.example.workflowguard.domain.Node;
import com.example.workflowguard.domain.VersionDiff;
import com.example.workflowguard.domain.VersionMeta;
import com.example.workflowguard.domain.VersionSnapshot;
import com.example.workflowguard.domain.VersionStats;
import com.example.workflowguard.domain.Workflow;

import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Local, content-addressed snapshot store for workflows.
 * <p>
 * Layout: {@code <storageDir>/<workflowId>/<versionId>.json}, each file holding {@code {meta, workflow}}.
 * A save whose content hash equals the newest snapshot's is skipped, and after each write only the
 * newest {@code maxVersions} snapshots are kept. Calls for the same workflow id must not run
 * concurrently; there is no locking.
 * </p>
 */
@Slf4j
public class VersionStore {

    private static final String EXTENSION = ".json";
    private static final Pattern SAFE_ID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");
    private static final DateTimeFormatter VERSION_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS'Z'").withZone(ZoneOffset.UTC);
    private static final Comparator<VersionMeta> NEWEST_FIRST =
            Comparator.comparing(VersionMeta::timestamp).thenComparing(VersionMeta::id).reversed();

    private final VersionStoreProperties properties;
    private final JsonMapper jsonMapper;
    private final Clock clock;
    private final Path root;

    public VersionStore(VersionStoreProperties properties, JsonMapper jsonMapper, Clock clock) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.jsonMapper = Objects.requireNonNull(jsonMapper, "jsonMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.root = properties.storagePath();
    }

    /**
     * Stores a snapshot unless the store is disabled or the content equals the newest snapshot.
     *
     * @return metadata of the written snapshot, or empty when nothing was written
     */
    public Optional<VersionMeta> save(Workflow workflow, String reason) throws IOException {
        if (!properties.enabled()) {
            return Optional.empty();
        }
        String workflowId = checkId(workflow.getId(), "workflow id");
        String hash = hash(workflow);
        List<VersionMeta> existing = list(workflowId);
        if (!existing.isEmpty() && existing.get(0).hash().equals(hash)) {
            log.debug("Skipping snapshot of workflow id={}: unchanged since {}", workflowId, existing.get(0).id());
            return Optional.empty();
        }

        Instant timestamp = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        if (!existing.isEmpty() && !timestamp.isAfter(existing.get(0).timestamp())) {
            timestamp = existing.get(0).timestamp().plusMillis(1);
        }
        String versionId = VERSION_TIMESTAMP.format(timestamp) + "_" + hash.substring(0, 6);
        VersionMeta meta = new VersionMeta(versionId, workflowId, workflow.getName(), timestamp,
                reason != null ? reason : "manual", workflow.getNodes().size(), hash);

        Path dir = Files.createDirectories(root.resolve(workflowId));
        Files.writeString(dir.resolve(versionId + EXTENSION), write(new VersionSnapshot(meta, workflow)), StandardCharsets.UTF_8);
        log.debug("Saved snapshot workflow id={} version={} reason={}", workflowId, versionId, meta.reason());

        prune(workflowId);
        return Optional.of(meta);
    }

    /** Metadata of every snapshot of the workflow, newest first. */
    public List<VersionMeta> list(String workflowId) throws IOException {
        Path dir = root.resolve(checkId(workflowId, "workflow id"));
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<VersionMeta> versions = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (file.getFileName().toString().endsWith(EXTENSION)) {
                    versions.add(read(file).meta());
                }
            }
        }
        versions.sort(NEWEST_FIRST);
        return versions;
    }

    public Optional<VersionSnapshot> get(String workflowId, String versionId) throws IOException {
        Path file = root.resolve(checkId(workflowId, "workflow id")).resolve(checkId(versionId, "version id") + EXTENSION);
        try {
            return Optional.of(read(file));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    public Optional<VersionSnapshot> latest(String workflowId) throws IOException {
        List<VersionMeta> versions = list(workflowId);
        if (versions.isEmpty()) {
            return Optional.empty();
        }
        return get(workflowId, versions.get(0).id());
    }

    /**
     * Deletes every snapshot of the workflow and, when it is then empty, its directory.
     *
     * @return number of snapshots deleted
     */
    public int deleteAll(String workflowId) throws IOException {
        List<VersionMeta> versions = list(workflowId);
        Path dir = root.resolve(workflowId);
        for (VersionMeta version : versions) {
            Files.deleteIfExists(dir.resolve(version.id() + EXTENSION));
        }
        try {
            Files.deleteIfExists(dir);
        } catch (DirectoryNotEmptyException e) {
            log.debug("Keeping non-empty snapshot directory {}", dir);
        }
        log.debug("Deleted {} snapshots of workflow id={}", versions.size(), workflowId);
        return versions.size();
    }

    public VersionStats stats() throws IOException {
        int workflowCount = 0;
        int totalVersions = 0;
        if (Files.isDirectory(root)) {
            List<Path> dirs;
            try (Stream<Path> entries = Files.list(root)) {
                dirs = entries.filter(Files::isDirectory).sorted().toList();
            }
            for (Path dir : dirs) {
                String workflowId = dir.getFileName().toString();
                if (!SAFE_ID.matcher(workflowId).matches()) {
                    continue;
                }
                workflowCount++;
                totalVersions += list(workflowId).size();
            }
        }
        return new VersionStats(properties.enabled(), root.toString(), properties.maxVersions(), workflowCount, totalVersions);
    }

    /**
     * Compares two workflows. Nodes are matched by name and count as modified when their parameters
     * differ; connections and settings are compared as a whole, a missing settings map being empty.
     */
    public VersionDiff diff(Workflow older, Workflow newer) {
        Map<String, Node> oldNodes = byName(older);
        Map<String, Node> newNodes = byName(newer);
        List<String> added = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        newNodes.forEach((name, node) -> {
            Node previous = oldNodes.get(name);
            if (previous == null) {
                added.add(name);
            } else if (!Objects.equals(previous.getParameters(), node.getParameters())) {
                modified.add(name);
            }
        });
        for (String name : oldNodes.keySet()) {
            if (!newNodes.containsKey(name)) {
                removed.add(name);
            }
        }
        boolean connectionsChanged = !older.getConnections().equals(newer.getConnections());
        boolean settingsChanged = !settingsOf(older).equals(settingsOf(newer));

        List<String> parts = new ArrayList<>();
        if (!added.isEmpty()) {
            parts.add("+" + added.size() + " nodes");
        }
        if (!removed.isEmpty()) {
            parts.add("-" + removed.size() + " nodes");
        }
        if (!modified.isEmpty()) {
            parts.add("~" + modified.size() + " modified");
        }
        if (connectionsChanged) {
            parts.add("connections changed");
        }
        if (settingsChanged) {
            parts.add("settings changed");
        }
        String summary = parts.isEmpty() ? "no changes" : String.join(", ", parts);
        return new VersionDiff(added, removed, modified, connectionsChanged, settingsChanged, summary);
    }

    private void prune(String workflowId) throws IOException {
        List<VersionMeta> versions = list(workflowId);
        if (versions.size() <= properties.maxVersions()) {
            return;
        }
        Path dir = root.resolve(workflowId);
        List<VersionMeta> excess = versions.subList(properties.maxVersions(), versions.size());
        for (VersionMeta version : excess) {
            Files.deleteIfExists(dir.resolve(version.id() + EXTENSION));
        }
        log.debug("Pruned {} snapshots of workflow id={}", excess.size(), workflowId);
    }

    /**
     * SHA-256 over the key-sorted JSON of nodes, connections and settings. Name, active flag and
     * timestamps do not contribute.
     */
    String hash(Workflow workflow) {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("nodes", jsonMapper.convertValue(workflow.getNodes(), Object.class));
        content.put("connections", jsonMapper.convertValue(workflow.getConnections(), Object.class));
        content.put("settings", workflow.getSettings());
        byte[] canonical;
        try {
            canonical = jsonMapper.writeValueAsBytes(JsonValues.canonical(content));
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow for hashing", e);
        }
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String write(VersionSnapshot snapshot) {
        try {
            return jsonMapper.writerWithDefaultPrettyPrinter().writeValueAsString(snapshot);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize snapshot " + snapshot.meta().id(), e);
        }
    }

    private VersionSnapshot read(Path file) throws IOException {
        String json = Files.readString(file, StandardCharsets.UTF_8);
        try {
            return jsonMapper.readValue(json, VersionSnapshot.class);
        } catch (JacksonException e) {
            throw new IOException("Corrupt snapshot file " + file, e);
        }
    }

    private static Map<String, Node> byName(Workflow workflow) {
        Map<String, Node> nodes = new LinkedHashMap<>();
        for (Node node : workflow.getNodes()) {
            nodes.put(node.getName(), node);
        }
        return nodes;
    }

    private static Map<String, Object> settingsOf(Workflow workflow) {
        return workflow.getSettings() != null ? workflow.getSettings() : Map.of();
    }

    private static String checkId(String id, String what) {
        if (id == null || !SAFE_ID.matcher(id).matches() || id.contains("..")) {
            throw new IllegalArgumentException("Invalid " + what + ": " + id);
        }
        return id;
    }
}
