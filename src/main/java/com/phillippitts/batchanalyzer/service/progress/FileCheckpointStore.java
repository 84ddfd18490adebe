package com.phillippitts.batchanalyzer.service.progress;

import com.phillippitts.batchanalyzer.exception.CheckpointException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores one JSON checkpoint file per run token under a directory.
 *
 * <p>Writes go to a temporary file in the same directory which is then moved over the target,
 * atomically where the file system supports it.
 */
public class FileCheckpointStore implements CheckpointStore {

    private static final Logger LOG = LogManager.getLogger(FileCheckpointStore.class);
    private static final String SUFFIX = ".checkpoint.json";

    private final Path directory;

    public FileCheckpointStore(Path directory) {
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    Path fileFor(String runToken) {
        return directory.resolve(safeName(runToken) + SUFFIX);
    }

    @Override
    public Optional<ProgressSnapshot> load(String runToken) {
        Path file = fileFor(runToken);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            return Optional.of(fromJson(new JSONObject(json), runToken));
        } catch (IOException | JSONException | IllegalArgumentException | DateTimeException e) {
            throw new CheckpointException("Failed to read checkpoint " + file, runToken, e);
        }
    }

    @Override
    public void save(ProgressSnapshot snapshot) {
        Path target = fileFor(snapshot.runToken());
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, "checkpoint-", ".tmp");
            Files.writeString(tmp, toJson(snapshot).toString(2), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            LOG.debug("Checkpoint written: {} ({} processed)", target, snapshot.processed());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new CheckpointException("Failed to write checkpoint " + target, snapshot.runToken(), e);
        }
    }

    @Override
    public void delete(String runToken) {
        Path file = fileFor(runToken);
        try {
            if (Files.deleteIfExists(file)) {
                LOG.debug("Checkpoint removed: {}", file);
            }
        } catch (IOException e) {
            throw new CheckpointException("Failed to delete checkpoint " + file, runToken, e);
        }
    }

    static JSONObject toJson(ProgressSnapshot s) {
        JSONObject failed = new JSONObject();
        s.failedIds().forEach(failed::put);
        JSONObject counts = new JSONObject()
                .put("processed", s.processed())
                .put("succeeded", s.succeeded())
                .put("failed", s.failed())
                .put("skipped", s.skipped());
        return new JSONObject()
                .put("runToken", s.runToken())
                .put("processedIdentifiers", new JSONArray(s.processedIds()))
                .put("failedIdentifiers", failed)
                .put("cumulativeCost", s.cumulativeCost())
                .put("counts", counts)
                .put("savedAt", s.savedAt().toString());
    }

    /**
     * Reads a checkpoint record. The record carries no run state or item total; a loaded snapshot
     * reports {@link RunState#RUNNING} and a total of processed plus skipped items.
     */
    static ProgressSnapshot fromJson(JSONObject json) {
        return fromJson(json, null);
    }

    static ProgressSnapshot fromJson(JSONObject json, String expectedToken) {
        JSONArray ids = json.optJSONArray("processedIdentifiers");
        List<String> processedIds = new ArrayList<>();
        if (ids != null) {
            for (int i = 0; i < ids.length(); i++) {
                processedIds.add(ids.getString(i));
            }
        }
        Map<String, String> failedIds = new LinkedHashMap<>();
        JSONObject failed = json.optJSONObject("failedIdentifiers");
        if (failed != null) {
            for (String key : failed.keySet()) {
                failedIds.put(key, failed.optString(key, ""));
            }
        }
        JSONObject counts = json.optJSONObject("counts");
        if (counts == null) {
            counts = new JSONObject();
        }
        int succeeded = counts.optInt("succeeded", processedIds.size());
        int failedCount = counts.optInt("failed", failedIds.size());
        int processed = counts.optInt("processed", succeeded + failedCount);
        int skipped = counts.optInt("skipped", 0);
        String savedAt = json.optString("savedAt", null);
        return new ProgressSnapshot(
                expectedToken == null ? json.getString("runToken") : json.optString("runToken", expectedToken),
                RunState.RUNNING,
                processed + skipped,
                processed,
                succeeded,
                failedCount,
                skipped,
                json.optDouble("cumulativeCost", 0.0),
                processedIds,
                failedIds,
                savedAt == null ? null : Instant.parse(savedAt));
    }

    private static String safeName(String runToken) {
        return runToken.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            LOG.debug("Could not remove temporary checkpoint {}: {}", tmp, e.getMessage());
        }
    }
}
