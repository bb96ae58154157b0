package com.adapterhost.ipc.bulk;

import com.adapterhost.codec.WireTypes;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Side channel for values whose serialized size exceeds a threshold. The sender writes the JSON to a
 * file in the shared directory and puts a reference in the envelope instead:
 * <pre>{"__type":"BulkTransfer","path":"/tmp/adapterhost-bulk-123.json","size":4000000}</pre>
 * The receiver reads the file and deletes it. References outside the directory, or to files this
 * channel did not name, are refused.
 */
public final class BulkTransfer {

    private static final Logger log = LoggerFactory.getLogger(BulkTransfer.class);

    public static final int DEFAULT_THRESHOLD_BYTES = 1_000_000;
    static final String FILE_PREFIX = "adapterhost-bulk-";
    static final String FILE_SUFFIX = ".json";

    private final Path directory;
    private final int thresholdBytes;
    private final ObjectMapper mapper;
    private final Set<Path> written = ConcurrentHashMap.newKeySet();

    public BulkTransfer(Path directory, int thresholdBytes, ObjectMapper mapper) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        if (thresholdBytes <= 0) {
            throw new IllegalArgumentException("thresholdBytes must be positive");
        }
        this.thresholdBytes = thresholdBytes;
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public int getThresholdBytes() {
        return thresholdBytes;
    }

    public Path getDirectory() {
        return directory;
    }

    /** Returns {@code value} unchanged when small enough, otherwise a reference to a new bulk file. */
    public JsonNode offload(JsonNode value) {
        if (value == null || !(value.isContainerNode() || value.isTextual())) {
            return value;
        }
        byte[] bytes;
        try {
            bytes = mapper.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new BulkTransferException("Cannot serialize payload: " + e.getMessage(), e);
        }
        if (bytes.length <= thresholdBytes) {
            return value;
        }
        pruneConsumed();
        try {
            Files.createDirectories(directory);
            Path file = Files.createTempFile(directory, FILE_PREFIX, FILE_SUFFIX);
            Files.write(file, bytes);
            written.add(file);
            log.debug("Offloaded {} byte payload to {}", bytes.length, file);
            ObjectNode ref = mapper.createObjectNode();
            ref.put(WireTypes.TYPE_FIELD, WireTypes.BULK_TRANSFER);
            ref.put("path", file.toString());
            ref.put("size", bytes.length);
            return ref;
        } catch (IOException e) {
            throw new BulkTransferException("Cannot write bulk payload to " + directory + ": " + e.getMessage(), e);
        }
    }

    public List<JsonNode> offloadAll(List<JsonNode> values) {
        List<JsonNode> out = new ArrayList<>(values.size());
        for (JsonNode value : values) {
            out.add(offload(value));
        }
        return out;
    }

    /** Replaces a bulk reference by the payload it names and deletes the file; other values pass through. */
    public JsonNode resolve(JsonNode value) {
        if (!isReference(value)) {
            return value;
        }
        Path file = checkedPath(value);
        try {
            return mapper.readTree(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new BulkTransferException("Cannot read bulk payload " + file + ": " + e.getMessage(), e);
        } finally {
            deleteQuietly(file);
            written.remove(file);
        }
    }

    public List<JsonNode> resolveAll(List<JsonNode> values) {
        List<JsonNode> out = new ArrayList<>(values.size());
        for (JsonNode value : values) {
            out.add(resolve(value));
        }
        return out;
    }

    /** Deletes the files behind any references in {@code values} that were never resolved. */
    public void discard(List<JsonNode> values) {
        for (JsonNode value : values) {
            discard(value);
        }
    }

    public void discard(JsonNode value) {
        if (!isReference(value)) return;
        try {
            Path file = checkedPath(value);
            deleteQuietly(file);
            written.remove(file);
        } catch (BulkTransferException e) {
            log.debug("Not discarding foreign bulk reference: {}", e.getMessage());
        }
    }

    /** Deletes every file this instance wrote that is still on disk; the peer will not read them now. */
    public void cleanup() {
        for (Path file : List.copyOf(written)) {
            deleteQuietly(file);
            written.remove(file);
        }
    }

    /** Files written by this instance that are still on disk. */
    public int outstandingFiles() {
        pruneConsumed();
        return written.size();
    }

    // The peer deletes a file once it has read it.
    private void pruneConsumed() {
        written.removeIf(file -> !Files.exists(file));
    }

    public static boolean isReference(JsonNode value) {
        return WireTypes.isTagged(value, WireTypes.BULK_TRANSFER);
    }

    private Path checkedPath(JsonNode ref) {
        String raw = ref.path("path").asText("");
        if (raw.isEmpty()) {
            throw new BulkTransferException("Bulk reference has no path");
        }
        Path file = Paths.get(raw).toAbsolutePath().normalize();
        String name = file.getFileName() != null ? file.getFileName().toString() : "";
        if (!directory.equals(file.getParent()) || !name.startsWith(FILE_PREFIX) || !name.endsWith(FILE_SUFFIX)) {
            throw new BulkTransferException("Bulk reference outside " + directory + ": " + raw);
        }
        return file;
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete bulk file {}: {}", file, e.getMessage());
        }
    }
}
