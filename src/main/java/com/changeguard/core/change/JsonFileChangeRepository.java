package com.changeguard.core.change;

import com.changeguard.core.exception.FileAccessException;
import com.changeguard.core.model.ChangeRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Keeps the audit trail as one JSON array in a file.
 * <p>
 * Every save rewrites the document into a temporary file, forces it to disk and renames it over
 * the previous one, so readers see either the old or the new document. A save that cannot be
 * persisted leaves the in-memory view unchanged.
 */
public class JsonFileChangeRepository implements ChangeRepository {

    private static final Logger log = LoggerFactory.getLogger(JsonFileChangeRepository.class);

    private static final TypeReference<List<ChangeRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, ChangeRecord> records = new LinkedHashMap<>();

    public JsonFileChangeRepository(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        load();
    }

    private void load() {
        if (!Files.exists(file)) {
            log.info("No change store at {}, starting empty", file);
            return;
        }
        try {
            List<ChangeRecord> loaded = objectMapper.readValue(file.toFile(), RECORD_LIST);
            loaded.forEach(r -> records.put(r.id(), r));
            log.info("Loaded {} change records from {}", records.size(), file);
        } catch (IOException e) {
            throw new FileAccessException(file, "Cannot read change store", e);
        }
    }

    @Override
    public synchronized void save(ChangeRecord record) {
        ChangeRecord previous = records.put(record.id(), record);
        try {
            persist();
        } catch (IOException e) {
            if (previous == null) {
                records.remove(record.id());
            } else {
                records.put(record.id(), previous);
            }
            throw new FileAccessException(file, "Cannot write change store", e);
        }
    }

    @Override
    public synchronized Optional<ChangeRecord> findById(String id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public synchronized List<ChangeRecord> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparing(ChangeRecord::createdAt).thenComparing(ChangeRecord::id))
                .toList();
    }

    @Override
    public String location() {
        return file.toString();
    }

    private void persist() throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        byte[] json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(records.values());
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            ByteBuffer buffer = ByteBuffer.wrap(json);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
        }
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
