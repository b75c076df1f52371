package org.carma.slotcoord.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.carma.slotcoord.model.SuccessRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.*;
import java.util.*;

/**
 * Success records kept as a pretty-printed JSON array in a single file.
 *
 * The file is read in full when the store is opened and rewritten in full
 * after every append (temp file, then move over the existing file). There is no
 * locking: with several processes on one file the last writer wins.
 */
public class JsonSuccessRecordStore implements SuccessRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JsonSuccessRecordStore.class);

    private static final TypeReference<List<SuccessRecord>> RECORD_LIST = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper mapper;
    private final List<SuccessRecord> records;

    private JsonSuccessRecordStore(Path file, ObjectMapper mapper, List<SuccessRecord> loaded) {
        this.file = file;
        this.mapper = mapper;
        this.records = new ArrayList<>(loaded);
    }

    /**
     * Open a store, loading any records already in {@code file}. A missing
     * file is an empty store; an unreadable or corrupt one is an error.
     */
    public static JsonSuccessRecordStore open(Path file) {
        ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
        if (!Files.exists(file)) {
            log.info("No success records at {}, starting empty", file);
            return new JsonSuccessRecordStore(file, mapper, List.of());
        }
        try {
            List<SuccessRecord> loaded = Files.size(file) == 0
                ? List.of()
                : mapper.readValue(file.toFile(), RECORD_LIST);
            log.info("Loaded {} success record(s) from {}", loaded.size(), file);
            return new JsonSuccessRecordStore(file, mapper, loaded);
        } catch (IOException e) {
            throw new SuccessRecordStoreException("Could not read success records from " + file, e);
        }
    }

    @Override
    public synchronized List<SuccessRecord> getRecords() {
        return new ArrayList<>(records);
    }

    @Override
    public synchronized void append(SuccessRecord record) {
        records.add(record);
        try {
            write();
        } catch (IOException e) {
            throw new SuccessRecordStoreException("Could not write success records to " + file, e);
        }
        log.info("Saved {} success record(s) to {}", records.size(), file);
    }

    private void write() throws IOException {
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), records);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    @Override
    public String toString() {
        return String.format("JsonSuccessRecordStore[%s, records=%d]", file, records.size());
    }
}
