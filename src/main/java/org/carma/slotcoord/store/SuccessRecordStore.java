package org.carma.slotcoord.store;

import org.carma.slotcoord.model.SuccessRecord;

import java.util.List;

/**
 * Append-only, ordered collection of success records.
 */
public interface SuccessRecordStore {

    /**
     * All records, oldest first, including ones loaded from earlier runs.
     */
    List<SuccessRecord> getRecords();

    /**
     * Append a record and make it durable.
     *
     * @throws SuccessRecordStoreException if the record could not be persisted;
     *         the record stays in memory either way
     */
    void append(SuccessRecord record);

    default int size() {
        return getRecords().size();
    }
}
