package org.carma.slotcoord.store;

import org.carma.slotcoord.model.SuccessRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Keeps records for the lifetime of the process only.
 */
public class InMemorySuccessRecordStore implements SuccessRecordStore {

    private final List<SuccessRecord> records = Collections.synchronizedList(new ArrayList<>());

    @Override
    public List<SuccessRecord> getRecords() {
        return new ArrayList<>(records);
    }

    @Override
    public void append(SuccessRecord record) {
        records.add(record);
    }
}
