package org.carma.slotcoord.store;

/**
 * The success record collection could not be read or written.
 */
public class SuccessRecordStoreException extends RuntimeException {

    public SuccessRecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
