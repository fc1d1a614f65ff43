package com.lshann.common;

/**
 * Raised by a storage backend when a table holds no bucket for a signature.
 *
 * <p>Checked on purpose: it is an expected outcome of probing and callers must decide
 * what an empty probe means for them. The index treats it as an empty bucket.</p>
 */
public class BucketNotFoundException extends Exception {

    private final int tableId;

    public BucketNotFoundException(Signature signature, int tableId) {
        super("No bucket for " + signature + " in table " + tableId);
        this.tableId = tableId;
    }

    public int getTableId() {
        return tableId;
    }

    public ErrorKind getKind() {
        return ErrorKind.BUCKET_NOT_FOUND;
    }
}
