package io.partybroker.model;

import io.partybroker.util.Hashing;

import java.util.Arrays;

/**
 * Schema and column-control fingerprints of one party's tables for a query.
 */
public record Checksum(byte[] tableSchema, byte[] ccl) {

    public Checksum {
        tableSchema = tableSchema == null ? new byte[0] : tableSchema.clone();
        ccl = ccl == null ? new byte[0] : ccl.clone();
    }

    @Override
    public byte[] tableSchema() {
        return tableSchema.clone();
    }

    @Override
    public byte[] ccl() {
        return ccl.clone();
    }

    public CompareResult compareTo(Checksum other) {
        if (!Arrays.equals(tableSchema, other.tableSchema)) {
            return CompareResult.TABLE_SCHEMA_NOT_EQUAL;
        }
        if (!Arrays.equals(ccl, other.ccl)) {
            return CompareResult.CCL_NOT_EQUAL;
        }
        return CompareResult.EQUAL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Checksum other)) {
            return false;
        }
        return Arrays.equals(tableSchema, other.tableSchema) && Arrays.equals(ccl, other.ccl);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(tableSchema) + Arrays.hashCode(ccl);
    }

    @Override
    public String toString() {
        return "Checksum{tableSchema=" + Hashing.toHex(tableSchema) + ", ccl=" + Hashing.toHex(ccl) + "}";
    }
}
