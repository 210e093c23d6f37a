package io.partybroker.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class ColumnMetaTest {

    @Test
    void typeCheckIgnoresCaseAndLengthSuffix() {
        Assertions.assertTrue(new ColumnMeta("id", "INT").hasSupportedType());
        Assertions.assertTrue(new ColumnMeta("name", " varchar(64) ").hasSupportedType());
        Assertions.assertTrue(new ColumnMeta("amount", "decimal(10, 2)").hasSupportedType());
        Assertions.assertTrue(new ColumnMeta("at", "timestamp").hasSupportedType());
    }

    @Test
    void unknownOrMalformedTypesAreRejected() {
        Assertions.assertFalse(new ColumnMeta("shape", "geometry").hasSupportedType());
        Assertions.assertFalse(new ColumnMeta("raw", "blob").hasSupportedType());
        Assertions.assertFalse(new ColumnMeta("name", "varchar(64").hasSupportedType());
        Assertions.assertFalse(new ColumnMeta("x", null).hasSupportedType());
        Assertions.assertFalse(new ColumnMeta("x", "").hasSupportedType());
    }
}
