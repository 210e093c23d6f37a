package io.partybroker.model;

import java.util.Locale;
import java.util.Set;

public record ColumnMeta(String columnName, String dataType) {
    // Types the query compiler can place into its catalog; a length or precision suffix is ignored.
    static final Set<String> SUPPORTED_TYPES = Set.of(
            "int", "integer", "int32", "int64", "long", "bigint", "smallint", "tinyint",
            "float", "float32", "float64", "double", "real", "decimal",
            "string", "str", "varchar", "char", "text",
            "bool", "boolean",
            "date", "datetime", "timestamp"
    );

    // Canonical type text fed into the schema fingerprint.
    public String typeDescriptor() {
        return dataType == null ? "" : dataType.trim().toLowerCase(Locale.ROOT);
    }

    public boolean hasSupportedType() {
        String type = typeDescriptor();
        int paren = type.indexOf('(');
        if (paren >= 0) {
            if (!type.endsWith(")")) {
                return false;
            }
            type = type.substring(0, paren).trim();
        }
        return SUPPORTED_TYPES.contains(type);
    }
}
