package io.partybroker.checksum;

import io.partybroker.model.Checksum;
import io.partybroker.model.ColumnControl;
import io.partybroker.model.ColumnMeta;
import io.partybroker.model.TableMeta;
import io.partybroker.util.Hashing;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Fingerprints one party's view of the tables and column controls of a query.
 *
 * <p>Two brokers can only agree when they hash the same bytes, so every input is sorted before it
 * is fed to the digest: tables by {@code db.table}, columns by name, column controls by
 * (table, column, party). Each field is terminated by a zero byte so that adjacent values cannot
 * shift into each other.
 */
public final class ChecksumEngine {
    private static final Comparator<TableMeta> TABLE_ORDER =
            Comparator.comparing(t -> t.dbTable().toString());
    private static final Comparator<ColumnMeta> COLUMN_ORDER =
            Comparator.comparing(ColumnMeta::columnName).thenComparing(ColumnMeta::typeDescriptor);
    private static final Comparator<ColumnControl> CCL_ORDER =
            Comparator.comparing(ColumnControl::tableName)
                    .thenComparing(ColumnControl::columnName)
                    .thenComparing(ColumnControl::partyCode)
                    .thenComparing(c -> c.visibility().name());

    private ChecksumEngine() {
    }

    public static Checksum compute(String party, Collection<TableMeta> tables, Collection<ColumnControl> ccls) {
        MessageDigest schemaDigest = Hashing.sha256();
        MessageDigest cclDigest = Hashing.sha256();
        List<TableMeta> owned = tables.stream()
                .filter(t -> party.equals(t.owner()))
                .sorted(TABLE_ORDER)
                .toList();
        for (TableMeta table : owned) {
            feed(schemaDigest, table.dbTable().toString());
            List<ColumnMeta> columns = table.columns().stream().sorted(COLUMN_ORDER).toList();
            for (ColumnMeta column : columns) {
                feed(schemaDigest, column.columnName());
                feed(schemaDigest, column.typeDescriptor());
            }
            List<ColumnControl> tableCcls = ccls.stream()
                    .filter(c -> table.tableName().equals(c.tableName()) && table.projectId().equals(c.dbName()))
                    .sorted(CCL_ORDER)
                    .toList();
            for (ColumnControl ccl : tableCcls) {
                feed(cclDigest, ccl.tableName());
                feed(cclDigest, ccl.columnName());
                feed(cclDigest, ccl.visibility().name());
            }
        }
        return new Checksum(schemaDigest.digest(), cclDigest.digest());
    }

    public static Map<String, Checksum> computeAll(
            Collection<String> parties,
            Collection<TableMeta> tables,
            Collection<ColumnControl> ccls
    ) {
        Map<String, Checksum> out = new TreeMap<>();
        for (String party : parties) {
            out.put(party, compute(party, tables, ccls));
        }
        return out;
    }

    private static void feed(MessageDigest digest, String value) {
        digest.update((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
        digest.update((byte) 0);
    }
}
