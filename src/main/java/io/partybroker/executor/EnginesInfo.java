package io.partybroker.executor;

import io.partybroker.model.DbTable;
import io.partybroker.model.PartyInfo;
import io.partybroker.model.RefTable;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Which party owns which table of a query, where each table physically lives, and how to reach
 * every work party.
 */
public record EnginesInfo(
        Map<String, List<DbTable>> tablesByParty,
        Map<DbTable, RefTable> refTables,
        List<PartyInfo> parties
) {
    public EnginesInfo {
        tablesByParty = tablesByParty == null ? Map.of() : Map.copyOf(tablesByParty);
        refTables = refTables == null ? Map.of() : Map.copyOf(refTables);
        parties = parties == null ? List.of() : List.copyOf(parties);
    }

    public List<DbTable> tablesOf(String party) {
        return tablesByParty.getOrDefault(party, List.of());
    }

    public Optional<RefTable> refTableOf(DbTable table) {
        return Optional.ofNullable(refTables.get(table));
    }
}
