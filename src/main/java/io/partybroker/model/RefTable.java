package io.partybroker.model;

public record RefTable(DbTable table, DbType dbType) {
}
