package io.partybroker.error;

import java.util.List;

public final class TableNotFoundException extends BrokerException {
    private final List<String> missingTables;

    public TableNotFoundException(List<String> missingTables) {
        super(ErrorCode.TABLE_NOT_FOUND, "table " + missingTables + " not found");
        this.missingTables = List.copyOf(missingTables);
    }

    public List<String> missingTables() {
        return missingTables;
    }
}
