package io.partybroker.plan;

import io.partybroker.model.ColumnControl;

import java.util.List;

public record SecurityConfig(List<ColumnControl> columnControlList) {
    public SecurityConfig {
        columnControlList = columnControlList == null ? List.of() : List.copyOf(columnControlList);
    }
}
