package io.partybroker.rpc;

import io.partybroker.model.ColumnControl;
import io.partybroker.model.Status;
import io.partybroker.model.TableMeta;

import java.util.List;

public record AskInfoResponse(Status status, List<TableMeta> tables, List<ColumnControl> ccls) {
    public AskInfoResponse {
        tables = tables == null ? List.of() : List.copyOf(tables);
        ccls = ccls == null ? List.of() : List.copyOf(ccls);
    }

    public static AskInfoResponse of(Status status) {
        return new AskInfoResponse(status, List.of(), List.of());
    }
}
