package io.partybroker.rpc;

import io.partybroker.model.Checksum;
import io.partybroker.model.Status;

public record ExchangeJobInfoResponse(Status status, Checksum expectedServerChecksum, String endpoint) {

    public static ExchangeJobInfoResponse of(Status status) {
        return new ExchangeJobInfoResponse(status, null, null);
    }
}
