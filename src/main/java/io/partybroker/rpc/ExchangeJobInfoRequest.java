package io.partybroker.rpc;

import io.partybroker.model.Checksum;

/**
 * {@code serverChecksum} is the sender's view of the receiver's tables, absent when the receiver
 * owns no table of the query. {@code clientChecksum} is the sender's checksum of its own tables,
 * absent when the sender owns none. {@code clientEndpoint} is the sender's engine endpoint.
 */
public record ExchangeJobInfoRequest(
        String projectId,
        String jobId,
        String clientId,
        Checksum serverChecksum,
        Checksum clientChecksum,
        String clientEndpoint
) {
}
