package io.partybroker.rpc;

import java.io.IOException;

/**
 * Client side of the broker-to-broker protocol. {@code brokerUrl} is the base URL of the peer
 * broker as listed in the party registry.
 */
public interface InterPartyStub {
    String EXCHANGE_JOB_INFO_PATH = "/inter/job/exchange";
    String ASK_INFO_PATH = "/inter/project/ask-info";

    ExchangeJobInfoResponse exchangeJobInfo(String brokerUrl, ExchangeJobInfoRequest request) throws IOException;

    AskInfoResponse askInfo(String brokerUrl, AskInfoRequest request) throws IOException;
}
