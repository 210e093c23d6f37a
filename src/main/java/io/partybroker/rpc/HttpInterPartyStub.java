package io.partybroker.rpc;

import io.partybroker.util.Jsons;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class HttpInterPartyStub implements InterPartyStub {
    private final HttpClient http;
    private final Duration requestTimeout;

    public HttpInterPartyStub() {
        this(Duration.ofSeconds(10), Duration.ofSeconds(30));
    }

    public HttpInterPartyStub(Duration connectTimeout, Duration requestTimeout) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .build();
        this.requestTimeout = requestTimeout;
    }

    @Override
    public ExchangeJobInfoResponse exchangeJobInfo(String brokerUrl, ExchangeJobInfoRequest request) throws IOException {
        return post(brokerUrl + EXCHANGE_JOB_INFO_PATH, request, ExchangeJobInfoResponse.class);
    }

    @Override
    public AskInfoResponse askInfo(String brokerUrl, AskInfoRequest request) throws IOException {
        return post(brokerUrl + ASK_INFO_PATH, request, AskInfoResponse.class);
    }

    private <T> T post(String url, Object body, Class<T> type) throws IOException {
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofString(Jsons.toCompactJson(body), StandardCharsets.UTF_8))
                .build();
        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted while calling " + url, e);
        }
        if (resp.statusCode() / 100 != 2) {
            throw new IOException("request to " + url + " failed status=" + resp.statusCode());
        }
        return Jsons.compact().readValue(resp.body(), type);
    }
}
