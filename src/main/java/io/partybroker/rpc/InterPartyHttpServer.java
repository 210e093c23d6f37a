package io.partybroker.rpc;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.partybroker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Serves {@link InterPartyService} over HTTP with JSON bodies, the counterpart of
 * {@link HttpInterPartyStub}.
 */
public final class InterPartyHttpServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InterPartyHttpServer.class);

    private final HttpServer server;
    private final ExecutorService executor;

    public InterPartyHttpServer(InterPartyService service, int port) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(4, r -> {
            Thread t = new Thread(r, "inter-party-http");
            t.setDaemon(true);
            return t;
        });
        server.createContext(InterPartyStub.EXCHANGE_JOB_INFO_PATH,
                exchange -> handle(exchange, ExchangeJobInfoRequest.class, service::exchangeJobInfo));
        server.createContext(InterPartyStub.ASK_INFO_PATH,
                exchange -> handle(exchange, AskInfoRequest.class, service::askInfo));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("inter-party server listening on port {}", port());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private static <Q> void handle(HttpExchange exchange, Class<Q> type, Function<Q, Object> handler) throws IOException {
        try {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                writeJson(exchange, Map.of("error", "method_not_allowed"), 405);
                return;
            }
            byte[] raw = exchange.getRequestBody().readAllBytes();
            Q request;
            try {
                request = Jsons.compact().readValue(raw, type);
            } catch (IOException e) {
                writeJson(exchange, Map.of("error", "bad_json", "message", String.valueOf(e.getMessage())), 400);
                return;
            }
            writeJson(exchange, handler.apply(request), 200);
        } catch (RuntimeException e) {
            log.error("inter-party request {} failed", exchange.getRequestURI(), e);
            writeJson(exchange, Map.of("error", "internal", "message", String.valueOf(e.getMessage())), 500);
        } finally {
            exchange.close();
        }
    }

    private static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toCompactJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
