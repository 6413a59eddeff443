package com.ryuqq.remoteexec.adapter.rest;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 테스트용 플랫폼 스텁 서버.
 *
 * <p>"METHOD path" 단위로 응답을 등록하고 받은 요청을 기록합니다.
 * 등록된 응답의 마지막 항목은 계속 반복됩니다. 등록되지 않은 경로는 404를 반환합니다.</p>
 */
final class StubPlatformServer implements AutoCloseable {

    record RecordedRequest(String method, String path, String query, String body, Map<String, String> headers) {

        String header(String name) {
            return headers.get(name.toLowerCase(Locale.ROOT));
        }
    }

    private record StubResponse(int status, String body, long delayMs) {
    }

    private final HttpServer server;
    private final ExecutorService executor;
    private final Map<String, Deque<StubResponse>> routes = new ConcurrentHashMap<>();
    private final List<RecordedRequest> requests = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private StubPlatformServer(HttpServer server, ExecutorService executor) {
        this.server = server;
        this.executor = executor;
    }

    static StubPlatformServer start() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        ExecutorService executor = Executors.newCachedThreadPool();
        StubPlatformServer stub = new StubPlatformServer(server, executor);
        server.createContext("/", stub::handle);
        server.setExecutor(executor);
        server.start();
        return stub;
    }

    String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    StubPlatformServer respond(String method, String path, int status, String body) {
        return respondAfter(method, path, status, body, 0);
    }

    StubPlatformServer respondAfter(String method, String path, int status, String body, long delayMs) {
        routes.computeIfAbsent(method + " " + path, key -> new ArrayDeque<>())
            .addLast(new StubResponse(status, body, delayMs));
        return this;
    }

    List<RecordedRequest> requests() {
        return List.copyOf(requests);
    }

    RecordedRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }

    private void handle(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        String body;
        try (InputStream in = exchange.getRequestBody()) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        Map<String, String> headers = new ConcurrentHashMap<>();
        exchange.getRequestHeaders().forEach((name, values) ->
            headers.put(name.toLowerCase(Locale.ROOT), String.join(",", values)));
        requests.add(new RecordedRequest(method, path, exchange.getRequestURI().getRawQuery(), body, headers));

        StubResponse response = next(method + " " + path);
        if (response.delayMs() > 0) {
            try {
                Thread.sleep(response.delayMs());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        byte[] bytes = response.body().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private StubResponse next(String route) {
        Deque<StubResponse> responses = routes.get(route);
        if (responses == null || responses.isEmpty()) {
            return new StubResponse(404, "{\"error_code\":\"ENDPOINT_NOT_FOUND\",\"message\":\"No route " + route + "\"}", 0);
        }
        synchronized (responses) {
            return responses.size() > 1 ? responses.pollFirst() : responses.peekFirst();
        }
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        server.stop(0);
        executor.shutdownNow();
    }
}
