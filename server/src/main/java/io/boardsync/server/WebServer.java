// file: server/src/main/java/io/boardsync/server/WebServer.java
package io.boardsync.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.boardsync.core.ObjectPatch;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.server.dto.BatchUpdateRequest;
import io.boardsync.server.dto.DeleteManyRequest;
import io.boardsync.server.dto.InsertManyRequest;
import io.boardsync.server.dto.VersionResponse;
import io.boardsync.server.dto.VersionsResponse;
import io.boardsync.storage.ObjectNotFoundException;
import io.boardsync.storage.json.ObjectJson;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Thin HTTP adapter over {@link BoardService} and {@link BoardRelayHub}.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into model objects and DTOs.
 *  - Map Java exceptions to HTTP status codes.
 *  - Hand WebSocket upgrades to the relay.
 *  - Log every request through {@link RequestLogger}.
 *
 * Path layout:
 *   - GET    /boards/{board}/objects               list, oldest first
 *   - POST   /boards/{board}/objects               insert (body: object)
 *   - PATCH  /boards/{board}/objects               batch update (body: {updates})
 *   - POST   /boards/{board}/objects/insert        insert many (body: {objects})
 *   - POST   /boards/{board}/objects/delete        delete many (body: {ids})
 *   - PATCH  /boards/{board}/objects/{id}          update (body: patch)
 *   - DELETE /boards/{board}/objects/{id}          delete
 *   - GET    /boards/{board}/live?userId=&userName= WebSocket
 *   - GET    /admin/health                         health check
 *
 * An {@code Idempotency-Key} header on a write becomes its WAL op id, so a
 * retried request is applied once.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final String BOARDS = "/boards/";

    private final Undertow server;
    private final ObjectMapper json = ObjectJson.newMapper();
    private final BoardService boards;
    private final BoardRelayHub relay;

    /** Functional core of one request; returns the response body for a 200. */
    private interface Action {
        Object run(byte[] body) throws Exception;
    }

    public WebServer(int port, BoardService boards, BoardRelayHub relay) {
        this.boards = boards;
        this.relay = relay;

        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(exchange -> {
                    var path = exchange.getRequestPath();
                    var method = exchange.getRequestMethod().toString();

                    if ("/admin/health".equals(path)) {
                        send(exchange, 200, Map.of("status", "ok"));
                        RequestLogger.logRequest(method, path, 200, 0, -1, null);
                    } else if (path.startsWith(BOARDS)) {
                        routeBoard(exchange, method, path.substring(BOARDS.length()).split("/", -1));
                    } else {
                        reject(exchange, 404, "not found");
                    }
                }).build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void routeBoard(HttpServerExchange ex, String method, String[] parts) throws Exception {
        String board = parts[0];
        if (board.isBlank()) {
            reject(ex, 400, "boardId must not be empty");
            return;
        }
        if (parts.length == 2 && "live".equals(parts[1])) {
            handleLive(ex, board);
        } else if (parts.length == 2 && "objects".equals(parts[1])) {
            switch (method) {
                case "GET" -> respond(ex, null, body -> boards.list(board));
                case "POST" -> withBody(ex, body -> boards.insert(board, read(body, WhiteboardObject.class), opId(ex)));
                case "PATCH" -> withBody(ex, body -> {
                    var req = read(body, BatchUpdateRequest.class);
                    return new VersionsResponse(boards.updateMany(board, req.updates, opId(ex)));
                });
                default -> reject(ex, 405, "method not allowed");
            }
        } else if (parts.length == 3 && "objects".equals(parts[1])) {
            String id = parts[2];
            if (id.isBlank()) {
                reject(ex, 400, "id must not be empty");
            } else if ("insert".equals(id) && "POST".equals(method)) {
                withBody(ex, body -> {
                    var req = read(body, InsertManyRequest.class);
                    return Map.of("inserted", boards.insertMany(board, req.objects, opId(ex)));
                });
            } else if ("delete".equals(id) && "POST".equals(method)) {
                withBody(ex, body -> {
                    var req = read(body, DeleteManyRequest.class);
                    return Map.of("deleted", boards.deleteMany(board, req.ids, opId(ex)));
                });
            } else {
                switch (method) {
                    case "PATCH" -> withBody(ex, body -> new VersionResponse(
                            boards.update(board, id, read(body, ObjectPatch.class), opId(ex))));
                    case "DELETE" -> respond(ex, null, body -> Map.of("deleted", boards.delete(board, id, opId(ex))));
                    default -> reject(ex, 405, "method not allowed");
                }
            }
        } else {
            reject(ex, 404, "not found");
        }
    }

    private void handleLive(HttpServerExchange ex, String board) throws Exception {
        if (!"GET".equals(ex.getRequestMethod().toString())) {
            reject(ex, 405, "method not allowed");
            return;
        }
        if (!"websocket".equalsIgnoreCase(ex.getRequestHeaders().getFirst(Headers.UPGRADE))) {
            reject(ex, 400, "websocket upgrade required");
            return;
        }
        new WebSocketProtocolHandshakeHandler(relay.connectionCallback(board)).handleRequest(ex);
    }

    // ---------- request plumbing ----------

    /** Read the full body, then run the action on it. */
    private void withBody(HttpServerExchange ex, Action action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    if (data.length > MAX_BODY_BYTES) {
                        reject(exchange, 413, "request body too large");
                    } else {
                        respond(exchange, data, action);
                    }
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(exchange.getRequestMethod().toString(), exchange.getRequestPath(),
                            400, 0, -1, ioEx);
                }
        );
    }

    private void respond(HttpServerExchange ex, byte[] data, Action action) {
        String method = ex.getRequestMethod().toString();
        String path = ex.getRequestPath();
        long start = System.nanoTime();
        int status = 200;
        long repoMs = -1L;
        Throwable error = null;

        try {
            long rStart = System.nanoTime();
            Object result = action.run(data);
            repoMs = (System.nanoTime() - rStart) / 1_000_000L;
            send(ex, status, result);
        } catch (IllegalArgumentException bad) {
            status = 400;
            error = bad;
            send(ex, status, Map.of("error", String.valueOf(bad.getMessage())));
        } catch (ObjectNotFoundException missing) {
            status = 404;
            error = missing;
            send(ex, status, Map.of("error", "object not found", "id", missing.objectId()));
        } catch (JsonProcessingException jsonEx) {
            status = 400;
            error = jsonEx;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            long totalMs = (System.nanoTime() - start) / 1_000_000L;
            RequestLogger.logRequest(method, path, status, totalMs, repoMs, error);
        }
    }

    private <T> T read(byte[] body, Class<T> type) throws IOException {
        if (body == null || body.length == 0) throw new IllegalArgumentException("request body must not be empty");
        T value = json.readValue(body, type);
        if (value == null) throw new IllegalArgumentException("request body must not be null");
        return value;
    }

    private static String opId(HttpServerExchange ex) {
        return ex.getRequestHeaders().getFirst("Idempotency-Key");
    }

    private void reject(HttpServerExchange ex, int code, String message) {
        send(ex, code, Map.of("error", message));
        RequestLogger.logRequest(ex.getRequestMethod().toString(), ex.getRequestPath(), code, 0, -1, null);
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
