// file: sync/src/main/java/io/boardsync/sync/transport/HttpObjectRepository.java
package io.boardsync.sync.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.boardsync.core.ObjectPatch;
import io.boardsync.core.ObjectUpdate;
import io.boardsync.core.WhiteboardObject;
import io.boardsync.storage.ObjectNotFoundException;
import io.boardsync.storage.ObjectRepository;
import io.boardsync.storage.json.ObjectJson;

import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * {@link ObjectRepository} backed by the board server's REST API:
 * <pre>
 *   GET    /boards/{board}/objects
 *   POST   /boards/{board}/objects
 *   POST   /boards/{board}/objects/insert     { "objects": [...] }
 *   PATCH  /boards/{board}/objects/{id}       -> { "version": n }
 *   PATCH  /boards/{board}/objects            -> { "versions": { id: n } }
 *   DELETE /boards/{board}/objects/{id}
 *   POST   /boards/{board}/objects/delete     { "ids": [...] }
 * </pre>
 * Every write carries a fresh {@code Idempotency-Key} so the server applies a
 * retried request once. One instance talks to one board.
 */
public final class HttpObjectRepository implements ObjectRepository {

    private static final TypeReference<List<WhiteboardObject>> OBJECT_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Integer>> VERSION_MAP = new TypeReference<>() {};

    private final URI baseUri;
    private final String boardId;
    private final HttpClient client;
    private final ObjectMapper mapper = ObjectJson.newMapper();

    public HttpObjectRepository(URI baseUri, String boardId) {
        this(baseUri, boardId, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build());
    }

    public HttpObjectRepository(URI baseUri, String boardId, HttpClient client) {
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.boardId = Objects.requireNonNull(boardId, "boardId");
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public CompletableFuture<List<WhiteboardObject>> list(String board) {
        HttpRequest req = HttpRequest.newBuilder(objectsUri(board, "")).GET().build();
        return call("list", null, req).thenApply(body -> read(body, OBJECT_LIST));
    }

    @Override
    public CompletableFuture<Void> insert(WhiteboardObject object) {
        HttpRequest req = write(objectsUri(object.boardId(), ""), "POST", object);
        return call("insert", object.id(), req).thenApply(body -> null);
    }

    @Override
    public CompletableFuture<Void> insertMany(List<WhiteboardObject> objects) {
        HttpRequest req = write(objectsUri(boardId, "/insert"), "POST", Map.of("objects", List.copyOf(objects)));
        return call("insertMany", null, req).thenApply(body -> null);
    }

    @Override
    public CompletableFuture<Integer> update(String id, ObjectPatch patch) {
        HttpRequest req = write(objectsUri(boardId, "/" + encode(id)), "PATCH", patch);
        return call("update", id, req).thenApply(body -> readTree(body).path("version").asInt());
    }

    @Override
    public CompletableFuture<Map<String, Integer>> updateMany(List<ObjectUpdate> updates) {
        HttpRequest req = write(objectsUri(boardId, ""), "PATCH", Map.of("updates", updates));
        return call("updateMany", null, req)
                .thenApply(body -> mapper.convertValue(readTree(body).path("versions"), VERSION_MAP));
    }

    @Override
    public CompletableFuture<Void> delete(String id) {
        HttpRequest req = HttpRequest.newBuilder(objectsUri(boardId, "/" + encode(id)))
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .DELETE()
                .build();
        return call("delete", id, req).thenApply(body -> null);
    }

    @Override
    public CompletableFuture<Void> deleteMany(Collection<String> ids) {
        HttpRequest req = write(objectsUri(boardId, "/delete"), "POST", Map.of("ids", List.copyOf(ids)));
        return call("deleteMany", null, req).thenApply(body -> null);
    }

    // ---------- internals ----------

    private CompletableFuture<String> call(String operation, String objectId, HttpRequest req) {
        return client.sendAsync(req, HttpResponse.BodyHandlers.ofString()).thenApply(resp -> {
            int status = resp.statusCode();
            if (status == 404 && objectId != null && "update".equals(operation)) {
                throw new ObjectNotFoundException(objectId);
            }
            if (status / 100 != 2) {
                throw new RemoteCallException(operation, status, resp.body());
            }
            return resp.body();
        });
    }

    private HttpRequest write(URI uri, String method, Object body) {
        byte[] json;
        try {
            json = mapper.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("cannot encode request body", e);
        }
        return HttpRequest.newBuilder(uri)
                .header("Content-Type", "application/json")
                .header("Idempotency-Key", UUID.randomUUID().toString())
                .method(method, HttpRequest.BodyPublishers.ofByteArray(json))
                .build();
    }

    private URI objectsUri(String board, String suffix) {
        return baseUri.resolve("/boards/" + encode(board) + "/objects" + suffix);
    }

    private <T> T read(String body, TypeReference<T> type) {
        try {
            return mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("invalid response body", e);
        }
    }

    private JsonNode readTree(String body) {
        try {
            return mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("invalid response body", e);
        }
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
