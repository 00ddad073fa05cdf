/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */
package me.golemcore.workbridge.adapter.outbound.workspace;

import me.golemcore.workbridge.domain.exception.WorkspaceChannelException;
import me.golemcore.workbridge.domain.model.CommandResult;
import me.golemcore.workbridge.domain.model.ConnectionState;
import me.golemcore.workbridge.domain.model.FileListCommand;
import me.golemcore.workbridge.domain.model.FileReadCommand;
import me.golemcore.workbridge.domain.model.WorkspaceCommand;
import me.golemcore.workbridge.domain.model.WorkspaceEvent;
import me.golemcore.workbridge.domain.model.WorkspaceEventType;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.port.outbound.ResultCachePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Correlated request/response client for a single workspace agent over a
 * WebSocket.
 *
 * <p>
 * Every message is a JSON envelope {@code {type, payload, timestamp}}. The
 * client:
 * <ol>
 * <li>Opens the socket and sends {@code AUTH {token, workspaceId}}
 * <li>Waits for {@code AUTH_SUCCESS} within the auth timeout, otherwise drops
 * the socket
 * <li>Sends {@code COMMAND {id, command}} with a random UUID as correlation id
 * and matches {@code COMMAND_RESPONSE} by that id
 * <li>Forwards unsolicited {@code EVENT} messages to the listener
 * </ol>
 *
 * <p>
 * Transport loss rejects every pending request and, unless the disconnect was
 * requested or authentication was refused, reconnects with exponential
 * backoff ({@code reconnectDelay * 2^attempt}). After
 * {@code maxReconnectAttempts} the connection is FAILED.
 *
 * <p>
 * Not a Spring bean. Created per workspace by
 * {@link WorkspaceClientManager}.
 *
 * @see WorkspaceClientManager
 */
public class WorkspaceChannelClient implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceChannelClient.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };
    private static final int NORMAL_CLOSURE = 1000;
    private static final int MAX_BACKOFF_SHIFT = 20;

    static final String AUTH = "AUTH";
    static final String AUTH_SUCCESS = "AUTH_SUCCESS";
    static final String AUTH_FAILURE = "AUTH_FAILURE";
    static final String COMMAND = "COMMAND";
    static final String COMMAND_RESPONSE = "COMMAND_RESPONSE";
    static final String EVENT = "EVENT";
    static final String PING = "PING";
    static final String PONG = "PONG";

    private final String workspaceId;
    private final WorkbridgeProperties.WorkspaceProperties config;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService scheduler;
    private final ResultCachePort cache;
    private final long cacheTtlMs;
    private final Clock clock;
    private final WorkspaceChannelListener listener;

    private final Map<String, PendingRequest> pendingRequests = new ConcurrentHashMap<>();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final AtomicLong lastActivityTimestamp = new AtomicLong();

    private volatile WebSocket webSocket;
    private volatile boolean manualDisconnect;
    private volatile boolean authFailed;
    private volatile String connectionId;
    private int reconnectAttempt;
    private ScheduledFuture<?> authTimeoutTask;
    private ScheduledFuture<?> reconnectTask;
    private CompletableFuture<Void> connectFuture;

    public WorkspaceChannelClient(String workspaceId, WorkbridgeProperties.WorkspaceProperties config,
            OkHttpClient httpClient, ObjectMapper objectMapper, ScheduledExecutorService scheduler,
            ResultCachePort cache, long cacheTtlMs, Clock clock, WorkspaceChannelListener listener) {
        this.workspaceId = workspaceId;
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.scheduler = scheduler;
        this.cache = cache;
        this.cacheTtlMs = cacheTtlMs;
        this.clock = clock;
        this.listener = listener;
        this.lastActivityTimestamp.set(clock.millis());
    }

    // ==================== CONNECTION LIFECYCLE ====================

    /**
     * Open the connection. The returned future completes once the agent
     * accepts authentication, or exceptionally when authentication is refused
     * or reconnection gives up.
     */
    public synchronized CompletableFuture<Void> connect() {
        if (state.get() == ConnectionState.CONNECTED) {
            return CompletableFuture.completedFuture(null);
        }
        if (connectFuture != null && !connectFuture.isDone()) {
            return connectFuture;
        }
        manualDisconnect = false;
        authFailed = false;
        reconnectAttempt = 0;
        connectFuture = new CompletableFuture<>();
        openSocket(ConnectionState.CONNECTING);
        return connectFuture;
    }

    private synchronized void openSocket(ConnectionState phase) {
        if (manualDisconnect) {
            return;
        }
        changeState(phase, null);
        log.info("[Workspace:{}] Connecting to {}", workspaceId, config.getUrl());
        Request request = new Request.Builder().url(config.getUrl()).build();
        webSocket = httpClient.newWebSocket(request, new ChannelListener());
    }

    /**
     * Close the connection on request. Pending requests are rejected before
     * this method returns and no reconnection is attempted.
     */
    public void disconnect() {
        WebSocket socket;
        synchronized (this) {
            manualDisconnect = true;
            cancel(reconnectTask);
            cancel(authTimeoutTask);
            socket = webSocket;
            webSocket = null;
            changeState(ConnectionState.DISCONNECTED, "client disconnect");
            if (connectFuture != null && !connectFuture.isDone()) {
                connectFuture.completeExceptionally(
                        WorkspaceChannelException.connectionLost(workspaceId, "client disconnected"));
            }
        }
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "Client disconnect");
        }
        rejectAllPending(WorkspaceChannelException.connectionLost(workspaceId, "client disconnected"));
        try {
            cache.evictByPrefix(cacheKeyPrefix());
        } catch (RuntimeException e) {
            log.warn("[Workspace:{}] Failed to clear cached results: {}", workspaceId, e.getMessage());
        }
    }

    @Override
    public void close() {
        disconnect();
    }

    private synchronized void handleConnectionLoss(WebSocket socket, String reason) {
        if (socket != webSocket) {
            return;
        }
        webSocket = null;
        cancel(authTimeoutTask);
        log.warn("[Workspace:{}] Connection lost: {}", workspaceId, reason);
        rejectAllPending(WorkspaceChannelException.connectionLost(workspaceId, reason));

        if (manualDisconnect || authFailed) {
            return;
        }
        if (!config.isReconnect()) {
            changeState(ConnectionState.DISCONNECTED, reason);
            failConnect(WorkspaceChannelException.connectionLost(workspaceId, reason));
            return;
        }
        scheduleReconnect(reason);
    }

    private void scheduleReconnect(String reason) {
        if (reconnectAttempt >= config.getMaxReconnectAttempts()) {
            log.error("[Workspace:{}] Giving up after {} reconnect attempts", workspaceId, reconnectAttempt);
            changeState(ConnectionState.FAILED, "reconnect attempts exhausted: " + reason);
            failConnect(WorkspaceChannelException.connectionLost(workspaceId, "reconnect attempts exhausted"));
            return;
        }
        long delay = config.getReconnectDelay() * (1L << Math.min(reconnectAttempt, MAX_BACKOFF_SHIFT));
        reconnectAttempt++;
        changeState(ConnectionState.RECONNECTING, reason);
        log.info("[Workspace:{}] Reconnecting in {}ms (attempt {}/{})", workspaceId, delay, reconnectAttempt,
                config.getMaxReconnectAttempts());
        reconnectTask = scheduler.schedule(() -> openSocket(ConnectionState.RECONNECTING), delay,
                TimeUnit.MILLISECONDS);
    }

    private void failConnect(Throwable error) {
        if (connectFuture != null && !connectFuture.isDone()) {
            connectFuture.completeExceptionally(error);
        }
    }

    // ==================== AUTHENTICATION ====================

    private synchronized void onSocketOpen(WebSocket socket) {
        if (socket != webSocket) {
            return;
        }
        Map<String, Object> auth = new LinkedHashMap<>();
        auth.put("token", config.getToken());
        auth.put("workspaceId", workspaceId);
        send(socket, AUTH, auth);
        authTimeoutTask = scheduler.schedule(() -> onAuthTimeout(socket), config.getAuthTimeout(),
                TimeUnit.MILLISECONDS);
    }

    private void onAuthTimeout(WebSocket socket) {
        synchronized (this) {
            if (socket != webSocket || state.get() == ConnectionState.CONNECTED) {
                return;
            }
        }
        log.warn("[Workspace:{}] No authentication answer within {}ms, closing", workspaceId,
                config.getAuthTimeout());
        socket.cancel();
        handleConnectionLoss(socket, "authentication timeout");
    }

    private synchronized void onAuthSuccess(JsonNode payload) {
        cancel(authTimeoutTask);
        connectionId = payload.path("connectionId").asText(null);
        reconnectAttempt = 0;
        changeState(ConnectionState.CONNECTED, null);
        log.info("[Workspace:{}] Authenticated (connectionId={})", workspaceId, connectionId);
        if (connectFuture != null && !connectFuture.isDone()) {
            connectFuture.complete(null);
        }
    }

    private void onAuthFailure(JsonNode payload) {
        String error = payload.path("error").asText("Authentication failed");
        WebSocket socket;
        synchronized (this) {
            authFailed = true;
            cancel(authTimeoutTask);
            socket = webSocket;
            webSocket = null;
            log.error("[Workspace:{}] Authentication rejected: {}", workspaceId, error);
            changeState(ConnectionState.FAILED, error);
            failConnect(WorkspaceChannelException.authFailed(workspaceId, error));
        }
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "Authentication failed");
        }
        rejectAllPending(WorkspaceChannelException.authFailed(workspaceId, error));
    }

    // ==================== COMMANDS ====================

    /**
     * Execute a command on the agent. Cacheable commands are answered from the
     * result cache when possible.
     */
    public CompletableFuture<CommandResult> execute(WorkspaceCommand command) {
        WebSocket socket = webSocket;
        if (state.get() != ConnectionState.CONNECTED || socket == null) {
            return CompletableFuture.failedFuture(WorkspaceChannelException.notConnected(workspaceId));
        }

        String cacheKey = command.type().isCacheable() ? cacheKey(command) : null;
        if (cacheKey != null) {
            Optional<CommandResult> cached = lookupCache(cacheKey);
            if (cached.isPresent()) {
                log.debug("[Workspace:{}] Cache hit for {}", workspaceId, cacheKey);
                return CompletableFuture.completedFuture(cached.get().asCacheHit());
            }
        }

        String id = UUID.randomUUID().toString();
        PendingRequest pending = new PendingRequest(clock.millis());
        pendingRequests.put(id, pending);
        pending.timeoutTask = scheduler.schedule(() -> expire(id), config.getCommandTimeout(),
                TimeUnit.MILLISECONDS);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("id", id);
        ObjectNode commandNode = objectMapper.valueToTree(command);
        commandNode.put("type", command.type().name());
        payload.put("command", commandNode);
        log.debug("[Workspace:{}] → {} {}", workspaceId, command.type(), id);
        if (!send(socket, COMMAND, payload)) {
            PendingRequest removed = pendingRequests.remove(id);
            if (removed != null) {
                cancel(removed.timeoutTask);
                removed.future.completeExceptionally(
                        WorkspaceChannelException.connectionLost(workspaceId, "send rejected"));
            }
        }

        if (cacheKey == null) {
            return pending.future;
        }
        return pending.future.thenApply(result -> {
            if (result.isSuccess()) {
                storeInCache(cacheKey, result);
            }
            return result;
        });
    }

    private void onCommandResponse(JsonNode payload) {
        String id = payload.path("id").asText(null);
        PendingRequest pending = id != null ? pendingRequests.remove(id) : null;
        if (pending == null) {
            log.warn("[Workspace:{}] Received response for unknown id: {}", workspaceId, id);
            return;
        }
        cancel(pending.timeoutTask);

        long executionTimeMs = payload.has("executionTimeMs")
                ? payload.get("executionTimeMs").asLong()
                : clock.millis() - pending.startedAt;
        CommandResult result = payload.path("success").asBoolean(false)
                ? CommandResult.success(payload.get("data"), executionTimeMs)
                : CommandResult.failure(payload.path("error").asText("Command failed"), executionTimeMs);
        pending.future.complete(result);
    }

    private void expire(String id) {
        PendingRequest pending = pendingRequests.remove(id);
        if (pending != null) {
            log.warn("[Workspace:{}] Command {} timed out after {}ms", workspaceId, id, config.getCommandTimeout());
            pending.future.completeExceptionally(
                    WorkspaceChannelException.timeout(workspaceId, config.getCommandTimeout()));
        }
    }

    private void rejectAllPending(WorkspaceChannelException error) {
        for (String id : pendingRequests.keySet()) {
            PendingRequest pending = pendingRequests.remove(id);
            if (pending != null) {
                cancel(pending.timeoutTask);
                pending.future.completeExceptionally(error);
            }
        }
    }

    // ==================== EVENTS ====================

    private void onWorkspaceEvent(JsonNode payload) {
        String typeName = payload.path("type").asText("");
        WorkspaceEventType type;
        try {
            type = WorkspaceEventType.valueOf(typeName);
        } catch (IllegalArgumentException e) {
            log.warn("[Workspace:{}] Ignoring event of unknown type '{}'", workspaceId, typeName);
            return;
        }

        Map<String, Object> eventPayload = payload.has("payload") && payload.get("payload").isObject()
                ? objectMapper.convertValue(payload.get("payload"), MAP_TYPE_REF)
                : Map.of();

        WorkspaceEvent event = WorkspaceEvent.builder()
                .workspaceId(workspaceId)
                .type(type)
                .timestamp(parseTimestamp(payload.get("timestamp")))
                .payload(eventPayload)
                .build();
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.error("[Workspace:{}] Event listener failed for {}: {}", workspaceId, type, e.getMessage(), e);
        }
    }

    private Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return clock.instant();
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            log.debug("[Workspace:{}] Unparseable event timestamp '{}', using arrival time", workspaceId,
                    node.asText());
            return clock.instant();
        }
    }

    // ==================== LIVENESS ====================

    /**
     * Send an application-level PING. No-op unless connected.
     */
    public void ping() {
        WebSocket socket = webSocket;
        if (state.get() == ConnectionState.CONNECTED && socket != null) {
            send(socket, PING, null);
        }
    }

    // ==================== WIRE ====================

    private void handleMessage(String text) {
        lastActivityTimestamp.set(clock.millis());
        JsonNode message;
        try {
            message = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("[Workspace:{}] Failed to parse message: {}", workspaceId, e.getMessage());
            return;
        }

        String type = message.path("type").asText("");
        JsonNode payload = message.path("payload");
        switch (type) {
        case AUTH_SUCCESS -> onAuthSuccess(payload);
        case AUTH_FAILURE -> onAuthFailure(payload);
        case COMMAND_RESPONSE -> onCommandResponse(payload);
        case EVENT -> onWorkspaceEvent(payload);
        case PING -> {
            WebSocket socket = webSocket;
            if (socket != null) {
                send(socket, PONG, null);
            }
        }
        case PONG -> log.trace("[Workspace:{}] PONG", workspaceId);
        default -> log.debug("[Workspace:{}] Ignoring message of type '{}'", workspaceId, type);
        }
    }

    private boolean send(WebSocket socket, String type, Object payload) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("type", type);
        envelope.set("payload", payload != null ? objectMapper.valueToTree(payload) : objectMapper.nullNode());
        envelope.put("timestamp", clock.instant().toString());
        try {
            return socket.send(objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException e) {
            log.error("[Workspace:{}] Failed to encode {} message: {}", workspaceId, type, e.getMessage());
            return false;
        }
    }

    // ==================== CACHE ====================

    private String cacheKeyPrefix() {
        return "workspace:" + workspaceId + ":";
    }

    String cacheKey(WorkspaceCommand command) {
        if (command instanceof FileReadCommand fileRead) {
            return cacheKeyPrefix() + "file:" + fileRead.path();
        }
        if (command instanceof FileListCommand fileList) {
            return cacheKeyPrefix() + "list:" + fileList.directory();
        }
        return cacheKeyPrefix() + "status:workspace";
    }

    private Optional<CommandResult> lookupCache(String key) {
        try {
            return cache.get(key);
        } catch (RuntimeException e) {
            log.warn("[Workspace:{}] Cache lookup failed, treating as miss: {}", workspaceId, e.getMessage());
            return Optional.empty();
        }
    }

    private void storeInCache(String key, CommandResult result) {
        try {
            cache.put(key, result, cacheTtlMs);
        } catch (RuntimeException e) {
            log.warn("[Workspace:{}] Failed to cache result for {}: {}", workspaceId, key, e.getMessage());
        }
    }

    // ==================== STATE ====================

    private void changeState(ConnectionState newState, String reason) {
        ConnectionState previous = state.getAndSet(newState);
        if (previous == newState) {
            return;
        }
        log.info("[Workspace:{}] {} -> {}{}", workspaceId, previous, newState,
                reason != null ? " (" + reason + ")" : "");
        try {
            listener.onStateChange(workspaceId, previous, newState, reason);
        } catch (RuntimeException e) {
            log.error("[Workspace:{}] State listener failed: {}", workspaceId, e.getMessage(), e);
        }
    }

    private static void cancel(ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    public ConnectionState getState() {
        return state.get();
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getConnectionId() {
        return connectionId;
    }

    public int getPendingRequestCount() {
        return pendingRequests.size();
    }

    public long getLastActivityTimestamp() {
        return lastActivityTimestamp.get();
    }

    private static final class PendingRequest {
        private final CompletableFuture<CommandResult> future = new CompletableFuture<>();
        private final long startedAt;
        private volatile ScheduledFuture<?> timeoutTask;

        private PendingRequest(long startedAt) {
            this.startedAt = startedAt;
        }
    }

    private final class ChannelListener extends WebSocketListener {

        @Override
        public void onOpen(WebSocket socket, Response response) {
            onSocketOpen(socket);
        }

        @Override
        public void onMessage(WebSocket socket, String text) {
            if (socket == webSocket) {
                handleMessage(text);
            }
        }

        @Override
        public void onClosing(WebSocket socket, int code, String reason) {
            socket.close(NORMAL_CLOSURE, null);
            handleConnectionLoss(socket, "closed by agent (" + code + (reason.isEmpty() ? "" : " " + reason) + ")");
        }

        @Override
        public void onClosed(WebSocket socket, int code, String reason) {
            handleConnectionLoss(socket, "closed (" + code + ")");
        }

        @Override
        public void onFailure(WebSocket socket, Throwable t, Response response) {
            handleConnectionLoss(socket, t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
        }
    }
}
