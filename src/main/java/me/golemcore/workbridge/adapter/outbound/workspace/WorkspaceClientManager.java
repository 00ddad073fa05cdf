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
import me.golemcore.workbridge.domain.model.WorkspaceCommand;
import me.golemcore.workbridge.domain.model.WorkspaceConnectionStateChangedEvent;
import me.golemcore.workbridge.domain.model.WorkspaceEvent;
import me.golemcore.workbridge.domain.service.WorkspaceEventBroadcaster;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import me.golemcore.workbridge.infrastructure.event.SpringEventBus;
import me.golemcore.workbridge.port.outbound.ResultCachePort;
import me.golemcore.workbridge.port.outbound.WorkspacePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registry of {@link WorkspaceChannelClient} instances keyed by workspace id.
 *
 * <p>
 * This manager provides:
 * <ul>
 * <li>Startup: connects every enabled workspace from
 * {@code workbridge.workspaces.*}
 * <li>Liveness: sends a protocol PING to connected workspaces every
 * {@code workbridge.workspace-client.ping-interval}
 * <li>Event routing: forwards agent events to the
 * {@link WorkspaceEventBroadcaster}
 * <li>State events: publishes {@link WorkspaceConnectionStateChangedEvent} on
 * every connection transition
 * <li>@PreDestroy shutdown: disconnects all clients
 * </ul>
 *
 * <p>
 * All clients share one scheduler for timeouts, auth deadlines and
 * reconnect backoff.
 *
 * @see WorkspaceChannelClient
 */
@Component
@Slf4j
public class WorkspaceClientManager implements WorkspacePort, WorkspaceChannelListener {

    private final WorkbridgeProperties properties;
    private final OkHttpClient webSocketClient;
    private final ObjectMapper objectMapper;
    private final ResultCachePort resultCache;
    private final WorkspaceEventBroadcaster broadcaster;
    private final SpringEventBus eventBus;
    private final Clock clock;

    private final Map<String, WorkspaceChannelClient> clients = new ConcurrentHashMap<>();
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> pingTask;

    public WorkspaceClientManager(WorkbridgeProperties properties, OkHttpClient okHttpClient,
            ObjectMapper objectMapper, ResultCachePort resultCache, WorkspaceEventBroadcaster broadcaster,
            SpringEventBus eventBus, Clock clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.resultCache = resultCache;
        this.broadcaster = broadcaster;
        this.eventBus = eventBus;
        this.clock = clock;
        // WebSockets are long-lived; the shared client's read timeout would kill idle connections
        this.webSocketClient = okHttpClient.newBuilder()
                .readTimeout(0, TimeUnit.MILLISECONDS)
                .build();

        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "workspace-channel-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Connect every enabled workspace and start the ping loop.
     */
    public void start() {
        properties.getWorkspaces().forEach((workspaceId, config) -> {
            if (!config.isEnabled()) {
                log.info("[WorkspaceManager] Workspace '{}' disabled, skipping", workspaceId);
                return;
            }
            connect(workspaceId).exceptionally(ex -> {
                log.warn("[WorkspaceManager] Workspace '{}' did not connect: {}", workspaceId, ex.getMessage());
                return null;
            });
        });

        long pingInterval = properties.getWorkspaceClient().getPingInterval();
        if (pingInterval > 0 && pingTask == null) {
            pingTask = scheduler.scheduleAtFixedRate(this::pingAll, pingInterval, pingInterval,
                    TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public CompletableFuture<CommandResult> execute(String workspaceId, WorkspaceCommand command) {
        WorkspaceChannelClient client = clients.get(workspaceId);
        if (client == null) {
            return CompletableFuture.failedFuture(WorkspaceChannelException.notConnected(workspaceId));
        }
        return client.execute(command);
    }

    @Override
    public ConnectionState getConnectionState(String workspaceId) {
        WorkspaceChannelClient client = clients.get(workspaceId);
        return client != null ? client.getState() : ConnectionState.DISCONNECTED;
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public CompletableFuture<Void> connect(String workspaceId) {
        WorkbridgeProperties.WorkspaceProperties config = properties.getWorkspaces().get(workspaceId);
        if (config == null || config.getUrl() == null || config.getUrl().isBlank()) {
            return CompletableFuture.failedFuture(WorkspaceChannelException.notConnected(workspaceId));
        }
        WorkspaceChannelClient client = clients.computeIfAbsent(workspaceId,
                id -> new WorkspaceChannelClient(id, config, webSocketClient, objectMapper, scheduler,
                        resultCache, properties.getWorkspaceClient().getCacheTtl(), clock, this));
        return client.connect();
    }

    @Override
    @SuppressWarnings("PMD.CloseResource")
    public void disconnect(String workspaceId) {
        WorkspaceChannelClient client = clients.remove(workspaceId);
        if (client != null) {
            client.disconnect();
            log.info("[WorkspaceManager] Disconnected workspace '{}'", workspaceId);
        }
    }

    @Override
    public void onEvent(WorkspaceEvent event) {
        broadcaster.publish(event);
    }

    @Override
    public void onStateChange(String workspaceId, ConnectionState previous, ConnectionState current,
            String reason) {
        eventBus.publish(new WorkspaceConnectionStateChangedEvent(workspaceId, previous, current, reason));
    }

    private void pingAll() {
        for (WorkspaceChannelClient client : clients.values()) {
            try {
                client.ping();
            } catch (RuntimeException e) {
                log.warn("[WorkspaceManager] Ping to '{}' failed: {}", client.getWorkspaceId(), e.getMessage());
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("[WorkspaceManager] Shutting down all workspace connections");
        for (Map.Entry<String, WorkspaceChannelClient> entry : clients.entrySet()) {
            try {
                entry.getValue().disconnect();
            } catch (RuntimeException e) {
                log.warn("[WorkspaceManager] Error closing workspace '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        clients.clear();
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
