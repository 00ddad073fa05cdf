package me.golemcore.workbridge.adapter.outbound.workspace;

import me.golemcore.workbridge.adapter.outbound.cache.InMemoryResultCacheAdapter;
import me.golemcore.workbridge.domain.exception.WorkspaceChannelException;
import me.golemcore.workbridge.domain.model.CommandResult;
import me.golemcore.workbridge.domain.model.ConnectionState;
import me.golemcore.workbridge.domain.model.ErrorCategory;
import me.golemcore.workbridge.domain.model.FileReadCommand;
import me.golemcore.workbridge.domain.model.SearchCommand;
import me.golemcore.workbridge.domain.model.StatusCommand;
import me.golemcore.workbridge.domain.model.WorkspaceEvent;
import me.golemcore.workbridge.domain.model.WorkspaceEventType;
import me.golemcore.workbridge.infrastructure.config.WorkbridgeProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class WorkspaceChannelClientTest {

    private static final String WORKSPACE = "ws-1";
    private static final String TOKEN = "secret";
    private static final long WAIT_SECONDS = 5;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private MockWebServer server;
    private FakeAgent agent;
    private ScheduledExecutorService scheduler;
    private OkHttpClient httpClient;
    private InMemoryResultCacheAdapter cache;
    private WorkspaceChannelListener listener;
    private WorkbridgeProperties.WorkspaceProperties config;
    private WorkspaceChannelClient client;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        agent = new FakeAgent();

        scheduler = Executors.newScheduledThreadPool(2);
        httpClient = new OkHttpClient.Builder().readTimeout(0, TimeUnit.MILLISECONDS).build();
        WorkbridgeProperties properties = new WorkbridgeProperties();
        cache = new InMemoryResultCacheAdapter(properties, Clock.systemUTC());
        listener = mock(WorkspaceChannelListener.class);

        config = new WorkbridgeProperties.WorkspaceProperties();
        config.setUrl(server.url("/agent").toString());
        config.setToken(TOKEN);
        config.setCommandTimeout(2000);
        config.setAuthTimeout(2000);
        config.setReconnectDelay(50);
        config.setMaxReconnectAttempts(2);
    }

    @AfterEach
    void tearDown() throws IOException {
        if (client != null) {
            client.disconnect();
        }
        scheduler.shutdownNow();
        httpClient.dispatcher().executorService().shutdown();
        server.shutdown();
    }

    private WorkspaceChannelClient newClient() {
        client = new WorkspaceChannelClient(WORKSPACE, config, httpClient, objectMapper, scheduler, cache, 300_000,
                Clock.systemUTC(), listener);
        return client;
    }

    private void acceptConnection() {
        server.enqueue(new MockResponse().withWebSocketUpgrade(agent));
    }

    private WorkspaceChannelClient connectedClient() throws Exception {
        acceptConnection();
        WorkspaceChannelClient connected = newClient();
        connected.connect().get(WAIT_SECONDS, TimeUnit.SECONDS);
        return connected;
    }

    private static Throwable failureOf(CompletableFuture<?> future) {
        ExecutionException error = assertThrows(ExecutionException.class,
                () -> future.get(WAIT_SECONDS, TimeUnit.SECONDS));
        return error.getCause();
    }

    // ===== Connection =====

    @Test
    void shouldAuthenticateOnConnect() throws Exception {
        WorkspaceChannelClient connected = connectedClient();

        assertEquals(ConnectionState.CONNECTED, connected.getState());
        assertEquals("conn-1", connected.getConnectionId());
        JsonNode auth = agent.received.get(0);
        assertEquals("AUTH", auth.path("type").asText());
        assertEquals(TOKEN, auth.path("payload").path("token").asText());
        assertEquals(WORKSPACE, auth.path("payload").path("workspaceId").asText());
        verify(listener).onStateChange(WORKSPACE, ConnectionState.CONNECTING, ConnectionState.CONNECTED, null);
    }

    @Test
    void shouldFailWithoutReconnectWhenAuthenticationRejected() {
        config.setToken("wrong");
        acceptConnection();

        Throwable error = failureOf(newClient().connect());

        WorkspaceChannelException channelError = assertInstanceOf(WorkspaceChannelException.class, error);
        assertEquals(ErrorCategory.AUTH_FAILED, channelError.getCategory());
        assertEquals(ConnectionState.FAILED, client.getState());
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void shouldRejectCommandWhenNotConnected() {
        Throwable error = failureOf(newClient().execute(new StatusCommand("status")));

        assertEquals(ErrorCategory.NOT_CONNECTED, ((WorkspaceChannelException) error).getCategory());
    }

    // ===== Commands =====

    @Test
    void shouldCorrelateResponseWithRequest() throws Exception {
        WorkspaceChannelClient connected = connectedClient();

        CommandResult result = connected.execute(new FileReadCommand("src/a.ts", "read src/a.ts"))
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("content of src/a.ts", result.getData().asText());
        assertFalse(result.isFromCache());
        JsonNode command = agent.commands.get(0).path("payload").path("command");
        assertEquals("FILE_READ", command.path("type").asText());
        assertEquals("src/a.ts", command.path("path").asText());
        assertEquals(0, connected.getPendingRequestCount());
    }

    @Test
    void shouldServeRepeatedCacheableCommandFromCache() throws Exception {
        WorkspaceChannelClient connected = connectedClient();
        FileReadCommand read = new FileReadCommand("src/a.ts", "read src/a.ts");

        connected.execute(read).get(WAIT_SECONDS, TimeUnit.SECONDS);
        CommandResult second = connected.execute(read).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertTrue(second.isFromCache());
        assertEquals("content of src/a.ts", second.getData().asText());
        assertEquals(1, agent.commands.size());
    }

    @Test
    void shouldNeverCacheSearch() throws Exception {
        WorkspaceChannelClient connected = connectedClient();
        SearchCommand search = new SearchCommand("TODO", null, "search TODO");

        connected.execute(search).get(WAIT_SECONDS, TimeUnit.SECONDS);
        CommandResult second = connected.execute(search).get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertFalse(second.isFromCache());
        assertEquals(2, agent.commands.size());
    }

    @Test
    void shouldResolveRemoteFailureAsUnsuccessfulResult() throws Exception {
        WorkspaceChannelClient connected = connectedClient();

        CommandResult result = connected.execute(new FileReadCommand("missing.txt", "read missing.txt"))
                .get(WAIT_SECONDS, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals("File not found: missing.txt", result.getError());
        assertTrue(cache.get("workspace:ws-1:file:missing.txt").isEmpty());
    }

    @Test
    void shouldMatchOutOfOrderResponses() throws Exception {
        WorkspaceChannelClient connected = connectedClient();
        agent.holdResponses = true;

        CompletableFuture<CommandResult> first = connected.execute(new SearchCommand("one", null, "search one"));
        CompletableFuture<CommandResult> second = connected.execute(new SearchCommand("two", null, "search two"));
        agent.awaitCommands(2);
        agent.releaseHeldInReverseOrder();

        assertEquals("results for one", first.get(WAIT_SECONDS, TimeUnit.SECONDS).getData().asText());
        assertEquals("results for two", second.get(WAIT_SECONDS, TimeUnit.SECONDS).getData().asText());
    }

    @Test
    void shouldTimeOutAndIgnoreLateResponse() throws Exception {
        config.setCommandTimeout(200);
        WorkspaceChannelClient connected = connectedClient();
        agent.holdResponses = true;

        CompletableFuture<CommandResult> future = connected.execute(new StatusCommand("status"));
        Throwable error = failureOf(future);
        agent.releaseHeldInReverseOrder();
        Thread.sleep(100);

        WorkspaceChannelException channelError = assertInstanceOf(WorkspaceChannelException.class, error);
        assertEquals(ErrorCategory.TIMEOUT, channelError.getCategory());
        assertEquals("Command timeout after 200ms", channelError.getMessage());
        assertEquals(0, connected.getPendingRequestCount());
        assertEquals(ConnectionState.CONNECTED, connected.getState());
    }

    @Test
    void shouldRejectPendingOnDisconnect() throws Exception {
        WorkspaceChannelClient connected = connectedClient();
        agent.holdResponses = true;
        CompletableFuture<CommandResult> future = connected.execute(new StatusCommand("status"));
        agent.awaitCommands(1);

        connected.disconnect();

        assertTrue(future.isCompletedExceptionally());
        assertEquals(ErrorCategory.CONNECTION_LOST,
                ((WorkspaceChannelException) failureOf(future)).getCategory());
        assertEquals(ConnectionState.DISCONNECTED, connected.getState());
    }

    // ===== Connection loss =====

    @Test
    void shouldRejectPendingAndReconnectWhenAgentDrops() throws Exception {
        WorkspaceChannelClient connected = connectedClient();
        acceptConnection();
        agent.holdResponses = true;
        CompletableFuture<CommandResult> future = connected.execute(new StatusCommand("status"));
        agent.awaitCommands(1);

        agent.dropConnection();

        assertEquals(ErrorCategory.CONNECTION_LOST,
                ((WorkspaceChannelException) failureOf(future)).getCategory());
        verify(listener, timeout(WAIT_SECONDS * 1000)).onStateChange(eq(WORKSPACE), eq(ConnectionState.RECONNECTING),
                eq(ConnectionState.CONNECTED), isNull());
        assertEquals(2, server.getRequestCount());
    }

    @Test
    void shouldGiveUpAfterMaxReconnectAttempts() throws Exception {
        config.setMaxReconnectAttempts(0);
        WorkspaceChannelClient connected = connectedClient();

        agent.dropConnection();

        verify(listener, timeout(WAIT_SECONDS * 1000)).onStateChange(eq(WORKSPACE), eq(ConnectionState.CONNECTED),
                eq(ConnectionState.FAILED), anyString());
        assertEquals(ConnectionState.FAILED, connected.getState());
    }

    // ===== Events & liveness =====

    @Test
    void shouldForwardEvents() throws Exception {
        connectedClient();

        agent.sendEvent("BUILD_COMPLETE", "{\"success\":true,\"duration\":1200}");

        ArgumentCaptor<WorkspaceEvent> captor = ArgumentCaptor.forClass(WorkspaceEvent.class);
        verify(listener, timeout(WAIT_SECONDS * 1000)).onEvent(captor.capture());
        WorkspaceEvent event = captor.getValue();
        assertEquals(WORKSPACE, event.getWorkspaceId());
        assertEquals(WorkspaceEventType.BUILD_COMPLETE, event.getType());
        assertEquals(Boolean.TRUE, event.getPayload().get("success"));
        assertNotNull(event.getTimestamp());
    }

    @Test
    void shouldIgnoreEventsOfUnknownType() throws Exception {
        connectedClient();

        agent.sendEvent("DEPLOYED", "{}");
        agent.sendEvent("ERROR", "{\"message\":\"boom\"}");

        ArgumentCaptor<WorkspaceEvent> captor = ArgumentCaptor.forClass(WorkspaceEvent.class);
        verify(listener, timeout(WAIT_SECONDS * 1000)).onEvent(captor.capture());
        assertEquals(WorkspaceEventType.ERROR, captor.getValue().getType());
    }

    @Test
    void shouldSendPing() throws Exception {
        WorkspaceChannelClient connected = connectedClient();

        connected.ping();

        JsonNode ping = agent.nextMessage();
        while (ping != null && !"PING".equals(ping.path("type").asText())) {
            ping = agent.nextMessage();
        }
        assertNotNull(ping);
    }

    /**
     * Minimal workspace agent: authenticates with {@link #TOKEN}, answers
     * FILE_READ and SEARCH commands, and can hold responses back.
     */
    private final class FakeAgent extends WebSocketListener {

        private final List<JsonNode> received = new CopyOnWriteArrayList<>();
        private final List<JsonNode> commands = new CopyOnWriteArrayList<>();
        private final List<JsonNode> held = new CopyOnWriteArrayList<>();
        private final BlockingQueue<JsonNode> inbox = new LinkedBlockingQueue<>();
        private volatile WebSocket socket;
        private volatile boolean holdResponses;

        @Override
        public void onOpen(WebSocket webSocket, Response response) {
            socket = webSocket;
        }

        @Override
        public void onMessage(WebSocket webSocket, String text) {
            JsonNode message;
            try {
                message = objectMapper.readTree(text);
            } catch (IOException e) {
                throw new IllegalStateException(e);
            }
            received.add(message);
            inbox.add(message);
            String type = message.path("type").asText();
            if ("AUTH".equals(type)) {
                if (TOKEN.equals(message.path("payload").path("token").asText())) {
                    reply(webSocket, "AUTH_SUCCESS", "{\"connectionId\":\"conn-1\"}");
                } else {
                    reply(webSocket, "AUTH_FAILURE", "{\"error\":\"invalid token\"}");
                }
            } else if ("COMMAND".equals(type)) {
                commands.add(message);
                if (holdResponses) {
                    held.add(message);
                } else {
                    respond(webSocket, message);
                }
            }
        }

        private void respond(WebSocket webSocket, JsonNode message) {
            JsonNode payload = message.path("payload");
            JsonNode command = payload.path("command");
            ObjectNode response = objectMapper.createObjectNode();
            response.put("id", payload.path("id").asText());
            String path = command.path("path").asText();
            if (path.startsWith("missing")) {
                response.put("success", false);
                response.put("error", "File not found: " + path);
            } else if ("SEARCH".equals(command.path("type").asText())) {
                response.put("success", true);
                response.put("data", "results for " + command.path("query").asText());
            } else if ("FILE_READ".equals(command.path("type").asText())) {
                response.put("success", true);
                response.put("data", "content of " + path);
            } else {
                response.put("success", true);
                response.set("data", objectMapper.createObjectNode().put("branch", "main"));
            }
            reply(webSocket, "COMMAND_RESPONSE", response.toString());
        }

        private void reply(WebSocket webSocket, String type, String payloadJson) {
            webSocket.send("{\"type\":\"" + type + "\",\"payload\":" + payloadJson
                    + ",\"timestamp\":\"2026-01-01T00:00:00Z\"}");
        }

        void awaitCommands(int count) throws InterruptedException {
            long deadline = System.currentTimeMillis() + WAIT_SECONDS * 1000;
            while (commands.size() < count && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        }

        void releaseHeldInReverseOrder() {
            for (int i = held.size() - 1; i >= 0; i--) {
                respond(socket, held.get(i));
            }
            held.clear();
        }

        void sendEvent(String type, String payloadJson) {
            reply(socket, "EVENT", "{\"type\":\"" + type + "\",\"payload\":" + payloadJson + "}");
        }

        void dropConnection() {
            socket.close(1001, "going away");
        }

        JsonNode nextMessage() throws InterruptedException {
            return inbox.poll(WAIT_SECONDS, TimeUnit.SECONDS);
        }
    }
}
