package com.tablewrite.bridge;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tablewrite.bridge.protocol.BridgeProtocol;
import com.tablewrite.bridge.protocol.BridgeProtocol.BridgeMessage;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class BridgeDispatcherTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String[]> unsolicited = new CopyOnWriteArrayList<>();
    private ConnectionRegistry registry;
    private PendingCallTable table;
    private BridgeDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry();
        table = new PendingCallTable();
        var options = new DispatcherOptions(Duration.ofSeconds(5), Duration.ofMinutes(1), Duration.ofMinutes(1));
        dispatcher = new BridgeDispatcher(registry, table, mapper, options,
                (conn, message, endedCommand) -> unsolicited.add(
                        new String[] { conn, message.getType(), message.getRequestId(), endedCommand }),
                Runnable::run);
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private static String requestIdOf(RecordingConnection connection, String command) {
        BridgeMessage sent = connection.lastOfType(command);
        assertNotNull(sent, "expected " + command + " to be sent");
        return sent.getRequestId();
    }

    private static CallOutcome await(CompletableFuture<CallOutcome> future) throws Exception {
        return future.get(2, TimeUnit.SECONDS);
    }

    // --- Connection lifecycle ---

    @Test
    void attach_registersAndGreetsWithClientId() {
        var connection = new RecordingConnection();
        String clientId = dispatcher.attach(connection);

        assertEquals(1, dispatcher.connectionCount());
        BridgeMessage greeting = connection.lastOfType(BridgeProtocol.TYPE_CONNECTED);
        assertNotNull(greeting);
        assertEquals(clientId, greeting.getClientId());
    }

    // --- No connection ---

    @Test
    void call_emptyRegistry_returnsNoConnectionWithoutWaiting() throws Exception {
        long started = System.nanoTime();
        CompletableFuture<CallOutcome> future = dispatcher.call("list_actors", null, Duration.ofSeconds(10));

        assertTrue(future.isDone());
        assertEquals(CallOutcome.Status.NO_CONNECTION, await(future).status());
        assertEquals(0, dispatcher.pendingCount());
        assertTrue(System.nanoTime() - started < TimeUnit.SECONDS.toNanos(1));
    }

    @Test
    void callClient_unknownClient_returnsNoConnection() throws Exception {
        dispatcher.attach(new RecordingConnection());

        CallOutcome outcome = await(dispatcher.callClient("not-registered", "get_actor", null, null));

        assertEquals(CallOutcome.Status.NO_CONNECTION, outcome.status());
        assertEquals(0, dispatcher.pendingCount());
    }

    // --- Replies ---

    @Test
    void call_fansOutWithOneRequestId_andReplyResolves() throws Exception {
        var first = new RecordingConnection();
        var second = new RecordingConnection();
        String firstId = dispatcher.attach(first);
        dispatcher.attach(second);

        CompletableFuture<CallOutcome> future = dispatcher.call("actor", Map.of("name", "Goblin"));
        String requestId = requestIdOf(first, "actor");
        assertEquals(requestId, requestIdOf(second, "actor"));
        assertEquals("Goblin", first.lastOfType("actor").getData().get("name").asText());
        assertEquals(1, dispatcher.pendingCount());

        var data = mapper.createObjectNode().put("uuid", "Actor.abc123").put("name", "Goblin");
        dispatcher.handleInbound(firstId, BridgeMessage.reply("actor_created", data, requestId));

        CallOutcome outcome = await(future);
        assertTrue(outcome.isReplied());
        assertEquals("actor_created", outcome.reply().getType());
        assertEquals("Actor.abc123", outcome.reply().getData().get("uuid").asText());
        assertEquals(0, dispatcher.pendingCount());
    }

    @Test
    void duplicateReplies_firstWins_laterOnesDropped() throws Exception {
        var first = new RecordingConnection();
        var second = new RecordingConnection();
        String firstId = dispatcher.attach(first);
        String secondId = dispatcher.attach(second);

        CompletableFuture<CallOutcome> future = dispatcher.call("get_actor", Map.of("uuid", "Actor.x"));
        String requestId = requestIdOf(first, "get_actor");

        dispatcher.handleInbound(secondId, BridgeMessage.reply("actor_data",
                mapper.createObjectNode().put("from", "second"), requestId));
        dispatcher.handleInbound(firstId, BridgeMessage.reply("actor_data",
                mapper.createObjectNode().put("from", "first"), requestId));

        assertEquals("second", await(future).reply().getData().get("from").asText());
        assertEquals(1, unsolicited.size());
        assertEquals(firstId, unsolicited.get(0)[0]);
        assertEquals("get_actor", unsolicited.get(0)[3]);
    }

    @Test
    void concurrentCalls_resolveIndependently() throws Exception {
        var connection = new RecordingConnection();
        String clientId = dispatcher.attach(connection);

        CompletableFuture<CallOutcome> actors = dispatcher.call("list_actors", null);
        CompletableFuture<CallOutcome> scenes = dispatcher.call("list_scenes", null);
        String actorsId = requestIdOf(connection, "list_actors");
        String scenesId = requestIdOf(connection, "list_scenes");
        assertNotEquals(actorsId, scenesId);

        dispatcher.handleInbound(clientId, BridgeMessage.reply("scenes_list", null, scenesId));

        assertEquals("scenes_list", await(scenes).reply().getType());
        assertFalse(actors.isDone());
        assertTrue(table.contains(actorsId));

        dispatcher.handleInbound(clientId, BridgeMessage.reply("actors_list", null, actorsId));
        assertEquals("actors_list", await(actors).reply().getType());
    }

    @Test
    void unknownRequestId_goesToUnsolicitedHandler() {
        String clientId = dispatcher.attach(new RecordingConnection());

        dispatcher.handleInbound(clientId, BridgeMessage.reply("actor_data", null, "never-issued"));

        assertEquals(1, unsolicited.size());
        assertEquals("never-issued", unsolicited.get(0)[2]);
        assertNull(unsolicited.get(0)[3]);
    }

    @Test
    void replyWithoutType_stillResolvesItsCall() throws Exception {
        var connection = new RecordingConnection();
        String clientId = dispatcher.attach(connection);
        CompletableFuture<CallOutcome> future = dispatcher.call("actor", null, Duration.ofSeconds(30));
        String requestId = requestIdOf(connection, "actor");

        dispatcher.handleInbound(clientId, new BridgeMessage(null, null, requestId, "boom", null));

        assertTrue(future.isDone());
        CallOutcome outcome = await(future);
        assertEquals(CallOutcome.Status.REPLIED, outcome.status());
        assertNull(outcome.reply().getType());
        assertEquals("boom", outcome.reply().getError());
        assertEquals(0, dispatcher.pendingCount());
        assertTrue(unsolicited.isEmpty());
    }

    @Test
    void messageWithoutType_isDropped() {
        String clientId = dispatcher.attach(new RecordingConnection());

        dispatcher.handleInbound(clientId, new BridgeMessage());
        dispatcher.handleInbound(clientId, new BridgeMessage(null, null, "never-issued", "boom", null));
        dispatcher.handleInbound(clientId, null);

        assertTrue(unsolicited.isEmpty());
    }

    // --- Keep-alive ---

    @Test
    void ping_answeredWithPong_withoutTouchingPendingCalls() {
        var connection = new RecordingConnection();
        var other = new RecordingConnection();
        String clientId = dispatcher.attach(connection);
        dispatcher.attach(other);
        dispatcher.call("list_actors", null);
        int pendingBefore = dispatcher.pendingCount();

        var ping = new BridgeMessage(BridgeProtocol.TYPE_PING, null, null, null, null);
        dispatcher.handleInbound(clientId, ping);

        BridgeMessage pong = connection.lastOfType(BridgeProtocol.TYPE_PONG);
        assertNotNull(pong);
        assertNull(pong.getRequestId());
        assertEquals(0, other.countOfType(BridgeProtocol.TYPE_PONG));
        assertEquals(pendingBefore, dispatcher.pendingCount());
        assertTrue(unsolicited.isEmpty());
    }

    @Test
    void ping_carryingPendingRequestId_doesNotResolveIt() {
        var connection = new RecordingConnection();
        String clientId = dispatcher.attach(connection);
        CompletableFuture<CallOutcome> future = dispatcher.call("list_actors", null);
        String requestId = requestIdOf(connection, "list_actors");

        dispatcher.handleInbound(clientId, BridgeMessage.request(BridgeProtocol.TYPE_PING, null, requestId));

        assertFalse(future.isDone());
        assertTrue(table.contains(requestId));
    }

    // --- Timeouts and cancellation ---

    @Test
    void timeout_removesEntry_andLateReplyHasNoEffect() throws Exception {
        var connection = new RecordingConnection();
        String clientId = dispatcher.attach(connection);

        long started = System.nanoTime();
        CompletableFuture<CallOutcome> future = dispatcher.call("list_actors", null, Duration.ofMillis(50));
        String requestId = requestIdOf(connection, "list_actors");

        CallOutcome outcome = await(future);
        assertEquals(CallOutcome.Status.TIMED_OUT, outcome.status());
        assertTrue(System.nanoTime() - started >= TimeUnit.MILLISECONDS.toNanos(50));
        assertFalse(table.contains(requestId));

        assertDoesNotThrow(() -> dispatcher.handleInbound(clientId,
                BridgeMessage.reply("actors_list", null, requestId)));
        assertEquals(CallOutcome.Status.TIMED_OUT, future.get().status());
        assertEquals(1, unsolicited.size());
        assertEquals("list_actors", unsolicited.get(0)[3]);
    }

    @Test
    void hugeTimeout_saturatesAndKeepsWaiting() {
        dispatcher.attach(new RecordingConnection());

        CompletableFuture<CallOutcome> forever = dispatcher.call("list_actors", null, Duration.ofSeconds(Long.MAX_VALUE));
        CompletableFuture<CallOutcome> longWait = dispatcher.call("list_actors", null, Duration.ofDays(365L * 300_000_000L));

        assertEquals(0, dispatcher.sweep());
        assertFalse(forever.isDone());
        assertFalse(longWait.isDone());
        assertEquals(2, dispatcher.pendingCount());
    }

    @Test
    void callerCancellation_behavesLikeTimeout() {
        var connection = new RecordingConnection();
        String clientId = dispatcher.attach(connection);
        CompletableFuture<CallOutcome> future = dispatcher.call("list_scenes", null);
        String requestId = requestIdOf(connection, "list_scenes");

        assertTrue(future.cancel(true));

        assertFalse(table.contains(requestId));
        dispatcher.handleInbound(clientId, BridgeMessage.reply("scenes_list", null, requestId));
        assertThrows(CancellationException.class, future::join);
        assertEquals("list_scenes", unsolicited.get(0)[3]);
    }

    @Test
    void cancel_byRequestId_reportsCancelled() throws Exception {
        var connection = new RecordingConnection();
        dispatcher.attach(connection);
        CompletableFuture<CallOutcome> future = dispatcher.call("list_scenes", null);
        String requestId = requestIdOf(connection, "list_scenes");

        assertTrue(dispatcher.cancel(requestId));
        assertFalse(dispatcher.cancel(requestId));
        assertEquals(CallOutcome.Status.CANCELLED, await(future).status());
    }

    // --- Send failures and disconnects ---

    @Test
    void sendFailure_dropsThatConnection_butCallStillResolves() throws Exception {
        var broken = new RecordingConnection();
        broken.failSends = true;
        var healthy = new RecordingConnection();
        dispatcher.attach(healthy);
        String healthyId = registry.ids().get(0);
        registry.register(broken);

        CompletableFuture<CallOutcome> future = dispatcher.call("list_journals", null);

        assertEquals(1, dispatcher.connectionCount());
        assertTrue(broken.closed);
        String requestId = requestIdOf(healthy, "list_journals");
        dispatcher.handleInbound(healthyId, BridgeMessage.reply("journals_list", null, requestId));
        assertTrue(await(future).isReplied());
    }

    @Test
    void allSendsFail_resolvesAsNoConnection() throws Exception {
        var broken = new RecordingConnection();
        broken.failSends = true;
        registry.register(broken);

        CallOutcome outcome = await(dispatcher.call("list_journals", null));

        assertEquals(CallOutcome.Status.NO_CONNECTION, outcome.status());
        assertEquals(0, dispatcher.connectionCount());
        assertEquals(0, dispatcher.pendingCount());
    }

    @Test
    void detach_failsTargetedCalls_butFanOutKeepsWaiting() throws Exception {
        var leaving = new RecordingConnection();
        var staying = new RecordingConnection();
        String leavingId = dispatcher.attach(leaving);
        String stayingId = dispatcher.attach(staying);

        CompletableFuture<CallOutcome> targeted = dispatcher.callClient(leavingId, "get_scene", null, null);
        CompletableFuture<CallOutcome> fanOut = dispatcher.call("list_scenes", null);
        assertEquals(0, staying.countOfType("get_scene"));

        dispatcher.detach(leavingId);
        dispatcher.detach(leavingId);

        assertEquals(CallOutcome.Status.CONNECTION_LOST, await(targeted).status());
        assertFalse(fanOut.isDone());
        dispatcher.handleInbound(stayingId,
                BridgeMessage.reply("scenes_list", null, requestIdOf(staying, "list_scenes")));
        assertTrue(await(fanOut).isReplied());
    }

    // --- Shutdown ---

    @Test
    void close_cancelsPendingCalls() throws Exception {
        dispatcher.attach(new RecordingConnection());
        CompletableFuture<CallOutcome> future = dispatcher.call("list_actors", null);

        dispatcher.close();

        assertEquals(CallOutcome.Status.CANCELLED, await(future).status());
        assertEquals(0, dispatcher.pendingCount());
    }

    @Test
    void call_afterClose_endsCancelledWithoutWaiter() throws Exception {
        var connection = new RecordingConnection();
        dispatcher.attach(connection);
        dispatcher.close();

        CompletableFuture<CallOutcome> future = dispatcher.call("list_actors", null);

        assertTrue(future.isDone());
        assertEquals(CallOutcome.Status.CANCELLED, await(future).status());
        assertEquals(0, dispatcher.pendingCount());
        assertEquals(0, connection.countOfType("list_actors"));
    }

    @Test
    void call_requiresCommand() {
        assertThrows(IllegalArgumentException.class, () -> dispatcher.call("", null));
        assertThrows(IllegalArgumentException.class, () -> dispatcher.callClient(null, "get_actor", null, null));
    }
}
