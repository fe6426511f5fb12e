package com.demo.chatrelay.handler;

import com.demo.chatrelay.domain.MessageView;
import com.demo.chatrelay.infrastructure.ConnectionRegistry;
import com.demo.chatrelay.infrastructure.PresenceTracker;
import com.demo.chatrelay.infrastructure.PubSubBackbone;
import com.demo.chatrelay.service.ConversationService;
import com.demo.chatrelay.service.MessageService;
import com.demo.chatrelay.service.MetricsService;
import com.demo.chatrelay.service.UserService;
import com.demo.chatrelay.support.InMemoryPresenceStore;
import com.demo.chatrelay.support.InMemoryPubSubBackbone;
import com.demo.chatrelay.support.MutableClock;
import com.demo.chatrelay.support.TestSessions;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Protocol behaviour of the router over in-memory presence and backbone.
 * Several router instances may share one backbone to stand in for separate servers.
 */
class ChatEventRouterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private InMemoryPubSubBackbone backbone;
    private InMemoryPresenceStore presenceStore;
    private UserService userService;
    private MessageService messageService;
    private ConversationService conversationService;
    private MetricsService metricsService;

    @BeforeEach
    void setUp() {
        backbone = new InMemoryPubSubBackbone();
        presenceStore = new InMemoryPresenceStore();
        userService = mock(UserService.class);
        messageService = mock(MessageService.class);
        conversationService = mock(ConversationService.class);
        metricsService = new MetricsService();
        when(messageService.getConversationMessages(anyString())).thenReturn(List.of());
    }

    private ChatEventRouter newInstance() {
        ConnectionRegistry registry = new ConnectionRegistry(TestSessions.objectMapper(), clock, 10000, 512 * 1024);
        PresenceTracker presenceTracker = new PresenceTracker(presenceStore, backbone, clock);
        ChatEventRouter router = new ChatEventRouter(TestSessions.objectMapper(), registry, presenceTracker,
                backbone, new InboundEventValidator(), userService, messageService, conversationService,
                metricsService);
        router.start();
        return router;
    }

    private static MessageView message(String id, String content, String senderId, String conversationId) {
        return MessageView.builder()
                .id(id)
                .content(content)
                .senderId(senderId)
                .conversationId(conversationId)
                .createdAt(Instant.parse("2024-05-01T10:00:01Z"))
                .sender(MessageView.Sender.builder().id(senderId).username(senderId).build())
                .build();
    }

    private static String authenticate(String userId) {
        return "{\"type\":\"authenticate\",\"data\":{\"userId\":\"" + userId + "\",\"username\":\"" + userId + "\"}}";
    }

    private static String join(String conversationId) {
        return "{\"type\":\"join_conversation\",\"data\":\"" + conversationId + "\"}";
    }

    private static String send(String conversationId, String content) {
        return "{\"type\":\"send_message\",\"data\":{\"conversationId\":\"" + conversationId
                + "\",\"content\":\"" + content + "\"}}";
    }

    @Test
    void shouldAnswerAuthenticateWithOnlineUsersAndAnnouncePresence() throws Exception {
        // Given: A fresh connection
        ChatEventRouter router = newInstance();
        WebSocketSession session = TestSessions.open("ws-1");
        router.onConnect(session);

        // When: It authenticates
        router.onFrame("ws-1", authenticate("alice"));

        // Then: Presence is persisted and published, and the client gets the online list
        verify(userService).setUserOnline("alice");
        assertEquals(Set.of("alice"), presenceStore.members());
        assertEquals(1, backbone.publishedOn(PubSubBackbone.USER_ONLINE).size());

        List<JsonNode> onlineUsers = TestSessions.sentFrames(session, "online_users");
        assertEquals(1, onlineUsers.size());
        assertEquals("alice", onlineUsers.get(0).path("data").get(0).asText());
        assertEquals(1, TestSessions.sentFrames(session, "user_online").size(),
                "user_online comes back through the backbone");
    }

    @Test
    void shouldSendHistoryOnJoinAcceptingBareOrObjectPayload() throws Exception {
        ChatEventRouter router = newInstance();
        WebSocketSession session = TestSessions.open("ws-1");
        router.onConnect(session);
        router.onFrame("ws-1", authenticate("alice"));
        when(messageService.getConversationMessages("c1"))
                .thenReturn(List.of(message("m1", "old", "bob", "c1")));

        router.onFrame("ws-1", join("c1"));
        router.onFrame("ws-1", "{\"type\":\"join_conversation\",\"data\":{\"conversationId\":\"c2\"}}");

        List<JsonNode> history = TestSessions.sentFrames(session, "message_history");
        assertEquals(2, history.size());
        assertEquals("c1", history.get(0).path("data").path("conversationId").asText());
        assertEquals("m1", history.get(0).path("data").path("messages").get(0).path("id").asText());
        assertEquals("c2", history.get(1).path("data").path("conversationId").asText());
    }

    @Test
    void shouldDeliverExactlyOneNewMessageToEachRoomMemberIncludingSender() throws Exception {
        // Given: Two users on one instance in the same conversation
        ChatEventRouter router = newInstance();
        WebSocketSession alice = TestSessions.open("ws-a");
        WebSocketSession bob = TestSessions.open("ws-b");
        router.onConnect(alice);
        router.onConnect(bob);
        router.onFrame("ws-a", authenticate("alice"));
        router.onFrame("ws-b", authenticate("bob"));
        router.onFrame("ws-a", join("c1"));
        router.onFrame("ws-b", join("c1"));
        when(messageService.createMessage("hello", "bob", "c1")).thenReturn(message("m1", "hello", "bob", "c1"));

        // When: Bob sends a message
        router.onFrame("ws-b", send("c1", "hello"));

        // Then: Both receive it once, sender included
        List<JsonNode> toAlice = TestSessions.sentFrames(alice, "new_message");
        List<JsonNode> toBob = TestSessions.sentFrames(bob, "new_message");
        assertEquals(1, toAlice.size());
        assertEquals(1, toBob.size());
        assertEquals("hello", toAlice.get(0).path("data").path("content").asText());
        assertEquals("m1", toBob.get(0).path("data").path("id").asText());
    }

    @Test
    void shouldNotDeliverToConnectionThatLeftTheRoom() throws Exception {
        ChatEventRouter router = newInstance();
        WebSocketSession alice = TestSessions.open("ws-a");
        WebSocketSession bob = TestSessions.open("ws-b");
        router.onConnect(alice);
        router.onConnect(bob);
        router.onFrame("ws-a", authenticate("alice"));
        router.onFrame("ws-b", authenticate("bob"));
        router.onFrame("ws-a", join("c1"));
        router.onFrame("ws-b", join("c1"));
        when(messageService.createMessage("bye", "bob", "c1")).thenReturn(message("m2", "bye", "bob", "c1"));

        router.onFrame("ws-a", "{\"type\":\"leave_conversation\",\"data\":\"c1\"}");
        router.onFrame("ws-b", send("c1", "bye"));

        assertTrue(TestSessions.sentFrames(alice, "new_message").isEmpty());
        assertEquals(1, TestSessions.sentFrames(bob, "new_message").size());
    }

    @Test
    void shouldRelayTypingToOtherLocalMembersOnly() throws Exception {
        ChatEventRouter router = newInstance();
        WebSocketSession alice = TestSessions.open("ws-a");
        WebSocketSession bob = TestSessions.open("ws-b");
        router.onConnect(alice);
        router.onConnect(bob);
        router.onFrame("ws-a", authenticate("alice"));
        router.onFrame("ws-b", authenticate("bob"));
        router.onFrame("ws-a", join("c1"));
        router.onFrame("ws-b", join("c1"));

        router.onFrame("ws-a", "{\"type\":\"typing\",\"data\":{\"conversationId\":\"c1\",\"isTyping\":true}}");

        assertTrue(TestSessions.sentFrames(alice, "user_typing").isEmpty());
        List<JsonNode> typing = TestSessions.sentFrames(bob, "user_typing");
        assertEquals(1, typing.size());
        assertEquals("alice", typing.get(0).path("data").path("userId").asText());
        assertTrue(typing.get(0).path("data").path("isTyping").asBoolean());
        assertTrue(backbone.publishedOn(PubSubBackbone.TYPING).isEmpty());
    }

    @Test
    void shouldDropIdentityEventsWhileUnauthenticated() throws Exception {
        // Given: A connection that never authenticated
        ChatEventRouter router = newInstance();
        WebSocketSession session = TestSessions.open("ws-1");
        router.onConnect(session);

        // When: It tries identity-requiring events
        router.onFrame("ws-1", join("c1"));
        router.onFrame("ws-1", send("c1", "hi"));
        router.onFrame("ws-1", "{\"type\":\"typing\",\"data\":{\"conversationId\":\"c1\",\"isTyping\":true}}");
        router.onFrame("ws-1", "{\"type\":\"start_direct\",\"data\":\"bob\"}");

        // Then: Nothing happens and nothing is sent back
        verifyNoInteractions(messageService, conversationService);
        assertTrue(backbone.publishedOn(PubSubBackbone.NEW_MESSAGE).isEmpty());
        assertTrue(TestSessions.sentFrames(session).isEmpty());
        assertEquals(4, metricsService.getCounterValue("websocket.events.dropped"));
    }

    @Test
    void shouldDropMalformedAndUnknownFramesAndKeepServing() throws Exception {
        ChatEventRouter router = newInstance();
        WebSocketSession session = TestSessions.open("ws-1");
        router.onConnect(session);

        router.onFrame("ws-1", "not json");
        router.onFrame("ws-1", "{\"type\":\"explode\"}");
        router.onFrame("ws-1", "{\"type\":\"new_message\",\"data\":{}}");
        router.onFrame("ws-1", "{\"type\":\"send_message\",\"data\":{\"conversationId\":\"c1\",\"content\":\"   \"}}");
        router.onFrame("ws-1", "{\"type\":\"heartbeat\"}");

        List<JsonNode> frames = TestSessions.sentFrames(session);
        assertEquals(1, frames.size(), "Only the heartbeat should be answered");
        assertEquals("heartbeat_ack", frames.get(0).path("type").asText());
    }

    @Test
    void shouldKeepFirstIdentityWhenAuthenticatingTwice() throws Exception {
        ChatEventRouter router = newInstance();
        router.onConnect(TestSessions.open("ws-1"));

        router.onFrame("ws-1", authenticate("alice"));
        router.onFrame("ws-1", authenticate("mallory"));

        verify(userService, never()).setUserOnline("mallory");
        assertEquals(Set.of("alice"), presenceStore.members());
    }

    @Test
    void shouldNotRepeatPresenceSideEffectsWhenReauthenticatingSameIdentity() throws Exception {
        ChatEventRouter router = newInstance();
        WebSocketSession session = TestSessions.open("ws-1");
        router.onConnect(session);

        router.onFrame("ws-1", authenticate("alice"));
        router.onFrame("ws-1", authenticate("alice"));

        verify(userService, times(1)).setUserOnline("alice");
        assertEquals(1, backbone.publishedOn(PubSubBackbone.USER_ONLINE).size());
        assertEquals(2, TestSessions.sentFrames(session, "online_users").size(),
                "Each authenticate is still answered with the online list");
    }

    @Test
    void shouldNotLeaveUserOnlineWhenConnectionClosesDuringAuthentication() throws Exception {
        // Given: Persisting alice's online flag blocks until released
        ChatEventRouter router = newInstance();
        WebSocketSession session = TestSessions.open("ws-1");
        router.onConnect(session);
        CountDownLatch persisting = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        doAnswer(invocation -> {
            persisting.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return null;
        }).when(userService).setUserOnline("alice");

        ExecutorService authenticator = Executors.newSingleThreadExecutor();
        try {
            Future<?> authenticating = authenticator.submit(() -> router.onFrame("ws-1", authenticate("alice")));
            assertTrue(persisting.await(5, TimeUnit.SECONDS));

            // When: The socket closes while authentication is still in flight
            router.onDisconnect("ws-1");
            release.countDown();
            authenticating.get(5, TimeUnit.SECONDS);
        } finally {
            authenticator.shutdownNow();
        }

        // Then: Alice ends offline everywhere and the last presence event is user_offline
        assertTrue(presenceStore.members().isEmpty(), "No connection is left, so nobody may be online");
        List<String> channels = backbone.channels();
        assertEquals(PubSubBackbone.USER_OFFLINE, channels.get(channels.size() - 1));
        InOrder order = inOrder(userService);
        order.verify(userService).setUserOnline("alice");
        order.verify(userService, atLeastOnce()).setUserOffline("alice");
        assertTrue(TestSessions.sentFrames(session, "online_users").isEmpty());
    }

    @Test
    void shouldAnswerPingWithPong() throws Exception {
        ChatEventRouter router = newInstance();
        WebSocketSession session = TestSessions.open("ws-1");
        router.onConnect(session);

        router.onFrame("ws-1", "{\"type\":\"ping\"}");

        assertEquals(1, TestSessions.sentFrames(session, "pong").size());
    }

    @Test
    void shouldMarkOfflineExactlyOnceOnDisconnect() throws Exception {
        // Given: Alice and Bob online on one instance
        ChatEventRouter router = newInstance();
        WebSocketSession bob = TestSessions.open("ws-b");
        router.onConnect(TestSessions.open("ws-a"));
        router.onConnect(bob);
        router.onFrame("ws-a", authenticate("alice"));
        router.onFrame("ws-b", authenticate("bob"));

        // When: Alice's connection closes, and the close is reported twice
        router.onDisconnect("ws-a");
        router.onDisconnect("ws-a");

        // Then: Alice leaves the online set with a single user_offline
        assertEquals(Set.of("bob"), presenceStore.members());
        verify(userService, times(1)).setUserOffline("alice");
        assertEquals(1, backbone.publishedOn(PubSubBackbone.USER_OFFLINE).size());
        List<JsonNode> offline = TestSessions.sentFrames(bob, "user_offline");
        assertEquals(1, offline.size());
        assertEquals("alice", offline.get(0).path("data").path("userId").asText());
    }

    @Test
    void shouldStillMarkOfflineWhenPersistenceFails() {
        ChatEventRouter router = newInstance();
        router.onConnect(TestSessions.open("ws-a"));
        router.onFrame("ws-a", authenticate("alice"));
        doThrow(new IllegalStateException("db down")).when(userService).setUserOffline("alice");

        router.onDisconnect("ws-a");

        assertTrue(presenceStore.members().isEmpty());
        assertEquals(1, backbone.publishedOn(PubSubBackbone.USER_OFFLINE).size());
    }

    @Test
    void shouldNotPublishWhenMessagePersistenceFails() throws Exception {
        ChatEventRouter router = newInstance();
        WebSocketSession session = TestSessions.open("ws-a");
        router.onConnect(session);
        router.onFrame("ws-a", authenticate("alice"));
        router.onFrame("ws-a", join("c1"));
        when(messageService.createMessage(anyString(), anyString(), anyString()))
                .thenThrow(new IllegalStateException("db down"));

        router.onFrame("ws-a", send("c1", "lost"));

        assertTrue(backbone.publishedOn(PubSubBackbone.NEW_MESSAGE).isEmpty());
        assertTrue(TestSessions.sentFrames(session, "new_message").isEmpty());
        assertEquals(1, metricsService.getCounterValue("errors"));

        // Connection keeps working
        router.onFrame("ws-a", "{\"type\":\"heartbeat\"}");
        assertEquals(1, TestSessions.sentFrames(session, "heartbeat_ack").size());
    }

    @Test
    void shouldRelayDirectConversationAcrossInstances() throws Exception {
        // Given: Alice on one server, Bob on another, sharing a backbone
        ChatEventRouter serverA = newInstance();
        ChatEventRouter serverB = newInstance();
        WebSocketSession alice = TestSessions.open("ws-a");
        WebSocketSession bob = TestSessions.open("ws-b");
        serverA.onConnect(alice);
        serverB.onConnect(bob);
        serverA.onFrame("ws-a", authenticate("alice"));
        serverB.onFrame("ws-b", authenticate("bob"));

        // Then: Each sees the other come online, and both are in the shared set
        assertEquals(Set.of("alice", "bob"), presenceStore.members());
        assertEquals(2, TestSessions.sentFrames(alice, "user_online").size());

        // When: Alice starts a direct conversation with Bob and both join it
        when(conversationService.getOrCreateDirectConversation("alice", "bob")).thenReturn("d1");
        serverA.onFrame("ws-a", "{\"type\":\"start_direct\",\"data\":{\"targetUserId\":\"bob\"}}");
        List<JsonNode> started = TestSessions.sentFrames(alice, "conversation_started");
        assertEquals(1, started.size());
        assertEquals("d1", started.get(0).path("data").path("conversationId").asText());

        serverA.onFrame("ws-a", join("d1"));
        serverB.onFrame("ws-b", join("d1"));
        when(messageService.createMessage("hi bob", "alice", "d1")).thenReturn(message("m1", "hi bob", "alice", "d1"));
        serverA.onFrame("ws-a", send("d1", "hi bob"));

        // Then: Both sides receive exactly one copy
        List<JsonNode> toBob = TestSessions.sentFrames(bob, "new_message");
        assertEquals(1, toBob.size());
        assertEquals("hi bob", toBob.get(0).path("data").path("content").asText());
        assertEquals(1, TestSessions.sentFrames(alice, "new_message").size());

        // When: Bob disconnects
        serverB.onDisconnect("ws-b");

        // Then: Alice is told once, on the other server
        List<JsonNode> offline = TestSessions.sentFrames(alice, "user_offline");
        assertEquals(1, offline.size());
        assertEquals("bob", offline.get(0).path("data").path("userId").asText());
        assertEquals(Set.of("alice"), presenceStore.members());
    }

    @Test
    void shouldIgnoreFramesFromUnknownConnections() {
        ChatEventRouter router = newInstance();

        router.onFrame("ghost", authenticate("alice"));

        verify(userService, never()).setUserOnline(any());
    }
}
