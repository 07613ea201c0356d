package edu.northeastern.hanafeng.matrixreloaded.user;

import edu.northeastern.hanafeng.matrixreloaded.client.ChatClient;
import edu.northeastern.hanafeng.matrixreloaded.client.ChatClientException;
import edu.northeastern.hanafeng.matrixreloaded.client.LoginStatus;
import edu.northeastern.hanafeng.matrixreloaded.client.RegistrationStatus;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncEvent;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncHandle;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncListener;
import edu.northeastern.hanafeng.matrixreloaded.client.SyncResult;
import edu.northeastern.hanafeng.matrixreloaded.metrics.Event;
import edu.northeastern.hanafeng.matrixreloaded.metrics.EventChannel;
import edu.northeastern.hanafeng.matrixreloaded.metrics.UserRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class UserTest {

    private static final String USER_ID = "@user_0_1:hs";
    private static final String LOCALPART = "user_0_1";

    @Mock
    private ChatClient client;

    private EventChannel events;
    private SyncHandle syncHandle;

    @BeforeEach
    void setUp() {
        events = new EventChannel(1000);
        syncHandle = new SyncHandle();
        lenient().when(client.userId()).thenReturn(USER_ID);
    }

    @Test
    void testRegister_Registered_MovesToUnauthenticated() throws Exception {
        // Given
        User user = newUser(0.99);
        when(client.register(LOCALPART)).thenReturn(RegistrationStatus.REGISTERED);

        // When
        user.act(PeerDirectory.NONE);

        // Then
        assertInstanceOf(UserState.Unauthenticated.class, user.getState());
        Event.RequestDuration duration = assertInstanceOf(Event.RequestDuration.class, events.receive());
        assertEquals(UserRequest.REGISTER, duration.request());
    }

    @Test
    void testRegister_AlreadyExists_MovesToUnauthenticated() throws Exception {
        // Given
        User user = newUser(0.99);
        when(client.register(LOCALPART)).thenReturn(RegistrationStatus.ALREADY_EXISTS);

        // When
        user.act(PeerDirectory.NONE);

        // Then
        assertInstanceOf(UserState.Unauthenticated.class, user.getState());
    }

    @Test
    void testRegister_Failure_KeepsStateAndReportsError() throws Exception {
        // Given
        User user = newUser(0.99);
        UserState before = user.getState();
        when(client.register(LOCALPART)).thenThrow(new ChatClientException("M_UNKNOWN"));

        // When
        user.act(PeerDirectory.NONE);

        // Then
        assertSame(before, user.getState());
        Event.RequestError error = assertInstanceOf(Event.RequestError.class, events.receive());
        assertEquals(UserRequest.REGISTER, error.request());
        assertEquals("M_UNKNOWN", error.cause().getMessage());
    }

    @Test
    void testLogin_NotRegistered_GoesBackToUnregistered() throws Exception {
        // Given
        User user = newUser(0.99);
        when(client.register(LOCALPART)).thenReturn(RegistrationStatus.REGISTERED);
        when(client.login(LOCALPART)).thenReturn(LoginStatus.NOT_REGISTERED);
        user.act(PeerDirectory.NONE);

        // When
        user.act(PeerDirectory.NONE);

        // Then
        assertInstanceOf(UserState.Unregistered.class, user.getState());
    }

    @Test
    void testLogin_Interrupted_KeepsState() throws Exception {
        // Given
        User user = newUser(0.99);
        when(client.register(LOCALPART)).thenReturn(RegistrationStatus.REGISTERED);
        when(client.login(LOCALPART)).thenThrow(new InterruptedException("tick over"));
        user.act(PeerDirectory.NONE);
        UserState before = user.getState();

        // When/Then
        assertThrows(InterruptedException.class, () -> user.act(PeerDirectory.NONE));
        assertSame(before, user.getState());
    }

    @Test
    void testSync_PendingInvitesBecomeEvents() throws Exception {
        // Given
        User user = newUser(0.99);
        stubUntilSync(List.of("!joined:hs"), List.of("!invited:hs"));

        // When
        actTimes(user, 3);

        // Then
        UserState.Syncing syncing = assertInstanceOf(UserState.Syncing.class, user.getState());
        assertEquals(List.of("!joined:hs"), syncing.rooms().snapshot());
        assertEquals(1, syncing.pendingEvents().size());
        assertEquals(new SyncEvent.Invite("!invited:hs"), syncing.pendingEvents().peekLast());
    }

    @Test
    void testSocialize_ReactsToNewestEventFirst() throws Exception {
        // Given
        User user = newUser(0.99);
        stubUntilSync(List.of(), List.of());
        actTimes(user, 3);
        when(client.readSyncEvents()).thenReturn(List.of(
                new SyncEvent.Invite("!older:hs"),
                new SyncEvent.Message("!newer:hs", "$1", "@other:hs", "hi")));
        when(client.sendMessage(eq("!newer:hs"), anyString())).thenReturn("$2");

        // When
        user.act(PeerDirectory.NONE);

        // Then
        verify(client).sendMessage(eq("!newer:hs"), anyString());
        verify(client, never()).joinRoom(any());
        UserState.Syncing syncing = (UserState.Syncing) user.getState();
        assertEquals(List.of(new SyncEvent.Invite("!older:hs")), new ArrayList<>(syncing.pendingEvents()));

        // When the next action handles the older invite
        when(client.readSyncEvents()).thenReturn(List.of());
        user.act(PeerDirectory.NONE);

        // Then
        verify(client).joinRoom("!older:hs");
        assertTrue(syncing.pendingEvents().isEmpty());
        assertTrue(user.knownRooms().contains("!older:hs"));
    }

    @Test
    void testSocialize_RoomCreatedAndKnownInvitesAreAbsorbed() throws Exception {
        // Given
        User user = newUser(0.99);
        stubUntilSync(List.of("!known:hs"), List.of());
        actTimes(user, 3);
        when(client.readSyncEvents()).thenReturn(List.of(
                new SyncEvent.RoomCreated("!mine:hs"),
                new SyncEvent.Invite("!known:hs")));
        when(client.sendMessage(anyString(), anyString())).thenReturn("$1");

        // When
        user.act(PeerDirectory.NONE);

        // Then
        verify(client, never()).joinRoom(any());
        assertTrue(user.knownRooms().contains("!mine:hs"));
        assertTrue(((UserState.Syncing) user.getState()).pendingEvents().isEmpty());
    }

    @Test
    void testSocialize_SendMessage_ReportsMessageSent() throws Exception {
        // Given
        User user = newUser(0.99);
        stubUntilSync(List.of("!room:hs"), List.of());
        actTimes(user, 3);
        drain();
        when(client.readSyncEvents()).thenReturn(List.of());
        when(client.sendMessage(eq("!room:hs"), anyString())).thenReturn("$event");

        // When
        user.act(PeerDirectory.NONE);

        // Then
        Event.RequestDuration duration = assertInstanceOf(Event.RequestDuration.class, events.receive());
        assertEquals(UserRequest.SEND_MESSAGE, duration.request());
        assertEquals(new Event.MessageSent("$event"), events.receive());
    }

    @Test
    void testSocialize_SendMessageWithoutRooms_DoesNothing() throws Exception {
        // Given
        User user = newUser(0.99);
        stubUntilSync(List.of(), List.of());
        actTimes(user, 3);
        when(client.readSyncEvents()).thenReturn(List.of());

        // When
        user.act(PeerDirectory.NONE);

        // Then
        verify(client, never()).sendMessage(any(), any());
        assertInstanceOf(UserState.Syncing.class, user.getState());
    }

    @Test
    void testSocialize_LogOut_StopsSync() throws Exception {
        // Given
        User user = newUser(0.0);
        stubUntilSync(List.of(), List.of());
        actTimes(user, 3);
        when(client.readSyncEvents()).thenReturn(List.of());

        // When
        user.act(PeerDirectory.NONE);

        // Then
        verify(client).logout();
        assertTrue(syncHandle.isStopRequested());
        assertInstanceOf(UserState.LoggedOut.class, user.getState());
    }

    @Test
    void testSocialize_UpdateStatus() throws Exception {
        // Given
        User user = newUser(0.03);
        stubUntilSync(List.of(), List.of());
        actTimes(user, 3);
        when(client.readSyncEvents()).thenReturn(List.of());

        // When
        user.act(PeerDirectory.NONE);

        // Then
        verify(client).updateStatus(anyString());
        assertInstanceOf(UserState.Syncing.class, user.getState());
    }

    @Test
    void testSocialize_AddFriend_RemembersRoom() throws Exception {
        // Given
        double[] draws = {0.5, 0.5, 0.1};
        int[] next = {0};
        User user = new User(LOCALPART, client, events, new SocialActionPicker(() -> draws[next[0]++ % draws.length]));
        stubUntilSync(List.of(), List.of());
        actTimes(user, 3);
        when(client.readSyncEvents()).thenReturn(List.of());
        when(client.addFriend("@friend:hs")).thenReturn("!dm:hs");

        // When
        user.act(userId -> Optional.of("@friend:hs"));

        // Then
        assertEquals(List.of("!dm:hs"), user.knownRooms());
    }

    @Test
    void testSocialize_StopRequested_MovesToLoggedOut() throws Exception {
        // Given
        User user = newUser(0.99);
        stubUntilSync(List.of(), List.of());
        actTimes(user, 3);

        // When
        user.stopSync();
        user.act(PeerDirectory.NONE);

        // Then
        assertInstanceOf(UserState.LoggedOut.class, user.getState());
        verify(client, never()).readSyncEvents();
    }

    @Test
    void testLoggedOut_ResetsAndLogsInAgain() throws Exception {
        // Given
        User user = newUser(0.99);
        stubUntilSync(List.of(), List.of());
        actTimes(user, 3);
        user.stopSync();
        user.act(PeerDirectory.NONE);

        // When
        user.act(PeerDirectory.NONE);

        // Then
        verify(client).reset();
        assertInstanceOf(UserState.Unauthenticated.class, user.getState());
    }

    @Test
    void testSyncListener_CountsMessagesFromOthersOnly() throws Exception {
        // Given
        User user = newUser(0.99);
        stubUntilSync(List.of(), List.of());
        actTimes(user, 3);
        ArgumentCaptor<SyncListener> listener = ArgumentCaptor.forClass(SyncListener.class);
        verify(client).sync(listener.capture());
        drain();

        // When
        listener.getValue().onMessage(new SyncEvent.Message("!r:hs", "$own", USER_ID, "hi"));
        listener.getValue().onMessage(new SyncEvent.Message("!r:hs", "$other", "@other:hs", "hi"));

        // Then
        assertEquals(1, events.size());
        assertEquals(new Event.MessageReceived("$other"), events.receive());
    }

    @Test
    void testAct_ConcurrentCallIsSkipped() throws Exception {
        // Given
        User user = newUser(0.99);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(client.register(LOCALPART)).thenAnswer(invocation -> {
            entered.countDown();
            release.await();
            return RegistrationStatus.REGISTERED;
        });
        Thread first = new Thread(() -> {
            try {
                user.act(PeerDirectory.NONE);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        first.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        // When
        user.act(PeerDirectory.NONE);
        release.countDown();
        first.join(5000);

        // Then
        verify(client, times(1)).register(LOCALPART);
        assertInstanceOf(UserState.Unauthenticated.class, user.getState());
    }

    @Test
    void testCreateRoom_NotSyncing_Throws() throws Exception {
        // Given
        User user = newUser(0.99);

        // When/Then
        assertThrows(ChatClientException.class, () -> user.createRoom(List.of("@other:hs")));
        verify(client, never()).createRoom(any());
    }

    private User newUser(double draw) {
        return new User(LOCALPART, client, events, new SocialActionPicker(() -> draw));
    }

    private void stubUntilSync(List<String> joined, List<String> invited) throws Exception {
        when(client.register(LOCALPART)).thenReturn(RegistrationStatus.REGISTERED);
        when(client.login(LOCALPART)).thenReturn(LoginStatus.LOGGED_IN);
        when(client.sync(any())).thenReturn(new SyncResult(joined, invited, syncHandle));
    }

    private void actTimes(User user, int times) throws InterruptedException {
        for (int i = 0; i < times; i++) {
            user.act(PeerDirectory.NONE);
        }
    }

    private void drain() throws InterruptedException {
        while (events.size() > 0) {
            events.receive();
        }
    }
}
