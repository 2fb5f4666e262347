package com.demo.multisig.service.notification;

import com.demo.multisig.support.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private NotificationService service(List<SideChannelSender> senders, Executor executor, int capacity) {
        return new NotificationService(new NotificationHistory(50), senders, executor, objectMapper, clock, capacity);
    }

    private NotificationService service() {
        return service(List.of(), Runnable::run, 16);
    }

    private NotificationMessage message(String id, String... recipients) {
        return new NotificationMessage(id, NotificationType.SIGNATURE_ADDED, "Proposal Signed",
                "Proposal signed. 1 more signature(s) needed.",
                new NotificationPayload.SignatureAdded("p-1", "v1", 1, 2, 1),
                clock.instant(), Set.of(recipients));
    }

    @Test
    void everyConnectionOfARecipientReceivesTheEvent() {
        NotificationService notifications = service();
        FakeConnection phone = new FakeConnection("phone");
        FakeConnection laptop = new FakeConnection("laptop");
        FakeConnection other = new FakeConnection("other");
        notifications.subscribe("bob", phone);
        notifications.subscribe("bob", laptop);
        notifications.subscribe("carol", other);

        notifications.publish(message("n1", "bob"));

        assertThat(phone.frames).hasSize(1);
        assertThat(phone.frames.get(0)).contains("\"type\":\"notification\"", "\"id\":\"n1\"");
        assertThat(laptop.frames).hasSize(1);
        assertThat(other.frames).isEmpty();
    }

    @Test
    void unsubscribingOneDeviceKeepsTheOthers() {
        NotificationService notifications = service();
        FakeConnection phone = new FakeConnection("phone");
        FakeConnection laptop = new FakeConnection("laptop");
        notifications.subscribe("bob", phone);
        notifications.subscribe("bob", laptop);

        notifications.unsubscribe("bob", "phone");
        notifications.publish(message("n1", "bob"));

        assertThat(phone.frames).isEmpty();
        assertThat(laptop.frames).hasSize(1);
        assertThat(notifications.connectionsOf("bob")).extracting(OutboundChannel::id).containsExactly("laptop");
    }

    @Test
    void failedConnectionIsClosedAndForgotten() {
        NotificationService notifications = service();
        FakeConnection broken = new FakeConnection("broken");
        broken.failOnSend = true;
        FakeConnection healthy = new FakeConnection("healthy");
        notifications.subscribe("bob", broken);
        notifications.subscribe("bob", healthy);

        notifications.publish(message("n1", "bob"));

        assertThat(broken.closed).isTrue();
        assertThat(healthy.frames).hasSize(1);
        assertThat(notifications.connectionsOf("bob")).extracting(OutboundChannel::id).containsExactly("healthy");
    }

    @Test
    void sideChannelFailureDoesNotAffectOtherChannels() {
        SideChannelSender push = mock(SideChannelSender.class);
        SideChannelSender email = mock(SideChannelSender.class);
        when(push.type()).thenReturn(ChannelType.PUSH);
        when(email.type()).thenReturn(ChannelType.EMAIL);
        doThrow(new IllegalStateException("gateway down")).when(push).send(any(), any());

        NotificationService notifications = service(List.of(push, email), Runnable::run, 16);
        FakeConnection phone = new FakeConnection("phone");
        notifications.subscribe("bob", phone);
        ChannelRegistration token = new ChannelRegistration(ChannelType.PUSH, "token-1", "phone", "ios");
        ChannelRegistration mail = new ChannelRegistration(ChannelType.EMAIL, "bob@example.com", null, null);
        notifications.registerChannel("bob", token);
        notifications.registerChannel("bob", mail);

        NotificationMessage m = message("n1", "bob");
        notifications.publish(m);

        verify(push).send(token, m);
        verify(email).send(mail, m);
        assertThat(phone.frames).hasSize(1);
        assertThat(notifications.recentNotifications("bob", 5)).hasSize(1);
    }

    @Test
    void reRegisteringAChannelReplacesTheEndpoint() {
        NotificationService notifications = service();
        notifications.registerChannel("bob", new ChannelRegistration(ChannelType.PUSH, "token-1", "phone", "ios"));
        notifications.registerChannel("bob", new ChannelRegistration(ChannelType.PUSH, "token-2", "phone", "ios"));
        notifications.registerChannel("bob", new ChannelRegistration(ChannelType.SMS, "+15550100", null, null));

        assertThat(notifications.channelsOf("bob"))
                .extracting(ChannelRegistration::endpoint)
                .containsExactlyInAnyOrder("token-2", "+15550100");
    }

    @Test
    void slowConnectionDropsItsOldestFrames() {
        List<Runnable> pending = new ArrayList<>();
        NotificationService notifications = service(List.of(), pending::add, 2);
        FakeConnection slow = new FakeConnection("slow");
        OutboundChannel channel = notifications.subscribe("bob", slow);

        notifications.publish(message("n1", "bob"));
        notifications.publish(message("n2", "bob"));
        notifications.publish(message("n3", "bob"));

        assertThat(channel.queued()).isEqualTo(2);
        assertThat(pending).hasSize(1);
        pending.get(0).run();

        assertThat(slow.frames).hasSize(2);
        assertThat(slow.frames.get(0)).contains("\"id\":\"n2\"");
        assertThat(slow.frames.get(1)).contains("\"id\":\"n3\"");
        // history is unaffected by the live queue
        assertThat(notifications.recentNotifications("bob", 10)).hasSize(3);
    }

    @Test
    void heartbeatPingsOpenConnectionsAndPrunesClosedOnes() {
        NotificationService notifications = service();
        FakeConnection open = new FakeConnection("open");
        FakeConnection gone = new FakeConnection("gone");
        notifications.subscribe("bob", open);
        notifications.subscribe("bob", gone);
        gone.open = false;

        notifications.heartbeat();

        assertThat(open.frames).hasSize(1);
        assertThat(open.frames.get(0)).contains("\"type\":\"ping\"");
        assertThat(notifications.connectionsOf("bob")).extracting(OutboundChannel::id).containsExactly("open");
    }

    @Test
    void historyIsNewestFirstAndCanBeMarkedRead() {
        NotificationService notifications = service();
        notifications.publish(message("n1", "bob", "alice"));
        notifications.publish(message("n2", "bob"));

        List<HistoryEntry> bob = notifications.recentNotifications("bob", 10);
        assertThat(bob).extracting(e -> e.notification().id()).containsExactly("n2", "n1");
        assertThat(bob).noneMatch(HistoryEntry::read);

        assertThat(notifications.markAsRead("bob", "n1")).isTrue();
        assertThat(notifications.markAsRead("bob", "missing")).isFalse();
        assertThat(notifications.recentNotifications("bob", 10))
                .extracting(HistoryEntry::read).containsExactly(false, true);
        assertThat(notifications.recentNotifications("alice", 10)).singleElement()
                .extracting(HistoryEntry::read).isEqualTo(false);
    }

    @Test
    void historyKeepsOnlyTheMostRecentEntries() {
        NotificationHistory history = new NotificationHistory(3);
        for (int i = 1; i <= 5; i++) {
            history.record("bob", message("n" + i, "bob"));
        }

        assertThat(history.recent("bob", 10)).extracting(e -> e.notification().id())
                .containsExactly("n5", "n4", "n3");
        assertThat(history.recent("nobody", 10)).isEmpty();
    }

    @Test
    void rejectedDrainKeepsFramesForTheNextPublish() {
        AtomicInteger calls = new AtomicInteger();
        Executor rejectsOnce = task -> {
            if (calls.getAndIncrement() == 0) {
                throw new RejectedExecutionException("saturated");
            }
            task.run();
        };
        NotificationService notifications = service(List.of(), rejectsOnce, 16);
        FakeConnection phone = new FakeConnection("phone");
        notifications.subscribe("bob", phone);

        notifications.publish(message("n1", "bob"));
        assertThat(phone.frames).isEmpty();

        notifications.publish(message("n2", "bob"));

        assertThat(phone.frames).hasSize(2);
        assertThat(phone.frames.get(0)).contains("\"id\":\"n1\"");
        assertThat(phone.frames.get(1)).contains("\"id\":\"n2\"");
    }

    @Test
    void concurrentChurnNeverLosesASubscription() throws Exception {
        NotificationService notifications = service();
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<?>> done = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int n = t;
                done.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 200; i++) {
                        String temp = "temp-" + n + "-" + i;
                        notifications.subscribe("bob", new FakeConnection(temp));
                        notifications.unsubscribe("bob", temp);
                    }
                    notifications.subscribe("bob", new FakeConnection("final-" + n));
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : done) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(notifications.connectionsOf("bob")).extracting(OutboundChannel::id)
                .containsExactlyInAnyOrder("final-0", "final-1", "final-2", "final-3",
                        "final-4", "final-5", "final-6", "final-7");
    }

    static final class FakeConnection implements LiveConnection {
        final String id;
        final List<String> frames = Collections.synchronizedList(new ArrayList<>());
        volatile boolean open = true;
        volatile boolean closed;
        volatile boolean failOnSend;

        FakeConnection(String id) {
            this.id = id;
        }

        @Override
        public String id() {
            return id;
        }

        @Override
        public boolean isOpen() {
            return open;
        }

        @Override
        public void send(String frame) throws IOException {
            if (failOnSend) throw new IOException("broken pipe");
            frames.add(frame);
        }

        @Override
        public void close() {
            open = false;
            closed = true;
        }
    }
}
