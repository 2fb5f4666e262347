package com.demo.multisig.service.notification;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Bounded per-recipient ring of recent notifications, newest last. Not persisted. */
@Component
public class NotificationHistory {

    private final int capacity;
    private final Map<String, Deque<HistoryEntry>> byUser = new ConcurrentHashMap<>();

    public NotificationHistory(@Value("${multisig.notifications.history-size:50}") int capacity) {
        this.capacity = Math.max(1, capacity);
    }

    public void record(String userId, NotificationMessage message) {
        Deque<HistoryEntry> ring = byUser.computeIfAbsent(userId, k -> new ArrayDeque<>());
        synchronized (ring) {
            ring.addLast(new HistoryEntry(message, false));
            while (ring.size() > capacity) {
                ring.removeFirst();
            }
        }
    }

    /** Newest first. */
    public List<HistoryEntry> recent(String userId, int limit) {
        Deque<HistoryEntry> ring = byUser.get(userId);
        if (ring == null) return List.of();
        List<HistoryEntry> out = new ArrayList<>();
        synchronized (ring) {
            Iterator<HistoryEntry> it = ring.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(it.next());
            }
        }
        return out;
    }

    public boolean markAsRead(String userId, String notificationId) {
        Deque<HistoryEntry> ring = byUser.get(userId);
        if (ring == null) return false;
        synchronized (ring) {
            List<HistoryEntry> copy = new ArrayList<>(ring);
            boolean found = false;
            for (ListIterator<HistoryEntry> it = copy.listIterator(); it.hasNext(); ) {
                HistoryEntry e = it.next();
                if (e.notification().id().equals(notificationId)) {
                    it.set(e.markRead());
                    found = true;
                }
            }
            if (found) {
                ring.clear();
                ring.addAll(copy);
            }
            return found;
        }
    }
}
