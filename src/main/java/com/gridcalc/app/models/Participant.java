package com.gridcalc.app.models;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.UUID;

/**
 * One connected editor of a collaboration session.
 * Each participant only ever writes its own presence, so updates are last-write-wins
 * per record. Pending cell-update events sit in a bounded queue that drops the
 * oldest entry when full.
 */
public class Participant {
    private final String participantId;
    private final String userId;
    private final String displayName;
    private final String color;
    private final long joinSequence;
    private final Instant joinedAt;
    private volatile Instant lastHeartbeat;
    private volatile Presence presence;

    private final Deque<CellUpdateEvent> pendingEvents = new ArrayDeque<>();
    private long droppedEvents;

    public Participant(String userId, String displayName, String color, long joinSequence, Instant joinedAt) {
        this.participantId = UUID.randomUUID().toString();
        this.userId = userId;
        this.displayName = displayName;
        this.color = color;
        this.joinSequence = joinSequence;
        this.joinedAt = joinedAt;
        this.lastHeartbeat = joinedAt;
        this.presence = new Presence(null, null, joinedAt);
    }

    public String getParticipantId() {
        return participantId;
    }

    public String getUserId() {
        return userId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getColor() {
        return color;
    }

    public long getJoinSequence() {
        return joinSequence;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public Presence getPresence() {
        return presence;
    }

    public void updatePresence(CursorPosition cursor, SelectionRange selection, Instant now) {
        this.presence = new Presence(cursor, selection, now);
        this.lastHeartbeat = now;
    }

    public void heartbeat(Instant now) {
        this.lastHeartbeat = now;
    }

    public boolean isExpired(Instant now, Duration timeout) {
        return lastHeartbeat.plus(timeout).isBefore(now);
    }

    /**
     * Queues an event without ever blocking the publisher.
     */
    public synchronized void offerEvent(CellUpdateEvent event, int maxPending) {
        while (pendingEvents.size() >= maxPending && !pendingEvents.isEmpty()) {
            pendingEvents.pollFirst();
            droppedEvents++;
        }
        pendingEvents.addLast(event);
    }

    public synchronized List<CellUpdateEvent> drainEvents() {
        List<CellUpdateEvent> drained = new ArrayList<>(pendingEvents);
        pendingEvents.clear();
        return drained;
    }

    public synchronized int pendingEventCount() {
        return pendingEvents.size();
    }

    public synchronized long droppedEventCount() {
        return droppedEvents;
    }
}
