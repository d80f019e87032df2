package com.gridcalc.app.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Ephemeral editing session bound to one spreadsheet.
 * Lives in memory only; it is separate from the persisted cell data.
 */
public class CollaborationSession {
    private final String id;
    private final String spreadsheetId;
    private final Instant createdAt;
    private volatile String websocketUrl;
    private final Map<String, Participant> participants = new ConcurrentHashMap<>();
    private final AtomicLong joinCounter = new AtomicLong();

    public CollaborationSession(String spreadsheetId, String websocketUrl, Instant createdAt) {
        this.id = UUID.randomUUID().toString();
        this.spreadsheetId = spreadsheetId;
        this.websocketUrl = websocketUrl;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public String getSpreadsheetId() {
        return spreadsheetId;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getWebsocketUrl() {
        return websocketUrl;
    }

    public void setWebsocketUrl(String websocketUrl) {
        this.websocketUrl = websocketUrl;
    }

    public SessionState getState() {
        return participants.isEmpty() ? SessionState.EMPTY : SessionState.ACTIVE;
    }

    public long nextJoinSequence() {
        return joinCounter.getAndIncrement();
    }

    public void addParticipant(Participant participant) {
        participants.put(participant.getParticipantId(), participant);
    }

    public Participant getParticipant(String participantId) {
        return participants.get(participantId);
    }

    public Participant removeParticipant(String participantId) {
        return participants.remove(participantId);
    }

    public Collection<Participant> participantRecords() {
        return participants.values();
    }

    /**
     * Participants in join order.
     */
    public List<Participant> orderedParticipants() {
        List<Participant> ordered = new ArrayList<>(participants.values());
        ordered.sort(Comparator.comparingLong(Participant::getJoinSequence));
        return ordered;
    }
}
