package com.gridcalc.app.dto;

import com.gridcalc.app.models.CursorPosition;
import com.gridcalc.app.models.Participant;
import com.gridcalc.app.models.Presence;
import com.gridcalc.app.models.SelectionRange;

import java.time.Instant;

public class ParticipantResponse {
    private final String participantId;
    private final String userId;
    private final String displayName;
    private final String color;
    private final CursorPosition cursor;
    private final SelectionRange selection;
    private final Instant joinedAt;
    private final Instant lastHeartbeat;
    private final int pendingEvents;

    public ParticipantResponse(Participant participant) {
        Presence presence = participant.getPresence();
        this.participantId = participant.getParticipantId();
        this.userId = participant.getUserId();
        this.displayName = participant.getDisplayName();
        this.color = participant.getColor();
        this.cursor = presence.getCursor();
        this.selection = presence.getSelection();
        this.joinedAt = participant.getJoinedAt();
        this.lastHeartbeat = participant.getLastHeartbeat();
        this.pendingEvents = participant.pendingEventCount();
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

    public CursorPosition getCursor() {
        return cursor;
    }

    public SelectionRange getSelection() {
        return selection;
    }

    public Instant getJoinedAt() {
        return joinedAt;
    }

    public Instant getLastHeartbeat() {
        return lastHeartbeat;
    }

    public int getPendingEvents() {
        return pendingEvents;
    }
}
