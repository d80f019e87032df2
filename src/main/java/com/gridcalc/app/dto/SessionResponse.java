package com.gridcalc.app.dto;

import com.gridcalc.app.models.SessionState;

import java.time.Instant;
import java.util.List;

public class SessionResponse {
    private final String sessionId;
    private final String spreadsheetId;
    private final SessionState state;
    private final String websocketUrl;
    private final Instant createdAt;
    private final List<ParticipantResponse> participants;

    public SessionResponse(String sessionId, String spreadsheetId, SessionState state, String websocketUrl,
                           Instant createdAt, List<ParticipantResponse> participants) {
        this.sessionId = sessionId;
        this.spreadsheetId = spreadsheetId;
        this.state = state;
        this.websocketUrl = websocketUrl;
        this.createdAt = createdAt;
        this.participants = participants;
    }

    public String getSessionId() {
        return sessionId;
    }

    public String getSpreadsheetId() {
        return spreadsheetId;
    }

    public SessionState getState() {
        return state;
    }

    public String getWebsocketUrl() {
        return websocketUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public List<ParticipantResponse> getParticipants() {
        return participants;
    }
}
