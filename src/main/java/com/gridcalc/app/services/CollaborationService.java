package com.gridcalc.app.services;

import com.gridcalc.app.config.GridCalcProperties;
import com.gridcalc.app.dto.ParticipantResponse;
import com.gridcalc.app.dto.PresenceRequest;
import com.gridcalc.app.dto.SessionResponse;
import com.gridcalc.app.exceptions.ParticipantNotFoundException;
import com.gridcalc.app.exceptions.SessionNotFoundException;
import com.gridcalc.app.models.CellUpdateEvent;
import com.gridcalc.app.models.CollaborationSession;
import com.gridcalc.app.models.Participant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks who is looking at each spreadsheet: participants, their presence,
 * and a bounded queue of cell updates per participant.
 *
 * Presence calls only touch one participant record, so they never wait on
 * spreadsheet locks; publishing never blocks on a slow participant.
 */
@Service
public class CollaborationService {

    private static final Logger log = LoggerFactory.getLogger(CollaborationService.class);

    static final String[] PALETTE = {
            "#E57373", "#64B5F6", "#81C784", "#FFB74D",
            "#BA68C8", "#4DB6AC", "#F06292", "#A1887F"
    };

    private final Map<String, CollaborationSession> sessions = new ConcurrentHashMap<>();

    private final SpreadsheetRegistry registry;
    private final GridCalcProperties properties;
    private final Clock clock;

    public CollaborationService(SpreadsheetRegistry registry, GridCalcProperties properties, Clock clock) {
        this.registry = registry;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Returns the spreadsheet's session, creating it on first use.
     */
    public SessionResponse startSession(String spreadsheetId) {
        registry.require(spreadsheetId);
        CollaborationSession session = sessions.computeIfAbsent(spreadsheetId, id -> {
            String url = properties.getCollaboration().getWebsocketBaseUrl() + "/ws/collab/" + id;
            log.info("Collaboration session started for spreadsheet {}", id);
            return new CollaborationSession(id, url, clock.instant());
        });
        return toResponse(session);
    }

    public SessionResponse getSession(String spreadsheetId) {
        CollaborationSession session = requireSession(spreadsheetId);
        evictExpired(session);
        return toResponse(session);
    }

    public void endSession(String spreadsheetId) {
        CollaborationSession removed = sessions.remove(spreadsheetId);
        if (removed == null) {
            throw new SessionNotFoundException("No collaboration session for spreadsheet: " + spreadsheetId);
        }
        log.info("Collaboration session ended for spreadsheet {} ({} participant(s) dropped)",
                spreadsheetId, removed.participantRecords().size());
    }

    /**
     * Drops the session if there is one; used when the spreadsheet itself goes away.
     */
    public void discardSession(String spreadsheetId) {
        if (sessions.remove(spreadsheetId) != null) {
            log.info("Collaboration session discarded with spreadsheet {}", spreadsheetId);
        }
    }

    public ParticipantResponse join(String spreadsheetId, String userId, String displayName) {
        CollaborationSession session = requireSession(spreadsheetId);
        long sequence = session.nextJoinSequence();
        String name = displayName == null || displayName.isBlank() ? defaultName(userId) : displayName.trim();
        String color = PALETTE[(int) (sequence % PALETTE.length)];
        Participant participant = new Participant(userId, name, color, sequence, clock.instant());
        session.addParticipant(participant);
        log.info("Participant {} ({}) joined spreadsheet {}", participant.getParticipantId(), name, spreadsheetId);
        return new ParticipantResponse(participant);
    }

    public void leave(String spreadsheetId, String participantId) {
        CollaborationSession session = requireSession(spreadsheetId);
        Participant removed = session.removeParticipant(participantId);
        if (removed == null) {
            throw new ParticipantNotFoundException("Participant not found: " + participantId);
        }
        log.info("Participant {} left spreadsheet {}", participantId, spreadsheetId);
    }

    /**
     * Replaces the participant's cursor and selection (last write wins) and counts as a heartbeat.
     */
    public ParticipantResponse updatePresence(String spreadsheetId, String participantId, PresenceRequest request) {
        Participant participant = requireParticipant(spreadsheetId, participantId);
        participant.updatePresence(request.getCursor(), request.getSelection(), clock.instant());
        return new ParticipantResponse(participant);
    }

    public ParticipantResponse heartbeat(String spreadsheetId, String participantId) {
        Participant participant = requireParticipant(spreadsheetId, participantId);
        participant.heartbeat(clock.instant());
        return new ParticipantResponse(participant);
    }

    /**
     * Live participants in join order. Expired ones are evicted on the way.
     * A spreadsheet without a session has no collaborators.
     */
    public List<ParticipantResponse> listParticipants(String spreadsheetId) {
        registry.require(spreadsheetId);
        CollaborationSession session = sessions.get(spreadsheetId);
        if (session == null) {
            return Collections.emptyList();
        }
        evictExpired(session);
        List<ParticipantResponse> result = new ArrayList<>();
        for (Participant participant : session.orderedParticipants()) {
            result.add(new ParticipantResponse(participant));
        }
        return result;
    }

    public List<CellUpdateEvent> pollEvents(String spreadsheetId, String participantId) {
        Participant participant = requireParticipant(spreadsheetId, participantId);
        participant.heartbeat(clock.instant());
        return participant.drainEvents();
    }

    /**
     * Queues the events for every participant of the spreadsheet. Fire-and-forget:
     * full queues drop their oldest entries.
     */
    public void publish(String spreadsheetId, List<CellUpdateEvent> events) {
        CollaborationSession session = sessions.get(spreadsheetId);
        if (session == null || events.isEmpty()) {
            return;
        }
        int maxPending = properties.getCollaboration().getMaxPendingEvents();
        for (Participant participant : session.participantRecords()) {
            for (CellUpdateEvent event : events) {
                participant.offerEvent(event, maxPending);
            }
        }
        log.debug("Published {} event(s) to {} participant(s) of spreadsheet {}",
                events.size(), session.participantRecords().size(), spreadsheetId);
    }

    @Scheduled(fixedDelayString = "${gridcalc.collaboration.sweep-interval-ms:15000}")
    public void sweepExpiredParticipants() {
        for (CollaborationSession session : sessions.values()) {
            evictExpired(session);
        }
    }

    private void evictExpired(CollaborationSession session) {
        Instant now = clock.instant();
        Duration timeout = properties.getCollaboration().getHeartbeatTimeout();
        for (Participant participant : new ArrayList<>(session.participantRecords())) {
            if (participant.isExpired(now, timeout)
                    && session.removeParticipant(participant.getParticipantId()) != null) {
                log.info("Participant {} expired from spreadsheet {} (last heartbeat {})",
                        participant.getParticipantId(), session.getSpreadsheetId(), participant.getLastHeartbeat());
            }
        }
    }

    private CollaborationSession requireSession(String spreadsheetId) {
        CollaborationSession session = sessions.get(spreadsheetId);
        if (session == null) {
            throw new SessionNotFoundException("No collaboration session for spreadsheet: " + spreadsheetId);
        }
        return session;
    }

    private Participant requireParticipant(String spreadsheetId, String participantId) {
        Participant participant = requireSession(spreadsheetId).getParticipant(participantId);
        if (participant == null) {
            throw new ParticipantNotFoundException("Participant not found: " + participantId);
        }
        return participant;
    }

    private SessionResponse toResponse(CollaborationSession session) {
        List<ParticipantResponse> participants = new ArrayList<>();
        for (Participant participant : session.orderedParticipants()) {
            participants.add(new ParticipantResponse(participant));
        }
        return new SessionResponse(session.getId(), session.getSpreadsheetId(), session.getState(),
                session.getWebsocketUrl(), session.getCreatedAt(), participants);
    }

    private static String defaultName(String userId) {
        return "User " + (userId.length() > 8 ? userId.substring(0, 8) : userId);
    }
}
