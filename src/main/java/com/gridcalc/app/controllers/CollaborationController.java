package com.gridcalc.app.controllers;

import com.gridcalc.app.dto.JoinRequest;
import com.gridcalc.app.dto.ParticipantResponse;
import com.gridcalc.app.dto.PresenceRequest;
import com.gridcalc.app.dto.SessionResponse;
import com.gridcalc.app.models.CellUpdateEvent;
import com.gridcalc.app.services.CollaborationService;
import jakarta.validation.Valid;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST endpoints for collaboration sessions, participants and presence.
 */
@RestController
@RequestMapping("/spreadsheets/{id}")
public class CollaborationController {

    @Autowired
    private CollaborationService collaborationService;

    /**
     * POST /spreadsheets/{id}/collaboration
     * Starts the session, or returns the running one.
     */
    @PostMapping("/collaboration")
    public ResponseEntity<SessionResponse> startSession(@PathVariable String id) {
        return ResponseEntity.ok(collaborationService.startSession(id));
    }

    @GetMapping("/collaboration")
    public ResponseEntity<SessionResponse> getSession(@PathVariable String id) {
        return ResponseEntity.ok(collaborationService.getSession(id));
    }

    /**
     * DELETE /spreadsheets/{id}/collaboration
     * Ends the session and drops all participants.
     */
    @DeleteMapping("/collaboration")
    public ResponseEntity<Void> endSession(@PathVariable String id) {
        collaborationService.endSession(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * POST /spreadsheets/{id}/collaboration/participants
     * Body: { "userId", "displayName" }. Returns the new participant with its id and colour.
     */
    @PostMapping("/collaboration/participants")
    public ResponseEntity<ParticipantResponse> join(@PathVariable String id, @Valid @RequestBody JoinRequest request) {
        ParticipantResponse participant = collaborationService.join(id, request.getUserId(), request.getDisplayName());
        return ResponseEntity.status(HttpStatus.CREATED).body(participant);
    }

    @DeleteMapping("/collaboration/participants/{participantId}")
    public ResponseEntity<Void> leave(@PathVariable String id, @PathVariable String participantId) {
        collaborationService.leave(id, participantId);
        return ResponseEntity.noContent().build();
    }

    /**
     * PUT /spreadsheets/{id}/collaboration/participants/{participantId}/presence
     * Body: { "cursor": { "sheetIndex", "row", "column" }, "selection": { ... } }
     */
    @PutMapping("/collaboration/participants/{participantId}/presence")
    public ResponseEntity<ParticipantResponse> updatePresence(@PathVariable String id,
                                                              @PathVariable String participantId,
                                                              @Valid @RequestBody PresenceRequest request) {
        return ResponseEntity.ok(collaborationService.updatePresence(id, participantId, request));
    }

    @PostMapping("/collaboration/participants/{participantId}/heartbeat")
    public ResponseEntity<ParticipantResponse> heartbeat(@PathVariable String id,
                                                         @PathVariable String participantId) {
        return ResponseEntity.ok(collaborationService.heartbeat(id, participantId));
    }

    /**
     * GET /spreadsheets/{id}/collaboration/participants/{participantId}/events
     * Drains the participant's queued cell updates. Also counts as a heartbeat.
     */
    @GetMapping("/collaboration/participants/{participantId}/events")
    public ResponseEntity<List<CellUpdateEvent>> pollEvents(@PathVariable String id,
                                                            @PathVariable String participantId) {
        return ResponseEntity.ok(collaborationService.pollEvents(id, participantId));
    }

    /**
     * GET /spreadsheets/{id}/collaborators
     * Live participants in join order; empty when no session is running.
     */
    @GetMapping("/collaborators")
    public ResponseEntity<List<ParticipantResponse>> getCollaborators(@PathVariable String id) {
        return ResponseEntity.ok(collaborationService.listParticipants(id));
    }
}
