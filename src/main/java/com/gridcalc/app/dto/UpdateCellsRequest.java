package com.gridcalc.app.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.List;

public class UpdateCellsRequest {
    // Editing participant; optional for edits made outside a collaboration session
    private String participantId;
    @NotEmpty
    @Valid
    private List<CellUpdateRequest> updates = new ArrayList<>();

    public UpdateCellsRequest() {
    }

    public UpdateCellsRequest(String participantId, List<CellUpdateRequest> updates) {
        this.participantId = participantId;
        this.updates = updates;
    }

    public String getParticipantId() {
        return participantId;
    }

    public void setParticipantId(String participantId) {
        this.participantId = participantId;
    }

    public List<CellUpdateRequest> getUpdates() {
        return updates;
    }

    public void setUpdates(List<CellUpdateRequest> updates) {
        this.updates = updates;
    }
}
