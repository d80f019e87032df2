package com.gridcalc.app.dto;

/**
 * An edit based on a stale revision that overwrote another participant's write.
 * The edit was still applied (last write wins).
 */
public class CellConflict {
    private final String address;
    private final long baseRevision;
    private final long overwrittenRevision;
    private final String overwrittenParticipantId;

    public CellConflict(String address, long baseRevision, long overwrittenRevision, String overwrittenParticipantId) {
        this.address = address;
        this.baseRevision = baseRevision;
        this.overwrittenRevision = overwrittenRevision;
        this.overwrittenParticipantId = overwrittenParticipantId;
    }

    public String getAddress() {
        return address;
    }

    public long getBaseRevision() {
        return baseRevision;
    }

    public long getOverwrittenRevision() {
        return overwrittenRevision;
    }

    public String getOverwrittenParticipantId() {
        return overwrittenParticipantId;
    }
}
