package com.gridcalc.app.dto;

import jakarta.validation.constraints.NotBlank;

public class JoinRequest {
    @NotBlank
    private String userId;
    private String displayName;

    public JoinRequest() {
    }

    public JoinRequest(String userId, String displayName) {
        this.userId = userId;
        this.displayName = displayName;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public void setDisplayName(String displayName) {
        this.displayName = displayName;
    }
}
