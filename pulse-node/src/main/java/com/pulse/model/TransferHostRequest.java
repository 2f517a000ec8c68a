package com.pulse.model;

import jakarta.validation.constraints.NotBlank;

public class TransferHostRequest {

    @NotBlank
    private String newHostId;

    public String getNewHostId() {
        return newHostId;
    }

    public void setNewHostId(String newHostId) {
        this.newHostId = newHostId;
    }
}
