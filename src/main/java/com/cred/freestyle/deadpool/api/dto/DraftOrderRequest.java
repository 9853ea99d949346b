package com.cred.freestyle.deadpool.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request DTO for initializing a season's draft order. Position follows list order.
 *
 * @author Deadpool Team
 */
public class DraftOrderRequest {

    @NotEmpty(message = "At least one player is required")
    private List<@NotBlank(message = "Player ID must not be blank") String> playerIds;

    public DraftOrderRequest() {
    }

    public DraftOrderRequest(List<String> playerIds) {
        this.playerIds = playerIds;
    }

    public List<String> getPlayerIds() {
        return playerIds;
    }

    public void setPlayerIds(List<String> playerIds) {
        this.playerIds = playerIds;
    }
}
