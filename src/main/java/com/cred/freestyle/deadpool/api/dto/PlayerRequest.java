package com.cred.freestyle.deadpool.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for registering a player. The id is generated when omitted.
 *
 * @author Deadpool Team
 */
public class PlayerRequest {

    @Size(max = 64, message = "Player ID must be at most 64 characters")
    private String playerId;

    @NotBlank(message = "First name is required")
    private String firstName;

    private String lastName;

    public PlayerRequest() {
    }

    public PlayerRequest(String playerId, String firstName, String lastName) {
        this.playerId = playerId;
        this.firstName = firstName;
        this.lastName = lastName;
    }

    public String getPlayerId() {
        return playerId;
    }

    public void setPlayerId(String playerId) {
        this.playerId = playerId;
    }

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }
}
