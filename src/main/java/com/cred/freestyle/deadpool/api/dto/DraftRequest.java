package com.cred.freestyle.deadpool.api.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for committing a pick.
 *
 * @author Deadpool Team
 */
public class DraftRequest {

    @NotBlank(message = "Player ID is required")
    private String playerId;

    @NotBlank(message = "Candidate name is required")
    @Size(max = 200, message = "Candidate name must be at most 200 characters")
    private String candidateName;

    /**
     * Defaults to the current year.
     */
    @Min(value = 1900, message = "Year must be 1900 or later")
    private Integer year;

    public DraftRequest() {
    }

    public DraftRequest(String playerId, String candidateName, Integer year) {
        this.playerId = playerId;
        this.candidateName = candidateName;
        this.year = year;
    }

    public String getPlayerId() {
        return playerId;
    }

    public void setPlayerId(String playerId) {
        this.playerId = playerId;
    }

    public String getCandidateName() {
        return candidateName;
    }

    public void setCandidateName(String candidateName) {
        this.candidateName = candidateName;
    }

    public Integer getYear() {
        return year;
    }

    public void setYear(Integer year) {
        this.year = year;
    }
}
