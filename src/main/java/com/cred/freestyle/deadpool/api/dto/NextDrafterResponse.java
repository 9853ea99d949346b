package com.cred.freestyle.deadpool.api.dto;

import com.cred.freestyle.deadpool.domain.model.NextDrafter;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response DTO for the next-drafter query. {@code eligible} is false once every
 * player is at capacity, in which case the drafter fields are absent.
 *
 * @author Deadpool Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NextDrafterResponse {

    private int year;
    private boolean eligible;
    private String playerId;
    private String playerName;
    private Integer draftPosition;
    private Integer totalPicks;
    private Integer activePicks;
    private Integer availableSlots;

    public NextDrafterResponse() {
    }

    public static NextDrafterResponse of(int year, NextDrafter drafter) {
        NextDrafterResponse response = new NextDrafterResponse();
        response.year = year;
        response.eligible = true;
        response.playerId = drafter.getPlayerId();
        response.playerName = drafter.getPlayerName();
        response.draftPosition = drafter.getDraftPosition();
        response.totalPicks = drafter.getTotalPicks();
        response.activePicks = drafter.getActivePicks();
        response.availableSlots = Math.max(0, drafter.getMaxPicks() - drafter.getActivePicks());
        return response;
    }

    public static NextDrafterResponse noneEligible(int year) {
        NextDrafterResponse response = new NextDrafterResponse();
        response.year = year;
        response.eligible = false;
        return response;
    }

    public int getYear() {
        return year;
    }

    public boolean isEligible() {
        return eligible;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getPlayerName() {
        return playerName;
    }

    public Integer getDraftPosition() {
        return draftPosition;
    }

    public Integer getTotalPicks() {
        return totalPicks;
    }

    public Integer getActivePicks() {
        return activePicks;
    }

    public Integer getAvailableSlots() {
        return availableSlots;
    }
}
