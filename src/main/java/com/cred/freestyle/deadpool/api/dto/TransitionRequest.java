package com.cred.freestyle.deadpool.api.dto;

import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for running a season transition.
 *
 * @author Deadpool Team
 */
public class TransitionRequest {

    @NotNull(message = "From year is required")
    private Integer fromYear;

    @NotNull(message = "To year is required")
    private Integer toYear;

    private boolean dryRun;
    private boolean verbose;

    public TransitionRequest() {
    }

    public TransitionRequest(Integer fromYear, Integer toYear, boolean dryRun, boolean verbose) {
        this.fromYear = fromYear;
        this.toYear = toYear;
        this.dryRun = dryRun;
        this.verbose = verbose;
    }

    public Integer getFromYear() {
        return fromYear;
    }

    public void setFromYear(Integer fromYear) {
        this.fromYear = fromYear;
    }

    public Integer getToYear() {
        return toYear;
    }

    public void setToYear(Integer toYear) {
        this.toYear = toYear;
    }

    public boolean isDryRun() {
        return dryRun;
    }

    public void setDryRun(boolean dryRun) {
        this.dryRun = dryRun;
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }
}
