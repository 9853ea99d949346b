package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A person who may be drafted.
 *
 * Status is never stored: a candidate is deceased iff a death date is present.
 * The age attribute is taken as recorded and is not recomputed from the birth date.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Candidate {

    private String id;

    /**
     * Name as first drafted.
     */
    private String name;

    /**
     * Output of the name normalizer; also the candidate's dedup key.
     */
    private String normalizedName;

    private Integer age;
    private LocalDate birthDate;
    private LocalDate deathDate;
    private Instant createdAt;

    public boolean isDeceased() {
        return deathDate != null;
    }

    /**
     * @param year Season year
     * @return true if the candidate died during that calendar year
     */
    public boolean diedIn(int year) {
        return deathDate != null && deathDate.getYear() == year;
    }

    public CandidateStatus getStatus() {
        return isDeceased() ? CandidateStatus.DECEASED : CandidateStatus.ALIVE;
    }

    public enum CandidateStatus {
        ALIVE,
        DECEASED
    }
}
