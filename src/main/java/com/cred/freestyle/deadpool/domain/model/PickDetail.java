package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;

/**
 * A pick joined with its candidate, for listing a player's roster.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PickDetail {

    private String candidateId;
    private String candidateName;
    private Integer age;
    private LocalDate deathDate;
    private boolean deceased;
    private Instant timestamp;
}
