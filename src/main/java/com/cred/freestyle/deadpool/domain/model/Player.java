package com.cred.freestyle.deadpool.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A participant in the pool. Profile fields are owned by the signup flow;
 * the draft engine only reads players.
 *
 * @author Deadpool Team
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Player {

    private String id;
    private String firstName;
    private String lastName;
    private Instant createdAt;

    /**
     * First and last name, skipping whichever is missing.
     */
    public String getDisplayName() {
        if (firstName == null || firstName.isBlank()) {
            return lastName == null ? id : lastName;
        }
        if (lastName == null || lastName.isBlank()) {
            return firstName;
        }
        return firstName + " " + lastName;
    }
}
