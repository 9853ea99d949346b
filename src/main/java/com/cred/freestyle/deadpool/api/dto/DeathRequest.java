package com.cred.freestyle.deadpool.api.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * Request DTO for recording a candidate's death.
 *
 * @author Deadpool Team
 */
public class DeathRequest {

    @NotNull(message = "Death date is required")
    private LocalDate deathDate;

    @Min(value = 0, message = "Age must not be negative")
    @Max(value = 150, message = "Age must be at most 150")
    private Integer age;

    public DeathRequest() {
    }

    public DeathRequest(LocalDate deathDate, Integer age) {
        this.deathDate = deathDate;
        this.age = age;
    }

    public LocalDate getDeathDate() {
        return deathDate;
    }

    public void setDeathDate(LocalDate deathDate) {
        this.deathDate = deathDate;
    }

    public Integer getAge() {
        return age;
    }

    public void setAge(Integer age) {
        this.age = age;
    }
}
