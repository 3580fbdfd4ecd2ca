package de.bsommerfeld.feedsim.core.domain;

import java.time.Instant;

/**
 * A generated biography for a profile handle. Produced outside the
 * simulation; read when agents are materialized.
 */
public record GeneratedBio(String handle, String generatedBio, Instant createdAt) {

    public GeneratedBio {
        Validators.requireNonBlank(handle, "handle");
        Validators.requirePresent(generatedBio, "generated_bio");
        Validators.requirePresent(createdAt, "created_at");
    }
}
