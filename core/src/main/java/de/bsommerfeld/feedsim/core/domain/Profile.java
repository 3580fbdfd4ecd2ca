package de.bsommerfeld.feedsim.core.domain;

/**
 * Author metadata used to seed agents.
 *
 * @param handle         unique handle
 * @param did            decentralized identifier
 * @param displayName    display name
 * @param bio            profile description as published
 * @param followersCount {@code >= 0}
 * @param followsCount   {@code >= 0}
 * @param postsCount     {@code >= 0}
 */
public record Profile(
        String handle,
        String did,
        String displayName,
        String bio,
        int followersCount,
        int followsCount,
        int postsCount) {

    public Profile {
        Validators.requireNonBlank(handle, "handle");
        Validators.requireNonBlank(did, "did");
        Validators.requirePresent(displayName, "display_name");
        Validators.requirePresent(bio, "bio");
        Validators.requireNonNegative(followersCount, "followers_count");
        Validators.requireNonNegative(followsCount, "follows_count");
        Validators.requireNonNegative(postsCount, "posts_count");
    }
}
