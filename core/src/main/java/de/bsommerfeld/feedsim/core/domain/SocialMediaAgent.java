package de.bsommerfeld.feedsim.core.domain;

/**
 * A simulated account, materialized from a {@link Profile} and its optional
 * {@link GeneratedBio}. Feeds are keyed by {@link #handle()}.
 *
 * @param handle         agent handle, identical to the seeding profile's
 * @param displayName    display name
 * @param bio            published bio
 * @param generatedBio   generated bio, empty if none exists
 * @param followersCount {@code >= 0}
 * @param followingCount {@code >= 0}
 * @param postsCount     {@code >= 0}
 */
public record SocialMediaAgent(
        String handle,
        String displayName,
        String bio,
        String generatedBio,
        int followersCount,
        int followingCount,
        int postsCount) {

    public SocialMediaAgent {
        Validators.requireNonBlank(handle, "handle");
        Validators.requirePresent(displayName, "display_name");
        Validators.requirePresent(bio, "bio");
        Validators.requirePresent(generatedBio, "generated_bio");
        Validators.requireNonNegative(followersCount, "followers_count");
        Validators.requireNonNegative(followingCount, "following_count");
        Validators.requireNonNegative(postsCount, "posts_count");
    }

    public static SocialMediaAgent fromProfile(Profile profile, String generatedBio) {
        return new SocialMediaAgent(profile.handle(), profile.displayName(), profile.bio(),
                generatedBio == null ? "" : generatedBio,
                profile.followersCount(), profile.followsCount(), profile.postsCount());
    }

    /** Bare agent without profile data. */
    public static SocialMediaAgent withHandle(String handle) {
        return new SocialMediaAgent(handle, handle, "", "", 0, 0, 0);
    }
}
