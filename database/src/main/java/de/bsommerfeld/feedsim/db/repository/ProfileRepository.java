package de.bsommerfeld.feedsim.db.repository;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.Profile;
import de.bsommerfeld.feedsim.core.domain.Validators;
import de.bsommerfeld.feedsim.db.adapter.ProfileAdapter;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the profiles agents are seeded from, plus the upsert used by
 * ingestion.
 */
@Singleton
public class ProfileRepository {

    private final ProfileAdapter adapter;

    @Inject
    public ProfileRepository(ProfileAdapter adapter) {
        this.adapter = adapter;
    }

    public Optional<Profile> getProfile(String handle) {
        Validators.requireNonBlank(handle, "handle");
        return adapter.readProfile(handle);
    }

    /** All profiles, ordered by handle. */
    public List<Profile> listProfiles() {
        return adapter.readAllProfiles();
    }

    public Profile createOrUpdateProfile(Profile profile) {
        Validators.requirePresent(profile, "profile");
        adapter.writeProfile(profile);
        return profile;
    }
}
