package de.bsommerfeld.feedsim.db.adapter;

import de.bsommerfeld.feedsim.core.domain.Profile;

import java.util.List;
import java.util.Optional;

/**
 * Persistence gateway for {@link Profile} rows.
 */
public interface ProfileAdapter {

    Optional<Profile> readProfile(String handle);

    List<Profile> readAllProfiles();

    void writeProfile(Profile profile);
}
