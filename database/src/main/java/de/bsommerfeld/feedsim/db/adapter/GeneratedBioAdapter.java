package de.bsommerfeld.feedsim.db.adapter;

import de.bsommerfeld.feedsim.core.domain.GeneratedBio;

import java.util.List;
import java.util.Optional;

public interface GeneratedBioAdapter {

    Optional<GeneratedBio> readGeneratedBio(String handle);

    List<GeneratedBio> readAllGeneratedBios();

    void writeGeneratedBio(GeneratedBio bio);
}
