package de.bsommerfeld.feedsim.db.repository;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.GeneratedBio;
import de.bsommerfeld.feedsim.core.domain.Validators;
import de.bsommerfeld.feedsim.db.adapter.GeneratedBioAdapter;

import java.util.List;
import java.util.Optional;

@Singleton
public class GeneratedBioRepository {

    private final GeneratedBioAdapter adapter;

    @Inject
    public GeneratedBioRepository(GeneratedBioAdapter adapter) {
        this.adapter = adapter;
    }

    public Optional<GeneratedBio> getGeneratedBio(String handle) {
        Validators.requireNonBlank(handle, "handle");
        return adapter.readGeneratedBio(handle);
    }

    public List<GeneratedBio> listAllGeneratedBios() {
        return adapter.readAllGeneratedBios();
    }

    public GeneratedBio createOrUpdateGeneratedBio(GeneratedBio bio) {
        Validators.requirePresent(bio, "bio");
        adapter.writeGeneratedBio(bio);
        return bio;
    }
}
