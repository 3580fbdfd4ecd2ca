package de.bsommerfeld.feedsim.simulation;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.GeneratedBio;
import de.bsommerfeld.feedsim.core.domain.Profile;
import de.bsommerfeld.feedsim.core.domain.SocialMediaAgent;
import de.bsommerfeld.feedsim.core.domain.Validators;
import de.bsommerfeld.feedsim.db.repository.GeneratedBioRepository;
import de.bsommerfeld.feedsim.db.repository.ProfileRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Materializes agents from stored profiles. Profiles are taken in handle
 * order; a profile without a generated bio gets an empty one.
 */
@Singleton
public class AgentFactory {

    private static final Logger LOG = LoggerFactory.getLogger(AgentFactory.class);

    private final ProfileRepository profileRepository;
    private final GeneratedBioRepository generatedBioRepository;

    @Inject
    public AgentFactory(ProfileRepository profileRepository, GeneratedBioRepository generatedBioRepository) {
        this.profileRepository = profileRepository;
        this.generatedBioRepository = generatedBioRepository;
    }

    /**
     * @throws InsufficientAgentsException if fewer than {@code numAgents}
     *                                     profiles exist
     */
    public List<SocialMediaAgent> createAgents(int numAgents) {
        Validators.requirePositive(numAgents, "num_agents");

        List<Profile> profiles = profileRepository.listProfiles();
        if (profiles.size() < numAgents) {
            throw new InsufficientAgentsException(numAgents, profiles.size());
        }

        Map<String, String> bios = new HashMap<>();
        for (GeneratedBio bio : generatedBioRepository.listAllGeneratedBios()) {
            bios.put(bio.handle(), bio.generatedBio());
        }

        List<SocialMediaAgent> agents = new ArrayList<>(numAgents);
        for (Profile profile : profiles.subList(0, numAgents)) {
            String generatedBio = bios.get(profile.handle());
            if (generatedBio == null) {
                LOG.debug("No generated bio for {}", profile.handle());
            }
            agents.add(SocialMediaAgent.fromProfile(profile, generatedBio));
        }
        LOG.info("Created {} agents from {} profiles", agents.size(), profiles.size());
        return agents;
    }
}
