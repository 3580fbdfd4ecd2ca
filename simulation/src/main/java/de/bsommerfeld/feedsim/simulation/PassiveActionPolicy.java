package de.bsommerfeld.feedsim.simulation;

import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.AgentAction;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.SocialMediaAgent;

import java.util.Collections;
import java.util.List;

/**
 * Agents read their feeds and take no action.
 */
@Singleton
public class PassiveActionPolicy implements AgentActionPolicy {

    @Override
    public List<AgentAction.Like> likePosts(SocialMediaAgent agent, List<FeedPost> feed) {
        return Collections.emptyList();
    }

    @Override
    public List<AgentAction.Comment> commentPosts(SocialMediaAgent agent, List<FeedPost> feed) {
        return Collections.emptyList();
    }

    @Override
    public List<AgentAction.Follow> followUsers(SocialMediaAgent agent, List<FeedPost> feed) {
        return Collections.emptyList();
    }
}
