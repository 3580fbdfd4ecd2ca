package de.bsommerfeld.feedsim.simulation;

import de.bsommerfeld.feedsim.core.domain.AgentAction;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.SocialMediaAgent;

import java.util.List;

/**
 * Decides what an agent does with the feed it was served. Called once per
 * agent and turn with the hydrated feed, in feed order.
 */
public interface AgentActionPolicy {

    List<AgentAction.Like> likePosts(SocialMediaAgent agent, List<FeedPost> feed);

    List<AgentAction.Comment> commentPosts(SocialMediaAgent agent, List<FeedPost> feed);

    List<AgentAction.Follow> followUsers(SocialMediaAgent agent, List<FeedPost> feed);
}
