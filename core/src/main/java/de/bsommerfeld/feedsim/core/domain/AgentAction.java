package de.bsommerfeld.feedsim.core.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * Actions an agent can produce while reading its feed. Each variant maps to
 * exactly one {@link TurnAction} kind.
 */
public sealed interface AgentAction permits AgentAction.Like, AgentAction.Comment, AgentAction.Follow {

    String agentHandle();

    Instant createdAt();

    TurnAction kind();

    record Like(String likeId, String agentHandle, String postUri, Instant createdAt) implements AgentAction {
        public Like {
            Validators.requireNonBlank(likeId, "like_id");
            Validators.requireNonBlank(agentHandle, "agent_handle");
            Validators.requireNonBlank(postUri, "post_uri");
            Validators.requirePresent(createdAt, "created_at");
        }

        public static Like of(String agentHandle, String postUri, Instant createdAt) {
            return new Like("like_" + UUID.randomUUID(), agentHandle, postUri, createdAt);
        }

        @Override
        public TurnAction kind() {
            return TurnAction.LIKE;
        }
    }

    record Comment(String commentId, String agentHandle, String postUri, String text, Instant createdAt)
            implements AgentAction {
        public Comment {
            Validators.requireNonBlank(commentId, "comment_id");
            Validators.requireNonBlank(agentHandle, "agent_handle");
            Validators.requireNonBlank(postUri, "post_uri");
            Validators.requirePresent(text, "text");
            Validators.requirePresent(createdAt, "created_at");
        }

        public static Comment of(String agentHandle, String postUri, String text, Instant createdAt) {
            return new Comment("comment_" + UUID.randomUUID(), agentHandle, postUri, text, createdAt);
        }

        @Override
        public TurnAction kind() {
            return TurnAction.COMMENT;
        }
    }

    record Follow(String followId, String agentHandle, String followedHandle, Instant createdAt)
            implements AgentAction {
        public Follow {
            Validators.requireNonBlank(followId, "follow_id");
            Validators.requireNonBlank(agentHandle, "agent_handle");
            Validators.requireNonBlank(followedHandle, "followed_handle");
            Validators.requirePresent(createdAt, "created_at");
        }

        public static Follow of(String agentHandle, String followedHandle, Instant createdAt) {
            return new Follow("follow_" + UUID.randomUUID(), agentHandle, followedHandle, createdAt);
        }

        @Override
        public TurnAction kind() {
            return TurnAction.FOLLOW;
        }
    }
}
