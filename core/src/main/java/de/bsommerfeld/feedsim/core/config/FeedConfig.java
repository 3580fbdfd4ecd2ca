package de.bsommerfeld.feedsim.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

public class FeedConfig {

    @JsonProperty("algorithm")
    private String algorithm = "chronological";

    @JsonProperty("max-posts")
    private int maxPosts = 20;

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public int getMaxPosts() {
        return maxPosts;
    }

    public void setMaxPosts(int maxPosts) {
        this.maxPosts = maxPosts;
    }
}
