package de.bsommerfeld.feedsim.feeds;

import java.util.Set;

/**
 * Raised when a feed algorithm name is not part of {@link FeedAlgorithm}.
 */
public class UnknownAlgorithmException extends IllegalArgumentException {

    private final String name;

    public UnknownAlgorithmException(String name, Set<String> known) {
        super("Unknown feed algorithm '" + name + "', known algorithms: " + known);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
