package de.bsommerfeld.feedsim.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Run parameters used when the command line does not override them.
 */
public class RunDefaultsConfig {

    @JsonProperty("num-agents")
    private int numAgents = 5;

    @JsonProperty("num-turns")
    private int numTurns = 3;

    public int getNumAgents() {
        return numAgents;
    }

    public void setNumAgents(int numAgents) {
        this.numAgents = numAgents;
    }

    public int getNumTurns() {
        return numTurns;
    }

    public void setNumTurns(int numTurns) {
        this.numTurns = numTurns;
    }
}
