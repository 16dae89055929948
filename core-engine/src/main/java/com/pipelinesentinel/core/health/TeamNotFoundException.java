package com.pipelinesentinel.core.health;

public class TeamNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TeamNotFoundException(String team) {
        super("No pipelines found for team: " + team);
    }
}
