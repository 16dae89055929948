package com.pipelinesentinel.core.health;

public class PipelineNotFoundException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public PipelineNotFoundException(String pipelineId) {
        super("Pipeline not found: " + pipelineId);
    }
}
