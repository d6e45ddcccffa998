package com.clusterscope.cloud.service.resolution;

/**
 * Thrown at a stage boundary when a newer refresh has started; the run stops without publishing.
 */
public class SupersededRunException extends RuntimeException {

    private final long generation;

    public SupersededRunException(long generation, long latestGeneration) {
        super("Resolution run " + generation + " superseded by run " + latestGeneration);
        this.generation = generation;
    }

    public long getGeneration() {
        return generation;
    }
}
