package com.eainde.extraction.pipeline;

/**
 * Stages of one extraction run, in order. Exactly one of
 * {@link #SINGLE_PASS} and {@link #HIERARCHICAL} runs.
 */
public enum PipelineStage {
    CLASSIFY,
    PRE_EXTRACT,
    SINGLE_PASS,
    HIERARCHICAL,
    GAP_FILL,
    FINALIZE
}
