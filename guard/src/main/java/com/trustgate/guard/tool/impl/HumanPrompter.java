package com.trustgate.guard.tool.impl;

import java.util.List;

/** A channel to a human operator. */
public interface HumanPrompter {

    /** False when no human can answer (no console attached). */
    boolean available();

    /**
     * Asks and blocks for an answer. With options, returns one of them
     * (the first on empty or invalid input); without, returns free text
     * ("yes" on empty input).
     */
    String ask(String question, List<String> options);
}
