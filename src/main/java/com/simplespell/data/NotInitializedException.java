package com.simplespell.data;

/**
 * Thrown when the frequency model is queried before any corpus has been built.
 */
public class NotInitializedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public NotInitializedException() {
        super("Corpus not built. Call buildCorpus() before querying the spell checker.");
    }
}
