package com.simplespell.data;

/**
 * Failure reading a corpus source. Wraps the underlying I/O cause.
 */
public class CorpusLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String location;

    public CorpusLoadException(String location, Throwable cause) {
        super("Could not load corpus from " + location, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
