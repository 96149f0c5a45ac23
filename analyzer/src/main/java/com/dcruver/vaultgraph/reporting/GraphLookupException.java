package com.dcruver.vaultgraph.reporting;

/**
 * A report was asked about a note or community the analysis does not contain.
 * The message names the most likely reason.
 */
public class GraphLookupException extends RuntimeException {

    public GraphLookupException(String message) {
        super(message);
    }
}
