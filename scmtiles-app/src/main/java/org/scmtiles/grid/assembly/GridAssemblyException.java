package org.scmtiles.grid.assembly;

/**
 * Signals a failure that prevents the final grid dataset from being produced.
 */
public class GridAssemblyException
        extends Exception {

    public GridAssemblyException(final String message) {
        super(message);
    }

    public GridAssemblyException(final String message,
                                 final Throwable cause) {
        super(message, cause);
    }
}
