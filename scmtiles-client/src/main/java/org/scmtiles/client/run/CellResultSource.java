package org.scmtiles.client.run;

import org.scmtiles.grid.spec.Cell;

/**
 * Provides the outcome of producing a cell's output files,
 * either by running the model or by locating the files of an earlier run.
 * Implementations report cell level failures through the result rather than by throwing.
 */
public interface CellResultSource {

    RunResult getResult(final Cell cell);

}
