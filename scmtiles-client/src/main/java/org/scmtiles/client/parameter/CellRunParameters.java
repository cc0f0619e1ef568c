package org.scmtiles.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters controlling how each cell's model run directory is prepared and kept.
 */
public class CellRunParameters implements Serializable {

    @Parameter(
            names = "--archiveFailedRuns",
            description = "Keep the run directory (with model stdout and stderr) of each failed cell " +
                          "in the output directory instead of deleting it",
            arity = 0)
    public boolean archiveFailedRuns = false;

    @Parameter(
            names = "--copyTemplate",
            description = "Copy template directory entries into each run directory instead of linking them",
            arity = 0)
    public boolean copyTemplate = false;

}
