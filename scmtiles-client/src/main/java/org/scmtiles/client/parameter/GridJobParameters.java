package org.scmtiles.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parameters shared by every grid job client.
 */
public class GridJobParameters implements Serializable {

    public static final String DEFAULT_DROP_LIST = "dropvars.txt";

    @Parameter(
            names = "--config",
            description = "JSON file describing the grid job (start time, grid size, directories)",
            required = true)
    public String config;

    @Parameter(
            names = "--numWorkers",
            description = "Number of tiles to process concurrently"
    )
    public Integer numWorkers = 1;

    @Parameter(
            names = "--rowHeight",
            description = "Number of grid rows in each tile"
    )
    public Integer rowHeight = 1;

    @Parameter(
            names = "--dropList",
            description = "File listing (one per line) variables to omit from the grid output, " +
                          "ignored if the file does not exist"
    )
    public String dropList = DEFAULT_DROP_LIST;

    @Parameter(
            names = "--deleteCellFiles",
            description = "Delete archived cell output files once the grid output has been written",
            arity = 0)
    public boolean deleteCellFiles = false;

    public Path getConfigPath() {
        return Paths.get(config);
    }

    public Path getDropListPath() {
        return dropList == null ? null : Paths.get(dropList);
    }

    /**
     * @throws IllegalArgumentException
     *   if the worker count or row height is not positive.
     */
    public void validate()
            throws IllegalArgumentException {
        if ((numWorkers == null) || (numWorkers < 1)) {
            throw new IllegalArgumentException("--numWorkers must be positive");
        }
        if ((rowHeight == null) || (rowHeight < 1)) {
            throw new IllegalArgumentException("--rowHeight must be positive");
        }
    }
}
