package org.scmtiles.client;

import com.beust.jcommander.ParametersDelegate;

import java.nio.file.Path;

import org.scmtiles.client.parameter.CellRunParameters;
import org.scmtiles.client.parameter.CommandLineParameters;
import org.scmtiles.client.parameter.GridJobParameters;
import org.scmtiles.grid.spec.GridJobConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for running the single column model over every cell of a grid
 * and combining the cell results into one grid file.
 */
public class GridRunClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public GridJobParameters job = new GridJobParameters();

        @ParametersDelegate
        public CellRunParameters cellRun = new CellRunParameters();

        @Override
        public void validate()
                throws IllegalArgumentException {
            job.validate();
        }

    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final GridJobConfiguration configuration =
                        GridJobConfiguration.loadFromFile(parameters.job.getConfigPath());

                LOG.info("runClient: loaded configuration {}", configuration);

                final GridJob gridJob = new GridJob(configuration, parameters.job);
                final Path outputFile = gridJob.run(parameters.cellRun);

                LOG.info("runClient: exit, wrote {}", outputFile);
            }
        };
        clientRunner.run();
    }

    private static final Logger LOG = LoggerFactory.getLogger(GridRunClient.class);
}
