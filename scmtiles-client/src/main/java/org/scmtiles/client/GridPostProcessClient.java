package org.scmtiles.client;

import com.beust.jcommander.ParametersDelegate;

import java.nio.file.Path;

import org.scmtiles.client.parameter.CommandLineParameters;
import org.scmtiles.client.parameter.GridJobParameters;
import org.scmtiles.grid.spec.GridJobConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for combining the archived cell results of an earlier model run into one grid file.
 */
public class GridPostProcessClient {

    public static class Parameters extends CommandLineParameters {

        @ParametersDelegate
        public GridJobParameters job = new GridJobParameters();

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

                final GridJob gridJob = new GridJob(configuration, parameters.job);
                final Path outputFile = gridJob.postProcess();

                LOG.info("runClient: exit, wrote {}", outputFile);
            }
        };
        clientRunner.run();
    }

    private static final Logger LOG = LoggerFactory.getLogger(GridPostProcessClient.class);
}
