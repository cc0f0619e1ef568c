package org.scmtiles.client;

import org.junit.Assert;
import org.junit.Test;
import org.scmtiles.client.parameter.CommandLineParameters;

/**
 * Tests the {@link GridRunClient} class.
 */
public class GridRunClientTest {

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new GridRunClient.Parameters());
    }

    @Test
    public void testParsedValues() throws Exception {
        final GridRunClient.Parameters parameters = new GridRunClient.Parameters();
        final boolean parsed = parameters.parse(new String[] {
                "--config", "job.json", "--numWorkers", "4", "--archiveFailedRuns"
        }, GridRunClient.class, false);

        Assert.assertTrue("arguments should be parsed", parsed);
        Assert.assertEquals("invalid config", "job.json", parameters.job.getConfigPath().toString());
        Assert.assertEquals("invalid worker count", Integer.valueOf(4), parameters.job.numWorkers);
        Assert.assertEquals("invalid default row height", Integer.valueOf(1), parameters.job.rowHeight);
        Assert.assertEquals("invalid default drop list", "dropvars.txt", parameters.job.dropList);
        Assert.assertTrue("failed runs should be archived", parameters.cellRun.archiveFailedRuns);
        Assert.assertFalse("template should be linked by default", parameters.cellRun.copyTemplate);
    }

    @Test
    public void testInvalidCountsFailValidation() throws Exception {
        Assert.assertFalse("zero workers should fail",
                           new GridRunClient.Parameters().parse(new String[] {
                                   "--config", "job.json", "--numWorkers", "0"
                           }, GridRunClient.class, false));
        Assert.assertFalse("negative row height should fail",
                           new GridPostProcessClient.Parameters().parse(new String[] {
                                   "--config", "job.json", "--rowHeight", "-1"
                           }, GridPostProcessClient.class, false));
    }

    @Test
    public void testMissingConfig() throws Exception {
        final GridRunClient.Parameters parameters = new GridRunClient.Parameters();
        Assert.assertFalse("missing --config should fail",
                           parameters.parse(new String[] { "--numWorkers", "2" }, GridRunClient.class, false));
    }

}
