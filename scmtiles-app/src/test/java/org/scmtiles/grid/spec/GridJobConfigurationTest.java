package org.scmtiles.grid.spec;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Tests the {@link GridJobConfiguration} class.
 */
public class GridJobConfigurationTest {

    private Path configFile;

    @Before
    public void setup() throws Exception {
        configFile = File.createTempFile("grid_job_", ".json").toPath();
    }

    @After
    public void tearDown() throws Exception {
        Files.deleteIfExists(configFile);
    }

    @Test
    public void testLoadFromFile() throws Exception {

        writeConfig("{\n" +
                    "  \"startTime\": \"2009-04-06T01:00:00\",\n" +
                    "  \"xsize\": 4,\n" +
                    "  \"ysize\": 3,\n" +
                    "  \"inputDirectory\": \"/data/forcing\",\n" +
                    "  \"inputFilePattern\": \"scm_in.{timestamp}.nc\",\n" +
                    "  \"outputDirectory\": \"/data/output\",\n" +
                    "  \"templateDirectory\": \"/data/template\"\n" +
                    "}");

        final GridJobConfiguration configuration = GridJobConfiguration.loadFromFile(configFile);

        Assert.assertEquals("invalid start time",
                            Instant.parse("2009-04-06T01:00:00Z"), configuration.getStartTime());
        Assert.assertEquals("invalid timestamp", "20090406_010000", configuration.getJobTimestamp());
        Assert.assertEquals("invalid input file",
                            Paths.get("/data/forcing/scm_in.20090406_010000.nc"), configuration.getInputFile());
        Assert.assertEquals("work directory should default to output directory",
                            Paths.get("/data/output"), configuration.getWorkDirectory());
        Assert.assertEquals("invalid default xname", "lon", configuration.getXname());
        Assert.assertEquals("invalid default yname", "lat", configuration.getYname());
    }

    @Test(expected = IOException.class)
    public void testUnknownPropertyIsRejected() throws Exception {
        writeConfig("{ \"startTime\": \"2009-04-06T01:00:00\", \"xsize\": 1, \"ysize\": 1, \"gridSize\": 4 }");
        GridJobConfiguration.loadFromFile(configFile);
    }

    @Test
    public void testValidate() {
        validateFails("bad start time", new GridJobConfiguration("2009-04-06 01:00", 1, 1, "in", "f.nc", "out",
                                                                 null, null, "lon", "lat"));
        validateFails("zero xsize", new GridJobConfiguration("2009-04-06T01:00:00", 0, 1, "in", "f.nc", "out",
                                                             null, null, "lon", "lat"));
        validateFails("missing output", new GridJobConfiguration("2009-04-06T01:00:00", 1, 1, "in", "f.nc", " ",
                                                                 null, null, "lon", "lat"));
        validateFails("same grid names", new GridJobConfiguration("2009-04-06T01:00:00", 1, 1, "in", "f.nc", "out",
                                                                  null, null, "lat", "lat"));
    }

    private void writeConfig(final String json) throws IOException {
        Files.write(configFile, json.getBytes(StandardCharsets.UTF_8));
    }

    private static void validateFails(final String context,
                                      final GridJobConfiguration configuration) {
        try {
            configuration.validate();
            Assert.fail(context + " should have failed validation");
        } catch (final IllegalArgumentException e) {
            // expected
        }
    }
}
