package org.scmtiles.grid.spec;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

import org.scmtiles.grid.json.JsonUtils;

/**
 * Static description of a grid job: the reference time, grid size and the
 * directories the job reads from and writes to.
 * Instances are loaded from JSON and are read-only once validated.
 */
public class GridJobConfiguration
        implements Serializable {

    public static final String TIMESTAMP_TOKEN = "{timestamp}";

    private static final DateTimeFormatter START_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private String startTime;
    private int xsize;
    private int ysize;
    private String inputDirectory;
    private String inputFilePattern;
    private String outputDirectory;
    private String workDirectory;
    private String templateDirectory;
    private String xname;
    private String yname;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private GridJobConfiguration() {
        this.xname = "lon";
        this.yname = "lat";
    }

    public GridJobConfiguration(final String startTime,
                                final int xsize,
                                final int ysize,
                                final String inputDirectory,
                                final String inputFilePattern,
                                final String outputDirectory,
                                final String workDirectory,
                                final String templateDirectory,
                                final String xname,
                                final String yname) {
        this.startTime = startTime;
        this.xsize = xsize;
        this.ysize = ysize;
        this.inputDirectory = inputDirectory;
        this.inputFilePattern = inputFilePattern;
        this.outputDirectory = outputDirectory;
        this.workDirectory = workDirectory;
        this.templateDirectory = templateDirectory;
        this.xname = xname;
        this.yname = yname;
    }

    /**
     * @return the job reference time (UTC).
     */
    public Instant getStartTime() {
        return LocalDateTime.parse(startTime, START_TIME_FORMAT).toInstant(ZoneOffset.UTC);
    }

    /**
     * @return the reference time formatted for artifact names (e.g. "20090406_010000").
     */
    public String getJobTimestamp() {
        return TIMESTAMP_FORMAT.format(LocalDateTime.ofInstant(getStartTime(), ZoneOffset.UTC));
    }

    public int getXsize() {
        return xsize;
    }

    public int getYsize() {
        return ysize;
    }

    public Path getInputFile() {
        final String fileName = inputFilePattern.replace(TIMESTAMP_TOKEN, getJobTimestamp());
        return Paths.get(inputDirectory, fileName);
    }

    public Path getOutputDirectory() {
        return Paths.get(outputDirectory);
    }

    /**
     * @return directory where per-cell run directories are created (defaults to the output directory).
     */
    public Path getWorkDirectory() {
        return workDirectory == null ? getOutputDirectory() : Paths.get(workDirectory);
    }

    public Path getTemplateDirectory() {
        return templateDirectory == null ? null : Paths.get(templateDirectory);
    }

    public String getXname() {
        return xname;
    }

    public String getYname() {
        return yname;
    }

    /**
     * @throws IllegalArgumentException
     *   if any required value is missing or invalid.
     */
    public void validate()
            throws IllegalArgumentException {

        if (startTime == null) {
            throw new IllegalArgumentException("startTime must be specified");
        }
        try {
            LocalDateTime.parse(startTime, START_TIME_FORMAT);
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("startTime '" + startTime + "' must have the form yyyy-MM-ddTHH:mm:ss", e);
        }

        if (xsize <= 0) {
            throw new IllegalArgumentException("xsize must be positive but is " + xsize);
        }
        if (ysize <= 0) {
            throw new IllegalArgumentException("ysize must be positive but is " + ysize);
        }

        validateSpecified("inputDirectory", inputDirectory);
        validateSpecified("inputFilePattern", inputFilePattern);
        validateSpecified("outputDirectory", outputDirectory);
        validateSpecified("xname", xname);
        validateSpecified("yname", yname);

        if (xname.equals(yname)) {
            throw new IllegalArgumentException("xname and yname must differ but are both '" + xname + "'");
        }
    }

    @Override
    public String toString() {
        return JsonUtils.toJson(this);
    }

    /**
     * Loads and validates a configuration file.
     *
     * @throws IOException
     *   if the file cannot be read or parsed.
     *
     * @throws IllegalArgumentException
     *   if the loaded configuration is invalid.
     */
    public static GridJobConfiguration loadFromFile(final Path path)
            throws IOException, IllegalArgumentException {
        final GridJobConfiguration configuration = JsonUtils.loadJsonFile(path, GridJobConfiguration.class);
        configuration.validate();
        return configuration;
    }

    private static void validateSpecified(final String name,
                                          final String value)
            throws IllegalArgumentException {
        if ((value == null) || value.trim().isEmpty()) {
            throw new IllegalArgumentException(name + " must be specified");
        }
    }

}
