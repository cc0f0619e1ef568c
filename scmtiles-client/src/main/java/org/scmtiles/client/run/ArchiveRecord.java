package org.scmtiles.client.run;

import java.nio.file.Path;

/**
 * What was kept for a failed cell run.
 * The relocated directory is null when the run directory was not kept or could not be moved.
 * Standard output and error are null when the model process never ran.
 */
public class ArchiveRecord {

    private final Path relocatedRunDirectory;
    private final String standardOutput;
    private final String standardError;

    public ArchiveRecord(final Path relocatedRunDirectory,
                         final String standardOutput,
                         final String standardError) {
        this.relocatedRunDirectory = relocatedRunDirectory;
        this.standardOutput = standardOutput;
        this.standardError = standardError;
    }

    public Path getRelocatedRunDirectory() {
        return relocatedRunDirectory;
    }

    public String getStandardOutput() {
        return standardOutput;
    }

    public String getStandardError() {
        return standardError;
    }

    @Override
    public String toString() {
        return "ArchiveRecord{relocatedRunDirectory=" + relocatedRunDirectory + '}';
    }
}
