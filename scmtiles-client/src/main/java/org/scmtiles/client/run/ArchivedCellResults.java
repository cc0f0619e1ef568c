package org.scmtiles.client.run;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.scmtiles.grid.spec.Cell;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the archived output files of an earlier model run without running the model again.
 */
public class ArchivedCellResults
        implements CellResultSource {

    private final Path outputDirectory;
    private final Path workDirectory;
    private final String jobTimestamp;

    public ArchivedCellResults(final Path outputDirectory,
                               final Path workDirectory,
                               final String jobTimestamp) {
        this.outputDirectory = outputDirectory;
        this.workDirectory = workDirectory;
        this.jobTimestamp = jobTimestamp;
    }

    @Override
    public RunResult getResult(final Cell cell) {

        final List<Path> archivedFiles = new ArrayList<>(CellRunner.ARCHIVED_OUTPUT_FILES.size());
        final List<Path> missingFiles = new ArrayList<>();
        for (final String fileName : CellRunner.ARCHIVED_OUTPUT_FILES) {
            final Path path = CellRunner.getArchivedFile(outputDirectory, fileName, jobTimestamp, cell);
            if (Files.isRegularFile(path)) {
                archivedFiles.add(path);
            } else {
                missingFiles.add(path);
            }
        }

        final RunResult result;
        if (missingFiles.isEmpty()) {
            result = RunResult.success(cell,
                                       archivedFiles,
                                       CellRunner.getRunDirectory(workDirectory, jobTimestamp, cell));
        } else {
            final String message = "archived output files " + missingFiles + " do not exist";
            LOG.error("getResult: cell {} failed with {}: {}", cell, FailureKind.VERIFICATION, message);
            result = RunResult.failure(cell, FailureKind.VERIFICATION, message, null);
        }

        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ArchivedCellResults.class);
}
