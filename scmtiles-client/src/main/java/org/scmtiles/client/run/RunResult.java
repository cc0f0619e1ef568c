package org.scmtiles.client.run;

import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

import org.scmtiles.grid.spec.Cell;

/**
 * Outcome of one cell run.
 *
 * A successful result lists the archived output files.
 * A failed result has no files and instead identifies the failure kind and message,
 * with an archive record when the failed run directory was kept.
 */
public class RunResult {

    private final Cell cell;
    private final List<Path> archivedFiles;
    private final Path runDirectory;
    private final FailureKind failureKind;
    private final String failureMessage;
    private final ArchiveRecord archiveRecord;

    private RunResult(final Cell cell,
                      final List<Path> archivedFiles,
                      final Path runDirectory,
                      final FailureKind failureKind,
                      final String failureMessage,
                      final ArchiveRecord archiveRecord) {
        this.cell = cell;
        this.archivedFiles = archivedFiles;
        this.runDirectory = runDirectory;
        this.failureKind = failureKind;
        this.failureMessage = failureMessage;
        this.archiveRecord = archiveRecord;
    }

    /**
     * @param  cell           the cell that was run.
     * @param  archivedFiles  output files moved to the output directory.
     * @param  runDirectory   the cell's run directory (may already have been removed).
     */
    public static RunResult success(final Cell cell,
                                    final List<Path> archivedFiles,
                                    final Path runDirectory) {
        return new RunResult(cell,
                             Collections.unmodifiableList(archivedFiles),
                             runDirectory,
                             null,
                             null,
                             null);
    }

    public static RunResult failure(final Cell cell,
                                    final FailureKind failureKind,
                                    final String failureMessage,
                                    final ArchiveRecord archiveRecord) {
        return new RunResult(cell,
                             Collections.emptyList(),
                             null,
                             failureKind,
                             failureMessage,
                             archiveRecord);
    }

    public Cell getCell() {
        return cell;
    }

    public boolean isSuccessful() {
        return failureKind == null;
    }

    public List<Path> getArchivedFiles() {
        return archivedFiles;
    }

    public Path getRunDirectory() {
        return runDirectory;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getFailureMessage() {
        return failureMessage;
    }

    public ArchiveRecord getArchiveRecord() {
        return archiveRecord;
    }

    @Override
    public String toString() {
        return isSuccessful() ?
               "RunResult{cell=" + cell + ", archivedFiles=" + archivedFiles + '}' :
               "RunResult{cell=" + cell + ", failureKind=" + failureKind + ", failureMessage='" + failureMessage + "'}";
    }
}
