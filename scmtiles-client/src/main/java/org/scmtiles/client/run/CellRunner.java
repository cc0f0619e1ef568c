package org.scmtiles.client.run;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.scmtiles.client.parameter.CellRunParameters;
import org.scmtiles.grid.dataset.DatasetWriteOptions;
import org.scmtiles.grid.dataset.LabeledDataset;
import org.scmtiles.grid.dataset.NetcdfDatasetWriter;
import org.scmtiles.grid.spec.Cell;
import org.scmtiles.grid.spec.GridJobConfiguration;
import org.scmtiles.grid.time.TimeCoordinateTransformer;
import org.scmtiles.grid.util.FileUtil;
import org.scmtiles.grid.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the single column model for one cell at a time.
 *
 * Each run stages a private run directory (template entries plus the cell's model input file),
 * executes the model there, verifies and archives its outputs, and finally deletes or relocates
 * the run directory (see {@link CellRunState#getCleanupAction}).
 *
 * Instances only read shared state, so one runner can serve several worker threads.
 */
public class CellRunner
        implements CellResultSource {

    public static final String MODEL_EXECUTABLE = "master1c.exe";
    public static final String MODEL_INPUT_FILE = "scm_in.nc";

    /** Files the model must write (non-empty) for a run to succeed. */
    public static final List<String> REQUIRED_OUTPUT_FILES =
            Collections.unmodifiableList(Arrays.asList("onecol.r", "progvar.nc", "diagvar.nc", "diagvar2.nc"));

    /** Model output files that are moved to the output directory. */
    public static final List<String> ARCHIVED_OUTPUT_FILES =
            Collections.unmodifiableList(Arrays.asList("diagvar.nc", "diagvar2.nc", "progvar.nc"));

    public static final String FAILED_RUN_PREFIX = "failed";
    public static final String STANDARD_OUTPUT_FILE = "stdout.txt";
    public static final String STANDARD_ERROR_FILE = "stderr.txt";

    private final GridJobConfiguration configuration;
    private final CellRunParameters runParameters;
    private final LabeledDataset modelInput;
    private final String jobTimestamp;
    private final NetcdfDatasetWriter writer;

    /**
     * @param  configuration  job configuration.
     * @param  runParameters  run directory options.
     * @param  modelInput     gridded input with model form time coordinates
     *                        (see {@link TimeCoordinateTransformer#toModelForm(LabeledDataset)}).
     */
    public CellRunner(final GridJobConfiguration configuration,
                      final CellRunParameters runParameters,
                      final LabeledDataset modelInput) {
        this.configuration = configuration;
        this.runParameters = runParameters;
        this.modelInput = modelInput;
        this.jobTimestamp = configuration.getJobTimestamp();
        this.writer = new NetcdfDatasetWriter();
    }

    @Override
    public RunResult getResult(final Cell cell) {
        return runCell(cell);
    }

    /**
     * Runs the model for the specified cell.
     * Cell level failures are logged and returned as failed results.
     */
    public RunResult runCell(final Cell cell) {

        LOG.debug("runCell: entry, cell={}", cell);

        final ProcessTimer timer = new ProcessTimer();
        final CellRun run = new CellRun(cell, getRunDirectory(configuration.getWorkDirectory(), jobTimestamp, cell));

        List<Path> archivedFiles = null;
        CellRunException failure = null;
        try {
            stage(run);
            execute(run);
            verify(run);
            archivedFiles = archive(run);
        } catch (final CellRunException e) {
            failure = e;
            run.moveTo(CellRunState.FAILED);
        }

        final ArchiveRecord archiveRecord = cleanup(run);

        final RunResult result;
        if (failure == null) {
            result = RunResult.success(cell, archivedFiles, run.runDirectory);
            LOG.info("runCell: cell {} completed in {}", cell, timer);
        } else {
            result = RunResult.failure(cell, failure.getFailureKind(), failure.getMessage(), archiveRecord);
            LOG.error("runCell: cell {} failed after {} with {}", cell, timer, failure.getMessage());
        }

        return result;
    }

    private void stage(final CellRun run)
            throws CellRunException {

        final Path runDirectory = run.runDirectory;
        try {
            if (Files.exists(runDirectory)) {
                LOG.warn("stage: removing stale run directory {}", runDirectory);
                FileUtil.deleteRecursive(runDirectory.toFile());
            }
            Files.createDirectories(runDirectory);

            final Path templateDirectory = configuration.getTemplateDirectory();
            if (templateDirectory != null) {
                final List<Path> entries;
                try (final Stream<Path> stream = Files.list(templateDirectory)) {
                    entries = stream.collect(Collectors.toList());
                }
                for (final Path entry : entries) {
                    final Path target = runDirectory.resolve(entry.getFileName());
                    if (! runParameters.copyTemplate) {
                        Files.createSymbolicLink(target, entry.toAbsolutePath());
                    } else if (Files.isDirectory(entry)) {
                        FileUtils.copyDirectory(entry.toFile(), target.toFile());
                    } else {
                        Files.copy(entry, target, StandardCopyOption.COPY_ATTRIBUTES);
                    }
                }
            }

            final LabeledDataset cellInput = modelInput
                    .selectIndex(configuration.getYname(), run.cell.getYGlobal())
                    .selectIndex(configuration.getXname(), run.cell.getXGlobal());

            writer.write(cellInput,
                         runDirectory.resolve(MODEL_INPUT_FILE),
                         DatasetWriteOptions.withUnboundedDimension(TimeCoordinateTransformer.TIME));

        } catch (final IOException | IllegalArgumentException e) {
            throw new CellRunException(FailureKind.STAGING,
                                       "failed to stage " + runDirectory + ", " + e.getMessage(),
                                       e);
        }

        run.moveTo(CellRunState.STAGED);
    }

    private void execute(final CellRun run)
            throws CellRunException {

        final Path executable = run.runDirectory.resolve(MODEL_EXECUTABLE);
        if (! Files.exists(executable)) {
            throw new CellRunException(FailureKind.EXECUTABLE_MISSING,
                                       "cannot locate " + MODEL_EXECUTABLE + " in " + run.runDirectory +
                                       ", check the template directory " + configuration.getTemplateDirectory());
        }
        if (! Files.isExecutable(executable)) {
            throw new CellRunException(FailureKind.NOT_EXECUTABLE,
                                       executable + " is not executable");
        }

        final ProcessBuilder processBuilder =
                new ProcessBuilder("./" + MODEL_EXECUTABLE).
                        directory(run.runDirectory.toFile()).
                        redirectOutput(ProcessBuilder.Redirect.PIPE).
                        redirectError(ProcessBuilder.Redirect.PIPE);

        LOG.debug("execute: running {} in {}", processBuilder.command(), run.runDirectory);

        final Process process;
        try {
            process = processBuilder.start();
        } catch (final IOException e) {
            throw new CellRunException(FailureKind.LAUNCH_FAILURE,
                                       "failed to start " + executable + ", " + e.getMessage(),
                                       e);
        }

        try (final InputStream processStandardOut = process.getInputStream();
             final InputStream processStandardError = process.getErrorStream()) {

            // read stderr on another thread so a full pipe can not block the model
            final CompletableFuture<String> standardError = CompletableFuture.supplyAsync(() -> {
                try {
                    return IOUtils.toString(processStandardError, StandardCharsets.UTF_8);
                } catch (final IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
            final String standardOutput = IOUtils.toString(processStandardOut, StandardCharsets.UTF_8);
            final int returnCode = process.waitFor();

            run.processResult = new ModelProcessResult(returnCode, standardOutput, standardError.get());

        } catch (final IOException | ExecutionException e) {
            process.destroy();
            throw new CellRunException(FailureKind.LAUNCH_FAILURE,
                                       "failed to capture output of " + executable + ", " + e.getMessage(),
                                       e);
        } catch (final InterruptedException e) {
            process.destroy();
            Thread.currentThread().interrupt();
            throw new CellRunException(FailureKind.LAUNCH_FAILURE,
                                       "interrupted while waiting for " + executable,
                                       e);
        }

        if (! run.processResult.isSuccessful()) {
            throw new CellRunException(FailureKind.NONZERO_EXIT,
                                       "code " + run.processResult.getExitCode() + " returned from " +
                                       processBuilder.command() + " in " + run.runDirectory);
        }

        run.moveTo(CellRunState.EXECUTED);
    }

    private void verify(final CellRun run)
            throws CellRunException {

        final List<String> missingOrEmpty = new ArrayList<>();
        for (final String fileName : REQUIRED_OUTPUT_FILES) {
            final File file = run.runDirectory.resolve(fileName).toFile();
            if (! file.isFile() || (file.length() == 0)) {
                missingOrEmpty.add(fileName);
            }
        }

        if (missingOrEmpty.size() > 0) {
            throw new CellRunException(FailureKind.VERIFICATION,
                                       "model output files " + missingOrEmpty + " are missing or empty in " +
                                       run.runDirectory);
        }

        run.moveTo(CellRunState.VERIFIED);
    }

    private List<Path> archive(final CellRun run)
            throws CellRunException {

        final Path outputDirectory = configuration.getOutputDirectory();
        if (! Files.isDirectory(outputDirectory)) {
            throw new CellRunException(FailureKind.ARCHIVAL,
                                       "output directory " + outputDirectory + " does not exist");
        }

        final List<Path> archivedFiles = new ArrayList<>(ARCHIVED_OUTPUT_FILES.size());
        for (final String fileName : ARCHIVED_OUTPUT_FILES) {
            final Path source = run.runDirectory.resolve(fileName);
            final Path destination = getArchivedFile(outputDirectory, fileName, jobTimestamp, run.cell);
            try {
                // results of an earlier run of the same job are replaced
                if (Files.deleteIfExists(destination)) {
                    LOG.warn("archive: removed earlier result {}", destination);
                }
                FileUtils.moveFile(source.toFile(), destination.toFile());
            } catch (final IOException e) {
                throw new CellRunException(FailureKind.ARCHIVAL,
                                           "failed to move " + source + " to " + destination +
                                           " (already archived: " + archivedFiles + "), " + e.getMessage(),
                                           e);
            }
            archivedFiles.add(destination);
        }

        run.moveTo(CellRunState.ARCHIVED);

        return archivedFiles;
    }

    private ArchiveRecord cleanup(final CellRun run) {

        final CellRunState.CleanupAction action = run.state.getCleanupAction(runParameters.archiveFailedRuns);
        final ModelProcessResult processResult = run.processResult;
        final File runDirectory = run.runDirectory.toFile();

        ArchiveRecord archiveRecord = null;

        if (action == CellRunState.CleanupAction.RELOCATE_RUN_DIRECTORY) {

            Path relocatedDirectory = null;
            if (runDirectory.isDirectory()) {
                final Path destination = configuration.getOutputDirectory().resolve(
                        FAILED_RUN_PREFIX + "." + jobTimestamp + "." + run.cell.getCellId());
                try {
                    if (processResult != null) {
                        FileUtils.writeStringToFile(new File(runDirectory, STANDARD_OUTPUT_FILE),
                                                    processResult.getStandardOutput(),
                                                    StandardCharsets.UTF_8);
                        FileUtils.writeStringToFile(new File(runDirectory, STANDARD_ERROR_FILE),
                                                    processResult.getStandardError(),
                                                    StandardCharsets.UTF_8);
                    }
                    FileUtils.moveDirectory(runDirectory, destination.toFile());
                    relocatedDirectory = destination;
                    LOG.info("cleanup: moved failed run directory for cell {} to {}", run.cell, destination);
                } catch (final IOException e) {
                    LOG.warn("cleanup: failed to move run directory " + runDirectory + " to " + destination +
                             ", ignoring error", e);
                }
            }

            archiveRecord = processResult == null ?
                            new ArchiveRecord(relocatedDirectory, null, null) :
                            new ArchiveRecord(relocatedDirectory,
                                              processResult.getStandardOutput(),
                                              processResult.getStandardError());

        } else if (runDirectory.exists()) {
            FileUtil.deleteRecursive(runDirectory);
        }

        run.moveTo(CellRunState.CLEANED);

        return archiveRecord;
    }

    /**
     * @return run directory for a cell: {@code <workDirectory>/<timestamp>.<cellId>}.
     */
    public static Path getRunDirectory(final Path workDirectory,
                                       final String jobTimestamp,
                                       final Cell cell) {
        return workDirectory.resolve(jobTimestamp + "." + cell.getCellId());
    }

    /**
     * @return archived location of a model output file, e.g. {@code diagvar.20090406_010000.y0001x0002.nc}.
     */
    public static Path getArchivedFile(final Path outputDirectory,
                                       final String fileName,
                                       final String jobTimestamp,
                                       final Cell cell) {
        final int extensionStart = fileName.lastIndexOf('.');
        final String base = extensionStart < 0 ? fileName : fileName.substring(0, extensionStart);
        final String extension = extensionStart < 0 ? "" : fileName.substring(extensionStart);
        return outputDirectory.resolve(base + "." + jobTimestamp + "." + cell.getCellId() + extension);
    }

    /** Mutable state of one run, confined to the calling thread. */
    private static class CellRun {

        private final Cell cell;
        private final Path runDirectory;
        private CellRunState state;
        private ModelProcessResult processResult;

        private CellRun(final Cell cell,
                        final Path runDirectory) {
            this.cell = cell;
            this.runDirectory = runDirectory;
            this.state = CellRunState.INIT;
            this.processResult = null;
        }

        private void moveTo(final CellRunState next)
                throws IllegalStateException {
            if (! state.canTransitionTo(next)) {
                throw new IllegalStateException("cell " + cell + " cannot move from " + state + " to " + next);
            }
            LOG.debug("moveTo: cell {} {} -> {}", cell, state, next);
            state = next;
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(CellRunner.class);
}
