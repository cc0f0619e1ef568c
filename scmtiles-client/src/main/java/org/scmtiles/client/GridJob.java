package org.scmtiles.client;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.scmtiles.client.parameter.CellRunParameters;
import org.scmtiles.client.parameter.GridJobParameters;
import org.scmtiles.client.run.ArchivedCellResults;
import org.scmtiles.client.run.CellResultSource;
import org.scmtiles.client.run.CellRunner;
import org.scmtiles.client.worker.CellDatasetLoader;
import org.scmtiles.client.worker.CleanupCoordinator;
import org.scmtiles.client.worker.CoordinateTemplates;
import org.scmtiles.client.worker.TileResult;
import org.scmtiles.client.worker.TileTaskScheduler;
import org.scmtiles.client.worker.TileWorker;
import org.scmtiles.grid.assembly.GridAssembler;
import org.scmtiles.grid.assembly.GridAssemblyException;
import org.scmtiles.grid.assembly.TileAssembler;
import org.scmtiles.grid.assembly.TileDataset;
import org.scmtiles.grid.dataset.DatasetWriteOptions;
import org.scmtiles.grid.dataset.DropList;
import org.scmtiles.grid.dataset.LabeledDataset;
import org.scmtiles.grid.dataset.NetcdfDatasetReader;
import org.scmtiles.grid.dataset.NetcdfDatasetWriter;
import org.scmtiles.grid.spec.GridDecomposer;
import org.scmtiles.grid.spec.GridJobConfiguration;
import org.scmtiles.grid.spec.Tile;
import org.scmtiles.grid.time.TimeCoordinateTransformer;
import org.scmtiles.grid.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordinates a grid job: decomposes the grid into row tiles, has workers produce and merge
 * the cell results of each tile, assembles the tiles into the grid output file
 * and optionally removes the intermediate cell files.
 */
public class GridJob {

    public static final String OUTPUT_FILE_PREFIX = "scm_out";

    private final GridJobConfiguration configuration;
    private final GridJobParameters jobParameters;

    /**
     * @throws IllegalArgumentException
     *   if the configuration or parameters are invalid.
     */
    public GridJob(final GridJobConfiguration configuration,
                   final GridJobParameters jobParameters)
            throws IllegalArgumentException {
        configuration.validate();
        jobParameters.validate();
        this.configuration = configuration;
        this.jobParameters = jobParameters;
    }

    /**
     * Runs the model for every cell and assembles the results.
     *
     * @return path of the written grid file.
     *
     * @throws IllegalArgumentException
     *   if the template directory is missing or the output or work directories cannot be used.
     *
     * @throws GridAssemblyException
     *   if the input cannot be loaded or the grid cannot be assembled or written.
     */
    public Path run(final CellRunParameters runParameters)
            throws IllegalArgumentException, IOException, GridAssemblyException {

        final Path templateDirectory = configuration.getTemplateDirectory();
        if (templateDirectory == null) {
            throw new IllegalArgumentException("templateDirectory must be specified to run the model");
        } else if (! Files.isDirectory(templateDirectory)) {
            throw new IllegalArgumentException("templateDirectory " + templateDirectory + " is not a directory");
        }

        FileUtil.ensureWritableDirectory(configuration.getOutputDirectory());
        FileUtil.ensureWritableDirectory(configuration.getWorkDirectory());

        final Path inputFile = configuration.getInputFile();
        LOG.info("run: loading input {}", inputFile);

        final LabeledDataset input;
        final LabeledDataset modelInput;
        try {
            input = new NetcdfDatasetReader().read(inputFile);
            modelInput = getTimeTransformer().toModelForm(input);
        } catch (final IOException | IllegalArgumentException e) {
            throw new GridAssemblyException("failed to load model input from " + inputFile, e);
        }

        final CoordinateTemplates coordinateTemplates =
                CoordinateTemplates.fromDataset(input,
                                                configuration.getXname(),
                                                configuration.getYname(),
                                                configuration.getXsize(),
                                                configuration.getYsize());

        final CellRunner cellRunner = new CellRunner(configuration, runParameters, modelInput);

        return processGrid(cellRunner, coordinateTemplates);
    }

    /**
     * Assembles the archived results of an earlier run without running the model.
     *
     * @return path of the written grid file.
     *
     * @throws GridAssemblyException
     *   if the coordinate templates cannot be loaded or the grid cannot be assembled or written.
     */
    public Path postProcess()
            throws IOException, GridAssemblyException {

        LOG.info("postProcess: loading coordinate templates from {}", configuration.getInputFile());

        final CoordinateTemplates coordinateTemplates =
                CoordinateTemplates.load(configuration.getInputFile(),
                                         configuration.getXname(),
                                         configuration.getYname(),
                                         configuration.getXsize(),
                                         configuration.getYsize());

        final ArchivedCellResults archivedCellResults =
                new ArchivedCellResults(configuration.getOutputDirectory(),
                                        configuration.getWorkDirectory(),
                                        configuration.getJobTimestamp());

        return processGrid(archivedCellResults, coordinateTemplates);
    }

    public Path getOutputFile() {
        return configuration.getOutputDirectory().resolve(
                OUTPUT_FILE_PREFIX + "." + configuration.getJobTimestamp() + ".nc");
    }

    private TimeCoordinateTransformer getTimeTransformer() {
        return new TimeCoordinateTransformer(configuration.getStartTime());
    }

    private Path processGrid(final CellResultSource cellResultSource,
                             final CoordinateTemplates coordinateTemplates)
            throws IOException, GridAssemblyException {

        final String xname = configuration.getXname();
        final String yname = configuration.getYname();

        final DropList dropList = DropList.load(jobParameters.getDropListPath());
        LOG.info("processGrid: using {}", dropList);

        final GridDecomposer decomposer = new GridDecomposer(configuration.getXsize(), configuration.getYsize());
        final List<Tile> tiles = decomposer.decomposeByRows(jobParameters.rowHeight);

        final TileWorker worker = new TileWorker(cellResultSource,
                                                 new CellDatasetLoader(dropList, coordinateTemplates, xname, yname),
                                                 new TileAssembler(xname, yname));

        final TileTaskScheduler scheduler = new TileTaskScheduler(jobParameters.numWorkers);
        final List<TileResult> tileResults = scheduler.processTiles(tiles, worker);

        final List<TileDataset> tileDatasets = new ArrayList<>(tileResults.size());
        int successfulCellCount = 0;
        int failedCellCount = 0;
        for (final TileResult tileResult : tileResults) {
            tileResult.getTileDataset().ifPresent(tileDatasets::add);
            successfulCellCount += tileResult.getSuccessCount();
            failedCellCount += tileResult.getFailureCount();
        }

        LOG.info("processGrid: {} cells succeeded, {} cells failed, {} of {} tiles have usable data",
                 successfulCellCount, failedCellCount, tileDatasets.size(), tiles.size());

        final GridAssembler gridAssembler = new GridAssembler(xname,
                                                              yname,
                                                              getTimeTransformer(),
                                                              coordinateTemplates.isYDescending());
        final LabeledDataset grid = gridAssembler.assemble(tileDatasets);

        final Path outputFile = getOutputFile();
        LOG.info("processGrid: writing grid to {}", outputFile);
        try {
            new NetcdfDatasetWriter().write(grid,
                                            outputFile,
                                            DatasetWriteOptions.withUnboundedDimension(TimeCoordinateTransformer.TIME));
        } catch (final IOException | IllegalArgumentException e) {
            Files.deleteIfExists(outputFile);
            throw new GridAssemblyException("failed to write grid to " + outputFile, e);
        }

        if (jobParameters.deleteCellFiles) {
            new CleanupCoordinator().deleteCellFiles(tileResults);
        }

        return outputFile;
    }

    private static final Logger LOG = LoggerFactory.getLogger(GridJob.class);
}
