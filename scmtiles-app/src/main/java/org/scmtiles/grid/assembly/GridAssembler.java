package org.scmtiles.grid.assembly;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.scmtiles.grid.dataset.LabeledDataset;
import org.scmtiles.grid.time.TimeCoordinateTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges tile datasets, returned by workers in any order, into the final grid dataset.
 *
 * Tiles are ordered by their maximum row coordinate value (not by tile id) before they are joined
 * along the row dimension, ascending or descending to match the direction of the grid's row coordinate.
 * The time coordinate is then rebased onto the job reference time and dimensions are put in
 * serialization order: time, level dimensions, row, column.
 */
public class GridAssembler {

    /** Level dimensions of the model output, in serialization order. */
    public static final List<String> LEVEL_DIMENSIONS =
            Collections.unmodifiableList(Arrays.asList("nlev", "nlevp1", "nlevs", "norg", "ntiles", "ncextr"));

    private final String xname;
    private final String yname;
    private final TimeCoordinateTransformer timeTransformer;
    private final boolean descendingRows;

    /**
     * Creates an assembler for a grid with ascending row coordinate values.
     */
    public GridAssembler(final String xname,
                         final String yname,
                         final TimeCoordinateTransformer timeTransformer) {
        this(xname, yname, timeTransformer, false);
    }

    /**
     * @param  descendingRows  true if row coordinate values decrease with the global row index
     *                         (e.g. latitudes listed north to south).
     */
    public GridAssembler(final String xname,
                         final String yname,
                         final TimeCoordinateTransformer timeTransformer,
                         final boolean descendingRows) {
        this.xname = xname;
        this.yname = yname;
        this.timeTransformer = timeTransformer;
        this.descendingRows = descendingRows;
    }

    /**
     * @param  tileDatasets  results for all usable tiles, in any order.
     *
     * @return the merged grid dataset.
     *
     * @throws GridAssemblyException
     *   if no tiles are available or the tiles cannot be merged.
     */
    public LabeledDataset assemble(final Collection<TileDataset> tileDatasets)
            throws GridAssemblyException {

        if (tileDatasets.isEmpty()) {
            throw new GridAssemblyException("no tile produced usable data, grid cannot be assembled");
        }

        final List<TileDataset> sortedTiles = new ArrayList<>(tileDatasets);
        final Comparator<TileDataset> byMaxRow = Comparator.comparingDouble(TileDataset::getMaxRowCoordinate);
        sortedTiles.sort(descendingRows ? byMaxRow.reversed() : byMaxRow);

        final List<LabeledDataset> datasets = new ArrayList<>(sortedTiles.size());
        for (final TileDataset tileDataset : sortedTiles) {
            datasets.add(tileDataset.getDataset());
        }

        final LabeledDataset grid;
        try {
            final LabeledDataset joined = LabeledDataset.concatenate(datasets, yname);
            final LabeledDataset rebased = timeTransformer.toOutputForm(joined);
            grid = rebased.transpose(getSerializationOrder(rebased));
        } catch (final IllegalArgumentException | IllegalStateException e) {
            throw new GridAssemblyException("failed to merge " + sortedTiles.size() + " tiles", e);
        }

        LOG.info("assemble: merged {} tiles into grid with dimensions {}", sortedTiles.size(),
                 grid.getDimensionLengths());

        return grid;
    }

    /**
     * @return time first, then the known level dimensions, then any other dimension in first-seen order,
     *         then row and column.
     */
    public List<String> getSerializationOrder(final LabeledDataset dataset) {
        final List<String> order = new ArrayList<>();
        order.add(TimeCoordinateTransformer.TIME);
        order.addAll(LEVEL_DIMENSIONS);
        for (final String dimension : dataset.getDimensionLengths().keySet()) {
            if (! order.contains(dimension) && ! dimension.equals(yname) && ! dimension.equals(xname)) {
                order.add(dimension);
            }
        }
        order.add(yname);
        order.add(xname);
        return order;
    }

    private static final Logger LOG = LoggerFactory.getLogger(GridAssembler.class);
}
