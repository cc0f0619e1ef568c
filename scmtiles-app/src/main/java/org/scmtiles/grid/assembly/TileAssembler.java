package org.scmtiles.grid.assembly;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import org.scmtiles.grid.dataset.LabeledDataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges the cell datasets of one tile into a single tile dataset.
 *
 * Cells are grouped by row, each row is joined along the column (x) dimension in ascending column order,
 * and rows are then joined along the row (y) dimension in ascending row order.
 * The order in which cell results are provided does not matter.
 */
public class TileAssembler {

    private final String xname;
    private final String yname;

    /**
     * @param  xname  name of the column dimension and its scalar cell coordinate (e.g. "lon").
     * @param  yname  name of the row dimension and its scalar cell coordinate (e.g. "lat").
     */
    public TileAssembler(final String xname,
                         final String yname) {
        this.xname = xname;
        this.yname = yname;
    }

    /**
     * @param  tileId        identifies the tile.
     * @param  cellDatasets  successful cell results for the tile, in any order.
     *
     * @return the merged tile dataset, or an empty result if no cell succeeded.
     *
     * @throws IllegalArgumentException
     *   if the cell datasets cannot be joined (e.g. they hold different variables).
     */
    public Optional<TileDataset> assemble(final int tileId,
                                          final List<CellDataset> cellDatasets)
            throws IllegalArgumentException {

        if (cellDatasets.isEmpty()) {
            LOG.warn("assemble: no cell results available for tile {}", tileId);
            return Optional.empty();
        }

        final Map<Integer, List<CellDataset>> rows = new TreeMap<>();
        for (final CellDataset cellDataset : cellDatasets) {
            rows.computeIfAbsent(cellDataset.getCell().getYGlobal(), y -> new ArrayList<>()).add(cellDataset);
        }

        final List<LabeledDataset> rowDatasets = new ArrayList<>(rows.size());
        for (final List<CellDataset> row : rows.values()) {
            row.sort(Comparator.comparingInt(cellDataset -> cellDataset.getCell().getXGlobal()));
            final List<LabeledDataset> columnDatasets = new ArrayList<>(row.size());
            for (final CellDataset cellDataset : row) {
                columnDatasets.add(cellDataset.getDataset());
            }
            rowDatasets.add(LabeledDataset.concatenate(columnDatasets, xname));
        }

        final LabeledDataset tileDataset;
        if (rowDatasets.size() == 1) {
            tileDataset = rowDatasets.get(0);
        } else {
            tileDataset = LabeledDataset.concatenate(rowDatasets, yname);
        }

        final double maxRowCoordinate = tileDataset.getVariable(yname).getMaxValue();

        LOG.info("assemble: merged {} cells in {} rows for tile {}", cellDatasets.size(), rowDatasets.size(), tileId);

        return Optional.of(new TileDataset(tileId, maxRowCoordinate, tileDataset));
    }

    private static final Logger LOG = LoggerFactory.getLogger(TileAssembler.class);
}
