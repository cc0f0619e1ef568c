package org.scmtiles.client.worker;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.scmtiles.grid.assembly.CellDataset;
import org.scmtiles.grid.dataset.DropList;
import org.scmtiles.grid.dataset.LabeledDataset;
import org.scmtiles.grid.dataset.NetcdfDatasetReader;
import org.scmtiles.grid.spec.Cell;

/**
 * Loads a cell's archived output files into one in-memory dataset labeled with the cell's
 * scalar row and column coordinates.
 */
public class CellDatasetLoader {

    private final NetcdfDatasetReader reader;
    private final DropList dropList;
    private final CoordinateTemplates coordinateTemplates;
    private final String xname;
    private final String yname;

    public CellDatasetLoader(final DropList dropList,
                             final CoordinateTemplates coordinateTemplates,
                             final String xname,
                             final String yname) {
        this.reader = new NetcdfDatasetReader();
        this.dropList = dropList;
        this.coordinateTemplates = coordinateTemplates;
        this.xname = xname;
        this.yname = yname;
    }

    /**
     * @param  cell   cell the files belong to.
     * @param  files  the cell's output files.
     *
     * @throws IOException
     *   if any file cannot be read or the files hold conflicting values.
     */
    public CellDataset load(final Cell cell,
                            final List<Path> files)
            throws IOException {

        final List<LabeledDataset> datasets = new ArrayList<>(files.size());
        for (final Path file : files) {
            datasets.add(reader.read(file, dropList));
        }

        LabeledDataset dataset;
        try {
            dataset = LabeledDataset.merge(datasets);

            // outputs written on a length 1 grid are reduced to the cell before relabeling
            for (final String gridDimension : new String[] { yname, xname }) {
                if (dataset.hasDimension(gridDimension)) {
                    dataset = dataset.selectIndex(gridDimension, 0);
                }
            }

            dataset = dataset
                    .withCoordinate(yname, coordinateTemplates.getYCoordinate(cell.getYGlobal()))
                    .withCoordinate(xname, coordinateTemplates.getXCoordinate(cell.getXGlobal()));

        } catch (final IllegalArgumentException e) {
            throw new IOException("the files " + files + " for cell " + cell + " cannot be combined", e);
        }

        return new CellDataset(cell, dataset);
    }

}
