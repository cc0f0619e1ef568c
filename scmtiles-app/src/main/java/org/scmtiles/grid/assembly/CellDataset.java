package org.scmtiles.grid.assembly;

import java.io.Serializable;

import org.scmtiles.grid.dataset.LabeledDataset;
import org.scmtiles.grid.spec.Cell;

/**
 * Results of one cell run loaded into memory, tagged with the cell they belong to.
 */
public class CellDataset
        implements Serializable {

    private final Cell cell;
    private final LabeledDataset dataset;

    public CellDataset(final Cell cell,
                       final LabeledDataset dataset) {
        this.cell = cell;
        this.dataset = dataset;
    }

    public Cell getCell() {
        return cell;
    }

    public LabeledDataset getDataset() {
        return dataset;
    }

    @Override
    public String toString() {
        return "CellDataset{cell=" + cell + ", dataset=" + dataset + '}';
    }
}
