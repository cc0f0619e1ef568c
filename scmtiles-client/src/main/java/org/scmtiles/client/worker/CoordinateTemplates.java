package org.scmtiles.client.worker;

import java.io.IOException;
import java.nio.file.Path;

import org.scmtiles.grid.assembly.GridAssemblyException;
import org.scmtiles.grid.dataset.DataArray;
import org.scmtiles.grid.dataset.LabeledDataset;
import org.scmtiles.grid.dataset.NetcdfDatasetReader;

/**
 * Row and column coordinate values of the grid, used to label each cell's results with
 * the latitude and longitude of the cell.
 */
public class CoordinateTemplates {

    private final String xname;
    private final String yname;
    private final DataArray xCoordinate;
    private final DataArray yCoordinate;

    private CoordinateTemplates(final String xname,
                                final String yname,
                                final DataArray xCoordinate,
                                final DataArray yCoordinate) {
        this.xname = xname;
        this.yname = yname;
        this.xCoordinate = xCoordinate;
        this.yCoordinate = yCoordinate;
    }

    /**
     * @return scalar column coordinate (with the template's attributes) for the specified global column.
     */
    public DataArray getXCoordinate(final int xGlobal) {
        return xCoordinate.selectIndex(xname, xGlobal);
    }

    /**
     * @return scalar row coordinate (with the template's attributes) for the specified global row.
     */
    public DataArray getYCoordinate(final int yGlobal) {
        return yCoordinate.selectIndex(yname, yGlobal);
    }

    /**
     * @return true if row coordinate values decrease with the global row index.
     */
    public boolean isYDescending() {
        final double[] values = yCoordinate.getValues();
        return (values.length > 1) && (values[0] > values[values.length - 1]);
    }

    public int getXsize() {
        return xCoordinate.getSize();
    }

    public int getYsize() {
        return yCoordinate.getSize();
    }

    /**
     * Extracts templates from a gridded dataset.
     *
     * @throws GridAssemblyException
     *   if the dataset's grid coordinates are missing or do not match the grid size.
     */
    public static CoordinateTemplates fromDataset(final LabeledDataset dataset,
                                                  final String xname,
                                                  final String yname,
                                                  final int xsize,
                                                  final int ysize)
            throws GridAssemblyException {

        final DataArray xCoordinate = getDimensionCoordinate(dataset, xname, xsize);
        final DataArray yCoordinate = getDimensionCoordinate(dataset, yname, ysize);

        return new CoordinateTemplates(xname, yname, xCoordinate, yCoordinate);
    }

    /**
     * Loads templates from the job's gridded input file.
     *
     * @throws GridAssemblyException
     *   if the file cannot be read or its grid coordinates do not match the grid size.
     */
    public static CoordinateTemplates load(final Path inputFile,
                                           final String xname,
                                           final String yname,
                                           final int xsize,
                                           final int ysize)
            throws GridAssemblyException {

        final LabeledDataset dataset;
        try {
            dataset = new NetcdfDatasetReader().read(inputFile);
        } catch (final IOException e) {
            throw new GridAssemblyException("failed to open input file " + inputFile, e);
        }

        return fromDataset(dataset, xname, yname, xsize, ysize);
    }

    private static DataArray getDimensionCoordinate(final LabeledDataset dataset,
                                                    final String name,
                                                    final int expectedSize)
            throws GridAssemblyException {

        if (! dataset.isDimensionCoordinate(name)) {
            throw new GridAssemblyException(
                    "failed to extract template coordinate '" + name + "', check grid dimensions in " +
                    "configuration match those in the input file");
        }

        final DataArray coordinate = dataset.getVariable(name);
        if (coordinate.getSize() != expectedSize) {
            throw new GridAssemblyException(
                    "template coordinate '" + name + "' has " + coordinate.getSize() +
                    " values but the configured grid size is " + expectedSize);
        }

        return coordinate;
    }

}
