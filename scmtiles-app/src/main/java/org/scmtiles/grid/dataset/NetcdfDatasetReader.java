package org.scmtiles.grid.dataset;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.IndexIterator;
import ucar.nc2.Attribute;
import ucar.nc2.Dimension;
import ucar.nc2.NetcdfFile;
import ucar.nc2.Variable;

/**
 * Loads NetCDF files completely into memory as {@link LabeledDataset} instances.
 * The file is closed before the dataset is returned.
 *
 * Dimension coordinates and variables named in a CF 'coordinates' attribute are loaded as coordinates.
 * Character and string variables are not supported and are skipped.
 */
public class NetcdfDatasetReader {

    public LabeledDataset read(final Path path)
            throws IOException {
        return read(path, DropList.absent());
    }

    /**
     * @param  path      file to read.
     * @param  dropList  variables to skip.
     *
     * @throws IOException
     *   if the file cannot be opened or read.
     */
    public LabeledDataset read(final Path path,
                               final DropList dropList)
            throws IOException {

        final NetcdfFile file;
        try {
            file = NetcdfFile.open(path.toString());
        } catch (final IOException e) {
            throw new IOException("failed to open " + path, e);
        }

        LabeledDataset dataset = new LabeledDataset();

        try {

            final Set<String> auxiliaryCoordinateNames = new HashSet<>();
            for (final Variable variable : file.getVariables()) {
                final Attribute coordinates = variable.findAttribute(NetcdfDatasetWriter.COORDINATES_ATTRIBUTE);
                if ((coordinates != null) && coordinates.isString()) {
                    for (final String name : coordinates.getStringValue().trim().split("\\s+")) {
                        auxiliaryCoordinateNames.add(name);
                    }
                }
            }

            for (final Variable variable : file.getVariables()) {

                final String name = variable.getShortName();
                final DataType dataType = variable.getDataType();

                if (dropList.contains(name)) {
                    LOG.debug("read: dropping variable '{}' from {}", name, path);
                    continue;
                }
                if ((dataType == DataType.CHAR) || (dataType == DataType.STRING)) {
                    LOG.debug("read: skipping {} variable '{}' in {}", dataType, name, path);
                    continue;
                }

                final List<String> dimensionNames = new ArrayList<>();
                for (final Dimension dimension : variable.getDimensions()) {
                    dimensionNames.add(dimension.getShortName());
                }

                final Array data = variable.read();
                final double[] values = new double[(int) data.getSize()];
                final IndexIterator iterator = data.getIndexIterator();
                int i = 0;
                while (iterator.hasNext()) {
                    values[i++] = iterator.getDoubleNext();
                }

                final Map<String, Object> attributes = new LinkedHashMap<>();
                for (final Attribute attribute : variable.getAttributes()) {
                    if (! NetcdfDatasetWriter.COORDINATES_ATTRIBUTE.equals(attribute.getShortName())) {
                        attributes.put(attribute.getShortName(), toAttributeValue(attribute));
                    }
                }

                final DataArray.ValueType valueType =
                        dataType.isIntegral() ? DataArray.ValueType.INT : DataArray.ValueType.DOUBLE;

                final boolean isCoordinate = auxiliaryCoordinateNames.contains(name) ||
                                             ((dimensionNames.size() == 1) && dimensionNames.get(0).equals(name));

                dataset = dataset.withVariable(name,
                                               new DataArray(dimensionNames, data.getShape(), values, valueType, attributes),
                                               isCoordinate);
            }

            for (final Attribute attribute : file.getGlobalAttributes()) {
                dataset = dataset.withAttribute(attribute.getShortName(), toAttributeValue(attribute));
            }

        } catch (final IllegalArgumentException e) {
            throw new IOException("inconsistent data found in " + path, e);
        } finally {
            file.close();
        }

        LOG.debug("read: loaded {} from {}", dataset, path);

        return dataset;
    }

    private static Object toAttributeValue(final Attribute attribute) {
        return attribute.isString() ? attribute.getStringValue() : attribute.getNumericValue();
    }

    private static final Logger LOG = LoggerFactory.getLogger(NetcdfDatasetReader.class);
}
