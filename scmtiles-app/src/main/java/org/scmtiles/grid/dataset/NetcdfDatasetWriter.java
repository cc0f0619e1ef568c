package org.scmtiles.grid.dataset;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.InvalidRangeException;
import ucar.nc2.Attribute;
import ucar.nc2.Dimension;
import ucar.nc2.NetcdfFileWriter;
import ucar.nc2.Variable;

/**
 * Writes {@link LabeledDataset} instances as NetCDF-3 classic files.
 *
 * Non-dimension coordinates are listed in the CF 'coordinates' attribute of each data variable
 * that spans all of the coordinate's dimensions, so that {@link NetcdfDatasetReader} can restore them.
 */
public class NetcdfDatasetWriter {

    public static final String COORDINATES_ATTRIBUTE = "coordinates";

    public void write(final LabeledDataset dataset,
                      final Path path,
                      final DatasetWriteOptions options)
            throws IOException {

        validateUnboundedDimensions(dataset, options);

        final NetcdfFileWriter writer = NetcdfFileWriter.createNew(NetcdfFileWriter.Version.netcdf3, path.toString());

        try {

            final Map<String, Dimension> dimensions = new HashMap<>();
            for (final Map.Entry<String, Integer> entry : dataset.getDimensionLengths().entrySet()) {
                final String name = entry.getKey();
                final Dimension dimension;
                if (options.isUnbounded(name)) {
                    dimension = writer.addUnlimitedDimension(name);
                } else {
                    dimension = writer.addDimension(null, name, entry.getValue());
                }
                dimensions.put(name, dimension);
            }

            final Map<String, Variable> variables = new HashMap<>();
            for (final String name : dataset.getVariableNames()) {
                final DataArray array = dataset.getVariable(name);

                final List<Dimension> variableDimensions = new ArrayList<>(array.getRank());
                for (final String dimensionName : array.getDimensions()) {
                    variableDimensions.add(dimensions.get(dimensionName));
                }

                final Variable variable = writer.addVariable(null, name, toDataType(array), variableDimensions);
                for (final Map.Entry<String, Object> attribute : array.getAttributes().entrySet()) {
                    writer.addVariableAttribute(variable, toAttribute(attribute.getKey(), attribute.getValue()));
                }

                if (! dataset.isCoordinate(name)) {
                    final String coordinates = getAuxiliaryCoordinates(dataset, array);
                    if (coordinates.length() > 0) {
                        writer.addVariableAttribute(variable, new Attribute(COORDINATES_ATTRIBUTE, coordinates));
                    }
                }

                variables.put(name, variable);
            }

            for (final Map.Entry<String, Object> attribute : dataset.getAttributes().entrySet()) {
                writer.addGroupAttribute(null, toAttribute(attribute.getKey(), attribute.getValue()));
            }

            writer.create();

            for (final String name : dataset.getVariableNames()) {
                writer.write(variables.get(name), toArray(dataset.getVariable(name)));
            }

        } catch (final InvalidRangeException e) {
            throw new IOException("failed to write data to " + path, e);
        } finally {
            writer.close();
        }

        LOG.debug("write: wrote {} to {}", dataset, path);
    }

    private static void validateUnboundedDimensions(final LabeledDataset dataset,
                                                    final DatasetWriteOptions options)
            throws IllegalArgumentException {
        if (options.getUnboundedDimensions().size() > 1) {
            throw new IllegalArgumentException("NetCDF-3 files support only one unbounded dimension but " +
                                               options.getUnboundedDimensions() + " were requested");
        }
        for (final String name : dataset.getVariableNames()) {
            final List<String> variableDimensions = dataset.getVariable(name).getDimensions();
            for (int axis = 1; axis < variableDimensions.size(); axis++) {
                if (options.isUnbounded(variableDimensions.get(axis))) {
                    throw new IllegalArgumentException(
                            "unbounded dimension '" + variableDimensions.get(axis) + "' must be the first dimension of '" +
                            name + "' which has dimensions " + variableDimensions);
                }
            }
        }
    }

    private static String getAuxiliaryCoordinates(final LabeledDataset dataset,
                                                  final DataArray dataArray) {
        final StringBuilder coordinates = new StringBuilder();
        for (final String coordinateName : dataset.getCoordinateNames()) {
            if (! dataset.isDimensionCoordinate(coordinateName) &&
                dataArray.getDimensions().containsAll(dataset.getVariable(coordinateName).getDimensions())) {
                if (coordinates.length() > 0) {
                    coordinates.append(' ');
                }
                coordinates.append(coordinateName);
            }
        }
        return coordinates.toString();
    }

    private static DataType toDataType(final DataArray array) {
        return array.getValueType() == DataArray.ValueType.INT ? DataType.INT : DataType.DOUBLE;
    }

    private static Array toArray(final DataArray array) {
        final double[] values = array.getValues();
        final Array ncArray;
        if (array.getValueType() == DataArray.ValueType.INT) {
            final int[] intValues = new int[values.length];
            for (int i = 0; i < values.length; i++) {
                intValues[i] = (int) Math.round(values[i]);
            }
            ncArray = Array.factory(DataType.INT, array.getShape(), intValues);
        } else {
            ncArray = Array.factory(DataType.DOUBLE, array.getShape(), values);
        }
        return ncArray;
    }

    private static Attribute toAttribute(final String name,
                                         final Object value) {
        final Attribute attribute;
        if (value instanceof Number) {
            attribute = new Attribute(name, (Number) value);
        } else {
            attribute = new Attribute(name, String.valueOf(value));
        }
        return attribute;
    }

    private static final Logger LOG = LoggerFactory.getLogger(NetcdfDatasetWriter.class);
}
