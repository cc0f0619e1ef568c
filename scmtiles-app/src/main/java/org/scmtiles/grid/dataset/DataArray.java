package org.scmtiles.grid.dataset;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Labeled multi-dimensional array of values stored in row-major order.
 *
 * Values are held as doubles regardless of their {@link ValueType};
 * the type only determines how the array is serialized.
 * Instances are immutable: every transformation returns a new array.
 */
public class DataArray
        implements Serializable {

    public enum ValueType {
        DOUBLE,
        INT
    }

    private final List<String> dimensions;
    private final int[] shape;
    private final double[] values;
    private final ValueType valueType;
    private final Map<String, Object> attributes;

    /**
     * @param  dimensions  ordered dimension names (empty for a scalar).
     * @param  shape       length of each dimension.
     * @param  values      row-major values, length must equal the product of shape.
     * @param  valueType   serialization type.
     * @param  attributes  string or numeric attributes (may be null).
     *
     * @throws IllegalArgumentException
     *   if the dimensions, shape and values are inconsistent.
     */
    public DataArray(final List<String> dimensions,
                     final int[] shape,
                     final double[] values,
                     final ValueType valueType,
                     final Map<String, Object> attributes)
            throws IllegalArgumentException {

        if (dimensions.size() != shape.length) {
            throw new IllegalArgumentException("dimensions " + dimensions + " do not match shape " +
                                               Arrays.toString(shape));
        }
        if (dimensions.size() != dimensions.stream().distinct().count()) {
            throw new IllegalArgumentException("dimensions " + dimensions + " contain duplicates");
        }
        if (values.length != sizeOf(shape)) {
            throw new IllegalArgumentException("shape " + Arrays.toString(shape) + " requires " + sizeOf(shape) +
                                               " values but " + values.length + " were given");
        }

        this.dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
        this.shape = shape.clone();
        this.values = values;
        this.valueType = valueType;
        this.attributes = attributes == null ? new LinkedHashMap<>() : new LinkedHashMap<>(attributes);
    }

    public static DataArray scalar(final double value,
                                   final ValueType valueType) {
        return new DataArray(Collections.emptyList(), new int[0], new double[] { value }, valueType, null);
    }

    public static DataArray vector(final String dimension,
                                   final double[] values,
                                   final ValueType valueType) {
        return new DataArray(Collections.singletonList(dimension),
                             new int[] { values.length },
                             values.clone(),
                             valueType,
                             null);
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public int[] getShape() {
        return shape.clone();
    }

    public int getRank() {
        return shape.length;
    }

    public int getSize() {
        return values.length;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public boolean hasDimension(final String dimension) {
        return dimensions.contains(dimension);
    }

    public int getLength(final String dimension) {
        return shape[axisOf(dimension)];
    }

    /**
     * @return copy of the row-major values.
     */
    public double[] getValues() {
        return values.clone();
    }

    public double getValue(final int... index) {
        if (index.length != shape.length) {
            throw new IllegalArgumentException("index " + Arrays.toString(index) + " does not match rank " +
                                               shape.length);
        }
        int offset = 0;
        for (int axis = 0; axis < shape.length; axis++) {
            if ((index[axis] < 0) || (index[axis] >= shape[axis])) {
                throw new IndexOutOfBoundsException("index " + Arrays.toString(index) + " is outside shape " +
                                                    Arrays.toString(shape));
            }
            offset = (offset * shape[axis]) + index[axis];
        }
        return values[offset];
    }

    /**
     * @throws IllegalStateException
     *   if this array holds more than one value.
     */
    public double getScalarValue()
            throws IllegalStateException {
        if (values.length != 1) {
            throw new IllegalStateException("array with shape " + Arrays.toString(shape) + " is not a scalar");
        }
        return values[0];
    }

    public double getMaxValue() {
        double max = Double.NaN;
        for (final double value : values) {
            if (! Double.isNaN(value) && (Double.isNaN(max) || (value > max))) {
                max = value;
            }
        }
        return max;
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    public Object getAttribute(final String name) {
        return attributes.get(name);
    }

    public DataArray withAttribute(final String name,
                                   final Object value) {
        final Map<String, Object> updatedAttributes = new LinkedHashMap<>(attributes);
        updatedAttributes.put(name, value);
        return new DataArray(dimensions, shape, values, valueType, updatedAttributes);
    }

    public DataArray withAttributes(final Map<String, Object> replacementAttributes) {
        return new DataArray(dimensions, shape, values, valueType, replacementAttributes);
    }

    /**
     * @return copy of this array with a new leading dimension of length 1.
     */
    public DataArray expandDimension(final String dimension)
            throws IllegalArgumentException {
        if (hasDimension(dimension)) {
            throw new IllegalArgumentException("array already has dimension '" + dimension + "'");
        }
        final List<String> expandedDimensions = new ArrayList<>(dimensions.size() + 1);
        expandedDimensions.add(dimension);
        expandedDimensions.addAll(dimensions);
        final int[] expandedShape = new int[shape.length + 1];
        expandedShape[0] = 1;
        System.arraycopy(shape, 0, expandedShape, 1, shape.length);
        return new DataArray(expandedDimensions, expandedShape, values, valueType, attributes);
    }

    /**
     * @return copy of this array at the specified index of the specified dimension,
     *         with that dimension removed.
     */
    public DataArray selectIndex(final String dimension,
                                 final int index)
            throws IllegalArgumentException {

        final int axis = axisOf(dimension);
        if ((index < 0) || (index >= shape[axis])) {
            throw new IllegalArgumentException("index " + index + " is outside dimension '" + dimension +
                                               "' with length " + shape[axis]);
        }

        final int outer = sizeOf(shape, 0, axis);
        final int length = shape[axis];
        final int inner = sizeOf(shape, axis + 1, shape.length);

        final double[] selected = new double[outer * inner];
        for (int o = 0; o < outer; o++) {
            System.arraycopy(values, ((o * length) + index) * inner, selected, o * inner, inner);
        }

        final List<String> remainingDimensions = new ArrayList<>(dimensions);
        remainingDimensions.remove(axis);

        return new DataArray(remainingDimensions, removeAxis(shape, axis), selected, valueType, attributes);
    }

    /**
     * Rearranges values along a dimension.
     *
     * @param  dimension      dimension to rearrange.
     * @param  sourceIndexes  for each target position, the source position or -1 for a missing (NaN) value.
     *
     * @return reindexed copy; an {@link ValueType#INT} array with missing values becomes {@link ValueType#DOUBLE}.
     */
    public DataArray reindex(final String dimension,
                             final int[] sourceIndexes)
            throws IllegalArgumentException {

        final int axis = axisOf(dimension);
        final int outer = sizeOf(shape, 0, axis);
        final int length = shape[axis];
        final int inner = sizeOf(shape, axis + 1, shape.length);

        boolean hasMissingValues = false;
        final double[] reindexed = new double[outer * sourceIndexes.length * inner];
        for (int o = 0; o < outer; o++) {
            for (int t = 0; t < sourceIndexes.length; t++) {
                final int source = sourceIndexes[t];
                final int targetOffset = ((o * sourceIndexes.length) + t) * inner;
                if (source < 0) {
                    Arrays.fill(reindexed, targetOffset, targetOffset + inner, Double.NaN);
                    hasMissingValues = true;
                } else if (source < length) {
                    System.arraycopy(values, ((o * length) + source) * inner, reindexed, targetOffset, inner);
                } else {
                    throw new IllegalArgumentException("source index " + source + " is outside dimension '" +
                                                       dimension + "' with length " + length);
                }
            }
        }

        final int[] reindexedShape = shape.clone();
        reindexedShape[axis] = sourceIndexes.length;
        final ValueType reindexedType = hasMissingValues ? ValueType.DOUBLE : valueType;

        return new DataArray(dimensions, reindexedShape, reindexed, reindexedType, attributes);
    }

    /**
     * @param  order  permutation of this array's dimensions.
     *
     * @return copy of this array with its dimensions in the specified order.
     */
    public DataArray transpose(final List<String> order)
            throws IllegalArgumentException {

        if ((order.size() != dimensions.size()) || (! order.containsAll(dimensions))) {
            throw new IllegalArgumentException("order " + order + " is not a permutation of " + dimensions);
        }
        if (order.equals(dimensions)) {
            return this;
        }

        final int rank = shape.length;
        final int[] strides = new int[rank];
        int stride = 1;
        for (int axis = rank - 1; axis >= 0; axis--) {
            strides[axis] = stride;
            stride *= shape[axis];
        }

        final int[] permutedShape = new int[rank];
        final int[] permutedStrides = new int[rank];
        for (int i = 0; i < rank; i++) {
            final int sourceAxis = dimensions.indexOf(order.get(i));
            permutedShape[i] = shape[sourceAxis];
            permutedStrides[i] = strides[sourceAxis];
        }

        final double[] transposed = new double[values.length];
        final int[] counter = new int[rank];
        for (int t = 0; t < transposed.length; t++) {
            int sourceOffset = 0;
            for (int i = 0; i < rank; i++) {
                sourceOffset += counter[i] * permutedStrides[i];
            }
            transposed[t] = values[sourceOffset];
            for (int i = rank - 1; i >= 0; i--) {
                counter[i]++;
                if (counter[i] < permutedShape[i]) {
                    break;
                }
                counter[i] = 0;
            }
        }

        return new DataArray(order, permutedShape, transposed, valueType, attributes);
    }

    /**
     * @return true if the other array has the same dimensions, shape and values (NaN matches NaN).
     *         Attributes and value types are not compared.
     */
    public boolean hasSameValues(final DataArray other) {
        return dimensions.equals(other.dimensions) &&
               Arrays.equals(shape, other.shape) &&
               Arrays.equals(values, other.values);
    }

    @Override
    public String toString() {
        return "DataArray{dimensions=" + dimensions + ", shape=" + Arrays.toString(shape) +
               ", valueType=" + valueType + '}';
    }

    /**
     * Joins arrays along an existing dimension.
     *
     * @throws IllegalArgumentException
     *   if the arrays do not all have the same dimensions and the same lengths outside the joined dimension.
     */
    public static DataArray concatenate(final List<DataArray> arrays,
                                        final String dimension)
            throws IllegalArgumentException {

        if (arrays.isEmpty()) {
            throw new IllegalArgumentException("at least one array must be provided");
        }

        final DataArray first = arrays.get(0);
        final int axis = first.axisOf(dimension);
        final int outer = sizeOf(first.shape, 0, axis);
        final int inner = sizeOf(first.shape, axis + 1, first.shape.length);

        int totalLength = 0;
        ValueType concatenatedType = first.valueType;
        for (final DataArray array : arrays) {
            if (! array.dimensions.equals(first.dimensions)) {
                throw new IllegalArgumentException("cannot join arrays with dimensions " + first.dimensions +
                                                   " and " + array.dimensions);
            }
            for (int a = 0; a < first.shape.length; a++) {
                if ((a != axis) && (array.shape[a] != first.shape[a])) {
                    throw new IllegalArgumentException(
                            "cannot join arrays with shapes " + Arrays.toString(first.shape) + " and " +
                            Arrays.toString(array.shape) + " along '" + dimension + "'");
                }
            }
            totalLength += array.shape[axis];
            if (array.valueType == ValueType.DOUBLE) {
                concatenatedType = ValueType.DOUBLE;
            }
        }

        final double[] concatenated = new double[outer * totalLength * inner];
        int offset = 0;
        for (int o = 0; o < outer; o++) {
            for (final DataArray array : arrays) {
                final int blockSize = array.shape[axis] * inner;
                System.arraycopy(array.values, o * blockSize, concatenated, offset, blockSize);
                offset += blockSize;
            }
        }

        final int[] concatenatedShape = first.shape.clone();
        concatenatedShape[axis] = totalLength;

        return new DataArray(first.dimensions, concatenatedShape, concatenated, concatenatedType, first.attributes);
    }

    private int axisOf(final String dimension)
            throws IllegalArgumentException {
        final int axis = dimensions.indexOf(dimension);
        if (axis < 0) {
            throw new IllegalArgumentException("array with dimensions " + dimensions +
                                               " does not have dimension '" + dimension + "'");
        }
        return axis;
    }

    private static int sizeOf(final int[] shape) {
        return sizeOf(shape, 0, shape.length);
    }

    private static int sizeOf(final int[] shape,
                              final int fromAxis,
                              final int toAxis) {
        int size = 1;
        for (int axis = fromAxis; axis < toAxis; axis++) {
            size *= shape[axis];
        }
        return size;
    }

    private static int[] removeAxis(final int[] shape,
                                    final int axis) {
        final int[] reduced = new int[shape.length - 1];
        System.arraycopy(shape, 0, reduced, 0, axis);
        System.arraycopy(shape, axis + 1, reduced, axis, shape.length - axis - 1);
        return reduced;
    }

}
