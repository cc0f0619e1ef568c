package org.scmtiles.grid.dataset;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collection of named {@link DataArray} variables that share dimensions.
 *
 * Each variable is either a coordinate or a data variable.
 * A coordinate whose only dimension has the coordinate's own name is a dimension coordinate
 * (e.g. a 'lat' variable with dimension 'lat').
 * Instances are immutable: every transformation returns a new dataset.
 */
public class LabeledDataset
        implements Serializable {

    private final Map<String, DataArray> variables;
    private final Set<String> coordinateNames;
    private final Map<String, Object> attributes;
    private final Map<String, Integer> dimensionLengths;

    public LabeledDataset() {
        this(new LinkedHashMap<>(), new LinkedHashSet<>(), new LinkedHashMap<>());
    }

    private LabeledDataset(final Map<String, DataArray> variables,
                           final Set<String> coordinateNames,
                           final Map<String, Object> attributes)
            throws IllegalArgumentException {
        this.variables = variables;
        this.coordinateNames = coordinateNames;
        this.attributes = attributes;
        this.dimensionLengths = new LinkedHashMap<>();
        for (final Map.Entry<String, DataArray> entry : variables.entrySet()) {
            final DataArray array = entry.getValue();
            final int[] shape = array.getShape();
            for (int axis = 0; axis < shape.length; axis++) {
                final String dimension = array.getDimensions().get(axis);
                final Integer existingLength = dimensionLengths.putIfAbsent(dimension, shape[axis]);
                if ((existingLength != null) && (existingLength != shape[axis])) {
                    throw new IllegalArgumentException(
                            "variable '" + entry.getKey() + "' has length " + shape[axis] + " for dimension '" +
                            dimension + "' but other variables have length " + existingLength);
                }
            }
        }
    }

    public LabeledDataset withVariable(final String name,
                                       final DataArray array) {
        return withVariable(name, array, false);
    }

    public LabeledDataset withCoordinate(final String name,
                                         final DataArray array) {
        return withVariable(name, array, true);
    }

    /**
     * @return copy of this dataset with the named variable added or replaced.
     *
     * @throws IllegalArgumentException
     *   if the variable's dimension lengths conflict with the other variables.
     */
    public LabeledDataset withVariable(final String name,
                                       final DataArray array,
                                       final boolean isCoordinate)
            throws IllegalArgumentException {
        final Map<String, DataArray> updatedVariables = new LinkedHashMap<>(variables);
        updatedVariables.put(name, array);
        final Set<String> updatedCoordinateNames = new LinkedHashSet<>(coordinateNames);
        if (isCoordinate) {
            updatedCoordinateNames.add(name);
        } else {
            updatedCoordinateNames.remove(name);
        }
        return new LabeledDataset(updatedVariables, updatedCoordinateNames, attributes);
    }

    public LabeledDataset withoutVariables(final Collection<String> names) {
        final Map<String, DataArray> updatedVariables = new LinkedHashMap<>(variables);
        final Set<String> updatedCoordinateNames = new LinkedHashSet<>(coordinateNames);
        for (final String name : names) {
            updatedVariables.remove(name);
            updatedCoordinateNames.remove(name);
        }
        return new LabeledDataset(updatedVariables, updatedCoordinateNames, attributes);
    }

    public LabeledDataset withAttribute(final String name,
                                        final Object value) {
        final Map<String, Object> updatedAttributes = new LinkedHashMap<>(attributes);
        updatedAttributes.put(name, value);
        return new LabeledDataset(variables, coordinateNames, updatedAttributes);
    }

    public Set<String> getVariableNames() {
        return Collections.unmodifiableSet(variables.keySet());
    }

    public boolean hasVariable(final String name) {
        return variables.containsKey(name);
    }

    /**
     * @throws IllegalArgumentException
     *   if the dataset does not contain the named variable.
     */
    public DataArray getVariable(final String name)
            throws IllegalArgumentException {
        final DataArray array = variables.get(name);
        if (array == null) {
            throw new IllegalArgumentException("dataset does not contain variable '" + name + "', variables are " +
                                               variables.keySet());
        }
        return array;
    }

    public boolean isCoordinate(final String name) {
        return coordinateNames.contains(name);
    }

    public Set<String> getCoordinateNames() {
        return Collections.unmodifiableSet(coordinateNames);
    }

    public boolean isDimensionCoordinate(final String name) {
        final DataArray array = variables.get(name);
        return coordinateNames.contains(name) &&
               (array != null) &&
               array.getDimensions().equals(Collections.singletonList(name));
    }

    public Map<String, Object> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * @return lengths of all dimensions used by this dataset, in first-seen order.
     */
    public Map<String, Integer> getDimensionLengths() {
        return Collections.unmodifiableMap(dimensionLengths);
    }

    public boolean hasDimension(final String dimension) {
        return dimensionLengths.containsKey(dimension);
    }

    public int getDimensionLength(final String dimension)
            throws IllegalArgumentException {
        final Integer length = dimensionLengths.get(dimension);
        if (length == null) {
            throw new IllegalArgumentException("dataset does not have dimension '" + dimension + "'");
        }
        return length;
    }

    /**
     * @return copy of this dataset at one index of the specified dimension.
     *         The dimension is removed from every variable that has it,
     *         so its dimension coordinate becomes a scalar coordinate.
     */
    public LabeledDataset selectIndex(final String dimension,
                                      final int index)
            throws IllegalArgumentException {
        getDimensionLength(dimension);
        final Map<String, DataArray> selectedVariables = new LinkedHashMap<>();
        for (final Map.Entry<String, DataArray> entry : variables.entrySet()) {
            final DataArray array = entry.getValue();
            selectedVariables.put(entry.getKey(),
                                  array.hasDimension(dimension) ? array.selectIndex(dimension, index) : array);
        }
        return new LabeledDataset(selectedVariables, new LinkedHashSet<>(coordinateNames), attributes);
    }

    /**
     * Adds a new leading dimension of length 1.
     * A scalar coordinate with the dimension's name becomes its dimension coordinate,
     * every data variable gains the dimension and all other coordinates are left as they are.
     */
    public LabeledDataset expandDimension(final String dimension)
            throws IllegalArgumentException {
        if (hasDimension(dimension)) {
            throw new IllegalArgumentException("dataset already has dimension '" + dimension + "'");
        }
        final Map<String, DataArray> expandedVariables = new LinkedHashMap<>();
        for (final Map.Entry<String, DataArray> entry : variables.entrySet()) {
            final String name = entry.getKey();
            final DataArray array = entry.getValue();
            final boolean isCoordinate = coordinateNames.contains(name);
            if (name.equals(dimension)) {
                if (array.getRank() != 0) {
                    throw new IllegalArgumentException("variable '" + name + "' must be a scalar to become a dimension");
                }
                expandedVariables.put(name, array.expandDimension(dimension));
            } else if (isCoordinate) {
                expandedVariables.put(name, array);
            } else {
                expandedVariables.put(name, array.expandDimension(dimension));
            }
        }
        return new LabeledDataset(expandedVariables, new LinkedHashSet<>(coordinateNames), attributes);
    }

    /**
     * Conforms this dataset to a new set of values for a dimension coordinate.
     * Positions whose value is not present in this dataset are filled with NaN.
     */
    public LabeledDataset reindex(final String dimension,
                                  final double[] targetValues)
            throws IllegalArgumentException {

        if (! isDimensionCoordinate(dimension)) {
            throw new IllegalArgumentException("dataset does not have a dimension coordinate '" + dimension + "'");
        }

        final double[] sourceValues = variables.get(dimension).getValues();
        final int[] sourceIndexes = new int[targetValues.length];
        for (int t = 0; t < targetValues.length; t++) {
            sourceIndexes[t] = -1;
            for (int s = 0; s < sourceValues.length; s++) {
                if (Double.compare(sourceValues[s], targetValues[t]) == 0) {
                    sourceIndexes[t] = s;
                    break;
                }
            }
        }

        final Map<String, DataArray> reindexedVariables = new LinkedHashMap<>();
        for (final Map.Entry<String, DataArray> entry : variables.entrySet()) {
            final String name = entry.getKey();
            final DataArray array = entry.getValue();
            if (name.equals(dimension)) {
                final DataArray targetCoordinate = DataArray.vector(dimension, targetValues, array.getValueType());
                reindexedVariables.put(name, targetCoordinate.withAttributes(array.getAttributes()));
            } else if (array.hasDimension(dimension)) {
                reindexedVariables.put(name, array.reindex(dimension, sourceIndexes));
            } else {
                reindexedVariables.put(name, array);
            }
        }
        return new LabeledDataset(reindexedVariables, new LinkedHashSet<>(coordinateNames), attributes);
    }

    /**
     * Reorders the dimensions of every variable.
     *
     * @param  order  ordering for all dimensions of this dataset; names of absent dimensions are ignored.
     *
     * @throws IllegalArgumentException
     *   if the order omits one of this dataset's dimensions.
     */
    public LabeledDataset transpose(final List<String> order)
            throws IllegalArgumentException {

        final Set<String> unordered = new TreeSet<>(dimensionLengths.keySet());
        unordered.removeAll(order);
        if (! unordered.isEmpty()) {
            throw new IllegalArgumentException("order " + order + " omits dimensions " + unordered);
        }

        final Map<String, DataArray> transposedVariables = new LinkedHashMap<>();
        for (final Map.Entry<String, DataArray> entry : variables.entrySet()) {
            final DataArray array = entry.getValue();
            final List<String> arrayOrder = new ArrayList<>(array.getRank());
            for (final String dimension : order) {
                if (array.hasDimension(dimension)) {
                    arrayOrder.add(dimension);
                }
            }
            transposedVariables.put(entry.getKey(), array.transpose(arrayOrder));
        }
        return new LabeledDataset(transposedVariables, new LinkedHashSet<>(coordinateNames), attributes);
    }

    /**
     * @return value of the named variable at the position identified by dimension coordinate values.
     *
     * @throws IllegalArgumentException
     *   if a dimension of the variable is not located or a coordinate value is not found.
     */
    public double getValueAt(final String variableName,
                             final Map<String, Double> coordinateValues)
            throws IllegalArgumentException {
        final DataArray array = getVariable(variableName);
        final List<String> arrayDimensions = array.getDimensions();
        final int[] index = new int[arrayDimensions.size()];
        for (int axis = 0; axis < index.length; axis++) {
            final String dimension = arrayDimensions.get(axis);
            final Double value = coordinateValues.get(dimension);
            if (value == null) {
                throw new IllegalArgumentException("no coordinate value specified for dimension '" + dimension + "'");
            }
            final double[] dimensionValues = getVariable(dimension).getValues();
            index[axis] = -1;
            for (int i = 0; i < dimensionValues.length; i++) {
                if (Double.compare(dimensionValues[i], value) == 0) {
                    index[axis] = i;
                    break;
                }
            }
            if (index[axis] < 0) {
                throw new IllegalArgumentException(dimension + " value " + value + " not found in " +
                                                   Arrays.toString(dimensionValues));
            }
        }
        return array.getValue(index);
    }

    /**
     * @return true if both datasets hold the same variables with the same coordinate flags and values.
     */
    public boolean hasSameContent(final LabeledDataset other) {
        if (! variables.keySet().equals(other.variables.keySet()) ||
            ! coordinateNames.equals(other.coordinateNames)) {
            return false;
        }
        for (final Map.Entry<String, DataArray> entry : variables.entrySet()) {
            if (! entry.getValue().hasSameValues(other.variables.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "LabeledDataset{dimensions=" + dimensionLengths + ", variables=" + variables.keySet() +
               ", coordinates=" + coordinateNames + '}';
    }

    /**
     * Combines datasets holding different variables into one dataset.
     * A variable found in more than one dataset must have the same values in each;
     * the first occurrence is kept.
     *
     * @throws IllegalArgumentException
     *   if the datasets hold conflicting values for a variable.
     */
    public static LabeledDataset merge(final List<LabeledDataset> datasets)
            throws IllegalArgumentException {

        final Map<String, DataArray> mergedVariables = new LinkedHashMap<>();
        final Set<String> mergedCoordinateNames = new LinkedHashSet<>();
        final Map<String, Object> mergedAttributes = new LinkedHashMap<>();

        for (final LabeledDataset dataset : datasets) {
            for (final Map.Entry<String, DataArray> entry : dataset.variables.entrySet()) {
                final String name = entry.getKey();
                final DataArray existing = mergedVariables.get(name);
                if (existing == null) {
                    mergedVariables.put(name, entry.getValue());
                } else if (! existing.hasSameValues(entry.getValue())) {
                    throw new IllegalArgumentException("conflicting values found for variable '" + name + "'");
                }
                if (dataset.coordinateNames.contains(name)) {
                    mergedCoordinateNames.add(name);
                }
            }
            for (final Map.Entry<String, Object> entry : dataset.attributes.entrySet()) {
                mergedAttributes.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }

        return new LabeledDataset(mergedVariables, mergedCoordinateNames, mergedAttributes);
    }

    /**
     * Joins datasets along a dimension.
     *
     * <ul>
     *   <li>A dataset without the dimension is first expanded (see {@link #expandDimension}).</li>
     *   <li>Other dimension coordinates that differ between datasets are outer aligned:
     *       the union of their values is used and missing positions are NaN.</li>
     *   <li>Variables with the dimension are joined along it, in dataset order.</li>
     *   <li>Variables without the dimension must be identical in every dataset and are kept once.</li>
     * </ul>
     *
     * @throws IllegalArgumentException
     *   if the datasets hold different variables or conflicting values.
     */
    public static LabeledDataset concatenate(final List<LabeledDataset> datasets,
                                             final String dimension)
            throws IllegalArgumentException {

        if (datasets.isEmpty()) {
            throw new IllegalArgumentException("at least one dataset must be provided");
        }

        final List<LabeledDataset> expanded = new ArrayList<>(datasets.size());
        for (final LabeledDataset dataset : datasets) {
            expanded.add(dataset.hasDimension(dimension) ? dataset : dataset.expandDimension(dimension));
        }

        final List<LabeledDataset> aligned = alignOuter(expanded, dimension);
        final LabeledDataset first = aligned.get(0);

        for (int i = 1; i < aligned.size(); i++) {
            final Set<String> names = aligned.get(i).variables.keySet();
            if (! names.equals(first.variables.keySet())) {
                throw new IllegalArgumentException("cannot join datasets with variables " +
                                                   first.variables.keySet() + " and " + names);
            }
        }

        final Map<String, DataArray> joinedVariables = new LinkedHashMap<>();
        for (final Map.Entry<String, DataArray> entry : first.variables.entrySet()) {
            final String name = entry.getKey();
            final List<DataArray> arrays = new ArrayList<>(aligned.size());
            for (final LabeledDataset dataset : aligned) {
                arrays.add(dataset.variables.get(name));
            }
            if (entry.getValue().hasDimension(dimension)) {
                joinedVariables.put(name, DataArray.concatenate(arrays, dimension));
            } else {
                for (final DataArray array : arrays) {
                    if (! array.hasSameValues(entry.getValue())) {
                        throw new IllegalArgumentException(
                                "variable '" + name + "' does not have dimension '" + dimension +
                                "' and differs between datasets");
                    }
                }
                joinedVariables.put(name, entry.getValue());
            }
        }

        return new LabeledDataset(joinedVariables, new LinkedHashSet<>(first.coordinateNames), first.attributes);
    }

    private static List<LabeledDataset> alignOuter(final List<LabeledDataset> datasets,
                                                   final String concatenationDimension) {

        List<LabeledDataset> aligned = datasets;
        final LabeledDataset first = datasets.get(0);

        for (final String name : first.variables.keySet()) {
            if (name.equals(concatenationDimension) || ! first.isDimensionCoordinate(name)) {
                continue;
            }

            final double[] firstValues = first.variables.get(name).getValues();
            boolean allSame = true;
            final Set<Double> union = new LinkedHashSet<>();
            for (final LabeledDataset dataset : aligned) {
                if (! dataset.isDimensionCoordinate(name)) {
                    throw new IllegalArgumentException("dataset is missing dimension coordinate '" + name + "'");
                }
                final double[] values = dataset.variables.get(name).getValues();
                allSame = allSame && Arrays.equals(firstValues, values);
                for (final double value : values) {
                    union.add(value);
                }
            }

            if (! allSame) {
                final double[] targetValues = sortInDirectionOf(firstValues, union);
                final List<LabeledDataset> reindexed = new ArrayList<>(aligned.size());
                for (final LabeledDataset dataset : aligned) {
                    reindexed.add(dataset.reindex(name, targetValues));
                }
                aligned = reindexed;
            }
        }

        return aligned;
    }

    private static double[] sortInDirectionOf(final double[] referenceValues,
                                              final Set<Double> values) {
        final boolean descending = (referenceValues.length > 1) &&
                                   (referenceValues[0] > referenceValues[referenceValues.length - 1]);
        final double[] sorted = new double[values.size()];
        int i = 0;
        for (final Double value : values) {
            sorted[i++] = value;
        }
        Arrays.sort(sorted);
        if (descending) {
            for (int left = 0, right = sorted.length - 1; left < right; left++, right--) {
                final double swap = sorted[left];
                sorted[left] = sorted[right];
                sorted[right] = swap;
            }
        }
        return sorted;
    }

}
