package org.scmtiles.grid.dataset;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Serialization options for {@link NetcdfDatasetWriter}.
 */
public class DatasetWriteOptions {

    public static final DatasetWriteOptions DEFAULT = new DatasetWriteOptions(Collections.emptySet());

    private final Set<String> unboundedDimensions;

    private DatasetWriteOptions(final Set<String> unboundedDimensions) {
        this.unboundedDimensions = Collections.unmodifiableSet(new LinkedHashSet<>(unboundedDimensions));
    }

    /**
     * @return options that write the named dimension as the file's unlimited (record) dimension.
     */
    public static DatasetWriteOptions withUnboundedDimension(final String dimension) {
        return new DatasetWriteOptions(Collections.singleton(dimension));
    }

    public Set<String> getUnboundedDimensions() {
        return unboundedDimensions;
    }

    public boolean isUnbounded(final String dimension) {
        return unboundedDimensions.contains(dimension);
    }

    @Override
    public String toString() {
        return "DatasetWriteOptions{unboundedDimensions=" + unboundedDimensions + '}';
    }
}
