package org.scmtiles.grid.dataset;

import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Names of variables to exclude when loading cell results.
 * A drop list is either present (loaded from a file, possibly with no entries) or absent.
 */
public class DropList
        implements Serializable {

    private static final DropList ABSENT = new DropList(false, null, Collections.emptySet());

    private final boolean present;
    private final transient Path source;
    private final Set<String> variableNames;

    private DropList(final boolean present,
                     final Path source,
                     final Set<String> variableNames) {
        this.present = present;
        this.source = source;
        this.variableNames = Collections.unmodifiableSet(new LinkedHashSet<>(variableNames));
    }

    public static DropList absent() {
        return ABSENT;
    }

    public static DropList of(final Set<String> variableNames) {
        return new DropList(true, null, variableNames);
    }

    /**
     * Loads a drop list file containing one variable name per line (blank lines are ignored).
     *
     * @return the loaded list, or {@link #absent()} if no regular file exists at the specified path.
     *
     * @throws IOException
     *   if the file exists but cannot be read.
     */
    public static DropList load(final Path path)
            throws IOException {

        if ((path == null) || ! Files.isRegularFile(path)) {
            return ABSENT;
        }

        final Set<String> names = new LinkedHashSet<>();
        for (final String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            final String name = line.trim();
            if (name.length() > 0) {
                names.add(name);
            }
        }

        return new DropList(true, path, names);
    }

    public boolean isPresent() {
        return present;
    }

    public Set<String> getVariableNames() {
        return variableNames;
    }

    public boolean contains(final String variableName) {
        return variableNames.contains(variableName);
    }

    public int size() {
        return variableNames.size();
    }

    @Override
    public String toString() {
        return isPresent() ? "drop list with " + size() + " entries" + (source == null ? "" : " from " + source) :
               "no drop list";
    }
}
