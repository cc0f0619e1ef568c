package org.scmtiles.grid.util;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities for run and output directories.
 */
public class FileUtil {

    /**
     * Creates the directory (and any missing parents) if necessary.
     *
     * @throws IllegalArgumentException
     *   if the directory cannot be created or is not writable.
     */
    public static void ensureWritableDirectory(final Path directory)
            throws IllegalArgumentException {
        // try twice since another worker may be creating the same parent concurrently
        if (! Files.isDirectory(directory)) {
            try {
                Files.createDirectories(directory);
            } catch (final IOException e) {
                if (! Files.isDirectory(directory)) {
                    try {
                        Files.createDirectories(directory);
                    } catch (final IOException e2) {
                        throw new IllegalArgumentException("failed to create " + directory, e2);
                    }
                }
            }
        }
        if (! Files.isWritable(directory)) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    /**
     * Deletes a file or directory tree.
     * Symbolic links are removed without touching their targets.
     *
     * @return true if everything was deleted, otherwise false (failures are logged).
     */
    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        if (file.isDirectory() && ! Files.isSymbolicLink(file.toPath())) {
            final File[] files = file.listFiles();
            if (files != null) {
                for (final File f : files) {
                    deleteSuccessful = deleteRecursive(f) && deleteSuccessful;
                }
            }
        }

        if (file.delete()) {
            LOG.debug("deleteRecursive: deleted {}", file.getAbsolutePath());
        } else {
            LOG.warn("deleteRecursive: failed to delete {}", file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);
}
