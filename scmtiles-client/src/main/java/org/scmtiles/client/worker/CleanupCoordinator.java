package org.scmtiles.client.worker;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.scmtiles.client.run.RunResult;
import org.scmtiles.grid.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes the intermediate files of successful cells once the grid output has been written.
 * Failed cells keep whatever their run left behind.
 */
public class CleanupCoordinator {

    /**
     * @return number of files and directories deleted.
     */
    public int deleteCellFiles(final List<TileResult> tileResults) {

        int deletedCount = 0;
        int failedCount = 0;

        for (final TileResult tileResult : tileResults) {
            for (final RunResult runResult : tileResult.getRunResults()) {
                if (! runResult.isSuccessful()) {
                    continue;
                }
                for (final Path archivedFile : runResult.getArchivedFiles()) {
                    try {
                        if (Files.deleteIfExists(archivedFile)) {
                            deletedCount++;
                            LOG.debug("deleteCellFiles: deleted {}", archivedFile);
                        }
                    } catch (final IOException e) {
                        failedCount++;
                        LOG.warn("deleteCellFiles: failed to delete " + archivedFile, e);
                    }
                }
                final Path runDirectory = runResult.getRunDirectory();
                if ((runDirectory != null) && Files.exists(runDirectory)) {
                    if (FileUtil.deleteRecursive(runDirectory.toFile())) {
                        deletedCount++;
                    } else {
                        failedCount++;
                    }
                }
            }
        }

        LOG.info("deleteCellFiles: deleted {} cell files and directories, {} deletions failed",
                 deletedCount, failedCount);

        return deletedCount;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CleanupCoordinator.class);
}
