package org.scmtiles.grid.util;

/**
 * Tracks elapsed time for a job, a tile or a single model run.
 */
public class ProcessTimer {

    private final long start;

    public ProcessTimer() {
        this.start = System.currentTimeMillis();
    }

    public long getElapsedMilliseconds() {
        return System.currentTimeMillis() - start;
    }

    public long getElapsedSeconds() {
        return getElapsedMilliseconds() / 1000;
    }

    @Override
    public String toString() {
        final long elapsedMilliseconds = getElapsedMilliseconds();
        if (elapsedMilliseconds < 1000) {
            return elapsedMilliseconds + " milliseconds";
        }
        final long totalSeconds = elapsedMilliseconds / 1000;
        final long hours = totalSeconds / 3600;
        final long minutes = (totalSeconds % 3600) / 60;
        final long seconds = totalSeconds % 60;
        return hours + " hours, " + minutes + " minutes, " + seconds + " seconds";
    }
}
