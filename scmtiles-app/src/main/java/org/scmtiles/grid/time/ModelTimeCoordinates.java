package org.scmtiles.grid.time;

import java.util.Arrays;

/**
 * Time representation required by the single column model: a constant reference date (YYYYMMDD),
 * a constant reference time of day (seconds since midnight of that date) and
 * whole-second offsets of each time point from the first time point.
 */
public class ModelTimeCoordinates {

    private final int referenceDate;
    private final int referenceSecond;
    private final long[] relativeSeconds;

    public ModelTimeCoordinates(final int referenceDate,
                                final int referenceSecond,
                                final long[] relativeSeconds) {
        this.referenceDate = referenceDate;
        this.referenceSecond = referenceSecond;
        this.relativeSeconds = relativeSeconds.clone();
    }

    public int getReferenceDate() {
        return referenceDate;
    }

    public int getReferenceSecond() {
        return referenceSecond;
    }

    public int size() {
        return relativeSeconds.length;
    }

    public long[] getRelativeSeconds() {
        return relativeSeconds.clone();
    }

    /**
     * @return the reference date repeated for every time point.
     */
    public double[] getDateValues() {
        final double[] values = new double[relativeSeconds.length];
        Arrays.fill(values, referenceDate);
        return values;
    }

    /**
     * @return the reference time of day repeated for every time point.
     */
    public double[] getSecondValues() {
        final double[] values = new double[relativeSeconds.length];
        Arrays.fill(values, referenceSecond);
        return values;
    }

    public double[] getRelativeSecondValues() {
        final double[] values = new double[relativeSeconds.length];
        for (int i = 0; i < values.length; i++) {
            values[i] = relativeSeconds[i];
        }
        return values;
    }

    @Override
    public String toString() {
        return "ModelTimeCoordinates{referenceDate=" + referenceDate + ", referenceSecond=" + referenceSecond +
               ", relativeSeconds=" + Arrays.toString(relativeSeconds) + '}';
    }
}
