package org.scmtiles.grid.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.scmtiles.grid.dataset.DataArray;
import org.scmtiles.grid.dataset.LabeledDataset;

/**
 * Converts time coordinates between their absolute (CF) form and the form required by the
 * single column model.
 *
 * The model form holds three coordinates on the 'time' dimension:
 * <ul>
 *   <li>'date': the reference date as an integer YYYYMMDD,</li>
 *   <li>'second': the reference time of day in seconds since midnight,</li>
 *   <li>'time': whole seconds elapsed since the first time point (units "seconds").</li>
 * </ul>
 *
 * The output form rebases relative 'time' onto the reference time by giving it the units
 * "seconds since &lt;reference&gt;".
 */
public class TimeCoordinateTransformer {

    public static final String TIME = "time";
    public static final String DATE = "date";
    public static final String SECOND = "second";

    public static final String UNITS = "units";
    public static final String RELATIVE_UNITS = "seconds";

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");

    private final Instant referenceTime;

    public TimeCoordinateTransformer(final Instant referenceTime) {
        this.referenceTime = referenceTime;
    }

    public Instant getReferenceTime() {
        return referenceTime;
    }

    /**
     * @param  times  absolute time points (at least one).
     *
     * @return model coordinates for the specified times.
     *         Each time point is rounded to the nearest second (halves round up) before
     *         offsets from the first point are calculated.
     */
    public ModelTimeCoordinates toModelForm(final List<Instant> times)
            throws IllegalArgumentException {

        if (times.isEmpty()) {
            throw new IllegalArgumentException("at least one time point is required");
        }

        final LocalDateTime reference = LocalDateTime.ofInstant(referenceTime, ZoneOffset.UTC);
        final LocalDate referenceDate = reference.toLocalDate();
        final int date = Integer.parseInt(DATE_FORMAT.format(referenceDate));
        final int second = reference.toLocalTime().toSecondOfDay();

        final long firstSecond = roundToSecond(times.get(0)).getEpochSecond();
        final long[] relativeSeconds = new long[times.size()];
        for (int i = 0; i < relativeSeconds.length; i++) {
            relativeSeconds[i] = roundToSecond(times.get(i)).getEpochSecond() - firstSecond;
        }

        return new ModelTimeCoordinates(date, second, relativeSeconds);
    }

    /**
     * @return absolute times for offsets (in seconds) from the reference time.
     */
    public List<Instant> rebase(final long[] relativeSeconds) {
        final List<Instant> times = new ArrayList<>(relativeSeconds.length);
        for (final long seconds : relativeSeconds) {
            times.add(referenceTime.plusSeconds(seconds));
        }
        return times;
    }

    /**
     * Replaces a dataset's absolute 'time' coordinate with the model's 'time', 'date' and 'second' coordinates.
     *
     * @throws IllegalArgumentException
     *   if the dataset does not have an absolute 'time' dimension coordinate.
     */
    public LabeledDataset toModelForm(final LabeledDataset dataset)
            throws IllegalArgumentException {

        final ModelTimeCoordinates modelTime = toModelForm(decodeTimes(getTimeCoordinate(dataset)));

        final DataArray time = DataArray.vector(TIME, modelTime.getRelativeSecondValues(), DataArray.ValueType.DOUBLE)
                .withAttributes(attributes("long_name", "Time", UNITS, RELATIVE_UNITS));
        final DataArray date = DataArray.vector(TIME, modelTime.getDateValues(), DataArray.ValueType.INT)
                .withAttributes(attributes("long_name", "Date", UNITS, "yyyymmdd"));
        final DataArray second = DataArray.vector(TIME, modelTime.getSecondValues(), DataArray.ValueType.INT)
                .withAttributes(attributes("long_name", "Second", UNITS, RELATIVE_UNITS));

        return dataset.withCoordinate(TIME, time)
                .withCoordinate(DATE, date)
                .withCoordinate(SECOND, second);
    }

    /**
     * Rebases a dataset's relative 'time' coordinate onto the reference time.
     *
     * @throws IllegalStateException
     *   if the 'time' coordinate is not in relative form (e.g. it has already been rebased).
     */
    public LabeledDataset toOutputForm(final LabeledDataset dataset)
            throws IllegalArgumentException, IllegalStateException {

        final DataArray time = getTimeCoordinate(dataset);
        final Object units = time.getAttribute(UNITS);
        if (! RELATIVE_UNITS.equals(units)) {
            throw new IllegalStateException("time coordinate with units '" + units +
                                            "' is not relative to the run start and cannot be rebased");
        }

        final Map<String, Object> outputAttributes = new LinkedHashMap<>(time.getAttributes());
        outputAttributes.put("standard_name", "time");
        outputAttributes.put(UNITS, getOutputUnits());
        outputAttributes.put("calendar", "standard");

        return dataset.withCoordinate(TIME, time.withAttributes(outputAttributes));
    }

    /**
     * @return units for rebased times, e.g. "seconds since 2009-04-06T01:00:00".
     */
    public String getOutputUnits() {
        return CfTimeUnits.secondsSince(referenceTime).format();
    }

    /**
     * @return absolute times for a time coordinate with CF units.
     *
     * @throws IllegalArgumentException
     *   if the coordinate's units are missing or not absolute.
     */
    public static List<Instant> decodeTimes(final DataArray timeCoordinate)
            throws IllegalArgumentException {
        final Object units = timeCoordinate.getAttribute(UNITS);
        final CfTimeUnits cfTimeUnits = CfTimeUnits.parse(units == null ? null : units.toString());
        final double[] values = timeCoordinate.getValues();
        final List<Instant> times = new ArrayList<>(values.length);
        for (final double value : values) {
            times.add(cfTimeUnits.decode(value));
        }
        return times;
    }

    public static Instant roundToSecond(final Instant time) {
        final long seconds = time.getEpochSecond();
        return Instant.ofEpochSecond(time.getNano() >= 500_000_000 ? seconds + 1 : seconds);
    }

    private static DataArray getTimeCoordinate(final LabeledDataset dataset)
            throws IllegalArgumentException {
        if (! dataset.isDimensionCoordinate(TIME)) {
            throw new IllegalArgumentException("dataset does not have a '" + TIME + "' dimension coordinate");
        }
        return dataset.getVariable(TIME);
    }

    private static Map<String, Object> attributes(final String... namesAndValues) {
        final Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            map.put(namesAndValues[i], namesAndValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }

}
