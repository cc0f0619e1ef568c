package org.scmtiles.grid.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * CF-convention time units of the form "&lt;unit&gt; since &lt;origin&gt;" (e.g. "hours since 2009-04-06 01:00:00").
 * Supported units are seconds, minutes, hours and days; the origin is interpreted as UTC.
 */
public class CfTimeUnits {

    public static final DateTimeFormatter ORIGIN_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final Pattern UNITS_PATTERN = Pattern.compile("^\\s*(\\w+)\\s+since\\s+(.+?)\\s*$");
    private static final Pattern UTC_SUFFIX_PATTERN = Pattern.compile("(Z|\\s*UTC|\\s*[+]00:?00)$");

    private final long secondsPerUnit;
    private final Instant origin;

    public CfTimeUnits(final long secondsPerUnit,
                       final Instant origin) {
        this.secondsPerUnit = secondsPerUnit;
        this.origin = origin;
    }

    public static CfTimeUnits secondsSince(final Instant origin) {
        return new CfTimeUnits(1, origin);
    }

    /**
     * @return true if the specified units identify absolute times (i.e. contain an origin).
     */
    public static boolean isAbsolute(final String units) {
        return (units != null) && UNITS_PATTERN.matcher(units).matches();
    }

    /**
     * @throws IllegalArgumentException
     *   if the units cannot be parsed.
     */
    public static CfTimeUnits parse(final String units)
            throws IllegalArgumentException {

        final Matcher matcher = units == null ? null : UNITS_PATTERN.matcher(units);
        if ((matcher == null) || ! matcher.matches()) {
            throw new IllegalArgumentException("time units '" + units + "' do not have the form '<unit> since <origin>'");
        }

        final long secondsPerUnit;
        switch (matcher.group(1).toLowerCase(Locale.ROOT)) {
            case "s":
            case "sec":
            case "secs":
            case "second":
            case "seconds":
                secondsPerUnit = 1;
                break;
            case "min":
            case "mins":
            case "minute":
            case "minutes":
                secondsPerUnit = 60;
                break;
            case "h":
            case "hr":
            case "hrs":
            case "hour":
            case "hours":
                secondsPerUnit = 3600;
                break;
            case "d":
            case "day":
            case "days":
                secondsPerUnit = 86400;
                break;
            default:
                throw new IllegalArgumentException("unsupported time unit '" + matcher.group(1) + "' in '" + units + "'");
        }

        return new CfTimeUnits(secondsPerUnit, parseOrigin(matcher.group(2), units));
    }

    public long getSecondsPerUnit() {
        return secondsPerUnit;
    }

    public Instant getOrigin() {
        return origin;
    }

    /**
     * @return the instant for a value in these units, rounded to the nearest nanosecond.
     *
     * @throws IllegalArgumentException
     *   if the value is not finite.
     */
    public Instant decode(final double value)
            throws IllegalArgumentException {
        if (! Double.isFinite(value)) {
            throw new IllegalArgumentException("cannot decode time value " + value + " with units '" + this + "'");
        }
        // whole seconds and the fraction are applied separately so distant origins do not overflow nanoseconds
        final double seconds = value * secondsPerUnit;
        final double wholeSeconds = Math.floor(seconds);
        final long nanos = Math.round((seconds - wholeSeconds) * 1e9);
        return origin.plusSeconds((long) wholeSeconds).plusNanos(nanos);
    }

    /**
     * @return units string in the form written to output files, e.g. "seconds since 2009-04-06T01:00:00".
     */
    public String format() {
        final String unitName;
        if (secondsPerUnit == 86400) {
            unitName = "days";
        } else if (secondsPerUnit == 3600) {
            unitName = "hours";
        } else if (secondsPerUnit == 60) {
            unitName = "minutes";
        } else {
            unitName = "seconds";
        }
        return unitName + " since " + ORIGIN_FORMAT.format(LocalDateTime.ofInstant(origin, ZoneOffset.UTC));
    }

    @Override
    public String toString() {
        return format();
    }

    private static Instant parseOrigin(final String originText,
                                       final String units)
            throws IllegalArgumentException {

        String text = UTC_SUFFIX_PATTERN.matcher(originText.trim()).replaceFirst("").trim();
        text = text.replaceFirst("^(\\d{4}-\\d{1,2}-\\d{1,2})\\s+", "$1T");

        try {
            if (text.contains("T")) {
                return LocalDateTime.parse(normalize(text)).toInstant(ZoneOffset.UTC);
            } else {
                return LocalDate.parse(normalizeDate(text)).atStartOfDay().toInstant(ZoneOffset.UTC);
            }
        } catch (final DateTimeParseException e) {
            throw new IllegalArgumentException("failed to parse time origin in units '" + units + "'", e);
        }
    }

    // pads single digit fields so that ISO parsing accepts values like "2009-4-6T1:00:00"
    private static String normalize(final String dateTime) {
        final int separator = dateTime.indexOf('T');
        final String date = normalizeDate(dateTime.substring(0, separator));
        final String[] timeFields = dateTime.substring(separator + 1).split(":");
        final StringBuilder time = new StringBuilder();
        for (int i = 0; i < 3; i++) {
            if (i > 0) {
                time.append(':');
            }
            final String field = i < timeFields.length ? timeFields[i] : "00";
            time.append(field.indexOf('.') == 1 || field.length() == 1 ? "0" + field : field);
        }
        return date + "T" + time;
    }

    private static String normalizeDate(final String date) {
        final String[] fields = date.split("-");
        if (fields.length != 3) {
            return date;
        }
        return fields[0] + "-" + pad(fields[1]) + "-" + pad(fields[2]);
    }

    private static String pad(final String field) {
        return field.length() == 1 ? "0" + field : field;
    }

}
