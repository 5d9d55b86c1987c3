package io.maas.sdk;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A MAAS API version of the form {@code major.minor}, as it appears in {@code /api/2.0/}.
 *
 * @param major major version number.
 * @param minor minor version number.
 */
public record ApiVersion(int major, int minor) {

    private static final Pattern MAJOR_MINOR = Pattern.compile("(\\d+)\\.(\\d+)");

    /**
     * @throws IllegalArgumentException when the value is not of the form {@code major.minor}.
     */
    public static ApiVersion parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("bad version: null, should be of the form 2.0");
        }
        Matcher matcher = MAJOR_MINOR.matcher(value.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("bad version: " + value + ", should be of the form 2.0");
        }
        try {
            return new ApiVersion(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2)));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("bad version: " + value, ex);
        }
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%d.%d", major, minor);
    }
}
