package io.maas.sdk.internal;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * URL shape helpers. MAAS runs on Django, which redirects any API path lacking a trailing slash, so every URL the
 * SDK produces ends in one.
 */
public final class Urls {

    private static final Pattern VERSIONED_URL = Pattern.compile("^(.*/)api/(\\d+\\.\\d+)/?$");

    private Urls() {
    }

    public static String ensureTrailingSlash(String url) {
        if (url.endsWith("/")) {
            return url;
        }
        return url + "/";
    }

    /**
     * Joins a base URL and a sub-path with exactly one slash, however many slashes either side carries.
     */
    public static String join(String baseUrl, String path) {
        return stripTrailing(baseUrl) + "/" + stripLeading(path);
    }

    /**
     * Percent-encodes every segment of a relative API path, keeping the separating slashes.
     */
    public static String encodePath(String path) {
        StringJoiner joiner = new StringJoiner("/");
        for (String segment : path.split("/", -1)) {
            joiner.add(URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20"));
        }
        return joiner.toString();
    }

    /**
     * {@code addApiVersion("http://host/MAAS", "2.0")} yields {@code http://host/MAAS/api/2.0/}.
     */
    public static String addApiVersion(String baseUrl, String apiVersion) {
        return ensureTrailingSlash(baseUrl) + "api/" + apiVersion + "/";
    }

    /**
     * Recognises URLs of the form {@code .../api/{major.minor}[/]} and splits off the version segment. URLs that do
     * not match are returned unchanged with an empty version.
     */
    public static VersionedUrl splitVersionedUrl(String url) {
        Matcher matcher = VERSIONED_URL.matcher(url);
        if (!matcher.matches()) {
            return new VersionedUrl(url, "", false);
        }
        return new VersionedUrl(matcher.group(1), matcher.group(2), true);
    }

    /**
     * Form-encodes parameters sorted by key; values keep their order within a key.
     */
    public static String encodeParams(Map<String, List<String>> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, List<String>> entry : new TreeMap<>(params).entrySet()) {
            String key = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            List<String> values = entry.getValue();
            if (values == null) {
                continue;
            }
            for (String value : values) {
                joiner.add(key + "=" + URLEncoder.encode(value == null ? "" : value, StandardCharsets.UTF_8));
            }
        }
        return joiner.toString();
    }

    /**
     * Builds the query string for an API call: {@code op} first, then the encoded parameters.
     *
     * @return the query including its leading {@code ?}, or an empty string when there is nothing to encode.
     */
    public static String query(String op, Map<String, List<String>> params) {
        StringJoiner joiner = new StringJoiner("&");
        if (op != null && !op.isEmpty()) {
            joiner.add("op=" + URLEncoder.encode(op, StandardCharsets.UTF_8));
        }
        String encoded = encodeParams(params);
        if (!encoded.isEmpty()) {
            joiner.add(encoded);
        }
        String joined = joiner.toString();
        return joined.isEmpty() ? "" : "?" + joined;
    }

    private static String stripTrailing(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    private static String stripLeading(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }

    /**
     * Result of {@link #splitVersionedUrl(String)}.
     *
     * @param baseUrl   URL preceding {@code api/}, with its trailing slash, or the input when not versioned.
     * @param version   the {@code major.minor} segment, empty when not versioned.
     * @param versioned whether the input carried a version segment.
     */
    public record VersionedUrl(String baseUrl, String version, boolean versioned) {
    }
}
