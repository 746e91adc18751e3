package io.apipipeline.server.core.router;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compiled path template.
 *
 * <p>Segments:
 * <ul>
 *   <li>{@code :name} captures one segment as {@code name}</li>
 *   <li>{@code *} captures one segment as {@code *0}, {@code *1}, ... in order of appearance</li>
 *   <li>{@code **} captures the remainder of the path, slashes included, as {@code **}</li>
 * </ul>
 * A trailing slash on the request path is optional. Captured values are percent-decoded.
 */
public final class RoutePattern {

    public static final String REST = "**";

    private static final Pattern PARAM_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String template;
    private final Pattern regex;
    private final List<String> paramNames;

    private RoutePattern(String template, Pattern regex, List<String> paramNames) {
        this.template = template;
        this.regex = regex;
        this.paramNames = paramNames;
    }

    /**
     * @throws IllegalArgumentException if the template does not start with {@code /}, uses an
     *     invalid parameter name or repeats one
     */
    public static RoutePattern compile(String template) {
        Objects.requireNonNull(template, "template");
        if (!template.startsWith("/")) throw new IllegalArgumentException("template must start with '/': " + template);

        StringBuilder re = new StringBuilder("^");
        List<String> names = new ArrayList<>();
        int wildcards = 0;

        for (String segment : template.split("/")) {
            if (segment.isEmpty()) continue;
            re.append('/');
            String name;
            if (segment.equals(REST)) {
                re.append("(.*?)");
                name = REST;
            } else if (segment.equals("*")) {
                re.append("([^/]+)");
                name = "*" + wildcards++;
            } else if (segment.startsWith(":")) {
                name = segment.substring(1);
                if (!PARAM_NAME.matcher(name).matches()) {
                    throw new IllegalArgumentException("invalid parameter name '" + name + "' in " + template);
                }
                re.append("([^/]+)");
            } else {
                re.append(Pattern.quote(segment));
                continue;
            }
            if (names.contains(name)) {
                throw new IllegalArgumentException("duplicate parameter '" + name + "' in " + template);
            }
            names.add(name);
        }
        re.append("/?$");
        return new RoutePattern(template, Pattern.compile(re.toString()), List.copyOf(names));
    }

    /**
     * Matches a raw request path.
     *
     * @return decoded parameters keyed by name, or empty when the path does not match
     */
    public Optional<Map<String, String>> match(String path) {
        if (path == null) return Optional.empty();
        Matcher m = regex.matcher(path);
        if (!m.matches()) return Optional.empty();
        Map<String, String> params = new LinkedHashMap<>();
        for (int i = 0; i < paramNames.size(); i++) {
            params.put(paramNames.get(i), decode(m.group(i + 1)));
        }
        return Optional.of(Collections.unmodifiableMap(params));
    }

    public String template() {
        return template;
    }

    public List<String> paramNames() {
        return paramNames;
    }

    private static String decode(String raw) {
        if (raw.indexOf('%') < 0) return raw;
        try {
            // '+' is literal in paths
            return URLDecoder.decode(raw.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException malformed) {
            return raw;
        }
    }

    @Override
    public String toString() {
        return template;
    }
}
