package com.questrail.txfile.tool;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Named command-line options of the form {@code --name value} or
 * {@code --name=value}.
 *
 * <p>Positional arguments, repeated options and options without a value are
 * rejected with {@link IllegalArgumentException}.</p>
 */
public final class ToolArguments
{
    private static final String PREFIX = "--";
    private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9-]*$");

    private final Map<String, String> values;

    private ToolArguments(Map<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static ToolArguments parse(String[] args) {
        final Map<String, String> values = new LinkedHashMap<>();
        if (args == null) {
            return new ToolArguments(values);
        }

        for (int i = 0; i < args.length; i++) {
            final String arg = args[i];
            if (arg == null || !arg.startsWith(PREFIX)) {
                throw new IllegalArgumentException("unexpected argument '" + arg + "'");
            }

            final String name;
            final String value;
            final int eq = arg.indexOf('=');
            if (eq >= 0) {
                name = arg.substring(PREFIX.length(), eq);
                value = arg.substring(eq + 1);
            }
            else {
                name = arg.substring(PREFIX.length());
                if (i + 1 >= args.length || args[i + 1].startsWith(PREFIX)) {
                    throw new IllegalArgumentException("option --" + name + " requires a value");
                }
                value = args[++i];
            }

            if (!NAME_PATTERN.matcher(name).matches()) {
                throw new IllegalArgumentException("invalid option name '" + name + "'");
            }
            if (value.isBlank()) {
                throw new IllegalArgumentException("option --" + name + " requires a value");
            }
            if (values.putIfAbsent(name, value) != null) {
                throw new IllegalArgumentException("option --" + name + " given more than once");
            }
        }
        return new ToolArguments(values);
    }

    /**
     * Returns the value of a mandatory option.
     */
    public String require(String name) {
        final String value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("missing required option --" + name);
        }
        return value;
    }

    public Optional<String> optional(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Rejects any option not in {@code allowed}.
     */
    public void requireOnly(Set<String> allowed) {
        for (String name : values.keySet()) {
            if (!allowed.contains(name)) {
                throw new IllegalArgumentException("unknown option --" + name);
            }
        }
    }
}
