package com.opsbot.engine;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renders a job's command line from its {@code run_args_template}.
 *
 * <p>Placeholders are {@code {name}}. Each substituted value is quoted for a POSIX shell,
 * so argument content can never add commands or redirections.</p>
 */
public final class CommandTemplate {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z_][A-Za-z0-9_]*)}");
    private static final Pattern SAFE = Pattern.compile("[A-Za-z0-9_@%+=:,./-]+");

    private CommandTemplate() {
    }

    /**
     * @throws IllegalArgumentException if the template names an argument that is not in {@code args}
     */
    public static String render(String template, Map<String, String> args) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            if (!args.containsKey(name)) {
                throw new IllegalArgumentException("Missing argument '" + name + "' for template: " + template);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(quote(args.get(name))));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    public static String quote(String value) {
        if (value == null || value.isEmpty()) {
            return "''";
        }
        if (SAFE.matcher(value).matches()) {
            return value;
        }
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }
}
