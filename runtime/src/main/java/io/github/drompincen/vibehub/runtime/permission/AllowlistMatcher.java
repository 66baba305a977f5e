package io.github.drompincen.vibehub.runtime.permission;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Set;

/**
 * Permission pattern generation and allow-list matching.
 *
 * <p>Patterns look like {@code Bash(pnpm build)}, {@code Write(/repo/README.md)} or a bare tool
 * name such as {@code WebFetch}. Matching rules, in order:
 * <ul>
 *   <li>an exact string match always wins;</li>
 *   <li>a stored {@code Bash(cmd)} matches any actual {@code Bash(cmd ...)} whose command starts with
 *       {@code cmd} and continues, if at all, at a whitespace boundary;</li>
 *   <li>a stored pattern ending in {@code *)} or {@code *} matches anything that starts with the text
 *       before the star.</li>
 * </ul>
 */
public final class AllowlistMatcher {

    public static final String BASH = "Bash";
    private static final String BASH_PREFIX = "Bash(";
    private static final Set<String> FILE_TOOLS = Set.of("Read", "Write", "Edit");

    private AllowlistMatcher() {}

    public static String generatePattern(String toolName, JsonNode input) {
        if (BASH.equals(toolName) && hasText(input, "command")) {
            return bashPattern(input.get("command").asText());
        }
        if (FILE_TOOLS.contains(toolName) && hasText(input, "file_path")) {
            return toolName + "(" + input.get("file_path").asText() + ")";
        }
        return toolName;
    }

    public static String bashPattern(String command) {
        return BASH_PREFIX + command + ")";
    }

    public static boolean matches(String pattern, Set<String> allowlist) {
        if (pattern == null || allowlist == null || allowlist.isEmpty()) {
            return false;
        }
        if (allowlist.contains(pattern)) {
            return true;
        }
        for (String allowed : allowlist) {
            if (matchesBashPrefix(allowed, pattern) || matchesWildcard(allowed, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks an invocation against the session and global lists. Compound Bash commands are allowed
     * only if every sub-command matches one of the two lists on its own.
     */
    public static boolean isAllowed(String toolName, JsonNode input, Set<String> sessionAllowlist,
                                    Set<String> globalAllowlist) {
        if (BASH.equals(toolName) && hasText(input, "command")) {
            List<String> subCommands = BashCommandSplitter.split(input.get("command").asText());
            if (subCommands.isEmpty()) {
                return false;
            }
            for (String subCommand : subCommands) {
                String pattern = bashPattern(subCommand);
                if (!matches(pattern, sessionAllowlist) && !matches(pattern, globalAllowlist)) {
                    return false;
                }
            }
            return true;
        }

        String pattern = generatePattern(toolName, input);
        return matches(pattern, sessionAllowlist) || matches(pattern, globalAllowlist);
    }

    private static boolean matchesBashPrefix(String allowed, String pattern) {
        if (!isBashPattern(allowed) || !isBashPattern(pattern)) {
            return false;
        }
        String allowedCommand = allowed.substring(BASH_PREFIX.length(), allowed.length() - 1);
        String actualCommand = pattern.substring(BASH_PREFIX.length(), pattern.length() - 1);
        if (allowedCommand.isEmpty() || !actualCommand.startsWith(allowedCommand)) {
            return false;
        }
        if (actualCommand.length() == allowedCommand.length()
                || Character.isWhitespace(allowedCommand.charAt(allowedCommand.length() - 1))) {
            return true;
        }
        return Character.isWhitespace(actualCommand.charAt(allowedCommand.length()));
    }

    private static boolean matchesWildcard(String allowed, String pattern) {
        if (allowed.endsWith("*)")) {
            String prefix = allowed.substring(0, allowed.length() - 2);
            String actual = pattern.endsWith(")") ? pattern.substring(0, pattern.length() - 1) : pattern;
            return actual.startsWith(prefix);
        }
        if (allowed.endsWith("*")) {
            return pattern.startsWith(allowed.substring(0, allowed.length() - 1));
        }
        return false;
    }

    private static boolean isBashPattern(String value) {
        return value.startsWith(BASH_PREFIX) && value.endsWith(")") && value.length() > BASH_PREFIX.length();
    }

    private static boolean hasText(JsonNode input, String field) {
        return input != null && input.hasNonNull(field) && !input.get(field).asText().isEmpty();
    }
}
