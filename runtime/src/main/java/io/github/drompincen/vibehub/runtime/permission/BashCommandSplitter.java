package io.github.drompincen.vibehub.runtime.permission;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a compound shell command on {@code &&}, {@code ||} and {@code ;} into its sub-commands.
 * Separators inside single or double quotes are kept. A quote preceded by a backslash does not
 * open or close a quoted section. Single {@code |} and {@code &} are not separators.
 */
public final class BashCommandSplitter {

    private enum State { UNQUOTED, IN_SINGLE_QUOTE, IN_DOUBLE_QUOTE }

    private BashCommandSplitter() {}

    public static List<String> split(String command) {
        List<String> commands = new ArrayList<>();
        if (command == null || command.isBlank()) {
            return commands;
        }

        StringBuilder current = new StringBuilder();
        State state = State.UNQUOTED;
        int length = command.length();
        int i = 0;

        while (i < length) {
            char c = command.charAt(i);
            boolean escaped = i > 0 && command.charAt(i - 1) == '\\';

            switch (state) {
                case UNQUOTED -> {
                    if (c == '\'' && !escaped) {
                        state = State.IN_SINGLE_QUOTE;
                    } else if (c == '"' && !escaped) {
                        state = State.IN_DOUBLE_QUOTE;
                    } else if (c == ';') {
                        flush(current, commands);
                        i++;
                        continue;
                    } else if ((c == '&' || c == '|') && i + 1 < length && command.charAt(i + 1) == c) {
                        flush(current, commands);
                        i += 2;
                        continue;
                    }
                }
                case IN_SINGLE_QUOTE -> {
                    if (c == '\'' && !escaped) state = State.UNQUOTED;
                }
                case IN_DOUBLE_QUOTE -> {
                    if (c == '"' && !escaped) state = State.UNQUOTED;
                }
            }
            current.append(c);
            i++;
        }

        flush(current, commands);
        return commands;
    }

    public static boolean isCompound(String command) {
        return split(command).size() > 1;
    }

    private static void flush(StringBuilder current, List<String> commands) {
        String trimmed = current.toString().trim();
        if (!trimmed.isEmpty()) {
            commands.add(trimmed);
        }
        current.setLength(0);
    }
}
