package com.phillippitts.mediaqueue.service.jobs;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a command line into arguments with POSIX-shell-like quoting.
 *
 * <p>Supported: whitespace separation, single quotes (literal), double quotes (backslash escapes
 * {@code \"} and {@code \\}), and backslash escapes outside quotes. No variable expansion, globbing
 * or operators. An unterminated quote runs to the end of the input.
 */
public final class CommandLineSplitter {

    private CommandLineSplitter() {
        // Utility class - prevent instantiation
    }

    public static List<String> split(String commandLine) {
        List<String> args = new ArrayList<>();
        if (commandLine == null) {
            return args;
        }
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;
        for (int i = 0; i < commandLine.length(); i++) {
            char c = commandLine.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    current.append(c);
                }
            } else if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < commandLine.length()
                        && (commandLine.charAt(i + 1) == '"' || commandLine.charAt(i + 1) == '\\')) {
                    current.append(commandLine.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    args.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (c == '\\' && i + 1 < commandLine.length()) {
                current.append(commandLine.charAt(++i));
                inToken = true;
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (inToken) {
            args.add(current.toString());
        }
        return args;
    }
}
