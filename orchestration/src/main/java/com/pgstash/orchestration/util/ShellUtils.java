package com.pgstash.orchestration.util;

import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public class ShellUtils {

    /**
     * Splits a command line the way a POSIX shell would, honouring single quotes, double quotes and backslash escapes.
     *
     * @throws IllegalArgumentException if a quote is not terminated
     */
    public static List<String> split(String commandLine) {
        List<String> result = new ArrayList<>();
        if (StringUtils.isBlank(commandLine)) {
            return result;
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
                } else if (c == '\\' && i + 1 < commandLine.length() && "\"\\$`".indexOf(commandLine.charAt(i + 1)) >= 0) {
                    current.append(commandLine.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    result.add(current.toString());
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

        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote in command line: " + commandLine);
        }
        if (inToken) {
            result.add(current.toString());
        }
        return result;
    }

    /**
     * Looks an executable up in {@code pathPrefix} and then in the {@code PATH} environment variable.
     *
     * @return absolute path to the executable or null if none was found
     */
    public static Path which(String executable, String pathPrefix) {
        return which(executable, pathPrefix, System.getenv("PATH"));
    }

    static Path which(String executable, String pathPrefix, String pathVariable) {
        List<String> directories = new ArrayList<>();
        if (StringUtils.isNotBlank(pathPrefix)) {
            directories.addAll(List.of(pathPrefix.split(File.pathSeparator)));
        }
        if (StringUtils.isNotBlank(pathVariable)) {
            directories.addAll(List.of(pathVariable.split(File.pathSeparator)));
        }

        for (String directory : directories) {
            if (StringUtils.isBlank(directory)) {
                continue;
            }
            Path candidate = Path.of(directory, executable);
            if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                return candidate.toAbsolutePath();
            }
        }
        return null;
    }

    private ShellUtils() {
    }
}
