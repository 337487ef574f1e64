package com.pgstash.orchestration.copy;

import org.apache.commons.collections4.ListUtils;

import java.util.List;
import java.util.regex.Pattern;

/**
 * rsync-like include/exclude evaluation for paths relative to a copy source.
 * <p>
 * A path matching an include rule is accepted, otherwise a path matching an exclude rule is rejected,
 * otherwise it is accepted. A rule starting with {@code /} is anchored at the source root, any other rule
 * also matches as a suffix of the path. A rule ending with {@code /} matches directories only.
 * {@code *} does not cross {@code /}, {@code **} does.
 */
public class PathFilter {
    private final List<String> exclude;
    private final List<String> include;

    public PathFilter(List<String> exclude, List<String> include) {
        this.exclude = ListUtils.emptyIfNull(exclude);
        this.include = ListUtils.emptyIfNull(include);
    }

    public boolean isAllowed(String path, boolean directory) {
        if (matchesAny(include, path, directory)) {
            return true;
        }
        return !matchesAny(exclude, path, directory);
    }

    private static boolean matchesAny(List<String> rules, String path, boolean directory) {
        for (String rule : rules) {
            if (matches(rule, path, directory)) {
                return true;
            }
        }
        return false;
    }

    static boolean matches(String rule, String path, boolean directory) {
        String pattern = rule;
        if (pattern.endsWith("/")) {
            if (!directory) {
                return false;
            }
            pattern = pattern.substring(0, pattern.length() - 1);
        }
        boolean anchored = false;
        if (pattern.startsWith("/")) {
            pattern = pattern.substring(1);
            anchored = true;
        }
        if (toRegex(pattern).matcher(path).matches()) {
            return true;
        }
        return !anchored && toRegex("**/" + pattern).matcher(path).matches();
    }

    static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '*') {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    regex.append(".*");
                    i += 2;
                    continue;
                }
                regex.append("[^/]*");
            } else if (c == '?') {
                regex.append("[^/]");
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString());
    }
}
