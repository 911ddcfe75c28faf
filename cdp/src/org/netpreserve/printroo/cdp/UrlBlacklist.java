package org.netpreserve.printroo.cdp;

import org.apache.commons.lang3.StringUtils;
import org.netpreserve.printroo.util.Url;

import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * URL patterns the browser must not load. Patterns use {@code *} as a wildcard for any run of characters and
 * must match the whole URL. Matching is case-sensitive.
 */
public class UrlBlacklist implements Predicate<Url> {
    private static final UrlBlacklist EMPTY = new UrlBlacklist(List.of());
    private final List<String> patterns;
    private final List<Pattern> regexes;

    public UrlBlacklist(Collection<String> patterns) {
        this.patterns = List.copyOf(patterns);
        var regexes = new ArrayList<Pattern>(patterns.size());
        for (String pattern : patterns) {
            if (StringUtils.isEmpty(pattern)) continue;
            regexes.add(Pattern.compile(wildcardToRegex(pattern)));
        }
        this.regexes = List.copyOf(regexes);
    }

    public static UrlBlacklist empty() {
        return EMPTY;
    }

    static String wildcardToRegex(String wildcard) {
        var builder = new StringBuilder(wildcard.length() + 16);
        int start = 0;
        int star;
        while ((star = wildcard.indexOf('*', start)) != -1) {
            if (star > start) builder.append(Pattern.quote(wildcard.substring(start, star)));
            builder.append(".*");
            start = star + 1;
        }
        if (start < wildcard.length()) builder.append(Pattern.quote(wildcard.substring(start)));
        return builder.toString();
    }

    public boolean isEmpty() {
        return regexes.isEmpty();
    }

    /**
     * True if any pattern matches the URL.
     */
    @Override
    public boolean test(Url url) {
        String s = url.toString();
        for (var regex : regexes) {
            if (regex.matcher(s).matches()) {
                return true;
            }
        }
        return false;
    }

    /**
     * True if a pattern matches the URL and the exact URL is not one of the safe URLs.
     */
    public boolean isBlocked(Url url, Set<Url> safeUrls) {
        return test(url) && !safeUrls.contains(url);
    }

    public List<String> patterns() {
        return patterns;
    }

    @Override
    public String toString() {
        return "UrlBlacklist" + patterns;
    }
}
