package com.inboxsync.ingestion.filter;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Subject include/exclude keywords. Include acts as a whitelist, exclude as a blacklist;
 * both match case-insensitively as substrings. Empty lists disable the respective check.
 */
public record SubjectFilter(List<String> include, List<String> exclude) {

    public SubjectFilter {
        include = normalize(include);
        exclude = normalize(exclude);
    }

    public static SubjectFilter none() {
        return new SubjectFilter(List.of(), List.of());
    }

    public boolean matches(String subject) {
        String s = subject == null ? "" : subject.toLowerCase(Locale.ROOT);
        if (!include.isEmpty() && include.stream().noneMatch(s::contains)) {
            return false;
        }
        return exclude.stream().noneMatch(s::contains);
    }

    public boolean hasInclude() {
        return !include.isEmpty();
    }

    private static List<String> normalize(List<String> keywords) {
        if (keywords == null) {
            return List.of();
        }
        return keywords.stream()
                .filter(Objects::nonNull)
                .map(String::strip)
                .filter(k -> !k.isEmpty())
                .map(k -> k.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
