package com.inboxsync.domain;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * One spreadsheet row derived from one mailbox item. {@code content} always occupies a single line:
 * line breaks and whitespace runs are collapsed to one space at construction.
 */
public record RowRecord(String from, String subject, String date, String content) {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    public RowRecord {
        from = from == null ? "" : from;
        subject = subject == null ? "" : subject;
        date = date == null ? "" : date;
        content = singleLine(content);
    }

    /** Cell values in sheet column order: From, Subject, Date, Content. */
    public List<String> cells() {
        return List.of(from, subject, date, content);
    }

    /**
     * Collapses every run of Unicode whitespace (including U+2028, U+2029 and U+0085) to one space
     * and trims both ends.
     */
    public static String singleLine(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return Arrays.stream(WHITESPACE.split(text))
                .filter(token -> !token.isEmpty())
                .collect(Collectors.joining(" "));
    }
}
