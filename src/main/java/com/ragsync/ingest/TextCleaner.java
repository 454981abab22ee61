package com.ragsync.ingest;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

public final class TextCleaner {
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\n{3,}");
    private static final Pattern HORIZONTAL_RUNS = Pattern.compile("[ \\t]{2,}");

    private TextCleaner() {
    }

    public static String clean(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = text.replace("\r\n", "\n").replace('\r', '\n');
        normalized = Arrays.stream(normalized.split("\n", -1))
                .map(String::strip)
                .collect(Collectors.joining("\n"));
        normalized = EXCESS_BLANK_LINES.matcher(normalized).replaceAll("\n\n");
        normalized = HORIZONTAL_RUNS.matcher(normalized).replaceAll(" ");
        return normalized.strip();
    }
}
