package com.sequence.editor.layout;

import java.util.regex.Pattern;

import lombok.experimental.UtilityClass;

/**
 * Approximate text measurement. Labels and note texts break on the two
 * character sequence {@code \n}; participant display names hold real newlines.
 */
@UtilityClass
public class TextMetrics {

    private static final String ESCAPED_NEWLINE = "\\n";

    private static final Pattern[] MARKUP = {
            Pattern.compile("\\*\\*([^*]+)\\*\\*"),
            Pattern.compile("//([^/]+)//"),
            Pattern.compile("\"\"([^\"]+)\"\""),
            Pattern.compile("__([^_]+)__"),
            Pattern.compile("~~([^~]+)~~"),
            Pattern.compile("<color\\s+[^>]+>([^<]*)</color>"),
            Pattern.compile("<bgcolor\\s+[^>]+>([^<]*)</bgcolor>")
    };

    /**
     * Removes paired markup delimiters so the remaining text can be measured.
     */
    public static String stripMarkup(String text) {
        if (text == null) {
            return "";
        }
        String plain = text;
        for (Pattern pattern : MARKUP) {
            plain = pattern.matcher(plain).replaceAll("$1");
        }
        return plain;
    }

    public static int labelLineCount(String label) {
        if (label == null || label.isEmpty()) {
            return 1;
        }
        return label.split(Pattern.quote(ESCAPED_NEWLINE), -1).length;
    }

    public static int longestLabelLine(String label) {
        return longestLine(label, ESCAPED_NEWLINE, true);
    }

    /**
     * Longest line of a note text. Markup is counted as written.
     */
    public static int longestNoteLine(String text) {
        return Math.max(1, longestLine(text, ESCAPED_NEWLINE, false));
    }

    public static int longestDisplayNameLine(String displayName) {
        return longestLine(displayName, "\n", true);
    }

    private static int longestLine(String text, String separator, boolean strip) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        int longest = 0;
        for (String line : text.split(Pattern.quote(separator), -1)) {
            String measured = strip ? stripMarkup(line) : line;
            longest = Math.max(longest, measured.length());
        }
        return longest;
    }
}
