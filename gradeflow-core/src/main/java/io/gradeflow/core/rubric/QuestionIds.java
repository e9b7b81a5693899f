package io.gradeflow.core.rubric;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Normalizes question labels to canonical top-level ids.
///
/// `"7(a)"`, `"Q7"`, `"Question 7.2"`, `"seven"`, `"第七题"` and `"[7]"`-suffixed labels all
/// map to `"7"`. Labels without any number are kept as trimmed text.
public final class QuestionIds {

    private static final Pattern SUB_LABEL = Pattern.compile("\\(.*?\\)|（.*?）|\\[.*?]");
    private static final Pattern PREFIX =
            Pattern.compile("^(question|problem|no\\.?|q|#|第)\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WORD = Pattern.compile("^[a-z]+");
    private static final Pattern SUB_NUMBER =
            Pattern.compile("\\d+\\s*[.\\-]\\s*\\d+|\\d+\\s*[a-z]\\b", Pattern.CASE_INSENSITIVE);

    private static final Map<String, Integer> ENGLISH =
            Map.ofEntries(
                    Map.entry("one", 1),
                    Map.entry("two", 2),
                    Map.entry("three", 3),
                    Map.entry("four", 4),
                    Map.entry("five", 5),
                    Map.entry("six", 6),
                    Map.entry("seven", 7),
                    Map.entry("eight", 8),
                    Map.entry("nine", 9),
                    Map.entry("ten", 10),
                    Map.entry("eleven", 11),
                    Map.entry("twelve", 12),
                    Map.entry("thirteen", 13),
                    Map.entry("fourteen", 14),
                    Map.entry("fifteen", 15),
                    Map.entry("sixteen", 16),
                    Map.entry("seventeen", 17),
                    Map.entry("eighteen", 18),
                    Map.entry("nineteen", 19),
                    Map.entry("twenty", 20));

    private static final String CHINESE_DIGITS = "一二三四五六七八九";

    private QuestionIds() {}

    /// Returns the canonical id of a label.
    ///
    /// @param label raw label as printed, may be null
    /// @return the question number as text, or the cleaned label if it has no number
    public static String canonical(String label) {
        int number = number(label);
        if (number > 0) {
            return String.valueOf(number);
        }
        return label == null ? "" : SUB_LABEL.matcher(label).replaceAll("").trim();
    }

    /// Returns whether a label names a sub-item such as `7(a)`, `7.2` or `7b`.
    public static boolean isSubLabel(String label) {
        if (label == null) {
            return false;
        }
        return SUB_LABEL.matcher(label).find() || SUB_NUMBER.matcher(label).find();
    }

    /// Returns the top-level question number of a label.
    ///
    /// @param label raw label, may be null
    /// @return the number, or 0 if none can be recognized
    public static int number(String label) {
        if (label == null) {
            return 0;
        }
        String text = SUB_LABEL.matcher(label.trim()).replaceAll("").trim();
        text = PREFIX.matcher(text.toLowerCase(Locale.ROOT)).replaceFirst("").trim();
        text = text.replace("题", "");
        if (text.isEmpty()) {
            return 0;
        }

        int chinese = chineseNumber(text);
        if (chinese > 0) {
            return chinese;
        }
        Matcher word = WORD.matcher(text);
        if (word.find() && ENGLISH.containsKey(word.group())) {
            return ENGLISH.get(word.group());
        }
        Matcher digits = DIGITS.matcher(text);
        if (digits.find()) {
            try {
                return Integer.parseInt(digits.group());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }

    // Handles 一..九十九 written with 十 as the tens marker.
    private static int chineseNumber(String text) {
        int tens = 0;
        int units = 0;
        int i = 0;
        int first = digit(text, 0);
        if (first > 0 && text.length() > 1 && text.charAt(1) == '十') {
            tens = first;
            i = 2;
        } else if (text.charAt(0) == '十') {
            tens = 1;
            i = 1;
        } else if (first > 0) {
            return first;
        } else {
            return 0;
        }
        int unit = digit(text, i);
        if (unit > 0) {
            units = unit;
        }
        return tens * 10 + units;
    }

    private static int digit(String text, int index) {
        if (index >= text.length()) {
            return 0;
        }
        return CHINESE_DIGITS.indexOf(text.charAt(index)) + 1;
    }
}
