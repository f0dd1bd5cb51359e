package app.magicrows.enrichment.provider;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort heuristics for responses that were not bound to an output contract.
 */
public final class FreeTextExtractor {

    private static final Pattern LIST_MARKER = Pattern.compile("^\\s*(?:[-*•]+|\\d+[\\).])\\s+");
    private static final Pattern CODE_FENCE = Pattern.compile("^\\s*```[\\w-]*\\s*\\R?|\\R?\\s*```\\s*$");
    private static final Pattern HEADING = Pattern.compile("(?m)^[ \\t]*#{1,6}[ \\t]*");
    private static final Pattern EMPHASIS = Pattern.compile("\\*\\*|__|`");
    private static final Pattern MULTI_SPACE = Pattern.compile("[ \\t]+");
    private static final Pattern THOUSANDS_SEPARATOR = Pattern.compile("(?<=\\d),(?=\\d{3}\\b)");
    private static final Pattern DECIMAL_COMMA = Pattern.compile("(?<=\\d),(?=\\d)");
    // a number glued to a word or a hyphen ("ISO-8601", "GPT4") is not a value
    private static final Pattern NUMBER = Pattern.compile("(?<![\\w.-])[-+]?\\d*\\.?\\d+(?:[eE][-+]?\\d+)?");

    private FreeTextExtractor() {
    }

    public static String stripMarkup(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = stripCodeFence(text);
        cleaned = HEADING.matcher(cleaned).replaceAll("");
        cleaned = EMPHASIS.matcher(cleaned).replaceAll("");
        cleaned = MULTI_SPACE.matcher(cleaned).replaceAll(" ");
        return cleaned.trim();
    }

    public static String stripCodeFence(String text) {
        if (text == null) {
            return "";
        }
        return CODE_FENCE.matcher(text.trim()).replaceAll("").trim();
    }

    public static boolean hasListMarkers(String text) {
        if (text == null) {
            return false;
        }
        for (String line : text.split("\\R")) {
            if (LIST_MARKER.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

    public static List<String> listItems(String text) {
        if (!hasListMarkers(text)) {
            return List.of();
        }
        List<String> items = new ArrayList<>();
        for (String line : text.split("\\R")) {
            Matcher matcher = LIST_MARKER.matcher(line);
            if (!matcher.find()) {
                continue;
            }
            String item = stripMarkup(line.substring(matcher.end()));
            if (!item.isEmpty()) {
                items.add(item);
            }
        }
        return List.copyOf(items);
    }

    public static List<String> lines(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> lines = new ArrayList<>();
        for (String line : stripCodeFence(text).split("\\R+")) {
            String cleaned = stripMarkup(line);
            if (!cleaned.isEmpty()) {
                lines.add(cleaned);
            }
        }
        return List.copyOf(lines);
    }

    public static Object extractText(String text, boolean multiple) {
        if (!multiple) {
            return stripMarkup(text);
        }
        List<String> items = listItems(text);
        return items.isEmpty() ? lines(text) : items;
    }

    public static List<String> matchCategories(String text, List<String> categories, boolean multiple) {
        if (text == null || text.isBlank() || categories == null || categories.isEmpty()) {
            return List.of();
        }
        List<String> matches = collectMatches(text, categories, multiple, false);
        if (matches.isEmpty()) {
            matches = collectMatches(text, categories, multiple, true);
        }
        return matches;
    }

    public static Optional<BigDecimal> extractNumber(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = THOUSANDS_SEPARATOR.matcher(stripMarkup(text)).replaceAll("");
        normalized = DECIMAL_COMMA.matcher(normalized).replaceAll(".");
        Matcher matcher = NUMBER.matcher(normalized);
        if (!matcher.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new BigDecimal(matcher.group()));
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
    }

    private static List<String> collectMatches(String text,
                                               List<String> categories,
                                               boolean multiple,
                                               boolean ignoreCase) {
        String haystack = ignoreCase ? text.toLowerCase(Locale.ROOT) : text;
        List<String> matches = new ArrayList<>();
        for (String category : categories) {
            String needle = ignoreCase ? category.toLowerCase(Locale.ROOT) : category;
            if (!needle.isEmpty() && haystack.contains(needle)) {
                matches.add(category);
                if (!multiple) {
                    break;
                }
            }
        }
        return matches;
    }
}
