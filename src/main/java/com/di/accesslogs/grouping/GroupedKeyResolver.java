package com.di.accesslogs.grouping;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a raw log key to its date-grouped key
 * {@code {groupedFolder}/year=YYYY/month=MM/day=DD/hour=HH/{basename}}.
 *
 * <p>The four fields come only from the pattern's named groups, zero-padded, never from the
 * clock, so late or redelivered objects land in the hour they were logged for.
 */
public class GroupedKeyResolver {

    private final Pattern rawKeyPattern;
    private final String groupedFolder;

    public GroupedKeyResolver(Pattern rawKeyPattern, String groupedFolder) {
        this.rawKeyPattern = rawKeyPattern;
        this.groupedFolder = groupedFolder;
    }

    /**
     * @return the grouped key, or empty if {@code rawKey} does not match the pattern
     */
    public Optional<String> resolve(String rawKey) {
        if (rawKey == null) {
            return Optional.empty();
        }
        Matcher matcher = rawKeyPattern.matcher(rawKey);
        if (!matcher.find()) {
            return Optional.empty();
        }
        if (matcher.group("year") == null || matcher.group("month") == null
                || matcher.group("day") == null || matcher.group("hour") == null) {
            return Optional.empty();
        }
        String year = leftPad(matcher.group("year"), 4);
        String month = leftPad(matcher.group("month"), 2);
        String day = leftPad(matcher.group("day"), 2);
        String hour = leftPad(matcher.group("hour"), 2);
        return Optional.of(String.format("%s/year=%s/month=%s/day=%s/hour=%s/%s",
                groupedFolder, year, month, day, hour, basename(rawKey)));
    }

    /** Everything after the last slash. */
    static String basename(String key) {
        int slash = key.lastIndexOf('/');
        return slash < 0 ? key : key.substring(slash + 1);
    }

    private static String leftPad(String value, int width) {
        StringBuilder sb = new StringBuilder(width);
        for (int i = value.length(); i < width; i++) {
            sb.append('0');
        }
        return sb.append(value).toString();
    }
}
