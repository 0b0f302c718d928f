package org.weatherwatch.ruler;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Finds drought and flood occurrences in a sequence using the platform regex engine. Matches are greedy,
 * non-overlapping and reported left to right.
 */
@ThreadSafe
@Immutable
public class PatternDetector {

    public PatternMatches detect(@Nonnull final CharSequence sequence) {
        final Map<PatternType, List<String>> found = new EnumMap<>(PatternType.class);
        for (PatternType type : PatternType.values()) {
            found.put(type, findAll(type, sequence));
        }
        return new PatternMatches(found.get(PatternType.DROUGHT), found.get(PatternType.FLOOD));
    }

    static List<String> findAll(final PatternType type, final CharSequence sequence) {
        final List<String> matches = new ArrayList<>();
        final Matcher matcher = type.pattern().matcher(sequence);
        while (matcher.find()) {
            matches.add(matcher.group());
        }
        return matches;
    }
}
