package com.residencepark.visitorparking.chat;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rule-based intent classifier for assistant queries.
 *
 * Rules are evaluated top to bottom and the first one with a matching trigger
 * phrase wins. There is no scoring. The order is part of the behavior:
 * HOW_TO sits above SEARCH and UNIT so that "how can I search for a visitor"
 * gets instructions instead of a search, and UNIT sits above LIST so that
 * "show visitors for unit B-1-01" is not read as a plain list request.
 *
 * Stateless; safe to share between requests.
 */
@Component
@Slf4j
public class IntentClassifier {

    /** Words never taken as a visitor name in SEARCH queries */
    static final Set<String> NAME_STOP_WORDS = Set.of(
            "search", "find", "for", "visitor", "named", "called",
            "the", "a", "an", "is", "there", "where", "who", "locate",
            "how", "can", "i", "do", "to", "tell", "me", "explain", "show");

    /** Unit numbers such as B-1-01, A-74, B1-09 (matched against the upper-cased query) */
    static final Pattern UNIT_PATTERN = Pattern.compile("[A-Z]-?\\d+-?\\d*");

    private static final List<IntentRule> RULES = List.of(
            IntentRule.of(ChatIntent.HOW_TO,
                    "how can i", "how do i", "how to", "what are the ways",
                    "tell me how", "explain how", "show me how"),
            IntentRule.of(ChatIntent.STATS,
                    "how many", "count", "stats", "statistics", "occupancy",
                    "available", "free", "spots", "capacity"),
            IntentRule.of(ChatIntent.SUMMARY,
                    "status", "summary", "overview", "situation", "full", "busy"),
            IntentRule.of(ChatIntent.SEARCH, IntentClassifier::extractVisitorName,
                    "search for", "find visitor", "locate visitor", "look for visitor",
                    "where is", "is there a visitor"),
            IntentRule.of(ChatIntent.UNIT, IntentClassifier::extractUnitNumber,
                    "unit", "apartment", "flat"),
            IntentRule.of(ChatIntent.LIST,
                    "list", "show all", "display", "view all", "see all", "visitors"),
            IntentRule.of(ChatIntent.GREETING,
                    "hello", "hi", "hey", "greetings"),
            IntentRule.of(ChatIntent.HELP,
                    "help", "what can you", "how to use"));

    /**
     * Classifies a query. Never returns null; unmatched or blank queries yield GENERAL.
     */
    public ClassifiedIntent classify(String query) {
        if (query == null || query.isBlank()) {
            return ClassifiedIntent.of(ChatIntent.GENERAL);
        }
        String lower = query.toLowerCase(Locale.ROOT);
        for (IntentRule rule : RULES) {
            if (rule.matches(lower)) {
                ClassifiedIntent result = rule.apply(query);
                log.debug("Classified '{}' as {}", query, result);
                return result;
            }
        }
        log.debug("Classified '{}' as GENERAL", query);
        return ClassifiedIntent.of(ChatIntent.GENERAL);
    }

    /**
     * First whitespace token that is longer than two characters, not a stop
     * word and not purely numeric, rendered capitalized ("john" → "John").
     * Surrounding punctuation is stripped first ("John?" → "John").
     */
    static Optional<String> extractVisitorName(String query) {
        return Arrays.stream(query.trim().split("\\s+"))
                .map(IntentClassifier::stripPunctuation)
                .filter(word -> word.length() > 2)
                .filter(word -> !NAME_STOP_WORDS.contains(word.toLowerCase(Locale.ROOT)))
                .filter(word -> !word.chars().allMatch(Character::isDigit))
                .map(IntentClassifier::capitalize)
                .findFirst();
    }

    /**
     * First match of {@link #UNIT_PATTERN} in the upper-cased query; failing
     * that, the first token containing both a letter and a digit.
     */
    static Optional<String> extractUnitNumber(String query) {
        String upper = query.toUpperCase(Locale.ROOT);
        Matcher matcher = UNIT_PATTERN.matcher(upper);
        if (matcher.find()) {
            return Optional.of(matcher.group());
        }
        return Arrays.stream(upper.trim().split("\\s+"))
                .filter(word -> word.chars().anyMatch(Character::isDigit))
                .filter(word -> word.chars().anyMatch(Character::isLetter))
                .findFirst();
    }

    private static String stripPunctuation(String word) {
        int start = 0;
        int end = word.length();
        while (start < end && !Character.isLetterOrDigit(word.charAt(start))) {
            start++;
        }
        while (end > start && !Character.isLetterOrDigit(word.charAt(end - 1))) {
            end--;
        }
        return word.substring(start, end);
    }

    private static String capitalize(String word) {
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }
}
