package com.residencepark.visitorparking.chat;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * One entry of the classifier's ordered rule list: a set of trigger phrases
 * (case-insensitive substring match) and the parameter extractor to run when
 * one of them is found.
 */
final class IntentRule {

    private static final Function<String, Optional<String>> NO_PARAMETER = query -> Optional.empty();

    private final ChatIntent intent;
    private final List<String> triggers;
    private final Function<String, Optional<String>> extractor;

    private IntentRule(ChatIntent intent, List<String> triggers, Function<String, Optional<String>> extractor) {
        this.intent = intent;
        this.triggers = List.copyOf(triggers);
        this.extractor = extractor;
    }

    static IntentRule of(ChatIntent intent, String... triggers) {
        return new IntentRule(intent, List.of(triggers), NO_PARAMETER);
    }

    static IntentRule of(ChatIntent intent, Function<String, Optional<String>> extractor, String... triggers) {
        return new IntentRule(intent, List.of(triggers), extractor);
    }

    /** @param lowerQuery the query already lower-cased */
    boolean matches(String lowerQuery) {
        for (String trigger : triggers) {
            if (lowerQuery.contains(trigger)) {
                return true;
            }
        }
        return false;
    }

    /** @param originalQuery the query as typed, case preserved */
    ClassifiedIntent apply(String originalQuery) {
        return ClassifiedIntent.of(intent, extractor.apply(originalQuery).orElse(null));
    }
}
