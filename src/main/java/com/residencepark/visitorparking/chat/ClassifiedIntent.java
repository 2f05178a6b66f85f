package com.residencepark.visitorparking.chat;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

/**
 * Result of classifying a query: the intent plus the parameter extracted for
 * it (visitor name for SEARCH, unit number for UNIT), if any.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ClassifiedIntent {

    private final ChatIntent intent;

    @Getter(lombok.AccessLevel.NONE)
    private final String parameter;

    private ClassifiedIntent(ChatIntent intent, String parameter) {
        this.intent = intent;
        this.parameter = parameter;
    }

    public static ClassifiedIntent of(ChatIntent intent) {
        return new ClassifiedIntent(intent, null);
    }

    public static ClassifiedIntent of(ChatIntent intent, String parameter) {
        return new ClassifiedIntent(intent, parameter);
    }

    public Optional<String> getParameter() {
        return Optional.ofNullable(parameter);
    }
}
