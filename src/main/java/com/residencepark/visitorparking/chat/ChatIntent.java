package com.residencepark.visitorparking.chat;

import java.util.Locale;

/**
 * What a free-text assistant query is asking for.
 */
public enum ChatIntent {

    /** "How can I ..." instructional questions — templated reply */
    HOW_TO,

    /** Counts and available spots */
    STATS,

    /** One-line occupancy verdict */
    SUMMARY,

    /** Find a visitor by name */
    SEARCH,

    /** Visitors for a unit */
    UNIT,

    /** Recent visitors */
    LIST,

    GREETING,

    HELP,

    /** Nothing matched */
    GENERAL;

    /** Lower-case wire form, e.g. "how_to". */
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Intents answered from a fixed template, with no tool call and no model call. */
    public boolean isTemplated() {
        return this == HOW_TO || this == GREETING || this == HELP;
    }
}
