package com.residencepark.visitorparking.chat;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Assistant answer plus what the query was understood as.
 */
@Getter
@ToString
@AllArgsConstructor
public class ChatReply {

    /** Lower-case intent name, e.g. "search" */
    private final String intent;

    /** Extracted visitor name or unit number; null when none */
    private final String parameter;

    private final String answer;
}
