package com.residencepark.visitorparking.chat;

import lombok.Getter;
import lombok.ToString;

/**
 * Plain-text output of one tool call.
 *
 * A context result is handed to the ResponseComposer for phrasing; a direct
 * result (e.g. "please specify a unit number") goes back to the user as is.
 */
@Getter
@ToString
public final class ToolResult {

    private final ChatIntent intent;
    private final String text;
    private final boolean directReply;

    private ToolResult(ChatIntent intent, String text, boolean directReply) {
        this.intent = intent;
        this.text = text;
        this.directReply = directReply;
    }

    public static ToolResult context(ChatIntent intent, String text) {
        return new ToolResult(intent, text, false);
    }

    public static ToolResult direct(ChatIntent intent, String text) {
        return new ToolResult(intent, text, true);
    }
}
