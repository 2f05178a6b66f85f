package com.residencepark.visitorparking.chat;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Turns classified queries and tool output into the text the user sees.
 *
 * GREETING, HELP and HOW_TO get fixed replies. Everything else is phrased by
 * the GenerativeModel from a prompt that embeds the tool output as context and
 * asks for all of it to be reproduced.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ResponseComposer {

    static final String GREETING_REPLY = "Hello! I'm your parking assistant. I can help you with:\n"
            + "- Checking parking availability\n"
            + "- Finding specific visitors\n"
            + "- Viewing visitor lists\n"
            + "- Searching by unit number\n\n"
            + "What would you like to know?";

    static final String HELP_REPLY = "How I can help you:\n\n"
            + "Check statistics:\n"
            + "- \"How many visitors are parked?\"\n"
            + "- \"What's the parking status?\"\n"
            + "- \"How many spots available?\"\n\n"
            + "Search visitors:\n"
            + "- \"Find visitor John\"\n"
            + "- \"Search for visitor named Alice\"\n"
            + "- \"Is there a visitor called Mike?\"\n\n"
            + "View lists:\n"
            + "- \"Show all visitors\"\n"
            + "- \"List all parked cars\"\n\n"
            + "Search by unit:\n"
            + "- \"Show visitors for unit B-1-01\"\n"
            + "- \"Who visited unit A-74?\"\n\n"
            + "Just ask naturally!";

    static final String HOW_TO_SEARCH_REPLY = "How to search for visitors:\n\n"
            + "1. By name: ask me \"Find visitor [Name]\" or \"Search for [Name]\"\n"
            + "   Example: \"Find visitor John\"\n"
            + "2. By license plate: open the visitor list and use the search box "
            + "(it matches name, identity number and plate)\n"
            + "3. By unit number: ask me \"Show visitors for unit [Unit#]\"\n"
            + "   Example: \"Show visitors for unit B-1-01\"";

    static final String HOW_TO_UNIT_REPLY = "How to find visitors by unit:\n\n"
            + "1. Ask me directly: \"Show visitors for unit [Unit Number]\"\n"
            + "   Example: \"Show visitors for unit B-1-01\"\n"
            + "   Example: \"Who visited unit A-74?\"\n"
            + "2. Open the visitor list and filter by unit number\n\n"
            + "You will get the name, license plate and status of every visitor for that unit.";

    static final String HOW_TO_GENERAL_REPLY = "I can help you with:\n"
            + "- Searching visitors: ask \"How can I search for visitors?\"\n"
            + "- Finding by unit: ask \"How to find visitors by unit?\"\n"
            + "- Checking availability: ask \"How many spots are available?\"\n"
            + "- Viewing lists: just say \"Show all visitors\"\n\n"
            + "What would you like to know?";

    private final GenerativeModel generativeModel;

    /**
     * Fixed reply for GREETING, HELP and HOW_TO; empty for every other intent.
     */
    public Optional<String> templatedReply(ClassifiedIntent classified, String query) {
        switch (classified.getIntent()) {
            case GREETING:
                return Optional.of(GREETING_REPLY);
            case HELP:
                return Optional.of(HELP_REPLY);
            case HOW_TO:
                return Optional.of(howToReply(query));
            default:
                return Optional.empty();
        }
    }

    /**
     * Phrases a tool result through the generative model.
     *
     * @throws com.residencepark.visitorparking.exception.BackendUnavailableException if the model fails
     */
    public String compose(String query, ToolResult toolResult) {
        if (toolResult.isDirectReply()) {
            return toolResult.getText();
        }
        log.debug("Composing {} answer via generative model", toolResult.getIntent());
        return generativeModel.generate(buildPrompt(query, toolResult.getText()));
    }

    public boolean isModelAvailable() {
        return generativeModel.isAvailable();
    }

    // Checked in this order: search/find, then unit, then anything else
    static String howToReply(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        if (lower.contains("search") || lower.contains("find")) {
            return HOW_TO_SEARCH_REPLY;
        }
        if (lower.contains("unit")) {
            return HOW_TO_UNIT_REPLY;
        }
        return HOW_TO_GENERAL_REPLY;
    }

    static String buildPrompt(String query, String context) {
        return "You are a friendly parking management assistant. Respond naturally and helpfully.\n\n"
                + "IMPORTANT: When you have visitor data, you MUST display it completely. "
                + "Never summarize or say \"followed by...\" - always show the full list.\n\n"
                + "Context/Data: " + context + "\n\n"
                + "User Question: " + query + "\n\n"
                + "Instructions:\n"
                + "- If context contains visitor information, display ALL of it in a clear, readable format\n"
                + "- Use bullet points or numbered lists for multiple visitors\n"
                + "- Include all details provided (name, identity number, plate, unit, status)\n"
                + "- Be concise but COMPLETE - never truncate or summarize the data\n"
                + "- If no data is available, say so clearly\n\n"
                + "Provide your response:";
    }
}
