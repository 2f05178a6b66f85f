package com.residencepark.visitorparking.chat;

import com.residencepark.visitorparking.exception.BackendUnavailableException;

/**
 * Text-generation backend used to phrase assistant answers.
 *
 * Output is free-form; callers make no assumption about its content.
 */
public interface GenerativeModel {

    /** False when no backend is configured (e.g. missing API key). */
    boolean isAvailable();

    /**
     * @throws BackendUnavailableException if the backend is not configured or the call fails
     */
    String generate(String prompt);
}
