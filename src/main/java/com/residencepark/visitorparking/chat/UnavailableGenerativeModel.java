package com.residencepark.visitorparking.chat;

import com.residencepark.visitorparking.exception.BackendUnavailableException;

/**
 * Stand-in used when no generative backend is configured.
 */
public class UnavailableGenerativeModel implements GenerativeModel {

    @Override
    public boolean isAvailable() {
        return false;
    }

    @Override
    public String generate(String prompt) {
        throw new BackendUnavailableException("No generative model configured");
    }
}
