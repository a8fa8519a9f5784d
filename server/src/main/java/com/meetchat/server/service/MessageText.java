package com.meetchat.server.service;

import com.meetchat.server.error.ValidationException;

/**
 * Text rules shared by the real-time and REST send paths.
 */
public final class MessageText {

    private MessageText() {
    }

    /**
     * @return the trimmed text
     * @throws ValidationException if the text is blank or longer than {@code maxLength}
     */
    public static String normalize(String text, int maxLength) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.isEmpty()) {
            throw new ValidationException("Message cannot be empty");
        }
        if (trimmed.length() > maxLength) {
            throw new ValidationException("Message exceeds " + maxLength + " characters");
        }
        return trimmed;
    }
}
