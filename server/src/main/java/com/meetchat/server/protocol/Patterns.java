package com.meetchat.server.protocol;

/**
 * Shared constraint values for inbound payloads.
 */
public final class Patterns {
    public static final String MEETING_ID = "^[A-Za-z0-9:_\\-.]{1,128}$";
    public static final int ID_MAX = 128;
    public static final int NAME_MAX = 255;
    public static final int EMOJI_MAX = 64;

    private Patterns() {
    }
}
