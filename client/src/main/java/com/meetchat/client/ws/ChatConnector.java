package com.meetchat.client.ws;

@FunctionalInterface
public interface ChatConnector {

    /** Starts connecting; the outcome arrives on {@code listener}. */
    ChatConnection connect(ChatConnection.Listener listener);
}
