package com.meetchat.client.ws;

/**
 * One live socket. Instances are never reused after close or failure.
 */
public interface ChatConnection {

    /** @return false when the frame could not be queued (socket closing or closed) */
    boolean send(String frame);

    void close(int code, String reason);

    interface Listener {
        void onOpen();

        void onMessage(String frame);

        void onClosed(int code, String reason);

        void onFailure(Throwable t);
    }
}
