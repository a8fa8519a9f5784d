package com.meetchat.client.ws;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;

public class OkHttpChatConnector implements ChatConnector {

    private final OkHttpClient client;
    private final String url;

    public OkHttpChatConnector(OkHttpClient client, String url) {
        this.client = client;
        this.url = url;
    }

    @Override
    public ChatConnection connect(ChatConnection.Listener listener) {
        Request req = new Request.Builder().url(url).build();
        WebSocket ws = client.newWebSocket(req, new WebSocketListener() {
            @Override public void onOpen(WebSocket webSocket, Response response) {
                listener.onOpen();
            }

            @Override public void onMessage(WebSocket webSocket, String text) {
                listener.onMessage(text);
            }

            @Override public void onClosing(WebSocket webSocket, int code, String reason) {
                webSocket.close(1000, null);
            }

            @Override public void onClosed(WebSocket webSocket, int code, String reason) {
                listener.onClosed(code, reason);
            }

            @Override public void onFailure(WebSocket webSocket, Throwable t, Response response) {
                listener.onFailure(t);
            }
        });

        return new ChatConnection() {
            @Override public boolean send(String frame) {
                return ws.send(frame);
            }

            @Override public void close(int code, String reason) {
                ws.close(code, reason);
            }
        };
    }
}
