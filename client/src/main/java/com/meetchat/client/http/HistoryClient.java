package com.meetchat.client.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.meetchat.client.model.ChatMessage;
import com.meetchat.client.util.JsonUtil;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads message history from {@code GET /api/chat/messages}. The whole call is bounded by
 * {@code timeout}.
 */
public class HistoryClient implements HistorySource {

    private final OkHttpClient http;
    private final HttpUrl endpoint;
    private final String userId;

    public HistoryClient(OkHttpClient base, String apiBaseUrl, String userId, Duration timeout) {
        this.http = base.newBuilder().callTimeout(timeout).build();
        HttpUrl root = HttpUrl.parse(apiBaseUrl);
        if (root == null) throw new IllegalArgumentException("Invalid api url: " + apiBaseUrl);
        this.endpoint = root.newBuilder().addPathSegments("api/chat/messages").build();
        this.userId = userId;
    }

    @Override
    public List<ChatMessage> fetch(String meetingId, int limit) throws IOException {
        HttpUrl url = endpoint.newBuilder()
                .addQueryParameter("meetingId", meetingId)
                .addQueryParameter("limit", Integer.toString(limit))
                .build();
        Request req = new Request.Builder().url(url).header("X-User-Id", userId).get().build();

        try (Response resp = http.newCall(req).execute()) {
            ResponseBody body = resp.body();
            String text = body == null ? "" : body.string();
            if (!resp.isSuccessful()) {
                throw new IOException("History request failed: HTTP " + resp.code() + " " + errorOf(text));
            }
            JsonNode messages = JsonUtil.MAPPER.readTree(text).path("messages");
            List<ChatMessage> out = new ArrayList<>();
            for (JsonNode n : messages) {
                out.add(JsonUtil.MAPPER.treeToValue(n, ChatMessage.class));
            }
            return out;
        }
    }

    private static String errorOf(String body) {
        try {
            return JsonUtil.MAPPER.readTree(body).path("error").asText("");
        } catch (IOException e) {
            return "";
        }
    }
}
