package com.meetchat.client.app;

import com.meetchat.client.config.ChatClientConfig;
import com.meetchat.client.http.HistoryClient;
import com.meetchat.client.model.ChatMessage;
import com.meetchat.client.session.ClientChatSession;
import com.meetchat.client.session.ExecutorScheduler;
import com.meetchat.client.session.SessionListener;
import com.meetchat.client.session.SessionState;
import com.meetchat.client.ws.OkHttpChatConnector;
import okhttp3.OkHttpClient;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Console chat: each stdin line is sent as a message.
 * {@code /react <messageId> <emoji>} reacts, {@code /quit} leaves.
 */
public class ChatCli {

    public static void main(String[] args) throws Exception {
        ChatClientConfig cfg = ChatClientConfig.fromArgs(args);
        OkHttpClient http = new OkHttpClient.Builder()
                .connectTimeout(cfg.requestTimeout())
                .readTimeout(0, TimeUnit.MILLISECONDS) // websocket stays open
                .build();
        ExecutorService io = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "chat-history");
            t.setDaemon(true);
            return t;
        });

        try (ExecutorScheduler scheduler = new ExecutorScheduler()) {
            ClientChatSession session = new ClientChatSession(cfg,
                    new OkHttpChatConnector(http, cfg.wsUrl()),
                    new HistoryClient(http, cfg.apiBaseUrl(), cfg.userId(), cfg.requestTimeout()),
                    io, scheduler, Clock.systemUTC(), new ConsolePrinter());
            session.connect();

            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            String line;
            while ((line = in.readLine()) != null) {
                if (line.equals("/quit")) break;
                if (line.startsWith("/react ")) {
                    String[] parts = line.split("\\s+", 3);
                    if (parts.length < 3 || !session.react(parts[1], parts[2])) {
                        System.out.println("! reaction not sent");
                    }
                    continue;
                }
                if (line.isBlank()) continue;
                session.sendMessage(line);
            }
            session.close();
        } finally {
            io.shutdownNow();
            http.dispatcher().executorService().shutdown();
            http.connectionPool().evictAll();
        }
    }

    private static final class ConsolePrinter implements SessionListener {
        private int printed;

        @Override public void onStateChanged(SessionState state) {
            System.out.println("* " + state.name().toLowerCase());
        }

        @Override public synchronized void onTimelineChanged(List<ChatMessage> messages) {
            if (messages.size() < printed) printed = 0;
            for (int i = printed; i < messages.size(); i++) {
                ChatMessage m = messages.get(i);
                String flag = m.failed ? " (failed)" : m.pending ? " (sending)" : "";
                String ref = m.id != null ? m.id : m.tempId;
                System.out.println("[" + ref + "] " + m.senderName + ": " + m.message + flag);
            }
            printed = messages.size();
        }

        @Override public void onTypingUsersChanged(Set<String> userIds) {
            if (!userIds.isEmpty()) System.out.println("* typing: " + String.join(", ", userIds));
        }

        @Override public void onOnlineUsersChanged(Set<String> userIds) {
            System.out.println("* online: " + String.join(", ", userIds));
        }

        @Override public void onError(String message) {
            System.out.println("! " + message);
        }
    }
}
