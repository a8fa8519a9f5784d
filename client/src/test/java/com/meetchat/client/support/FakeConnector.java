package com.meetchat.client.support;

import com.meetchat.client.ws.ChatConnection;
import com.meetchat.client.ws.ChatConnector;

import java.util.ArrayList;
import java.util.List;

/** Records every connection attempt; tests drive the socket callbacks by hand. */
public class FakeConnector implements ChatConnector {

    public final List<FakeConnection> attempts = new ArrayList<>();

    @Override
    public ChatConnection connect(ChatConnection.Listener listener) {
        FakeConnection c = new FakeConnection(listener);
        attempts.add(c);
        return c;
    }

    public FakeConnection last() {
        return attempts.get(attempts.size() - 1);
    }

    public static class FakeConnection implements ChatConnection {
        public final ChatConnection.Listener listener;
        public final List<String> sent = new ArrayList<>();
        public boolean closed;
        public boolean accepting = true;

        FakeConnection(ChatConnection.Listener listener) {
            this.listener = listener;
        }

        @Override public boolean send(String frame) {
            if (closed || !accepting) return false;
            sent.add(frame);
            return true;
        }

        @Override public void close(int code, String reason) {
            closed = true;
        }

        public List<String> sentEvents(String event) {
            List<String> out = new ArrayList<>();
            for (String s : sent) {
                if (s.contains("\"event\":\"" + event + "\"")) out.add(s);
            }
            return out;
        }
    }
}
