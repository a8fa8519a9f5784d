package com.meetchat.client.session;

import com.meetchat.client.model.ChatMessage;
import com.meetchat.client.model.Reaction;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered message list shown to the user.
 *
 * <p>Confirmed messages are unique by server id. An incoming confirmed message first replaces a
 * placeholder (pending or failed) of the same sender and text sent within {@link #MATCH_WINDOW},
 * in place; only when nothing matches is it appended. A failed placeholder may still have reached
 * the server before its socket dropped. Not thread-safe; the owning session serializes access.</p>
 */
public class MessageTimeline {

    public static final Duration MATCH_WINDOW = Duration.ofSeconds(5);

    private final List<ChatMessage> lines = new ArrayList<>();

    public void addPending(ChatMessage placeholder) {
        lines.add(placeholder);
    }

    /**
     * @return the placeholder that was replaced, if the message confirmed one
     */
    public Optional<ChatMessage> accept(ChatMessage confirmed) {
        int known = indexOfId(confirmed.id);
        if (known >= 0) {
            lines.set(known, confirmed);
            return Optional.empty();
        }
        int match = indexOfPlaceholderMatch(confirmed);
        if (match >= 0) {
            ChatMessage placeholder = lines.set(match, confirmed);
            confirmed.tempId = placeholder.tempId;
            return Optional.of(placeholder);
        }
        lines.add(confirmed);
        return Optional.empty();
    }

    /**
     * Merges fetched history: known ids are refreshed, new ones inserted in timestamp order,
     * and placeholders the server already has are replaced. Unmatched placeholders stay at the end.
     */
    public void mergeHistory(List<ChatMessage> history) {
        Map<String, ChatMessage> byId = new HashMap<>();
        for (ChatMessage m : lines) {
            if (m.isConfirmed()) byId.put(m.id, m);
        }
        List<ChatMessage> placeholders = new ArrayList<>();
        for (ChatMessage m : lines) {
            if (!m.isConfirmed()) placeholders.add(m);
        }

        for (ChatMessage h : history) {
            if (h.id == null) continue;
            Iterator<ChatMessage> it = placeholders.iterator();
            while (!byId.containsKey(h.id) && it.hasNext()) {
                ChatMessage p = it.next();
                if (matches(p, h)) {
                    h.tempId = p.tempId;
                    it.remove();
                    break;
                }
            }
            byId.put(h.id, h);
        }

        List<ChatMessage> confirmed = new ArrayList<>(byId.values());
        confirmed.sort(Comparator.comparing((ChatMessage m) -> m.timestamp,
                Comparator.nullsFirst(Comparator.naturalOrder())));
        lines.clear();
        lines.addAll(confirmed);
        lines.addAll(placeholders);
    }

    /** @return false when the message is not in the timeline */
    public boolean addReaction(String messageId, Reaction reaction) {
        int i = indexOfId(messageId);
        if (i < 0) return false;
        lines.get(i).reactions.add(reaction);
        return true;
    }

    public Optional<ChatMessage> findByTempId(String tempId) {
        return lines.stream().filter(m -> tempId.equals(m.tempId)).findFirst();
    }

    /** Marks a still pending placeholder as failed. */
    public boolean fail(String tempId) {
        for (ChatMessage m : lines) {
            if (!m.isConfirmed() && m.pending && tempId.equals(m.tempId)) {
                m.pending = false;
                m.failed = true;
                return true;
            }
        }
        return false;
    }

    /** @return the number of placeholders marked failed */
    public int failAllPending() {
        int n = 0;
        for (ChatMessage m : lines) {
            if (!m.isConfirmed() && m.pending) {
                m.pending = false;
                m.failed = true;
                n++;
            }
        }
        return n;
    }

    public List<ChatMessage> snapshot() {
        return List.copyOf(lines);
    }

    public int size() {
        return lines.size();
    }

    private int indexOfId(String id) {
        if (id == null) return -1;
        for (int i = 0; i < lines.size(); i++) {
            if (id.equals(lines.get(i).id)) return i;
        }
        return -1;
    }

    private int indexOfPlaceholderMatch(ChatMessage confirmed) {
        for (int i = 0; i < lines.size(); i++) {
            ChatMessage m = lines.get(i);
            if (!m.isConfirmed() && matches(m, confirmed)) return i;
        }
        return -1;
    }

    static boolean matches(ChatMessage placeholder, ChatMessage confirmed) {
        if (!Objects.equals(placeholder.senderId, confirmed.senderId)) return false;
        if (!Objects.equals(placeholder.message, confirmed.message)) return false;
        if (placeholder.timestamp == null || confirmed.timestamp == null) return false;
        Duration gap = Duration.between(placeholder.timestamp, confirmed.timestamp).abs();
        return gap.compareTo(MATCH_WINDOW) < 0;
    }
}
