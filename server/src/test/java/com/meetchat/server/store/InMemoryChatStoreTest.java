package com.meetchat.server.store;

import com.meetchat.server.model.ChatMessage;
import com.meetchat.server.support.MutableClock;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryChatStoreTest extends ChatStoreContractTest<InMemoryChatStore> {

    @Override
    protected InMemoryChatStore newStore(MutableClock clock) {
        return new InMemoryChatStore(clock);
    }

    @Test
    void returnedMessagesAreCopies() {
        ChatMessage saved = store.saveMessage(ChatMessage.user("m1", "alice", "Alice", null, "hi"));
        saved.message = "tampered";

        assertEquals("hi", store.listMessages("m1", 1).get(0).message);
    }
}
