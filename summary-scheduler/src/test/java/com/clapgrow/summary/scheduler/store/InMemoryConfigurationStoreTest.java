package com.clapgrow.summary.scheduler.store;

import com.clapgrow.summary.common.group.Cadence;
import com.clapgrow.summary.common.group.GroupConfig;
import com.clapgrow.summary.scheduler.model.GroupMessage;
import com.clapgrow.summary.scheduler.model.MessageType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryConfigurationStoreTest {

    private static final String GROUP = "123-456@g.us";
    private static final LocalDateTime START = LocalDateTime.of(2024, 5, 1, 8, 0);

    private InMemoryConfigurationStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryConfigurationStore();
    }

    @Test
    void testListEnabledGroups_SkipsDisabled() {
        store.saveGroup(new GroupConfig("2-2@g.us", "B", Cadence.daily(LocalTime.NOON), true));
        store.saveGroup(new GroupConfig("1-1@g.us", "A", Cadence.daily(LocalTime.NOON), true));
        store.saveGroup(new GroupConfig("3-3@g.us", "C", Cadence.daily(LocalTime.NOON), false));

        assertEquals(List.of("1-1@g.us", "2-2@g.us", "3-3@g.us"),
            store.listGroups().stream().map(GroupConfig::groupId).toList());
        assertEquals(List.of("1-1@g.us", "2-2@g.us"),
            store.listEnabledGroups().stream().map(GroupConfig::groupId).toList());
    }

    @Test
    void testRemoveGroup() {
        store.saveGroup(new GroupConfig(GROUP, "A", Cadence.daily(LocalTime.NOON), true));
        store.recordMessage(message(START, "hi"));

        assertTrue(store.removeGroup(GROUP));
        assertFalse(store.removeGroup(GROUP));
        assertTrue(store.findGroup(GROUP).isEmpty());
        assertTrue(store.getMessagesSince(GROUP, START.minusDays(1)).isEmpty());
    }

    @Test
    void testGetMessagesSince_StrictlyAfter() {
        store.recordMessage(message(START, "at start"));
        store.recordMessage(message(START.plusMinutes(1), "later"));

        List<GroupMessage> messages = store.getMessagesSince(GROUP, START);

        assertEquals(1, messages.size());
        assertEquals("later", messages.get(0).text());
    }

    @Test
    void testRecordMessage_KeepsMostRecentMessages() {
        for (int i = 0; i < InMemoryConfigurationStore.MAX_MESSAGES_PER_GROUP + 5; i++) {
            store.recordMessage(message(START.plusSeconds(i), "m" + i));
        }

        List<GroupMessage> messages = store.getMessagesSince(GROUP, START.minusDays(1));

        assertEquals(InMemoryConfigurationStore.MAX_MESSAGES_PER_GROUP, messages.size());
        assertEquals("m5", messages.get(0).text());
    }

    @Test
    void testClearMessages_KeepsGroupConfig() {
        store.saveGroup(new GroupConfig(GROUP, "A", Cadence.daily(LocalTime.NOON), true));
        store.recordMessage(message(START, "one"));
        store.recordMessage(message(START.plusMinutes(1), "two"));

        assertEquals(List.of("one", "two"), store.getMessages(GROUP).stream().map(GroupMessage::text).toList());
        assertEquals(2, store.clearMessages(GROUP));

        assertTrue(store.getMessages(GROUP).isEmpty());
        assertTrue(store.findGroup(GROUP).isPresent());
        assertEquals(0, store.clearMessages(GROUP));
    }

    @Test
    void testGetMessages_UnknownGroup_Empty() {
        assertTrue(store.getMessages("9-9@g.us").isEmpty());
    }

    private static GroupMessage message(LocalDateTime timestamp, String text) {
        return new GroupMessage(GROUP, "15551234567@c.us", "Alice", text, timestamp, MessageType.TEXT);
    }
}
