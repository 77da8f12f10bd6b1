package com.example.chatrelay.stream;

import com.example.chatrelay.model.ChatEvent;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class StreamDispatcherTest {

    /** Stage that records what it saw and can be told to fail on given ids. */
    static class ScriptedStage implements StreamStage {
        final String name;
        final List<String> seen = new ArrayList<>();
        final Set<String> failOn = new HashSet<>();

        ScriptedStage(String name) {
            this.name = name;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public ProcessingOutcome process(ChatEvent event) {
            seen.add(event.getId());
            if (failOn.contains(event.getId())) {
                throw new IllegalStateException("boom on " + event.getId());
            }
            return ProcessingOutcome.PROCESSED;
        }
    }

    private static StreamRecord insert(String id, long ts) {
        return StreamRecord.insert(Map.of("id", id, "channelId", "c1", "ts", ts, "role", "user", "content", "hi " + id));
    }

    @Test
    void testDispatch_IgnoresModifyAndRemove() {
        // Given
        ScriptedStage stage = new ScriptedStage("a");
        StreamDispatcher dispatcher = new StreamDispatcher(new ChatEventMapper(), List.of(stage));

        // When
        DispatchReport report = dispatcher.dispatch(List.of(
                new StreamRecord(StreamEventName.MODIFY, insert("m1", 1L).getChangeImage()),
                new StreamRecord(StreamEventName.REMOVE, Map.of("channelId", "c1", "ts", 1L)),
                insert("m2", 2L)));

        // Then
        assertEquals(List.of("m2"), stage.seen);
        assertEquals(2, report.getIgnored());
    }

    @Test
    void testDispatch_SkipsMalformedRecordWithoutFailingBatch() {
        // Given
        ScriptedStage stage = new ScriptedStage("a");
        StreamDispatcher dispatcher = new StreamDispatcher(new ChatEventMapper(), List.of(stage));

        // When
        DispatchReport report = dispatcher.dispatch(List.of(
                StreamRecord.insert(Map.of("id", "broken")),
                insert("m2", 2L)));

        // Then
        assertEquals(List.of("m2"), stage.seen);
        assertEquals(1, report.getMalformed());
    }

    @Test
    void testDispatch_PreservesBatchOrder() {
        // Given
        ScriptedStage stage = new ScriptedStage("a");
        StreamDispatcher dispatcher = new StreamDispatcher(new ChatEventMapper(), List.of(stage));

        // When
        dispatcher.dispatch(List.of(insert("m3", 3L), insert("m1", 1L), insert("m2", 2L)));

        // Then
        assertEquals(List.of("m3", "m1", "m2"), stage.seen);
    }

    @Test
    void testDispatch_StageFailureStillRunsOtherStagesThenStopsBatch() {
        // Given
        ScriptedStage failing = new ScriptedStage("responder");
        ScriptedStage other = new ScriptedStage("delivery");
        failing.failOn.add("m2");
        StreamDispatcher dispatcher = new StreamDispatcher(new ChatEventMapper(), List.of(failing, other));
        List<StreamRecord> batch = List.of(insert("m1", 1L), insert("m2", 2L), insert("m3", 3L));

        // When
        StreamDispatchException e = assertThrows(StreamDispatchException.class, () -> dispatcher.dispatch(batch));

        // Then
        assertEquals("responder", e.getStage());
        assertEquals(1, e.getFailedIndex());
        assertEquals(List.of("m1", "m2"), other.seen);
        assertEquals(2, e.remaining(batch).size());
        assertEquals(1, e.getReport().count("responder", ProcessingOutcome.FAILED));
        assertEquals(2, e.getReport().count("delivery", ProcessingOutcome.PROCESSED));
    }
}
