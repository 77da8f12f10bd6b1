package com.example.chatrelay.stream;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per record, per stage outcomes of one dispatched batch.
 */
public class DispatchReport {

    @Value
    public static class Entry {
        int recordIndex;
        String eventId;
        String stage;
        ProcessingOutcome outcome;
    }

    private final List<Entry> entries = new ArrayList<>();
    private int ignored;
    private int malformed;

    void record(int recordIndex, String eventId, String stage, ProcessingOutcome outcome) {
        entries.add(new Entry(recordIndex, eventId, stage, outcome));
    }

    void ignored() {
        ignored++;
    }

    void malformed() {
        malformed++;
    }

    public List<Entry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public long count(String stage, ProcessingOutcome outcome) {
        return entries.stream().filter(e -> e.getStage().equals(stage) && e.getOutcome() == outcome).count();
    }

    /** Records that were not INSERTs. */
    public int getIgnored() {
        return ignored;
    }

    public int getMalformed() {
        return malformed;
    }
}
