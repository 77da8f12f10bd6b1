package com.example.chatrelay.stream;

public enum ProcessingOutcome {
    PROCESSED,
    SKIPPED_DUPLICATE,
    SKIPPED_NOT_APPLICABLE,
    FAILED
}
