package io.jobs4j.core;

public enum QueueItemState {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED
}
