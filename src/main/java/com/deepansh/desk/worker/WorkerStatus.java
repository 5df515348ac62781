package com.deepansh.desk.worker;

public enum WorkerStatus {
    IDLE,
    COLLECTING_FIELDS,
    READY_FOR_ACTION,
    AWAITING_APPROVAL,
    COMPLETED,
    CANCELLED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
