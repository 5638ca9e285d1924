package com.airwatch.service.runtime;

public enum SchedulerState {
    IDLE,
    RUNNING,
    WAITING,
    STOPPED
}
