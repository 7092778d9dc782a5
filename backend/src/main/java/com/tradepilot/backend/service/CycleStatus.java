package com.tradepilot.backend.service;

public enum CycleStatus {
    OK,
    SKIPPED,
    TIMED_OUT,
    FAILED
}
