package com.splitvault.core.domain;

public enum DisputePhase {
    CLOSED,
    OPEN
}
