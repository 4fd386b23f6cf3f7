package com.tenacy.logradar.alert;

public enum AlertState {
    QUIET,
    TRIGGERED,
    SUPPRESSED
}
