package com.warden.core.replay;

public enum ReplayStatus {
    PASS,
    FAIL
}
