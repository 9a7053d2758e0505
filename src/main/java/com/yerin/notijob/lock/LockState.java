package com.yerin.notijob.lock;

public enum LockState {
    UNINITIALIZED,
    READY,
    DRAINING,
    STOPPED
}
