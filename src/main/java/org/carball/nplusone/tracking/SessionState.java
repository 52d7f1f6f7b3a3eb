package org.carball.nplusone.tracking;

public enum SessionState {
    UNINITIALIZED,
    ACTIVE,
    PAUSED
}
