package com.vtb.threatscan.core;

/**
 * Результат шага обхода: продолжать или сворачиваться из-за отмены
 */
public enum WalkOutcome {
    CONTINUE,
    CANCELLED;

    public boolean isCancelled() {
        return this == CANCELLED;
    }
}
