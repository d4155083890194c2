package com.vtb.threatscan.models;

/**
 * Состояния сканирования и их доля в общем прогрессе (в процентах).
 * Сумма весов рабочих фаз равна 100.
 */
public enum ScanPhase {
    IDLE(0),
    COUNTING(3),
    SCANNING_PROCESSES(3),
    SCANNING_STARTUP(3),
    SCANNING_BROWSER_EXTENSIONS(3),
    SCANNING_FILE_SYSTEM(78),
    SCANNING_REGISTRY(5),
    SCANNING_SCHEDULED_TASKS(3),
    FINALIZING(2),
    COMPLETED(0),
    CANCELLED(0),
    FAILED(0);

    private final int weight;

    ScanPhase(int weight) {
        this.weight = weight;
    }

    public int getWeight() {
        return weight;
    }

    /**
     * Процент, с которого начинается фаза
     */
    public int getStartPercent() {
        if (isTerminal()) {
            return 100;
        }
        int start = 0;
        for (ScanPhase phase : values()) {
            if (phase == this) {
                break;
            }
            start += phase.weight;
        }
        return start;
    }

    public int getEndPercent() {
        return isTerminal() ? 100 : getStartPercent() + weight;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED || this == FAILED;
    }
}
