package com.vtb.threatscan.models;

/**
 * Категория находки - определяет стратегию удаления
 */
public enum ThreatCategory {
    FILE,
    PROCESS,
    REGISTRY,
    STARTUP,
    BROWSER_EXTENSION,
    NETWORK,
    SCHEDULED_TASK
}
