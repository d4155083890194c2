package com.vtb.threatscan.models;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Результат одного запуска сканирования.
 * После возврата из оркестратора неизменяем - и при завершении, и при отмене, и при ошибке.
 */
@Value
public class ScanResult {
    Instant startedAt;
    Instant finishedAt;
    Duration duration;
    long filesScanned;
    /** Оценка из прохода подсчёта, может отличаться от filesScanned */
    long estimatedFiles;
    List<Threat> threats;
    boolean cancelled;
    String error;
    ScanPhase phase;

    @Builder
    private ScanResult(Instant startedAt,
                       Instant finishedAt,
                       Duration duration,
                       long filesScanned,
                       long estimatedFiles,
                       List<Threat> threats,
                       boolean cancelled,
                       String error,
                       ScanPhase phase) {
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
        this.duration = duration == null || duration.isNegative() ? Duration.ZERO : duration;
        this.filesScanned = filesScanned;
        this.estimatedFiles = estimatedFiles;
        this.threats = threats == null ? List.of() : List.copyOf(threats);
        this.cancelled = cancelled;
        this.error = error;
        this.phase = phase == null ? ScanPhase.IDLE : phase;
    }

    /**
     * Количество угроз заданной критичности
     */
    public int getThreatCountBySeverity(Severity severity) {
        return (int) threats.stream()
            .filter(t -> t.getSeverity() == severity)
            .count();
    }

    public int getCriticalCount() {
        return getThreatCountBySeverity(Severity.CRITICAL);
    }

    public int getHighCount() {
        return getThreatCountBySeverity(Severity.HIGH);
    }

    public int getMediumCount() {
        return getThreatCountBySeverity(Severity.MEDIUM);
    }

    public int getLowCount() {
        return getThreatCountBySeverity(Severity.LOW);
    }

    public int getThreatCount() {
        return threats.size();
    }

    public boolean isClean() {
        return threats.isEmpty() && error == null && !cancelled;
    }

    public boolean hasError() {
        return error != null;
    }

    /**
     * Есть ли критичные угрозы
     */
    public boolean hasCriticalThreats() {
        return threats.stream()
            .anyMatch(t -> t.getSeverity() == Severity.CRITICAL || t.getSeverity() == Severity.HIGH);
    }
}
