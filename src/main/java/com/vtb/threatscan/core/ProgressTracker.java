package com.vtb.threatscan.core;

import com.vtb.threatscan.models.ScanPhase;
import lombok.extern.slf4j.Slf4j;

/**
 * Взвешенный прогресс по фазам.
 * Процент внутри запуска не убывает; 100 выдаётся только через {@link #complete(String)}.
 */
@Slf4j
public class ProgressTracker {

    private static final int MAX_BEFORE_COMPLETION = 99;

    private final ScanEventListener listener;
    private int lastPercent;
    private String lastMessage = "";

    public ProgressTracker(ScanEventListener listener) {
        this.listener = listener;
    }

    public void enterPhase(ScanPhase phase, String message) {
        report(message, phase.getStartPercent());
    }

    /**
     * Прогресс внутри фазы пропорционально done/total; при неизвестном total остаётся на начале фазы
     */
    public void reportWithinPhase(ScanPhase phase, long done, long total) {
        int percent = phase.getStartPercent();
        if (total > 0 && done > 0) {
            long inside = done * phase.getWeight() / total;
            percent += (int) Math.min(inside, phase.getWeight());
        }
        report(lastMessage, percent);
    }

    public void report(String message, int percent) {
        int bounded = Math.max(lastPercent, Math.min(percent, MAX_BEFORE_COMPLETION));
        emit(message, bounded);
    }

    /**
     * Сообщение без изменения процента (отмена, ошибка)
     */
    public void message(String message) {
        emit(message, lastPercent);
    }

    public void complete(String message) {
        emit(message, 100);
    }

    public int getLastPercent() {
        return lastPercent;
    }

    private void emit(String message, int percent) {
        lastPercent = percent;
        if (message != null) {
            lastMessage = message;
        }
        try {
            listener.onProgress(lastMessage, percent);
        } catch (RuntimeException e) {
            log.warn("Обработчик прогресса выбросил исключение: {}", e.getMessage(), e);
        }
    }
}
