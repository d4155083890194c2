package com.vtb.threatscan.core;

import com.vtb.threatscan.models.Threat;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Доставка событий слушателю в отдельном потоке.
 * Рабочий поток сканирования не ждёт медленного потребителя; порядок событий сохраняется.
 */
@Slf4j
public class AsyncScanEventDispatcher implements ScanEventListener, AutoCloseable {

    private static final long DRAIN_TIMEOUT_SECONDS = 30;

    private final ScanEventListener delegate;
    private final ExecutorService executor;

    public AsyncScanEventDispatcher(ScanEventListener delegate) {
        this.delegate = delegate != null ? delegate : ScanEventListener.NOOP;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "threat-scan-events");
            thread.setDaemon(true);
            return thread;
        });
    }

    @Override
    public void onProgress(String message, int percent) {
        dispatch(() -> delegate.onProgress(message, percent));
    }

    @Override
    public void onThreatFound(Threat threat) {
        dispatch(() -> delegate.onThreatFound(threat));
    }

    @Override
    public void onFilesScannedChanged(long filesScanned) {
        dispatch(() -> delegate.onFilesScannedChanged(filesScanned));
    }

    @Override
    public void onCurrentFileChanged(String path) {
        dispatch(() -> delegate.onCurrentFileChanged(path));
    }

    /**
     * Доставить оставшиеся события и остановить поток
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Слушатель не успел обработать события за {} с", DRAIN_TIMEOUT_SECONDS);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void dispatch(Runnable event) {
        try {
            executor.execute(() -> {
                try {
                    event.run();
                } catch (RuntimeException e) {
                    log.warn("Слушатель событий выбросил исключение: {}", e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            log.debug("Событие после закрытия диспетчера отброшено");
        }
    }
}
