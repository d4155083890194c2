package com.vtb.threatscan.core;

import com.vtb.threatscan.models.ScanResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Ссылка на запущенное сканирование.
 * Результат становится доступен после доставки всех событий слушателю.
 */
public class ScanHandle {

    private final CompletableFuture<ScanResult> result;
    private final CancellationToken cancellation;

    ScanHandle(CompletableFuture<ScanResult> result, CancellationToken cancellation) {
        this.result = result;
        this.cancellation = cancellation;
    }

    public void cancel() {
        cancellation.cancel();
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Дождаться результата. Отмена и ошибки сканирования отражаются в {@link ScanResult}, а не исключением.
     */
    public ScanResult await() throws InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Рабочий поток сканирования аварийно завершился", e.getCause());
        }
    }

    public ScanResult await(long timeout, TimeUnit unit) throws InterruptedException, TimeoutException {
        try {
            return result.get(timeout, unit);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Рабочий поток сканирования аварийно завершился", e.getCause());
        }
    }

    public CompletableFuture<ScanResult> toFuture() {
        return result;
    }
}
