package com.vtb.threatscan.core;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Кооперативная отмена: флаг выставляется из потока вызывающего, опрашивается рабочим потоком
 * на границах каталогов, файлов и фаз.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }
}
