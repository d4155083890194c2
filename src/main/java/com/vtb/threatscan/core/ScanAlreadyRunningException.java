package com.vtb.threatscan.core;

/**
 * Попытка запустить сканирование, пока предыдущее ещё идёт
 */
public class ScanAlreadyRunningException extends IllegalStateException {

    public ScanAlreadyRunningException() {
        super("Сканирование уже выполняется");
    }
}
