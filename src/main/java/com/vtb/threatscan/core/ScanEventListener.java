package com.vtb.threatscan.core;

import com.vtb.threatscan.models.Threat;

/**
 * Получатель событий сканирования.
 * Все методы вызываются из рабочего потока и должны возвращаться быстро;
 * для медленного потребителя используйте {@link AsyncScanEventDispatcher}.
 */
public interface ScanEventListener {

    ScanEventListener NOOP = new ScanEventListener() { };

    default void onProgress(String message, int percent) {
    }

    default void onThreatFound(Threat threat) {
    }

    default void onFilesScannedChanged(long filesScanned) {
    }

    default void onCurrentFileChanged(String path) {
    }
}
