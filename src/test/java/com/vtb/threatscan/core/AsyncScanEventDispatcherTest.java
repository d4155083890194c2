package com.vtb.threatscan.core;

import com.vtb.threatscan.testing.RecordingListener;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AsyncScanEventDispatcherTest {

    @Test
    void deliversAllEventsInOrderOnDispatcherThread() {
        RecordingListener listener = new RecordingListener();
        AsyncScanEventDispatcher dispatcher = new AsyncScanEventDispatcher(listener);

        for (int i = 0; i <= 100; i++) {
            dispatcher.onProgress("шаг " + i, i);
        }
        dispatcher.onFilesScannedChanged(7);
        dispatcher.close();

        assertEquals(101, listener.percents.size());
        assertTrue(listener.isMonotonic());
        assertEquals(List.of(7L), listener.filesScanned);
        assertTrue(listener.threadNames.stream().allMatch("threat-scan-events"::equals));
    }

    @Test
    void eventsAfterCloseAreDropped() {
        RecordingListener listener = new RecordingListener();
        AsyncScanEventDispatcher dispatcher = new AsyncScanEventDispatcher(listener);
        dispatcher.close();

        assertDoesNotThrow(() -> dispatcher.onProgress("поздно", 50));
        assertTrue(listener.percents.isEmpty());
    }

    @Test
    void listenerFailureDoesNotStopDelivery() {
        RecordingListener recorder = new RecordingListener();
        AsyncScanEventDispatcher dispatcher = new AsyncScanEventDispatcher(new ScanEventListener() {
            @Override
            public void onProgress(String message, int percent) {
                if (percent == 1) {
                    throw new IllegalStateException("сбой");
                }
                recorder.onProgress(message, percent);
            }
        });

        dispatcher.onProgress("a", 1);
        dispatcher.onProgress("b", 2);
        dispatcher.close();

        assertEquals(List.of(2), recorder.percents);
    }
}
