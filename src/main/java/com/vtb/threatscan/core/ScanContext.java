package com.vtb.threatscan.core;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.platform.PlatformProbe;
import com.vtb.threatscan.signatures.SignatureStore;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Общее состояние одного запуска: база сигнатур, платформа, найденные угрозы и счётчики.
 *
 * Пишет в контекст только рабочий поток сканирования; счётчики объявлены volatile,
 * чтобы их можно было читать из других потоков.
 */
@Slf4j
public class ScanContext {

    private final SignatureStore signatures;
    private final PlatformProbe probe;
    private final ScannerConfig config;
    private final CancellationToken cancellation;
    private final ScanEventListener listener;
    private final ProgressTracker progress;

    private final List<Threat> threats = Collections.synchronizedList(new ArrayList<>());
    private volatile long filesScanned;
    private volatile long estimatedFiles;

    public ScanContext(SignatureStore signatures,
                       PlatformProbe probe,
                       ScannerConfig config,
                       CancellationToken cancellation,
                       ScanEventListener listener) {
        this.signatures = signatures;
        this.probe = probe;
        this.config = config;
        this.cancellation = cancellation;
        this.listener = listener != null ? listener : ScanEventListener.NOOP;
        this.progress = new ProgressTracker(this.listener);
    }

    public void addThreat(Threat threat) {
        threats.add(threat);
        log.info("Обнаружена угроза [{}] {}: {}", threat.getSeverity(), threat.getName(), threat.getLocation());
        try {
            listener.onThreatFound(threat);
        } catch (RuntimeException e) {
            log.warn("Обработчик угроз выбросил исключение: {}", e.getMessage(), e);
        }
    }

    /**
     * Учесть ещё один проверенный объект (файл, процесс, значение реестра, задачу)
     *
     * @return новое значение счётчика
     */
    public long incrementFilesScanned() {
        long value = filesScanned + 1;
        filesScanned = value;
        return value;
    }

    public void publishFilesScanned() {
        try {
            listener.onFilesScannedChanged(filesScanned);
        } catch (RuntimeException e) {
            log.warn("Обработчик счётчика выбросил исключение: {}", e.getMessage(), e);
        }
    }

    public void publishCurrentFile(String path) {
        try {
            listener.onCurrentFileChanged(path);
        } catch (RuntimeException e) {
            log.warn("Обработчик текущего файла выбросил исключение: {}", e.getMessage(), e);
        }
    }

    public boolean isCancellationRequested() {
        return cancellation.isCancellationRequested();
    }

    public WalkOutcome checkpoint() {
        return cancellation.isCancellationRequested() ? WalkOutcome.CANCELLED : WalkOutcome.CONTINUE;
    }

    /**
     * Копия списка угроз в порядке обнаружения
     */
    public List<Threat> getThreats() {
        synchronized (threats) {
            return List.copyOf(threats);
        }
    }

    public int getThreatCount() {
        return threats.size();
    }

    public long getFilesScanned() {
        return filesScanned;
    }

    public long getEstimatedFiles() {
        return estimatedFiles;
    }

    public void setEstimatedFiles(long estimatedFiles) {
        this.estimatedFiles = estimatedFiles;
    }

    public SignatureStore getSignatures() {
        return signatures;
    }

    public PlatformProbe getProbe() {
        return probe;
    }

    public ScannerConfig getConfig() {
        return config;
    }

    public CancellationToken getCancellation() {
        return cancellation;
    }

    public ProgressTracker getProgress() {
        return progress;
    }
}
