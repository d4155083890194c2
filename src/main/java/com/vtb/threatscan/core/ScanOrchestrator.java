package com.vtb.threatscan.core;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.models.RemovalResult;
import com.vtb.threatscan.models.ScanPhase;
import com.vtb.threatscan.models.ScanResult;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.platform.PlatformProbe;
import com.vtb.threatscan.platform.Volume;
import com.vtb.threatscan.remediation.RemediationEngine;
import com.vtb.threatscan.scanners.BrowserExtensionScanner;
import com.vtb.threatscan.scanners.DomainScanner;
import com.vtb.threatscan.scanners.ProcessScanner;
import com.vtb.threatscan.scanners.RegistryHijackScanner;
import com.vtb.threatscan.scanners.ScheduledTaskScanner;
import com.vtb.threatscan.scanners.StartupScanner;
import com.vtb.threatscan.signatures.SignatureStore;
import com.vtb.threatscan.traversal.FileClassifier;
import com.vtb.threatscan.traversal.FileCount;
import com.vtb.threatscan.traversal.FileSystemTraversal;
import com.vtb.threatscan.util.DurationFormat;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Главный движок сканирования угроз.
 * Последовательно проводит фазы в одном рабочем потоке, ведёт взвешенный прогресс,
 * обрабатывает отмену и собирает {@link ScanResult}.
 *
 * Одновременно выполняется не больше одного сканирования.
 */
@Slf4j
public class ScanOrchestrator implements AutoCloseable {

    private final ScannerConfig config;
    private final SignatureStore signatures;
    private final PlatformProbe probe;
    private final RemediationEngine remediation;
    private final Clock clock;
    private final LongSupplier ticker;

    private final ProcessScanner processScanner = new ProcessScanner();
    private final StartupScanner startupScanner = new StartupScanner();
    private final BrowserExtensionScanner browserExtensionScanner = new BrowserExtensionScanner();
    private final RegistryHijackScanner registryScanner = new RegistryHijackScanner();
    private final ScheduledTaskScanner scheduledTaskScanner = new ScheduledTaskScanner();

    private final ExecutorService worker;
    private final AtomicBoolean scanning = new AtomicBoolean(false);
    private volatile ScanPhase phase = ScanPhase.IDLE;
    private volatile ScanContext currentContext;
    private volatile CancellationToken currentCancellation;

    public ScanOrchestrator(ScannerConfig config,
                            SignatureStore signatures,
                            PlatformProbe probe,
                            RemediationEngine remediation,
                            Clock clock,
                            LongSupplier ticker) {
        this.config = config;
        this.signatures = signatures;
        this.probe = probe;
        this.remediation = remediation;
        this.clock = clock;
        this.ticker = ticker;
        this.worker = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "threat-scan-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public ScanOrchestrator(ScannerConfig config, SignatureStore signatures, PlatformProbe probe) {
        this(config, signatures, probe, new RemediationEngine(probe, config),
            Clock.systemDefaultZone(), System::nanoTime);
    }

    public ScanHandle startScan(ScanEventListener listener) {
        return startScan(ScanOptions.fullScan(), listener);
    }

    /**
     * Запустить сканирование в фоне
     *
     * @throws ScanAlreadyRunningException если сканирование уже идёт
     */
    public ScanHandle startScan(ScanOptions options, ScanEventListener listener) {
        if (!scanning.compareAndSet(false, true)) {
            throw new ScanAlreadyRunningException();
        }
        CancellationToken cancellation = new CancellationToken();
        currentCancellation = cancellation;
        AsyncScanEventDispatcher dispatcher = new AsyncScanEventDispatcher(listener);
        CompletableFuture<ScanResult> future = new CompletableFuture<>();

        try {
            worker.execute(() -> runOnWorker(options, cancellation, dispatcher, future));
        } catch (RejectedExecutionException e) {
            dispatcher.close();
            scanning.set(false);
            throw new IllegalStateException("Движок сканирования закрыт", e);
        }
        return new ScanHandle(future, cancellation);
    }

    /**
     * Запросить кооперативную отмену; без активного сканирования ничего не делает
     */
    public void cancelScan() {
        CancellationToken cancellation = currentCancellation;
        if (scanning.get() && cancellation != null) {
            log.info("Запрошена отмена сканирования");
            cancellation.cancel();
        }
    }

    public boolean isScanning() {
        return scanning.get();
    }

    public ScanPhase getPhase() {
        return phase;
    }

    public long getFilesScanned() {
        ScanContext context = currentContext;
        return context != null ? context.getFilesScanned() : 0;
    }

    /**
     * Удалить угрозу; не зависит от жизненного цикла сканирования
     */
    public RemovalResult removeThreat(Threat threat) {
        return remediation.remove(threat);
    }

    @Override
    public void close() {
        cancelScan();
        worker.shutdown();
    }

    private void runOnWorker(ScanOptions options,
                             CancellationToken cancellation,
                             AsyncScanEventDispatcher dispatcher,
                             CompletableFuture<ScanResult> future) {
        ScanResult result = null;
        Throwable failure = null;
        try {
            result = runScan(options, cancellation, dispatcher);
        } catch (Throwable t) {
            failure = t;
        } finally {
            dispatcher.close();
            scanning.set(false);
        }
        if (failure != null) {
            future.completeExceptionally(failure);
        } else {
            future.complete(result);
        }
    }

    ScanResult runScan(ScanOptions options, CancellationToken cancellation, ScanEventListener listener) {
        Instant startedAt = clock.instant();
        long startNanos = ticker.getAsLong();
        ScanContext context = new ScanContext(signatures, probe, config, cancellation, listener);
        currentContext = context;
        ProgressTracker progress = context.getProgress();
        log.info("Запуск сканирования угроз (сигнатур: {})", signatures.size());

        boolean cancelled = false;
        String error = null;
        try {
            progress.report("Инициализация сканирования...", 0);
            cancelled = runPhases(options, context).isCancelled();
        } catch (IOException | RuntimeException e) {
            log.error("Сканирование завершилось с ошибкой: {}", e.getMessage(), e);
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        }

        Duration duration = Duration.ofNanos(Math.max(0, ticker.getAsLong() - startNanos));
        long files = context.getFilesScanned();
        List<Threat> threats = context.getThreats();
        ScanPhase finalPhase;
        if (error != null) {
            finalPhase = ScanPhase.FAILED;
            progress.message("Ошибка сканирования: " + error);
        } else if (cancelled) {
            finalPhase = ScanPhase.CANCELLED;
            progress.message(String.format("Сканирование отменено после %,d файлов (%s)",
                files, DurationFormat.format(duration)));
        } else {
            finalPhase = ScanPhase.COMPLETED;
            progress.complete(threats.isEmpty()
                ? String.format("Сканирование завершено: проверено %,d объектов за %s, угроз не найдено",
                    files, DurationFormat.format(duration))
                : String.format("Найдено угроз: %d в %,d объектах (%s)",
                    threats.size(), files, DurationFormat.format(duration)));
        }
        phase = finalPhase;
        context.publishFilesScanned();

        ScanResult result = ScanResult.builder()
            .startedAt(startedAt)
            .finishedAt(startedAt.plus(duration))
            .duration(duration)
            .filesScanned(files)
            .estimatedFiles(context.getEstimatedFiles())
            .threats(threats)
            .cancelled(cancelled)
            .error(error)
            .phase(finalPhase)
            .build();
        log.info("Сканирование {}: объектов {}, угроз {} (критических {}, высоких {}, средних {}, низких {})",
            finalPhase, files, result.getThreatCount(), result.getCriticalCount(), result.getHighCount(),
            result.getMediumCount(), result.getLowCount());
        return result;
    }

    private WalkOutcome runPhases(ScanOptions options, ScanContext context) throws IOException {
        ProgressTracker progress = context.getProgress();

        enter(ScanPhase.COUNTING, progress, "Анализ томов и подсчёт файлов...");
        List<Volume> volumes = options.isFileSystem() ? resolveVolumes(options) : List.of();
        FileSystemTraversal traversal = new FileSystemTraversal(config,
            new FileClassifier(signatures, probe, config, clock), ticker);
        if (options.isFileSystem()) {
            FileCount count = traversal.countFiles(volumes, context.getCancellation());
            context.setEstimatedFiles(count.getTotal());
            if (count.getOutcome().isCancelled()) {
                return WalkOutcome.CANCELLED;
            }
            progress.report(String.format("Найдено %,d файлов для проверки", count.getTotal()),
                ScanPhase.COUNTING.getEndPercent());
        }

        if (runScanner(processScanner, options.isProcesses(), context,
                "Проверка запущенных процессов...").isCancelled()
            || runScanner(startupScanner, options.isStartup(), context,
                "Проверка автозагрузки...").isCancelled()
            || runScanner(browserExtensionScanner, options.isBrowserExtensions(), context,
                "Проверка расширений браузеров...").isCancelled()) {
            return WalkOutcome.CANCELLED;
        }

        if (context.isCancellationRequested()) {
            return WalkOutcome.CANCELLED;
        }
        enter(ScanPhase.SCANNING_FILE_SYSTEM, progress, "Полная проверка файлов...");
        if (options.isFileSystem() && traversal.scanFiles(volumes, context).isCancelled()) {
            return WalkOutcome.CANCELLED;
        }

        if (runScanner(registryScanner, options.isRegistry(), context,
                "Глубокая проверка реестра...").isCancelled()
            || runScanner(scheduledTaskScanner, options.isScheduledTasks(), context,
                "Проверка задач планировщика...").isCancelled()) {
            return WalkOutcome.CANCELLED;
        }

        if (context.isCancellationRequested()) {
            return WalkOutcome.CANCELLED;
        }
        enter(ScanPhase.FINALIZING, progress, "Подведение итогов...");
        return WalkOutcome.CONTINUE;
    }

    private WalkOutcome runScanner(DomainScanner scanner, boolean enabled, ScanContext context, String message) {
        if (context.isCancellationRequested()) {
            return WalkOutcome.CANCELLED;
        }
        enter(scanner.getPhase(), context.getProgress(), message);
        if (!enabled) {
            log.debug("Фаза {} отключена", scanner.getPhase());
            return WalkOutcome.CONTINUE;
        }
        long before = context.getThreatCount();
        WalkOutcome outcome = scanner.scan(context);
        context.publishFilesScanned();
        log.info("{}: найдено угроз {}", scanner.getName(), context.getThreatCount() - before);
        return outcome;
    }

    private void enter(ScanPhase next, ProgressTracker progress, String message) {
        phase = next;
        log.info("Фаза {}", next);
        progress.enterPhase(next, message);
    }

    private List<Volume> resolveVolumes(ScanOptions options) throws IOException {
        if (options.isCustomRoots()) {
            List<Volume> volumes = new ArrayList<>();
            for (Path root : options.getRoots()) {
                volumes.add(Volume.of(root.toAbsolutePath().normalize()));
            }
            return volumes;
        }
        List<Volume> volumes = probe.listFixedVolumes();
        if (volumes.isEmpty()) {
            throw new IOException("Не найдено ни одного локального тома для сканирования");
        }
        return volumes;
    }
}
