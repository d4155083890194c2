package com.vtb.threatscan.traversal;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.core.CancellationToken;
import com.vtb.threatscan.core.ProgressThrottle;
import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.core.WalkOutcome;
import com.vtb.threatscan.models.ScanPhase;
import com.vtb.threatscan.platform.Volume;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Обход томов в два прохода: подсчёт файлов и сканирование.
 * Оба прохода используют один и тот же фильтр и порядок, поэтому на неизменной
 * файловой системе число просканированных файлов совпадает с подсчитанным.
 */
@Slf4j
public class FileSystemTraversal {

    private final ExtensionRules rules;
    private final DirectoryLister lister;
    private final FileClassifier classifier;
    private final ScannerConfig.Progress progressSettings;
    private final LongSupplier ticker;

    public FileSystemTraversal(ScannerConfig config, FileClassifier classifier, LongSupplier ticker) {
        this.rules = new ExtensionRules(config.getTraversal());
        this.lister = new DirectoryLister();
        this.classifier = classifier;
        this.progressSettings = config.getProgress();
        this.ticker = ticker;
    }

    /**
     * Проход подсчёта: только число подходящих файлов, без классификации
     */
    public FileCount countFiles(List<Volume> volumes, CancellationToken cancellation) {
        AtomicLong total = new AtomicLong();
        for (Volume volume : volumes) {
            WalkOutcome outcome = walk(volume, cancellation, file -> {
                total.incrementAndGet();
                return WalkOutcome.CONTINUE;
            });
            if (outcome.isCancelled()) {
                log.info("Подсчёт файлов прерван на {} файлах", total.get());
                return new FileCount(total.get(), WalkOutcome.CANCELLED);
            }
        }
        log.info("Найдено файлов для проверки: {}", total.get());
        return new FileCount(total.get(), WalkOutcome.CONTINUE);
    }

    /**
     * Проход сканирования: каждый подходящий файл классифицируется, найденные угрозы попадают в контекст
     */
    public WalkOutcome scanFiles(List<Volume> volumes, ScanContext context) {
        ProgressThrottle throttle = new ProgressThrottle(
            progressSettings.getThrottleIntervalMs(), progressSettings.getImmediateReportFiles(), ticker);
        CancellationToken cancellation = context.getCancellation();
        long estimated = context.getEstimatedFiles();
        AtomicLong visited = new AtomicLong();

        for (Volume volume : volumes) {
            log.info("Сканирование тома {}", volume.getRoot());
            context.getProgress().report("Сканирование " + volume.getLabel() + "...",
                context.getProgress().getLastPercent());

            WalkOutcome outcome = walk(volume, cancellation, file -> {
                long count = visited.incrementAndGet();
                context.incrementFilesScanned();
                if (throttle.shouldReport(count)) {
                    context.publishCurrentFile(file.toString());
                    context.publishFilesScanned();
                    context.getProgress().reportWithinPhase(ScanPhase.SCANNING_FILE_SYSTEM, count, estimated);
                }
                classifier.classify(file, cancellation).ifPresent(context::addThreat);
                return context.checkpoint();
            });
            if (outcome.isCancelled()) {
                log.info("Сканирование файлов прервано после {} файлов", visited.get());
                return WalkOutcome.CANCELLED;
            }
        }
        context.publishFilesScanned();
        log.info("Проверено файлов: {}", visited.get());
        return WalkOutcome.CONTINUE;
    }

    WalkOutcome walk(Volume volume, CancellationToken cancellation, FileHandler handler) {
        Deque<Path> pending = new ArrayDeque<>();
        pending.push(volume.getRoot());
        while (!pending.isEmpty()) {
            if (cancellation.isCancellationRequested()) {
                return WalkOutcome.CANCELLED;
            }
            DirectoryLister.Listing listing = lister.list(pending.pop());
            for (Path file : listing.getFiles()) {
                if (cancellation.isCancellationRequested()) {
                    return WalkOutcome.CANCELLED;
                }
                if (rules.isScannable(file) && handler.handle(file).isCancelled()) {
                    return WalkOutcome.CANCELLED;
                }
            }
            // в обратном порядке, чтобы снимать со стека по алфавиту
            List<Path> directories = listing.getDirectories();
            for (int i = directories.size() - 1; i >= 0; i--) {
                Path directory = directories.get(i);
                if (rules.shouldSkipDirectory(directory) || volume.getExcludedPaths().contains(directory)) {
                    log.debug("Каталог исключён из обхода: {}", directory);
                    continue;
                }
                pending.push(directory);
            }
        }
        return WalkOutcome.CONTINUE;
    }

    @FunctionalInterface
    interface FileHandler {
        WalkOutcome handle(Path file);
    }
}
