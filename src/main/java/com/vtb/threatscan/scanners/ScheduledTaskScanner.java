package com.vtb.threatscan.scanners;

import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.core.WalkOutcome;
import com.vtb.threatscan.models.ScanPhase;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.signatures.FileNameMatch;
import com.vtb.threatscan.util.TextFiles;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Определения задач планировщика: содержимое файла целиком против шаблонов имён файлов
 */
@Slf4j
public class ScheduledTaskScanner implements DomainScanner {

    @Override
    public ScanPhase getPhase() {
        return ScanPhase.SCANNING_SCHEDULED_TASKS;
    }

    @Override
    public String getName() {
        return "Планировщик задач";
    }

    @Override
    public WalkOutcome scan(ScanContext context) {
        List<Path> taskFiles;
        try {
            taskFiles = context.getProbe().listScheduledTaskFiles();
        } catch (IOException | SecurityException e) {
            log.warn("Хранилище задач планировщика недоступно: {}", e.getMessage());
            return WalkOutcome.CONTINUE;
        }

        for (Path taskFile : taskFiles) {
            if (context.isCancellationRequested()) {
                return WalkOutcome.CANCELLED;
            }
            context.incrementFilesScanned();

            String content;
            try {
                content = TextFiles.readLenient(taskFile);
            } catch (IOException | SecurityException e) {
                log.debug("Задача недоступна {}: {}", taskFile, e.toString());
                continue;
            }
            Optional<FileNameMatch> match = context.getSignatures().matchFileName(content);
            if (match.isPresent()) {
                context.addThreat(Threat.builder()
                    .category(ThreatCategory.SCHEDULED_TASK)
                    .name("Подозрительная задача планировщика")
                    .description("Задача содержит подозрительный шаблон: " + match.get().getDescription())
                    .location(taskFile.toString())
                    .severity(Severity.MEDIUM)
                    .classification("Scheduled Task")
                    .removable(true)
                    .build());
            }
        }
        return WalkOutcome.CONTINUE;
    }
}
