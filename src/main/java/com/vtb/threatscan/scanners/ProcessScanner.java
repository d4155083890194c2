package com.vtb.threatscan.scanners;

import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.core.WalkOutcome;
import com.vtb.threatscan.models.ScanPhase;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.platform.ProcessInfo;
import com.vtb.threatscan.signatures.Signature;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Запущенные процессы против сигнатур имён процессов
 */
@Slf4j
public class ProcessScanner implements DomainScanner {

    @Override
    public ScanPhase getPhase() {
        return ScanPhase.SCANNING_PROCESSES;
    }

    @Override
    public String getName() {
        return "Процессы";
    }

    @Override
    public WalkOutcome scan(ScanContext context) {
        List<ProcessInfo> processes = context.getProbe().listProcesses();
        log.debug("Процессов для проверки: {}", processes.size());

        for (ProcessInfo process : processes) {
            if (context.isCancellationRequested()) {
                return WalkOutcome.CANCELLED;
            }
            context.incrementFilesScanned();

            Optional<Signature> match = context.getSignatures().matchProcess(process.baseName());
            if (match.isEmpty()) {
                continue;
            }
            String path = process.getExecutablePath();
            context.addThreat(Threat.builder()
                .category(ThreatCategory.PROCESS)
                .name("Подозрительный процесс: " + process.getName())
                .description("Процесс совпадает с сигнатурой вредоносного ПО: " + match.get().getPattern())
                .location(path != null && !path.isBlank() ? path : "Неизвестно")
                .details(process.getName())
                .severity(Severity.CRITICAL)
                .classification("Malware")
                .removable(true)
                .processId(process.getPid())
                .build());
        }
        return WalkOutcome.CONTINUE;
    }
}
