package com.vtb.threatscan.scanners;

import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.core.WalkOutcome;
import com.vtb.threatscan.models.ScanPhase;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.platform.PlatformProbe;
import com.vtb.threatscan.platform.RegistryLocation;
import com.vtb.threatscan.signatures.FileNameMatch;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Ключи автозагрузки Run/RunOnce: имя значения, затем его содержимое, против шаблонов имён файлов
 */
@Slf4j
public class StartupScanner implements DomainScanner {

    @Override
    public ScanPhase getPhase() {
        return ScanPhase.SCANNING_STARTUP;
    }

    @Override
    public String getName() {
        return "Автозагрузка";
    }

    @Override
    public WalkOutcome scan(ScanContext context) {
        PlatformProbe probe = context.getProbe();
        for (String configured : context.getConfig().getRegistry().getStartupLocations()) {
            if (context.isCancellationRequested()) {
                return WalkOutcome.CANCELLED;
            }
            Optional<RegistryLocation> parsed = RegistryLocation.parseKey(configured);
            if (parsed.isEmpty() || parsed.get().hive().isEmpty()) {
                log.warn("Некорректный ключ автозагрузки в конфигурации: {}", configured);
                continue;
            }
            RegistryLocation key = parsed.get();
            List<String> valueNames;
            try {
                valueNames = probe.listRegistryValueNames(key.getHive(), key.getKeyPath());
            } catch (IOException | SecurityException e) {
                log.debug("Ключ недоступен {}: {}", configured, e.toString());
                continue;
            }

            for (String valueName : valueNames) {
                if (context.isCancellationRequested()) {
                    return WalkOutcome.CANCELLED;
                }
                context.incrementFilesScanned();
                inspectValue(context, key.withValue(valueName));
            }
        }
        return WalkOutcome.CONTINUE;
    }

    private void inspectValue(ScanContext context, RegistryLocation value) {
        String content;
        try {
            content = context.getProbe()
                .readRegistryValue(value.getHive(), value.getKeyPath(), value.getValueName())
                .orElse("");
        } catch (IOException | SecurityException e) {
            log.debug("Значение недоступно {}: {}", value.format(), e.toString());
            content = "";
        }

        Optional<FileNameMatch> match = context.getSignatures().matchFileName(value.getValueName());
        if (match.isEmpty()) {
            match = context.getSignatures().matchFileName(content);
        }
        if (match.isEmpty()) {
            return;
        }
        context.addThreat(Threat.builder()
            .category(ThreatCategory.STARTUP)
            .name("Подозрительная автозагрузка: " + value.getValueName())
            .description("Запись автозагрузки содержит подозрительный шаблон: " + match.get().getDescription())
            .location(value.format())
            .details(content)
            .severity(Severity.HIGH)
            .classification("Startup Threat")
            .removable(true)
            .build());
    }
}
