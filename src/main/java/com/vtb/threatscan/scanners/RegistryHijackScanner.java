package com.vtb.threatscan.scanners;

import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.core.WalkOutcome;
import com.vtb.threatscan.models.ScanPhase;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.platform.RegistryLocation;
import com.vtb.threatscan.signatures.Signature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Точки перехвата: политики Explorer\Run, Winlogon, BHO, панели и расширения IE
 */
@Slf4j
public class RegistryHijackScanner implements DomainScanner {

    @Override
    public ScanPhase getPhase() {
        return ScanPhase.SCANNING_REGISTRY;
    }

    @Override
    public String getName() {
        return "Реестр";
    }

    @Override
    public WalkOutcome scan(ScanContext context) {
        for (String configured : context.getConfig().getRegistry().getHijackLocations()) {
            if (context.isCancellationRequested()) {
                return WalkOutcome.CANCELLED;
            }
            Optional<RegistryLocation> parsed = RegistryLocation.parseKey(configured);
            if (parsed.isEmpty() || parsed.get().hive().isEmpty()) {
                log.warn("Некорректный ключ реестра в конфигурации: {}", configured);
                continue;
            }
            WalkOutcome outcome = scanKey(context, parsed.get());
            if (outcome.isCancelled()) {
                return outcome;
            }
        }
        return WalkOutcome.CONTINUE;
    }

    private WalkOutcome scanKey(ScanContext context, RegistryLocation key) {
        List<String> valueNames;
        try {
            valueNames = context.getProbe().listRegistryValueNames(key.getHive(), key.getKeyPath());
        } catch (IOException | SecurityException e) {
            log.debug("Ключ недоступен {}: {}", key.format(), e.toString());
            return WalkOutcome.CONTINUE;
        }

        for (String valueName : valueNames) {
            if (context.isCancellationRequested()) {
                return WalkOutcome.CANCELLED;
            }
            context.incrementFilesScanned();
            RegistryLocation value = key.withValue(valueName);
            String content;
            try {
                content = context.getProbe()
                    .readRegistryValue(value.getHive(), value.getKeyPath(), valueName)
                    .orElse("");
            } catch (IOException | SecurityException e) {
                log.debug("Значение недоступно {}: {}", value.format(), e.toString());
                continue;
            }

            Optional<Signature> match = context.getSignatures().matchRegistryValue(content);
            if (match.isPresent()) {
                context.addThreat(Threat.builder()
                    .category(ThreatCategory.REGISTRY)
                    .name("Подозрительная запись реестра")
                    .description("Значение реестра совпадает с шаблоном угрозы: " + match.get().getPattern())
                    .location(value.format())
                    .details(content)
                    .severity(Severity.HIGH)
                    .classification("Registry Threat")
                    .removable(true)
                    .build());
            }
        }
        return WalkOutcome.CONTINUE;
    }
}
