package com.vtb.threatscan.traversal;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.core.CancellationToken;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.platform.FileMetadata;
import com.vtb.threatscan.platform.PlatformProbe;
import com.vtb.threatscan.signatures.FileNameMatch;
import com.vtb.threatscan.signatures.Signature;
import com.vtb.threatscan.signatures.SignatureStore;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Файловая эвристика. Проверки идут по порядку, первая сработавшая даёт угрозу
 * и останавливает остальные, так что на файл приходится не больше одной угрозы:
 * <ol>
 *   <li>имя совпало с сигнатурой</li>
 *   <li>двойное расширение ("invoice.pdf.exe")</li>
 *   <li>SHA-256 исполняемого файла в базе известных</li>
 *   <li>скрытый исполняемый файл в temp/appdata/programdata</li>
 *   <li>свежий маленький исполняемый файл во временном каталоге</li>
 * </ol>
 */
@Slf4j
public class FileClassifier {

    private static final String SUSPICIOUS_FILE = "Suspicious File";

    private final SignatureStore signatures;
    private final PlatformProbe probe;
    private final ExtensionRules rules;
    private final ScannerConfig.Traversal settings;
    private final Clock clock;

    public FileClassifier(SignatureStore signatures, PlatformProbe probe, ScannerConfig config, Clock clock) {
        this.signatures = signatures;
        this.probe = probe;
        this.settings = config.getTraversal();
        this.rules = new ExtensionRules(settings);
        this.clock = clock;
    }

    public Optional<Threat> classify(Path file, CancellationToken cancellation) {
        String fileName = file.getFileName().toString().toLowerCase(Locale.ROOT);
        String extension = ExtensionRules.extensionOf(fileName);
        String location = file.toString();

        FileMetadata metadata = readMetadata(file);
        Long size = metadata != null ? metadata.getSize() : null;

        Optional<FileNameMatch> nameMatch = signatures.matchFileName(fileName);
        if (nameMatch.isPresent()) {
            Signature signature = nameMatch.get().getSignature();
            return Optional.of(fileThreat("Подозрительный файл: " + fileName, location, signature.getSeverity(), size)
                .description("Имя файла совпадает с шаблоном угрозы: " + signature.getPattern())
                .classification(SUSPICIOUS_FILE)
                .build());
        }

        if (isDisguisedExecutable(fileName, extension)) {
            return Optional.of(fileThreat("Двойное расширение: " + fileName, location, Severity.HIGH, size)
                .description("Исполняемый файл замаскирован двойным расширением")
                .classification(SUSPICIOUS_FILE)
                .build());
        }

        if (metadata == null || !rules.isExecutable(extension)) {
            return Optional.empty();
        }

        if (metadata.getSize() > 0 && metadata.getSize() < settings.getHashSizeLimitBytes()) {
            if (cancellation.isCancellationRequested()) {
                return Optional.empty();
            }
            Optional<Threat> malware = matchHash(file, fileName, location, size);
            if (malware.isPresent()) {
                return malware;
            }
        }

        String parent = parentOf(file);
        if (metadata.isHidden() && containsAny(parent, settings.getHiddenExecutableLocations())) {
            return Optional.of(fileThreat("Скрытый исполняемый файл: " + fileName, location, Severity.HIGH, size)
                .description("Скрытый исполняемый файл в подозрительном каталоге")
                .classification(SUSPICIOUS_FILE)
                .build());
        }

        if (isRecentTempExecutable(fileName, parent, metadata)) {
            return Optional.of(fileThreat("Свежий файл во временном каталоге: " + fileName, location, Severity.LOW, size)
                .description("Недавно созданный исполняемый файл во временном каталоге")
                .classification("Potentially Unwanted")
                .build());
        }
        return Optional.empty();
    }

    /**
     * Последнее расширение исполняемое, предпоследнее из списка "безобидных", и это не ярлык
     */
    boolean isDisguisedExecutable(String fileName, String extension) {
        if (rules.isShortcut(extension) || !rules.isExecutable(extension)) {
            return false;
        }
        return rules.isInnocuous(ExtensionRules.secondExtensionOf(fileName));
    }

    private Optional<Threat> matchHash(Path file, String fileName, String location, Long size) {
        String digest;
        try {
            digest = probe.computeFileHash(file);
        } catch (IOException | SecurityException e) {
            log.debug("Не удалось вычислить хэш {}: {}", file, e.toString());
            return Optional.empty();
        }
        return signatures.findHash(digest)
            .map(signature -> fileThreat("Обнаружено вредоносное ПО: " + fileName, location, Severity.CRITICAL, size)
                .description(signature.getDescription() != null
                    ? "Хэш совпадает с сигнатурой: " + signature.getDescription()
                    : "Хэш файла совпадает с известной вредоносной сигнатурой")
                .details("SHA256: " + digest)
                .classification("Malware")
                .build());
    }

    private boolean isRecentTempExecutable(String fileName, String parent, FileMetadata metadata) {
        if (!containsAny(parent, settings.getTempLocations())) {
            return false;
        }
        Instant created = metadata.getCreationTime();
        Instant threshold = clock.instant().minus(Duration.ofDays(settings.getRecentWindowDays()));
        if (created == null || !created.isAfter(threshold)) {
            return false;
        }
        if (metadata.getSize() >= settings.getSmallFileLimitBytes()) {
            return false;
        }
        return containsAny(fileName, settings.getSuspiciousTempNameMarkers())
            || fileName.length() < settings.getShortNameLength();
    }

    private FileMetadata readMetadata(Path file) {
        try {
            return probe.readMetadata(file);
        } catch (IOException | SecurityException e) {
            log.debug("Атрибуты недоступны {}: {}", file, e.toString());
            return null;
        }
    }

    private static Threat.ThreatBuilder fileThreat(String name, String location, Severity severity, Long size) {
        return Threat.builder()
            .category(ThreatCategory.FILE)
            .name(name)
            .location(location)
            .severity(severity)
            .removable(true)
            .sizeBytes(size);
    }

    private static String parentOf(Path file) {
        Path parent = file.getParent();
        return parent == null ? "" : parent.toString().toLowerCase(Locale.ROOT);
    }

    private static boolean containsAny(String text, List<String> markers) {
        if (markers == null) {
            return false;
        }
        for (String marker : markers) {
            if (marker != null && !marker.isEmpty() && text.contains(marker.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
