package com.vtb.threatscan.scanners;

import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.core.WalkOutcome;
import com.vtb.threatscan.models.ScanPhase;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.platform.BrowserExtensionRoot;
import com.vtb.threatscan.signatures.FileNameMatch;
import com.vtb.threatscan.util.TextFiles;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Расширения Chrome, Edge и Firefox: имя каталога расширения против шаблонов имён,
 * затем manifest.json против маркеров adware.
 * Найденные расширения не удаляются автоматически.
 */
@Slf4j
public class BrowserExtensionScanner implements DomainScanner {

    private static final String MANIFEST = "manifest.json";
    private static final String PROFILE_EXTENSIONS = "extensions";

    @Override
    public ScanPhase getPhase() {
        return ScanPhase.SCANNING_BROWSER_EXTENSIONS;
    }

    @Override
    public String getName() {
        return "Расширения браузеров";
    }

    @Override
    public WalkOutcome scan(ScanContext context) {
        for (BrowserExtensionRoot root : context.getProbe().listBrowserExtensionRoots()) {
            if (context.isCancellationRequested()) {
                return WalkOutcome.CANCELLED;
            }
            WalkOutcome outcome;
            if (root.isProfileContainer()) {
                outcome = scanProfiles(context, root);
            } else {
                outcome = scanExtensionFolder(context, root.getBrowser(), root.getPath());
            }
            if (outcome.isCancelled()) {
                return outcome;
            }
        }
        return WalkOutcome.CONTINUE;
    }

    private WalkOutcome scanProfiles(ScanContext context, BrowserExtensionRoot root) {
        for (Path profile : subdirectories(root.getPath())) {
            if (context.isCancellationRequested()) {
                return WalkOutcome.CANCELLED;
            }
            WalkOutcome outcome = scanExtensionFolder(context, root.getBrowser(), profile.resolve(PROFILE_EXTENSIONS));
            if (outcome.isCancelled()) {
                return outcome;
            }
        }
        return WalkOutcome.CONTINUE;
    }

    private WalkOutcome scanExtensionFolder(ScanContext context, String browser, Path folder) {
        for (Path extension : subdirectories(folder)) {
            if (context.isCancellationRequested()) {
                return WalkOutcome.CANCELLED;
            }
            context.incrementFilesScanned();

            String extensionName = extension.getFileName().toString();
            Optional<FileNameMatch> nameMatch = context.getSignatures().matchFileName(extensionName);
            String reason;
            if (nameMatch.isPresent()) {
                reason = nameMatch.get().getDescription();
            } else {
                reason = findAdwareMarker(context, extension)
                    .map(marker -> "Adware: " + marker)
                    .orElse(null);
            }
            if (reason == null) {
                continue;
            }
            context.addThreat(Threat.builder()
                .category(ThreatCategory.BROWSER_EXTENSION)
                .name("Подозрительное расширение " + browser)
                .description("Расширение браузера совпадает с шаблоном угрозы: " + reason)
                .location(extension.toString())
                .severity(Severity.MEDIUM)
                .classification("Adware/PUP")
                .removable(false)
                .build());
        }
        return WalkOutcome.CONTINUE;
    }

    /**
     * manifest.json лежит либо в каталоге расширения, либо (Chromium) в подкаталоге версии
     */
    private Optional<String> findAdwareMarker(ScanContext context, Path extension) {
        List<Path> candidates = new ArrayList<>();
        candidates.add(extension.resolve(MANIFEST));
        for (Path version : subdirectories(extension)) {
            candidates.add(version.resolve(MANIFEST));
        }
        for (Path manifest : candidates) {
            if (!Files.isRegularFile(manifest, LinkOption.NOFOLLOW_LINKS)) {
                continue;
            }
            try {
                Optional<String> marker = context.getSignatures().matchAdwareMarker(TextFiles.readLenient(manifest));
                if (marker.isPresent()) {
                    return marker;
                }
            } catch (IOException | SecurityException e) {
                log.debug("manifest.json недоступен {}: {}", manifest, e.toString());
            }
        }
        return Optional.empty();
    }

    private static List<Path> subdirectories(Path folder) {
        List<Path> result = new ArrayList<>();
        if (!Files.isDirectory(folder, LinkOption.NOFOLLOW_LINKS)) {
            return result;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(folder)) {
            for (Path entry : stream) {
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    result.add(entry);
                }
            }
        } catch (IOException | DirectoryIteratorException | SecurityException e) {
            log.debug("Каталог расширений недоступен {}: {}", folder, e.toString());
        }
        result.sort(null);
        return result;
    }
}
