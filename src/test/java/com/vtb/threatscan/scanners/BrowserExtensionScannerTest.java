package com.vtb.threatscan.scanners;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.core.CancellationToken;
import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.signatures.SignatureStore;
import com.vtb.threatscan.testing.FakePlatformProbe;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BrowserExtensionScannerTest {

    private final SignatureStore signatures = SignatureStore.builder()
        .fileName("coolwebsearch", Severity.MEDIUM, "CoolWebSearch")
        .adwareMarker("searchprotect")
        .build();

    private static void manifest(Path dir, String name) throws Exception {
        Files.createDirectories(dir);
        Files.writeString(dir.resolve("manifest.json"), "{\"name\": \"" + name + "\", \"version\": \"1.0\"}");
    }

    @Test
    void chromiumExtensionWithAdwareManifest(@TempDir Path extensions) throws Exception {
        manifest(extensions.resolve("aapocclcgogkmnckokdopfmhonfmgoek").resolve("0.10_0"), "Slides");
        manifest(extensions.resolve("mhjfbmdgcfjbbpaeojofohoefgiehjai").resolve("3.1_0"), "SearchProtect Toolbar");

        FakePlatformProbe probe = new FakePlatformProbe().withBrowserRoot("Chrome", extensions, false);
        ScanContext context = new ScanContext(signatures, probe, ScannerConfig.defaults(), new CancellationToken(), null);

        new BrowserExtensionScanner().scan(context);

        assertEquals(2, context.getFilesScanned());
        List<Threat> threats = context.getThreats();
        assertEquals(1, threats.size());
        Threat threat = threats.get(0);
        assertEquals(ThreatCategory.BROWSER_EXTENSION, threat.getCategory());
        assertEquals(Severity.MEDIUM, threat.getSeverity());
        assertFalse(threat.isRemovable(), "Расширения не удаляются автоматически");
        assertTrue(threat.getLocation().endsWith("mhjfbmdgcfjbbpaeojofohoefgiehjai"));
        assertTrue(threat.getName().contains("Chrome"));
    }

    @Test
    void geckoProfilesAreSearchedForSuspiciousNames(@TempDir Path profiles) throws Exception {
        manifest(profiles.resolve("abc.default-release").resolve("extensions").resolve("coolwebsearch@helper"), "Helper");
        manifest(profiles.resolve("abc.default-release").resolve("extensions").resolve("ublock0@raymondhill.net"), "uBlock");
        Files.createDirectories(profiles.resolve("empty.profile"));

        FakePlatformProbe probe = new FakePlatformProbe().withBrowserRoot("Firefox", profiles, true);
        ScanContext context = new ScanContext(signatures, probe, ScannerConfig.defaults(), new CancellationToken(), null);

        new BrowserExtensionScanner().scan(context);

        assertEquals(1, context.getThreatCount());
        assertTrue(context.getThreats().get(0).getLocation().endsWith("coolwebsearch@helper"));
    }

    @Test
    void missingBrowserRootIsIgnored(@TempDir Path dir) {
        FakePlatformProbe probe = new FakePlatformProbe().withBrowserRoot("Edge", dir.resolve("absent"), false);
        ScanContext context = new ScanContext(signatures, probe, ScannerConfig.defaults(), new CancellationToken(), null);

        new BrowserExtensionScanner().scan(context);

        assertEquals(0, context.getThreatCount());
    }
}
