package com.vtb.threatscan.scanners;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.core.CancellationToken;
import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.platform.RegistryHive;
import com.vtb.threatscan.signatures.SignatureStore;
import com.vtb.threatscan.testing.FakePlatformProbe;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StartupScannerTest {

    private static final String RUN = "SOFTWARE\\Microsoft\\Windows\\CurrentVersion\\Run";

    private final SignatureStore signatures = SignatureStore.builder()
        .fileName("keylogger", Severity.MEDIUM, "Keylogger")
        .fileName("xmrig", Severity.MEDIUM, "Майнер")
        .build();

    @Test
    void valueNameOrContentTriggersHighStartupThreat() {
        FakePlatformProbe probe = new FakePlatformProbe()
            .withRegistryValue(RegistryHive.HKCU, RUN, "OneDrive", "C:\\Program Files\\OneDrive\\OneDrive.exe")
            .withRegistryValue(RegistryHive.HKCU, RUN, "KeyloggerPro", "C:\\Tools\\kp.exe")
            .withRegistryValue(RegistryHive.HKLM, RUN, "Updater", "C:\\Users\\Public\\xmrig.exe --donate 0");
        ScanContext context = new ScanContext(signatures, probe, ScannerConfig.defaults(), new CancellationToken(), null);

        new StartupScanner().scan(context);

        List<Threat> threats = context.getThreats();
        assertEquals(2, threats.size());
        assertEquals(3, context.getFilesScanned());
        assertTrue(threats.stream().allMatch(t -> t.getCategory() == ThreatCategory.STARTUP));
        assertTrue(threats.stream().allMatch(t -> t.getSeverity() == Severity.HIGH));
        assertEquals("HKCU\\" + RUN + "\\KeyloggerPro", threats.get(0).getLocation());
        assertEquals("HKLM\\" + RUN + "\\Updater", threats.get(1).getLocation());
        assertEquals("C:\\Users\\Public\\xmrig.exe --donate 0", threats.get(1).getDetails());
    }

    @Test
    void malformedConfiguredKeyIsSkipped() {
        ScannerConfig config = ScannerConfig.defaults();
        config.getRegistry().setStartupLocations(List.of("NOT_A_HIVE", "HKCU\\" + RUN));
        FakePlatformProbe probe = new FakePlatformProbe()
            .withRegistryValue(RegistryHive.HKCU, RUN, "xmrig", "x");
        ScanContext context = new ScanContext(signatures, probe, config, new CancellationToken(), null);

        new StartupScanner().scan(context);

        assertEquals(1, context.getThreatCount());
    }
}
