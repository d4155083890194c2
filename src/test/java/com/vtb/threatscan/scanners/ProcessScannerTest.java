package com.vtb.threatscan.scanners;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.core.CancellationToken;
import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.core.WalkOutcome;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.signatures.SignatureStore;
import com.vtb.threatscan.testing.FakePlatformProbe;
import com.vtb.threatscan.testing.RecordingListener;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ProcessScannerTest {

    private final SignatureStore signatures = SignatureStore.builder()
        .process("xmrig", Severity.CRITICAL, "Майнер")
        .build();

    @Test
    void minerProcessIsCritical() {
        FakePlatformProbe probe = new FakePlatformProbe()
            .withProcess(100, "explorer.exe", "C:\\Windows\\explorer.exe")
            .withProcess(4242, "XMRig.exe", "C:\\Users\\u\\AppData\\xmrig.exe")
            .withProcess(4243, "xmrig-helper", null);
        RecordingListener listener = new RecordingListener();
        ScanContext context = new ScanContext(signatures, probe, ScannerConfig.defaults(), new CancellationToken(), listener);

        WalkOutcome outcome = new ProcessScanner().scan(context);

        assertEquals(WalkOutcome.CONTINUE, outcome);
        assertEquals(3, context.getFilesScanned(), "Каждый процесс учитывается в счётчике");
        assertEquals(2, context.getThreatCount());
        Threat first = context.getThreats().get(0);
        assertEquals(ThreatCategory.PROCESS, first.getCategory());
        assertEquals(Severity.CRITICAL, first.getSeverity());
        assertEquals(4242L, first.getProcessId());
        assertEquals("C:\\Users\\u\\AppData\\xmrig.exe", first.getLocation());
        assertEquals("XMRig.exe", first.getDetails());
        assertEquals("Неизвестно", context.getThreats().get(1).getLocation());
        assertEquals(2, listener.threats.size());
    }

    @Test
    void cancelledBeforeFirstProcess() {
        FakePlatformProbe probe = new FakePlatformProbe().withProcess(1, "xmrig.exe", null);
        CancellationToken token = new CancellationToken();
        token.cancel();
        ScanContext context = new ScanContext(signatures, probe, ScannerConfig.defaults(), token, null);

        assertEquals(WalkOutcome.CANCELLED, new ProcessScanner().scan(context));
        assertEquals(0, context.getThreatCount());
    }
}
