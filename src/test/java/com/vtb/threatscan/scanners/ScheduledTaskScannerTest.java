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

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ScheduledTaskScannerTest {

    @Test
    void taskPointingToMinerIsMedium(@TempDir Path tasks) throws Exception {
        Path evil = tasks.resolve("SystemHealth");
        Path good = tasks.resolve("GoogleUpdateTaskMachineCore");
        byte[] body = "<Task><Actions><Exec><Command>C:\\ProgramData\\xmrig.exe</Command></Exec></Actions></Task>"
            .getBytes(StandardCharsets.UTF_16LE);
        byte[] withBom = new byte[body.length + 2];
        withBom[0] = (byte) 0xFF;
        withBom[1] = (byte) 0xFE;
        System.arraycopy(body, 0, withBom, 2, body.length);
        Files.write(evil, withBom);
        Files.writeString(good, "<Task><Exec><Command>GoogleUpdate.exe</Command></Exec></Task>");

        FakePlatformProbe probe = new FakePlatformProbe()
            .withTaskFile(good)
            .withTaskFile(evil)
            .withTaskFile(tasks.resolve("Vanished"));
        SignatureStore signatures = SignatureStore.builder().fileName("xmrig", Severity.MEDIUM, "Майнер").build();
        ScanContext context = new ScanContext(signatures, probe, ScannerConfig.defaults(), new CancellationToken(), null);

        new ScheduledTaskScanner().scan(context);

        assertEquals(3, context.getFilesScanned());
        assertEquals(1, context.getThreatCount(), "Непрочитанная задача пропускается без ошибки");
        Threat threat = context.getThreats().get(0);
        assertEquals(ThreatCategory.SCHEDULED_TASK, threat.getCategory());
        assertEquals(Severity.MEDIUM, threat.getSeverity());
        assertEquals(evil.toString(), threat.getLocation());
    }
}
