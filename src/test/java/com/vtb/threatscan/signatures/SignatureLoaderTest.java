package com.vtb.threatscan.signatures;

import com.vtb.threatscan.models.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SignatureLoaderTest {

    @Test
    void bundledDefinitionsLoad() {
        SignatureStore store = new SignatureLoader().loadDefault();

        assertTrue(store.getProcessSignatureCount() > 0);
        assertTrue(store.getFileNameSignatureCount() > 0);
        assertTrue(store.getHashCount() >= 2);
        assertEquals(Severity.CRITICAL, store.matchProcess("xmrig").get().getSeverity());
        assertEquals(Severity.MEDIUM, store.matchFileName("free_keylogger.exe").get().getSignature().getSeverity());
        assertTrue(store.matchHash("275a021bbfb6489e54d471899f7db9d1663fc695ec2fe2a2c4538aabf651fd0f"));
        assertTrue(store.matchAdwareMarker("conduit search").isPresent());
    }

    @Test
    void bundledProcessSignaturesDoNotMatchCommonSystemProcesses() {
        SignatureStore store = new SignatureLoader().loadDefault();

        for (String name : new String[]{"explorer", "svchost", "chrome", "firefox", "java", "navigator", "systemd"}) {
            assertTrue(store.matchProcess(name).isEmpty(), "Ложное срабатывание на " + name);
        }
    }

    @Test
    void externalFileWithDefaultsForMissingSeverity(@TempDir Path tempDir) throws Exception {
        Path file = tempDir.resolve("custom-signatures.yaml");
        Files.writeString(file, """
            version: "test"
            processes:
              - pattern: evilminer
            fileNames:
              - pattern: dropper
                severity: HIGH
                description: Загрузчик
            hashes:
              - sha256: "AABBCC"
                description: Тестовый хэш
            """);

        SignatureStore store = new SignatureLoader().load(file);

        assertEquals(Severity.CRITICAL, store.matchProcess("EvilMiner.exe").get().getSeverity());
        assertEquals(Severity.HIGH, store.matchFileName("dropper.js").get().getSignature().getSeverity());
        assertTrue(store.matchHash("aabbcc"));
    }

    @Test
    void missingFileIsReportedAsLoadFailure(@TempDir Path tempDir) {
        assertThrows(SignatureLoadException.class,
            () -> new SignatureLoader().load(tempDir.resolve("absent.yaml")));
    }
}
