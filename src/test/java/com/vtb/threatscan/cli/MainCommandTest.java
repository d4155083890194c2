package com.vtb.threatscan.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vtb.threatscan.testing.FakePlatformProbe;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainCommandTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private int run(FakePlatformProbe probe, String... args) {
        return new CommandLine(new MainCommand(probe, out)).execute(args);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private Path scanRoot() throws IOException {
        Path root = tempDir.resolve("scan");
        Files.createDirectories(root);
        return root;
    }

    @Test
    void cleanDirectoryExitsWithZero() throws Exception {
        Path root = scanRoot();
        Files.writeString(root.resolve("report.pdf"), "%PDF-1.7");

        int exitCode = run(new FakePlatformProbe(), "--path", root.toString());

        assertEquals(MainCommand.EXIT_CLEAN, exitCode);
        assertTrue(output().contains("VTB THREAT SCAN REPORT"));
        assertTrue(output().contains("[100%]"));
    }

    @Test
    void threatsExitWithOneAndReportIsWritten() throws Exception {
        Path root = scanRoot();
        Files.writeString(root.resolve("invoice.pdf.exe"), "MZ");
        Path report = tempDir.resolve("out").resolve("report.json");

        int exitCode = run(new FakePlatformProbe(), "-p", root.toString(), "-o", report.toString());

        assertEquals(MainCommand.EXIT_THREATS, exitCode);
        JsonNode json = new ObjectMapper().readTree(report.toFile());
        assertEquals(1, json.get("threatCount").asInt());
        assertEquals("HIGH", json.get("threats").get(0).get("severity").asText());
    }

    @Test
    void removeDeletesRemovableFiles() throws Exception {
        Path root = scanRoot();
        Path evil = root.resolve("photo.jpg.scr");
        Files.writeString(evil, "MZ");

        int exitCode = run(new FakePlatformProbe(), "--path", root.toString(), "--remove");

        assertEquals(MainCommand.EXIT_THREATS, exitCode, "Код выхода отражает найденные угрозы");
        assertFalse(Files.exists(evil));
        assertTrue(output().contains("УДАЛЕНИЕ УГРОЗ"));
    }

    @Test
    void quarantineUsesConfiguredVault() throws Exception {
        Path root = scanRoot();
        Path evil = root.resolve("photo.jpg.scr");
        Files.writeString(evil, "MZ");
        Path vault = tempDir.resolve("vault");
        Path config = tempDir.resolve("config.yaml");
        Files.writeString(config, "quarantine:\n  directory: '" + vault + "'\n");

        int exitCode = run(new FakePlatformProbe(), "-c", config.toString(), "-p", root.toString(),
            "--remove", "--quarantine");

        assertEquals(MainCommand.EXIT_THREATS, exitCode);
        assertFalse(Files.exists(evil));
        assertTrue(Files.exists(vault.resolve("index.json")));
    }

    @Test
    void volumeFailureExitsWithTwo() {
        FakePlatformProbe probe = new FakePlatformProbe().failVolumes(new IOException("тома недоступны"));

        int exitCode = run(probe);

        assertEquals(MainCommand.EXIT_ERROR, exitCode);
        assertTrue(output().contains("тома недоступны"));
    }

    @Test
    void missingSignaturesFileExitsWithTwo() throws Exception {
        int exitCode = run(new FakePlatformProbe(), "-s", tempDir.resolve("absent.yaml").toString(),
            "-p", scanRoot().toString());

        assertEquals(MainCommand.EXIT_ERROR, exitCode);
    }
}
