package com.vtb.threatscan.traversal;

import com.vtb.threatscan.config.ScannerConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExtensionRulesTest {

    private final ExtensionRules rules = new ExtensionRules(ScannerConfig.defaults().getTraversal());

    @Test
    void extensionsAreLowerCasedWithDot() {
        assertEquals(".exe", ExtensionRules.extensionOf("Setup.EXE"));
        assertEquals("", ExtensionRules.extensionOf("README"));
        assertEquals("", ExtensionRules.extensionOf("trailing."));
        assertEquals(".pdf", ExtensionRules.secondExtensionOf("invoice.PDF.exe"));
        assertEquals("", ExtensionRules.secondExtensionOf("setup.exe"));
        assertEquals(".tar", ExtensionRules.secondExtensionOf("backup.tar.gz"));
    }

    @Test
    void scannableCoversExecutablesDocumentsAndArchives() {
        assertTrue(rules.isScannable(Path.of("a", "tool.exe")));
        assertTrue(rules.isScannable(Path.of("a", "report.docm")));
        assertTrue(rules.isScannable(Path.of("a", "bundle.7z")));
        assertFalse(rules.isScannable(Path.of("a", "notes.txt")));
        assertFalse(rules.isScannable(Path.of("a", "Makefile")));
    }

    @Test
    void systemDirectoriesAreSkipped() {
        assertTrue(rules.shouldSkipDirectory(Path.of("C", "$Recycle.Bin")));
        assertTrue(rules.shouldSkipDirectory(Path.of("C", "$SysReset")), "Каталоги на '$' пропускаются");
        assertTrue(rules.shouldSkipDirectory(Path.of("C", "System Volume Information")));
        assertTrue(rules.shouldSkipDirectory(Path.of("C", "PerfLogs")));
        assertFalse(rules.shouldSkipDirectory(Path.of("C", "Users")));
    }
}
