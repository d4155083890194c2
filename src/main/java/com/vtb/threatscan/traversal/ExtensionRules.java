package com.vtb.threatscan.traversal;

import com.vtb.threatscan.config.ScannerConfig;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Set;

/**
 * Списки расширений и исключённых каталогов из конфигурации, приведённые к нижнему регистру
 */
public class ExtensionRules {

    private final Set<String> executable;
    private final Set<String> scannable;
    private final Set<String> innocuous;
    private final Set<String> shortcuts;
    private final Set<String> skippedDirectories;
    private final String skippedPrefix;

    public ExtensionRules(ScannerConfig.Traversal traversal) {
        this.executable = traversal.executableExtensionSet();
        this.scannable = traversal.scannableExtensionSet();
        this.innocuous = traversal.innocuousExtensionSet();
        this.shortcuts = traversal.shortcutExtensionSet();
        this.skippedDirectories = traversal.skippedDirectorySet();
        String prefix = traversal.getSkippedDirectoryPrefix();
        this.skippedPrefix = prefix == null ? "" : prefix.toLowerCase(Locale.ROOT);
    }

    /**
     * Расширение с точкой в нижнем регистре: "Setup.EXE" -> ".exe"; пустая строка, если его нет
     */
    public static String extensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Предпоследнее расширение: "invoice.pdf.exe" -> ".pdf"
     */
    public static String secondExtensionOf(String fileName) {
        if (fileName == null) {
            return "";
        }
        int last = fileName.lastIndexOf('.');
        if (last <= 0) {
            return "";
        }
        return extensionOf(fileName.substring(0, last));
    }

    public boolean isScannable(Path file) {
        Path name = file.getFileName();
        return name != null && scannable.contains(extensionOf(name.toString()));
    }

    public boolean isExecutable(String extension) {
        return executable.contains(extension);
    }

    public boolean isInnocuous(String extension) {
        return innocuous.contains(extension);
    }

    public boolean isShortcut(String extension) {
        return shortcuts.contains(extension);
    }

    public boolean shouldSkipDirectory(Path directory) {
        Path name = directory.getFileName();
        if (name == null) {
            return false;
        }
        String lower = name.toString().toLowerCase(Locale.ROOT);
        if (!skippedPrefix.isEmpty() && lower.startsWith(skippedPrefix)) {
            return true;
        }
        return skippedDirectories.contains(lower);
    }
}
