package com.vtb.threatscan.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Конфигурация сканера из YAML файла
 * Убирает хардкод списков расширений, путей и порогов из сканеров
 */
@Slf4j
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ScannerConfig {

    public static final String DEFAULT_RESOURCE = "threat-scanner-config.yaml";

    private Traversal traversal;
    private Progress progress;
    private Registry registry;
    private Remediation remediation;
    private Quarantine quarantine;

    private static ScannerConfig instance;

    /**
     * Загрузить конфигурацию из classpath (один раз на процесс)
     */
    public static synchronized ScannerConfig load() {
        if (instance == null) {
            try (InputStream is = ScannerConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (is == null) {
                    throw new IllegalStateException(DEFAULT_RESOURCE + " не найден в classpath");
                }
                instance = read(is);
            } catch (IOException e) {
                throw new IllegalStateException("Ошибка загрузки конфигурации: " + e.getMessage(), e);
            }
        }
        return instance;
    }

    /**
     * Загрузить конфигурацию из внешнего файла (не кэшируется)
     */
    public static ScannerConfig load(Path path) throws IOException {
        log.info("Загрузка конфигурации: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return read(is);
        }
    }

    /**
     * Конфигурация только из встроенных значений по умолчанию
     */
    public static ScannerConfig defaults() {
        ScannerConfig config = new ScannerConfig();
        config.ensureDefaults();
        return config;
    }

    static ScannerConfig read(InputStream is) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ScannerConfig config = mapper.readValue(is, ScannerConfig.class);
        if (config == null) {
            config = new ScannerConfig();
        }
        config.ensureDefaults();
        return config;
    }

    public void ensureDefaults() {
        if (traversal == null) {
            traversal = new Traversal();
        }
        traversal.ensureDefaults();
        if (progress == null) {
            progress = new Progress();
        }
        progress.ensureDefaults();
        if (registry == null) {
            registry = new Registry();
        }
        registry.ensureDefaults();
        if (remediation == null) {
            remediation = new Remediation();
        }
        remediation.ensureDefaults();
        if (quarantine == null) {
            quarantine = new Quarantine();
        }
        quarantine.ensureDefaults();
    }

    /**
     * Правила обхода файловой системы и файловой эвристики
     */
    @Data
    public static class Traversal {
        private static final List<String> DEFAULT_EXECUTABLE_EXTENSIONS = List.of(
            ".exe", ".dll", ".scr", ".bat", ".cmd", ".vbs", ".vbe", ".js", ".jse",
            ".wsf", ".wsh", ".ps1", ".psm1", ".msi", ".msp", ".com", ".pif",
            ".application", ".gadget", ".msc", ".jar", ".hta", ".cpl",
            ".inf", ".reg", ".lnk", ".scf", ".sys", ".drv");
        private static final List<String> DEFAULT_EXTRA_SCANNABLE_EXTENSIONS = List.of(
            // документы с макросами
            ".doc", ".docx", ".docm", ".xls", ".xlsx", ".xlsm", ".ppt", ".pptx", ".pptm",
            ".pdf", ".rtf",
            // архивы
            ".zip", ".rar", ".7z", ".tar", ".gz",
            // скрипты
            ".py", ".rb", ".pl", ".sh", ".php",
            // образы дисков
            ".iso", ".img", ".vhd");
        private static final List<String> DEFAULT_INNOCUOUS_EXTENSIONS = List.of(
            ".pdf", ".doc", ".docx", ".xls", ".xlsx", ".jpg", ".png", ".txt", ".mp3");
        private static final List<String> DEFAULT_SHORTCUT_EXTENSIONS = List.of(".lnk");
        private static final List<String> DEFAULT_SKIPPED_DIRECTORIES = List.of(
            "$recycle.bin", "system volume information", "windows.old", "recovery",
            "$windows.~bt", "$windows.~ws", "config.msi", "msocache", "perflogs");

        private List<String> executableExtensions;
        private List<String> scannableExtensions;
        private List<String> innocuousExtensions;
        private List<String> shortcutExtensions;
        private List<String> skippedDirectories;
        private String skippedDirectoryPrefix;
        private Long hashSizeLimitBytes;
        private Integer recentWindowDays;
        private Long smallFileLimitBytes;
        private Integer shortNameLength;
        private List<String> suspiciousTempNameMarkers;
        private List<String> hiddenExecutableLocations;
        private List<String> tempLocations;

        public void ensureDefaults() {
            if (executableExtensions == null || executableExtensions.isEmpty()) {
                executableExtensions = new ArrayList<>(DEFAULT_EXECUTABLE_EXTENSIONS);
            }
            if (scannableExtensions == null || scannableExtensions.isEmpty()) {
                List<String> all = new ArrayList<>(executableExtensions);
                all.addAll(DEFAULT_EXTRA_SCANNABLE_EXTENSIONS);
                scannableExtensions = all;
            }
            if (innocuousExtensions == null || innocuousExtensions.isEmpty()) {
                innocuousExtensions = new ArrayList<>(DEFAULT_INNOCUOUS_EXTENSIONS);
            }
            if (shortcutExtensions == null) {
                shortcutExtensions = new ArrayList<>(DEFAULT_SHORTCUT_EXTENSIONS);
            }
            if (skippedDirectories == null) {
                skippedDirectories = new ArrayList<>(DEFAULT_SKIPPED_DIRECTORIES);
            }
            if (skippedDirectoryPrefix == null) {
                skippedDirectoryPrefix = "$";
            }
            if (hashSizeLimitBytes == null || hashSizeLimitBytes <= 0) {
                hashSizeLimitBytes = 50_000_000L;
            }
            if (recentWindowDays == null || recentWindowDays <= 0) {
                recentWindowDays = 7;
            }
            if (smallFileLimitBytes == null || smallFileLimitBytes <= 0) {
                smallFileLimitBytes = 1_000_000L;
            }
            if (shortNameLength == null || shortNameLength < 0) {
                shortNameLength = 8;
            }
            if (suspiciousTempNameMarkers == null) {
                suspiciousTempNameMarkers = new ArrayList<>(List.of("update", "setup", "install"));
            }
            if (hiddenExecutableLocations == null) {
                hiddenExecutableLocations = new ArrayList<>(List.of("temp", "appdata", "programdata"));
            }
            if (tempLocations == null) {
                tempLocations = new ArrayList<>(List.of("temp", "tmp"));
            }
        }

        public Set<String> executableExtensionSet() {
            return lowerCaseSet(executableExtensions);
        }

        public Set<String> scannableExtensionSet() {
            return lowerCaseSet(scannableExtensions);
        }

        public Set<String> innocuousExtensionSet() {
            return lowerCaseSet(innocuousExtensions);
        }

        public Set<String> shortcutExtensionSet() {
            return lowerCaseSet(shortcutExtensions);
        }

        public Set<String> skippedDirectorySet() {
            return lowerCaseSet(skippedDirectories);
        }
    }

    /**
     * Частота уведомлений о прогрессе
     */
    @Data
    public static class Progress {
        private Long throttleIntervalMs;
        private Integer immediateReportFiles;

        public void ensureDefaults() {
            if (throttleIntervalMs == null || throttleIntervalMs < 0) {
                throttleIntervalMs = 250L;
            }
            if (immediateReportFiles == null || immediateReportFiles < 0) {
                immediateReportFiles = 5;
            }
        }
    }

    /**
     * Ключи реестра: автозагрузка и точки перехвата
     */
    @Data
    public static class Registry {
        private static final List<String> DEFAULT_STARTUP_LOCATIONS = List.of(
            "HKCU\\SOFTWARE\\Microsoft\\Windows\\CurrentVersion\\Run",
            "HKCU\\SOFTWARE\\Microsoft\\Windows\\CurrentVersion\\RunOnce",
            "HKLM\\SOFTWARE\\Microsoft\\Windows\\CurrentVersion\\Run",
            "HKLM\\SOFTWARE\\Microsoft\\Windows\\CurrentVersion\\RunOnce",
            "HKLM\\SOFTWARE\\WOW6432Node\\Microsoft\\Windows\\CurrentVersion\\Run");
        // Winlogon\Shell, Winlogon\Userinit и Browser Helper Objects не содержат значений
        // в этом виде; ключ Winlogon целиком не подставлять, его значения нельзя удалять
        private static final List<String> DEFAULT_HIJACK_LOCATIONS = List.of(
            "HKLM\\SOFTWARE\\Microsoft\\Windows\\CurrentVersion\\Policies\\Explorer\\Run",
            "HKLM\\SOFTWARE\\Microsoft\\Windows NT\\CurrentVersion\\Winlogon\\Shell",
            "HKLM\\SOFTWARE\\Microsoft\\Windows NT\\CurrentVersion\\Winlogon\\Userinit",
            "HKLM\\SOFTWARE\\Microsoft\\Windows\\CurrentVersion\\Explorer\\Browser Helper Objects",
            "HKLM\\SOFTWARE\\Microsoft\\Internet Explorer\\Toolbar",
            "HKLM\\SOFTWARE\\Microsoft\\Internet Explorer\\Extensions",
            "HKCU\\SOFTWARE\\Microsoft\\Windows\\CurrentVersion\\Policies\\Explorer\\Run");

        private List<String> startupLocations;
        private List<String> hijackLocations;

        public void ensureDefaults() {
            if (startupLocations == null) {
                startupLocations = new ArrayList<>(DEFAULT_STARTUP_LOCATIONS);
            }
            if (hijackLocations == null) {
                hijackLocations = new ArrayList<>(DEFAULT_HIJACK_LOCATIONS);
            }
        }
    }

    /**
     * Параметры удаления угроз
     */
    @Data
    public static class Remediation {
        private static final List<String> DEFAULT_PROTECTED_PATHS = List.of(
            "C:\\Windows\\System32\\Tasks",
            "C:\\Windows\\SysWOW64\\Tasks",
            "C:\\Program Files\\WindowsApps",
            "C:\\Windows\\WinSxS",
            "C:\\Windows\\servicing",
            "C:\\Windows\\assembly",
            "C:\\Windows\\Installer",
            "C:\\$Recycle.Bin",
            "C:\\System Volume Information");

        private List<String> protectedPaths;
        private List<String> protectedPathMarkers;
        private Integer elevationTimeoutSec;
        private Integer serviceControlTimeoutSec;
        private Integer processExitTimeoutSec;

        public void ensureDefaults() {
            if (protectedPaths == null) {
                protectedPaths = new ArrayList<>(DEFAULT_PROTECTED_PATHS);
            }
            if (protectedPathMarkers == null) {
                protectedPathMarkers = new ArrayList<>(List.of("windowsapps", "systemapps"));
            }
            if (elevationTimeoutSec == null || elevationTimeoutSec <= 0) {
                elevationTimeoutSec = 5;
            }
            if (serviceControlTimeoutSec == null || serviceControlTimeoutSec <= 0) {
                serviceControlTimeoutSec = 10;
            }
            if (processExitTimeoutSec == null || processExitTimeoutSec <= 0) {
                processExitTimeoutSec = 5;
            }
        }
    }

    /**
     * Хранилище карантина
     */
    @Data
    public static class Quarantine {
        private String directory;
        private Long maxFileSizeBytes;
        private Integer cleanupAfterDays;

        public void ensureDefaults() {
            if (directory == null || directory.isBlank()) {
                directory = Path.of(System.getProperty("user.home"), ".threat-scanner", "quarantine").toString();
            }
            if (maxFileSizeBytes == null || maxFileSizeBytes <= 0) {
                maxFileSizeBytes = 100L * 1024 * 1024;
            }
            if (cleanupAfterDays == null || cleanupAfterDays <= 0) {
                cleanupAfterDays = 30;
            }
        }
    }

    private static Set<String> lowerCaseSet(List<String> values) {
        Set<String> result = new LinkedHashSet<>();
        if (values != null) {
            for (String value : values) {
                if (value != null && !value.isBlank()) {
                    result.add(value.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        return result;
    }
}
