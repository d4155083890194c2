package com.vtb.threatscan.platform;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.util.FileHashing;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileStore;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.DosFileAttributeView;
import java.nio.file.attribute.DosFileAttributes;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Реализация {@link PlatformProbe} для локального хоста.
 * Файлы и процессы - через NIO и ProcessHandle, реестр и службы - через reg.exe и sc.exe.
 * На не-Windows хостах реестр, службы и планировщик пусты.
 */
@Slf4j
public class LocalPlatformProbe implements PlatformProbe {

    private static final Set<String> NON_FIXED_STORE_TYPES = Set.of(
        "cdfs", "udf", "iso9660", "proc", "sysfs", "devtmpfs", "devpts", "tmpfs",
        "cgroup", "cgroup2", "nfs", "nfs4", "cifs", "smbfs", "fuse.sshfs");
    private static final List<String> UNIX_PSEUDO_DIRECTORIES = List.of("/proc", "/sys", "/dev", "/run");
    private static final Pattern REG_VALUE_LINE = Pattern.compile("^ {4}(.+?) {4}(REG_[A-Z_]+)(?: {4}(.*))?$");

    private static final int SC_SERVICE_DOES_NOT_EXIST = 1060;
    private static final int SC_SERVICE_NOT_ACTIVE = 1062;

    private final CommandRunner commandRunner;
    private final Duration elevationTimeout;
    private final Duration serviceControlTimeout;
    private final Duration processExitTimeout;
    private final boolean windows;

    public LocalPlatformProbe(ScannerConfig config) {
        this(config, new CommandRunner());
    }

    public LocalPlatformProbe(ScannerConfig config, CommandRunner commandRunner) {
        this(config, commandRunner, System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows"));
    }

    LocalPlatformProbe(ScannerConfig config, CommandRunner commandRunner, boolean windows) {
        ScannerConfig.Remediation remediation = config.getRemediation();
        this.commandRunner = commandRunner;
        this.elevationTimeout = Duration.ofSeconds(remediation.getElevationTimeoutSec());
        this.serviceControlTimeout = Duration.ofSeconds(remediation.getServiceControlTimeoutSec());
        this.processExitTimeout = Duration.ofSeconds(remediation.getProcessExitTimeoutSec());
        this.windows = windows;
    }

    @Override
    public List<Volume> listFixedVolumes() throws IOException {
        List<Volume> volumes = new ArrayList<>();
        for (Path root : FileSystems.getDefault().getRootDirectories()) {
            try {
                FileStore store = Files.getFileStore(root);
                if (NON_FIXED_STORE_TYPES.contains(store.type().toLowerCase(Locale.ROOT))) {
                    log.debug("Том {} пропущен: тип {}", root, store.type());
                    continue;
                }
                if (!Files.isReadable(root)) {
                    continue;
                }
                volumes.add(new Volume(root, store.name(), excludedPathsFor(root)));
            } catch (IOException e) {
                // том не готов (пустой картридер, отключённый диск)
                log.debug("Том {} не готов: {}", root, e.getMessage());
            }
        }
        if (volumes.isEmpty()) {
            throw new IOException("Не найдено ни одного готового локального тома");
        }
        return volumes;
    }

    private Set<Path> excludedPathsFor(Path root) {
        if (windows) {
            return Set.of();
        }
        Set<Path> excluded = new HashSet<>();
        for (String dir : UNIX_PSEUDO_DIRECTORIES) {
            excluded.add(root.resolve(dir.substring(1)));
        }
        return excluded;
    }

    @Override
    public List<ProcessInfo> listProcesses() {
        List<ProcessInfo> processes = new ArrayList<>();
        ProcessHandle.allProcesses().forEach(handle -> {
            Optional<String> command = handle.info().command();
            if (command.isEmpty()) {
                return;
            }
            Path executable = Path.of(command.get());
            Path fileName = executable.getFileName();
            if (fileName != null) {
                processes.add(new ProcessInfo(handle.pid(), fileName.toString(), executable.toString()));
            }
        });
        return processes;
    }

    @Override
    public boolean killProcess(long pid) throws IOException {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid);
        if (handle.isEmpty() || !handle.get().isAlive()) {
            return false;
        }
        if (!handle.get().destroyForcibly()) {
            throw new AccessDeniedException("pid " + pid, null, "Процесс не может быть завершён");
        }
        try {
            handle.get().onExit().get(processExitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Ожидание завершения процесса " + pid + " прервано", e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IOException("Процесс " + pid + " не завершился за " + processExitTimeout.toSeconds() + " с", e);
        }
        return true;
    }

    @Override
    public Optional<String> readRegistryValue(RegistryHive hive, String keyPath, String valueName) throws IOException {
        if (!windows) {
            return Optional.empty();
        }
        CommandResult result = commandRunner.run(serviceControlTimeout,
            "reg", "query", hive.name() + "\\" + keyPath, "/v", valueName);
        if (!result.isSuccess()) {
            return Optional.empty();
        }
        for (String line : result.getOutput().split("\\R")) {
            Matcher matcher = REG_VALUE_LINE.matcher(line);
            if (matcher.matches() && matcher.group(1).equalsIgnoreCase(valueName)) {
                return Optional.of(matcher.group(3) != null ? matcher.group(3) : "");
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean deleteRegistryValue(RegistryHive hive, String keyPath, String valueName) throws IOException {
        if (!windows) {
            return false;
        }
        if (readRegistryValue(hive, keyPath, valueName).isEmpty()) {
            return false;
        }
        CommandResult result = commandRunner.run(serviceControlTimeout,
            "reg", "delete", hive.name() + "\\" + keyPath, "/v", valueName, "/f");
        if (result.isSuccess()) {
            return true;
        }
        if (result.outputContains("access is denied")) {
            throw new AccessDeniedException(hive.name() + "\\" + keyPath + "\\" + valueName);
        }
        throw new IOException("reg delete завершился с кодом " + result.getExitCode() + ": " + result.getOutput().trim());
    }

    @Override
    public List<String> listRegistryValueNames(RegistryHive hive, String keyPath) throws IOException {
        if (!windows) {
            return List.of();
        }
        CommandResult result = commandRunner.run(serviceControlTimeout, "reg", "query", hive.name() + "\\" + keyPath);
        if (!result.isSuccess()) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        for (String line : result.getOutput().split("\\R")) {
            Matcher matcher = REG_VALUE_LINE.matcher(line);
            if (matcher.matches()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }

    @Override
    public List<Path> listScheduledTaskFiles() throws IOException {
        if (!windows) {
            return List.of();
        }
        String systemRoot = System.getenv().getOrDefault("SystemRoot", "C:\\Windows");
        Path taskStore = Path.of(systemRoot, "System32", "Tasks");
        if (!Files.isDirectory(taskStore)) {
            return List.of();
        }
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(taskStore, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile()) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) {
                log.debug("Пропуск задачи {}: {}", file, exc.getMessage());
                return FileVisitResult.CONTINUE;
            }
        });
        return files;
    }

    @Override
    public List<BrowserExtensionRoot> listBrowserExtensionRoots() {
        String localAppData = System.getenv("LOCALAPPDATA");
        String appData = System.getenv("APPDATA");
        Path home = Path.of(System.getProperty("user.home"));

        List<BrowserExtensionRoot> roots = new ArrayList<>();
        if (localAppData != null) {
            roots.add(new BrowserExtensionRoot("Chrome",
                Path.of(localAppData, "Google", "Chrome", "User Data", "Default", "Extensions"), false));
            roots.add(new BrowserExtensionRoot("Edge",
                Path.of(localAppData, "Microsoft", "Edge", "User Data", "Default", "Extensions"), false));
        } else {
            roots.add(new BrowserExtensionRoot("Chrome",
                home.resolve(Path.of(".config", "google-chrome", "Default", "Extensions")), false));
            roots.add(new BrowserExtensionRoot("Edge",
                home.resolve(Path.of(".config", "microsoft-edge", "Default", "Extensions")), false));
        }
        if (appData != null) {
            roots.add(new BrowserExtensionRoot("Firefox", Path.of(appData, "Mozilla", "Firefox", "Profiles"), true));
        } else {
            roots.add(new BrowserExtensionRoot("Firefox", home.resolve(Path.of(".mozilla", "firefox")), true));
        }
        return roots;
    }

    @Override
    public FileMetadata readMetadata(Path path) throws IOException {
        DosFileAttributeView dosView = Files.getFileAttributeView(path, DosFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
        if (dosView != null && windows) {
            DosFileAttributes attrs = dosView.readAttributes();
            Set<FileFlag> flags = EnumSet.noneOf(FileFlag.class);
            if (attrs.isReadOnly()) flags.add(FileFlag.READ_ONLY);
            if (attrs.isHidden()) flags.add(FileFlag.HIDDEN);
            if (attrs.isSystem()) flags.add(FileFlag.SYSTEM);
            if (attrs.isArchive()) flags.add(FileFlag.ARCHIVE);
            return new FileMetadata(attrs.size(), attrs.creationTime().toInstant(), flags);
        }
        BasicFileAttributes attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        Set<FileFlag> flags = EnumSet.noneOf(FileFlag.class);
        if (Files.isHidden(path)) flags.add(FileFlag.HIDDEN);
        if (!Files.isWritable(path)) flags.add(FileFlag.READ_ONLY);
        return new FileMetadata(attrs.size(), attrs.creationTime().toInstant(), flags);
    }

    @Override
    public void setFileFlags(Path path, Set<FileFlag> flags) throws IOException {
        if (!Files.exists(path, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(path.toString());
        }
        DosFileAttributeView dosView = Files.getFileAttributeView(path, DosFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
        if (dosView != null && windows) {
            dosView.setReadOnly(flags.contains(FileFlag.READ_ONLY));
            dosView.setHidden(flags.contains(FileFlag.HIDDEN));
            dosView.setSystem(flags.contains(FileFlag.SYSTEM));
            dosView.setArchive(flags.contains(FileFlag.ARCHIVE));
            return;
        }
        PosixFileAttributeView posixView = Files.getFileAttributeView(path, PosixFileAttributeView.class, LinkOption.NOFOLLOW_LINKS);
        if (posixView != null) {
            Set<PosixFilePermission> permissions = posixView.readAttributes().permissions();
            if (flags.contains(FileFlag.READ_ONLY)) {
                permissions.remove(PosixFilePermission.OWNER_WRITE);
            } else {
                permissions.add(PosixFilePermission.OWNER_WRITE);
            }
            posixView.setPermissions(permissions);
        }
    }

    @Override
    public void deleteFile(Path path) throws IOException {
        Files.delete(path);
    }

    @Override
    public String computeFileHash(Path path) throws IOException {
        return FileHashing.sha256Hex(path);
    }

    @Override
    public void elevateAndRetry(Path path, FileOperation operation) throws IOException {
        if (windows) {
            CommandResult takeown = commandRunner.run(elevationTimeout, "takeown", "/F", path.toString());
            log.debug("takeown {}: код {}, таймаут {}", path, takeown.getExitCode(), takeown.isTimedOut());
            // S-1-5-32-544 - группа администраторов независимо от языка системы
            CommandResult icacls = commandRunner.run(elevationTimeout,
                "icacls", path.toString(), "/grant", "*S-1-5-32-544:F");
            log.debug("icacls {}: код {}, таймаут {}", path, icacls.getExitCode(), icacls.isTimedOut());
        }
        operation.run(path);
    }

    @Override
    public ServiceControlResult disableAndStopService(String serviceName) throws IOException {
        if (!windows) {
            throw new IOException("Управление службами поддерживается только в Windows");
        }
        CommandResult disable = commandRunner.run(serviceControlTimeout,
            "sc", "config", serviceName, "start=", "disabled");
        if (disable.getExitCode() == SC_SERVICE_DOES_NOT_EXIST) {
            return ServiceControlResult.missing(serviceName);
        }
        // остановка выполняется даже если отключить не удалось
        CommandResult stop = commandRunner.run(serviceControlTimeout, "sc", "stop", serviceName);
        boolean stopped = stop.isSuccess() || stop.getExitCode() == SC_SERVICE_NOT_ACTIVE;

        String message = disable.isSuccess()
            ? "Служба " + serviceName + " отключена" + (stopped ? " и остановлена" : ", остановить не удалось")
            : "Не удалось отключить службу " + serviceName + " (код " + disable.getExitCode() + ")";
        return new ServiceControlResult(true, disable.isSuccess(), stopped, message);
    }
}
