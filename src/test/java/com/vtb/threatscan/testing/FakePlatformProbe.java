package com.vtb.threatscan.testing;

import com.vtb.threatscan.platform.BrowserExtensionRoot;
import com.vtb.threatscan.platform.FileFlag;
import com.vtb.threatscan.platform.FileMetadata;
import com.vtb.threatscan.platform.FileOperation;
import com.vtb.threatscan.platform.PlatformProbe;
import com.vtb.threatscan.platform.ProcessInfo;
import com.vtb.threatscan.platform.RegistryHive;
import com.vtb.threatscan.platform.ServiceControlResult;
import com.vtb.threatscan.platform.Volume;
import com.vtb.threatscan.util.FileHashing;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Платформа в памяти для тестов: процессы, реестр и службы - коллекции,
 * файловые операции идут в настоящую ФС (обычно @TempDir) с подменой атрибутов.
 */
public class FakePlatformProbe implements PlatformProbe {

    private final List<Volume> volumes = new ArrayList<>();
    private IOException volumeFailure;
    private final List<ProcessInfo> processes = new ArrayList<>();
    private final Map<RegistryHive, Map<String, Map<String, String>>> registry = new HashMap<>();
    private final Set<String> protectedRegistryValues = new HashSet<>();
    private final List<Path> taskFiles = new ArrayList<>();
    private final List<BrowserExtensionRoot> browserRoots = new ArrayList<>();
    private final Map<Path, Set<FileFlag>> flagOverrides = new HashMap<>();
    private final Map<Path, Instant> creationOverrides = new HashMap<>();
    private final Set<Path> accessDenied = new HashSet<>();
    private final Set<Path> elevationFails = new HashSet<>();
    private final Map<String, Boolean> services = new HashMap<>();
    private Consumer<Path> metadataHook = path -> { };

    public final List<Path> deleteCalls = new ArrayList<>();
    public final List<Path> elevateCalls = new ArrayList<>();
    public final List<Long> killedPids = new ArrayList<>();
    public final List<String> disabledServices = new ArrayList<>();
    public final List<String> stoppedServices = new ArrayList<>();

    public FakePlatformProbe withVolume(Path root) {
        volumes.add(Volume.of(root));
        return this;
    }

    public FakePlatformProbe failVolumes(IOException failure) {
        this.volumeFailure = failure;
        return this;
    }

    public FakePlatformProbe withProcess(long pid, String name, String path) {
        processes.add(new ProcessInfo(pid, name, path));
        return this;
    }

    public FakePlatformProbe withRegistryValue(RegistryHive hive, String keyPath, String name, String value) {
        registry.computeIfAbsent(hive, h -> new HashMap<>())
            .computeIfAbsent(keyPath.toLowerCase(Locale.ROOT), k -> new LinkedHashMap<>())
            .put(name, value);
        return this;
    }

    /**
     * Значение, удаление которого отклоняется с AccessDeniedException
     */
    public FakePlatformProbe protectRegistryValue(RegistryHive hive, String keyPath, String name) {
        protectedRegistryValues.add(registryId(hive, keyPath, name));
        return this;
    }

    public FakePlatformProbe withTaskFile(Path file) {
        taskFiles.add(file);
        return this;
    }

    public FakePlatformProbe withBrowserRoot(String browser, Path path, boolean profileContainer) {
        browserRoots.add(new BrowserExtensionRoot(browser, path, profileContainer));
        return this;
    }

    public FakePlatformProbe withFlags(Path path, FileFlag... flags) {
        Set<FileFlag> set = EnumSet.noneOf(FileFlag.class);
        set.addAll(List.of(flags));
        flagOverrides.put(path, set);
        return this;
    }

    public FakePlatformProbe withCreationTime(Path path, Instant created) {
        creationOverrides.put(path, created);
        return this;
    }

    public FakePlatformProbe denyAccess(Path path) {
        accessDenied.add(path);
        return this;
    }

    public FakePlatformProbe failElevation(Path path) {
        elevationFails.add(path);
        return this;
    }

    public FakePlatformProbe withService(String name) {
        services.put(name.toLowerCase(Locale.ROOT), true);
        return this;
    }

    public FakePlatformProbe onReadMetadata(Consumer<Path> hook) {
        this.metadataHook = hook;
        return this;
    }

    public Optional<String> registryValue(RegistryHive hive, String keyPath, String name) {
        return Optional.ofNullable(registry.getOrDefault(hive, Map.of())
            .getOrDefault(keyPath.toLowerCase(Locale.ROOT), Map.of())
            .get(name));
    }

    public Set<FileFlag> flagsOf(Path path) {
        return flagOverrides.getOrDefault(path, EnumSet.noneOf(FileFlag.class));
    }

    @Override
    public List<Volume> listFixedVolumes() throws IOException {
        if (volumeFailure != null) {
            throw volumeFailure;
        }
        return List.copyOf(volumes);
    }

    @Override
    public List<ProcessInfo> listProcesses() {
        return List.copyOf(processes);
    }

    @Override
    public boolean killProcess(long pid) {
        boolean existed = processes.removeIf(p -> p.getPid() == pid);
        if (existed) {
            killedPids.add(pid);
        }
        return existed;
    }

    @Override
    public Optional<String> readRegistryValue(RegistryHive hive, String keyPath, String valueName) {
        return registryValue(hive, keyPath, valueName);
    }

    @Override
    public boolean deleteRegistryValue(RegistryHive hive, String keyPath, String valueName) throws IOException {
        Map<String, String> values = registry.getOrDefault(hive, Map.of()).get(keyPath.toLowerCase(Locale.ROOT));
        if (values == null || !values.containsKey(valueName)) {
            return false;
        }
        if (protectedRegistryValues.contains(registryId(hive, keyPath, valueName))) {
            throw new AccessDeniedException(hive + "\\" + keyPath + "\\" + valueName);
        }
        values.remove(valueName);
        return true;
    }

    @Override
    public List<String> listRegistryValueNames(RegistryHive hive, String keyPath) {
        Map<String, String> values = registry.getOrDefault(hive, Map.of()).get(keyPath.toLowerCase(Locale.ROOT));
        return values == null ? List.of() : List.copyOf(values.keySet());
    }

    @Override
    public List<Path> listScheduledTaskFiles() {
        return List.copyOf(taskFiles);
    }

    @Override
    public List<BrowserExtensionRoot> listBrowserExtensionRoots() {
        return List.copyOf(browserRoots);
    }

    @Override
    public FileMetadata readMetadata(Path path) throws IOException {
        metadataHook.accept(path);
        long size = Files.size(path);
        return new FileMetadata(size,
            creationOverrides.getOrDefault(path, Instant.EPOCH),
            flagsOf(path));
    }

    @Override
    public void setFileFlags(Path path, Set<FileFlag> flags) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString());
        }
        if (accessDenied.contains(path)) {
            throw new AccessDeniedException(path.toString());
        }
        Set<FileFlag> copy = EnumSet.noneOf(FileFlag.class);
        copy.addAll(flags);
        flagOverrides.put(path, copy);
    }

    @Override
    public void deleteFile(Path path) throws IOException {
        deleteCalls.add(path);
        if (accessDenied.contains(path)) {
            throw new AccessDeniedException(path.toString());
        }
        Files.delete(path);
    }

    @Override
    public String computeFileHash(Path path) throws IOException {
        return FileHashing.sha256Hex(path);
    }

    @Override
    public void elevateAndRetry(Path path, FileOperation operation) throws IOException {
        elevateCalls.add(path);
        if (elevationFails.contains(path)) {
            throw new AccessDeniedException(path.toString(), null, "takeown завершился с ошибкой");
        }
        accessDenied.remove(path);
        operation.run(path);
    }

    @Override
    public ServiceControlResult disableAndStopService(String serviceName) {
        String key = serviceName.toLowerCase(Locale.ROOT);
        if (!services.containsKey(key)) {
            return ServiceControlResult.missing(serviceName);
        }
        disabledServices.add(key);
        boolean wasRunning = services.put(key, false);
        if (wasRunning) {
            stoppedServices.add(key);
        }
        return new ServiceControlResult(true, true, true, "Служба " + serviceName + " отключена");
    }

    private static String registryId(RegistryHive hive, String keyPath, String name) {
        return hive + "\\" + keyPath.toLowerCase(Locale.ROOT) + "\\" + name;
    }
}
