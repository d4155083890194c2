package com.vtb.threatscan.remediation;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.models.RemovalResult;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.platform.FileFlag;
import com.vtb.threatscan.platform.PlatformProbe;
import com.vtb.threatscan.platform.ProcessInfo;
import com.vtb.threatscan.platform.RegistryHive;
import com.vtb.threatscan.platform.RegistryLocation;
import com.vtb.threatscan.platform.ServiceControlResult;
import com.vtb.threatscan.remediation.quarantine.QuarantineVault;
import com.vtb.threatscan.remediation.quarantine.QuarantinedItem;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Удаление найденных угроз по категориям.
 *
 * Каждый вызов - одна попытка без автоматических повторов. Отсутствующая цель считается
 * успешно удалённой. Исключения наружу не выходят: любая ошибка платформы
 * превращается в {@link RemovalResult#failure(String)}.
 */
@Slf4j
public class RemediationEngine {

    private final PlatformProbe probe;
    private final ProtectedPathGuard guard;
    private final QuarantineVault vault;

    public RemediationEngine(PlatformProbe probe, ScannerConfig config, QuarantineVault vault) {
        this.probe = probe;
        this.guard = new ProtectedPathGuard(config.getRemediation());
        this.vault = vault;
    }

    public RemediationEngine(PlatformProbe probe, ScannerConfig config) {
        this(probe, config, null);
    }

    public RemovalResult remove(Threat threat) {
        if (threat == null) {
            log.warn("Удаление отклонено: угроза не указана");
            return RemovalResult.failure("Угроза не указана");
        }
        log.info("Удаление угрозы: {} - {} ({})", threat.getCategory(), threat.getName(), threat.getLocation());
        // путь под системным каталогом не трогается ни в одной категории
        if (guard.isProtected(threat.getLocation())) {
            log.info("Защищённый системный путь, удаление пропущено: {}", threat.getLocation());
            return RemovalResult.protectedSystem(
                "Защищённый компонент Windows - требует TrustedInstaller (можно игнорировать)");
        }
        RemovalResult result;
        try {
            result = switch (threat.getCategory()) {
                case PROCESS -> killProcess(threat);
                case FILE -> deleteFile(threat);
                case STARTUP, REGISTRY -> removeRegistryValue(threat);
                case SCHEDULED_TASK -> disableService(threat);
                case BROWSER_EXTENSION -> RemovalResult.failure(
                    "Расширения браузера не удаляются автоматически: закройте браузер и удалите расширение "
                        + "на странице управления расширениями");
                case NETWORK -> RemovalResult.failure("Удаление для категории " + threat.getCategory() + " не поддерживается");
            };
        } catch (RuntimeException e) {
            log.warn("Ошибка удаления {}: {}", threat.getLocation(), e.getMessage(), e);
            result = RemovalResult.failure("Ошибка: " + e.getMessage());
        }
        log.info("Результат удаления: {} - {}", result.isSuccess(), result.getMessage());
        return result;
    }

    /**
     * Переместить файл угрозы в карантин вместо удаления
     */
    public RemovalResult quarantine(Threat threat) {
        if (vault == null) {
            return RemovalResult.failure("Карантин не настроен");
        }
        if (threat == null || threat.getCategory() != ThreatCategory.FILE) {
            return RemovalResult.failure("В карантин помещаются только файлы");
        }
        if (guard.isProtected(threat.getLocation())) {
            return RemovalResult.protectedSystem("Защищённый компонент Windows - можно игнорировать");
        }
        try {
            Path path = Path.of(threat.getLocation());
            // read-only файл иначе не открыть на запись при проверке блокировки
            probe.setFileFlags(path, EnumSet.noneOf(FileFlag.class));
            QuarantinedItem item = vault.quarantine(path, threat, probe::deleteFile);
            return RemovalResult.success("Помещён в карантин: " + fileName(item.getOriginalPath()));
        } catch (NoSuchFileException e) {
            return RemovalResult.failure("Файл не найден - возможно, он уже перемещён или удалён");
        } catch (AccessDeniedException e) {
            return RemovalResult.failure("Доступ запрещён. Запустите от имени администратора.");
        } catch (IOException | InvalidPathException e) {
            log.warn("Ошибка карантина {}: {}", threat.getLocation(), e.getMessage());
            return RemovalResult.failure("Не удалось поместить в карантин: " + e.getMessage());
        }
    }

    private RemovalResult killProcess(Threat threat) {
        if (threat.getProcessId() != null) {
            long pid = threat.getProcessId();
            try {
                if (probe.killProcess(pid)) {
                    return RemovalResult.success("Процесс " + threat.getName() + " (PID " + pid + ") завершён");
                }
                return RemovalResult.success("Процесс уже завершён");
            } catch (IOException e) {
                return RemovalResult.failure("Не удалось завершить процесс: " + e.getMessage());
            }
        }

        String baseName = ProcessInfo.stripExtension(
            threat.getDetails() != null && !threat.getDetails().isBlank() ? threat.getDetails() : threat.getName());
        List<ProcessInfo> targets = probe.listProcesses().stream()
            .filter(p -> p.baseName().equals(baseName))
            .collect(Collectors.toList());
        if (targets.isEmpty()) {
            return RemovalResult.success("Процесс уже завершён");
        }

        int killed = 0;
        int failed = 0;
        for (ProcessInfo target : targets) {
            try {
                if (probe.killProcess(target.getPid())) {
                    killed++;
                }
            } catch (IOException e) {
                log.debug("Не удалось завершить PID {}: {}", target.getPid(), e.getMessage());
                failed++;
            }
        }
        if (failed > 0) {
            return RemovalResult.failure("Завершено процессов: " + killed + ", не удалось: " + failed);
        }
        return RemovalResult.success("Завершено процессов: " + killed);
    }

    private RemovalResult deleteFile(Threat threat) {
        String location = threat.getLocation();
        Path path;
        try {
            path = Path.of(location);
        } catch (InvalidPathException e) {
            return RemovalResult.failure("Некорректный путь: " + location);
        }

        try {
            clearFlagsAndDelete(path);
            return RemovalResult.success("Удалён: " + fileName(location));
        } catch (NoSuchFileException e) {
            return RemovalResult.success("Файл уже удалён");
        } catch (AccessDeniedException e) {
            return forceDelete(path);
        } catch (IOException e) {
            return RemovalResult.failure("Не удалось удалить: " + e.getMessage());
        }
    }

    private RemovalResult forceDelete(Path path) {
        log.info("Доступ запрещён, получение прав на {}", path);
        try {
            probe.elevateAndRetry(path, this::clearFlagsAndDelete);
            return RemovalResult.success("Удалён после получения прав: " + fileName(path.toString()));
        } catch (NoSuchFileException e) {
            return RemovalResult.success("Файл уже удалён");
        } catch (IOException e) {
            return RemovalResult.failure(
                "Файл защищён Windows - может потребоваться ручное удаление или это системный компонент");
        }
    }

    private void clearFlagsAndDelete(Path path) throws IOException {
        probe.setFileFlags(path, EnumSet.noneOf(FileFlag.class));
        probe.deleteFile(path);
    }

    /**
     * Куст в исходной записи мог не сохраниться, поэтому значение удаляется из обоих
     */
    private RemovalResult removeRegistryValue(Threat threat) {
        Optional<RegistryLocation> parsed = RegistryLocation.parseValue(threat.getLocation());
        if (parsed.isEmpty()) {
            return RemovalResult.failure("Некорректный путь реестра: " + threat.getLocation());
        }
        RegistryLocation location = parsed.get();
        String valueName = location.getValueName();

        boolean removed = false;
        for (RegistryHive hive : RegistryHive.values()) {
            try {
                removed |= probe.deleteRegistryValue(hive, location.getKeyPath(), valueName);
            } catch (IOException e) {
                log.debug("Не удалось удалить {}\\{}: {}", hive, location.getKeyPath(), e.getMessage());
            }
        }

        for (RegistryHive hive : RegistryHive.values()) {
            try {
                if (probe.readRegistryValue(hive, location.getKeyPath(), valueName).isPresent()) {
                    return RemovalResult.failure("Не удалось удалить значение реестра " + valueName
                        + " из " + hive + ": доступ запрещён");
                }
            } catch (IOException e) {
                return RemovalResult.failure("Не удалось проверить значение реестра: " + e.getMessage());
            }
        }
        return removed
            ? RemovalResult.success("Удалено значение реестра: " + valueName)
            : RemovalResult.success("Значение реестра уже отсутствует: " + valueName);
    }

    private RemovalResult disableService(Threat threat) {
        String serviceName = ProcessInfo.stripExtension(fileName(threat.getLocation()));
        if (serviceName.isEmpty()) {
            return RemovalResult.failure("Не удалось определить имя службы: " + threat.getLocation());
        }
        try {
            ServiceControlResult result = probe.disableAndStopService(serviceName);
            if (!result.isServiceExists()) {
                return RemovalResult.success("Служба " + serviceName + " уже отсутствует");
            }
            if (result.isDisabled()) {
                return RemovalResult.success("Служба " + serviceName + " отключена"
                    + (result.isStopped() ? " и остановлена" : ""));
            }
            return RemovalResult.failure("Не удалось отключить службу " + serviceName + ": " + result.getMessage());
        } catch (IOException e) {
            return RemovalResult.failure("Не удалось отключить службу: " + e.getMessage());
        }
    }

    private static String fileName(String location) {
        if (location == null) {
            return "";
        }
        String normalized = location.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        return slash >= 0 ? normalized.substring(slash + 1) : normalized;
    }
}
