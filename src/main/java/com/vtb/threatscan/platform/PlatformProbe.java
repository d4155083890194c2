package com.vtb.threatscan.platform;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Доступ к примитивам ОС: процессы, реестр, службы, атрибуты файлов.
 *
 * Отсутствие цели сообщается через {@link java.nio.file.NoSuchFileException},
 * пустой результат или {@code false}; нехватка прав - через
 * {@link java.nio.file.AccessDeniedException}.
 */
public interface PlatformProbe {

    /**
     * Готовые несъёмные локальные тома
     *
     * @throws IOException если нельзя перечислить ни одного тома
     */
    List<Volume> listFixedVolumes() throws IOException;

    List<ProcessInfo> listProcesses();

    /**
     * Завершить процесс
     *
     * @return false, если процесса с таким pid уже нет
     */
    boolean killProcess(long pid) throws IOException;

    Optional<String> readRegistryValue(RegistryHive hive, String keyPath, String valueName) throws IOException;

    /**
     * @return false, если значения не было
     */
    boolean deleteRegistryValue(RegistryHive hive, String keyPath, String valueName) throws IOException;

    /**
     * Имена значений ключа; пустой список, если ключа нет
     */
    List<String> listRegistryValueNames(RegistryHive hive, String keyPath) throws IOException;

    /**
     * Файлы определений задач из хранилища планировщика
     */
    List<Path> listScheduledTaskFiles() throws IOException;

    List<BrowserExtensionRoot> listBrowserExtensionRoots();

    FileMetadata readMetadata(Path path) throws IOException;

    /**
     * Установить ровно указанный набор атрибутов (пустой набор снимает read-only/hidden/system)
     */
    void setFileFlags(Path path, Set<FileFlag> flags) throws IOException;

    void deleteFile(Path path) throws IOException;

    /**
     * SHA-256 содержимого файла, hex в нижнем регистре
     */
    String computeFileHash(Path path) throws IOException;

    /**
     * Забрать владение файлом, выдать администраторам полный доступ и повторить операцию
     */
    void elevateAndRetry(Path path, FileOperation operation) throws IOException;

    /**
     * Отключить автозапуск службы и остановить её; обе операции выполняются независимо
     */
    ServiceControlResult disableAndStopService(String serviceName) throws IOException;
}
