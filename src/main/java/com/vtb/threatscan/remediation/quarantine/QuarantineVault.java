package com.vtb.threatscan.remediation.quarantine;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.platform.FileOperation;
import com.vtb.threatscan.util.FileHashing;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Карантин: файл угрозы переносится в служебный каталог в обфусцированном виде
 * (XOR с ключом от имени машины и пользователя), сведения хранятся в index.json.
 *
 * Обфускация лишь исключает случайный запуск файла и не является защитой.
 */
@Slf4j
public class QuarantineVault {

    static final String INDEX_FILE = "index.json";
    static final String QUARANTINE_SUFFIX = ".qtn";
    private static final int BUFFER_SIZE = 8192;

    private final Path directory;
    private final long maxFileSizeBytes;
    private final byte[] key;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final List<QuarantinedItem> items = new ArrayList<>();

    public QuarantineVault(Path directory, long maxFileSizeBytes, byte[] key, Clock clock) throws IOException {
        this.directory = directory;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.key = key.clone();
        this.clock = clock;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        Files.createDirectories(directory);
        loadIndex();
    }

    /**
     * Карантин из конфигурации с ключом текущей машины и пользователя
     */
    public static QuarantineVault open(ScannerConfig.Quarantine settings) throws IOException {
        return new QuarantineVault(Path.of(settings.getDirectory()), settings.getMaxFileSizeBytes(),
            machineKey(), Clock.systemDefaultZone());
    }

    /**
     * SHA-256 от имени машины и имени пользователя
     */
    public static byte[] machineKey() {
        String machine;
        try {
            machine = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("Имя хоста недоступно: {}", e.getMessage());
            machine = Optional.ofNullable(System.getenv("COMPUTERNAME"))
                .orElse(Optional.ofNullable(System.getenv("HOSTNAME")).orElse("localhost"));
        }
        return deriveKey(machine, System.getProperty("user.name", ""));
    }

    static byte[] deriveKey(String machine, String user) {
        return HexFormat.of().parseHex(
            FileHashing.sha256Hex((machine + user).getBytes(StandardCharsets.UTF_8)));
    }

    public QuarantinedItem quarantine(Path file, Threat threat) throws IOException {
        return quarantine(file, threat, Files::delete);
    }

    /**
     * Поместить файл в карантин
     *
     * @param removeOriginal удаление исходного файла после копирования; при ошибке
     *                       копия в карантине удаляется, а исходный файл остаётся на месте
     */
    public synchronized QuarantinedItem quarantine(Path file, Threat threat, FileOperation removeOriginal)
            throws IOException {
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new NoSuchFileException(file.toString());
        }
        String original = file.toAbsolutePath().toString();
        boolean alreadyActive = items.stream()
            .anyMatch(i -> i.getStatus() == QuarantineStatus.ACTIVE && i.getOriginalPath().equalsIgnoreCase(original));
        if (alreadyActive) {
            throw new QuarantineException("Файл уже находится в карантине");
        }
        long size = Files.size(file);
        if (size > maxFileSizeBytes) {
            throw new QuarantineException("Файл слишком большой для карантина (максимум "
                + maxFileSizeBytes / (1024 * 1024) + " МБ). Удалите его вместо карантина.");
        }
        if (isLocked(file)) {
            throw new QuarantineException("Файл используется другой программой. Закройте её и повторите.");
        }

        String hash = FileHashing.sha256Hex(file);
        String id = UUID.randomUUID().toString();
        Path target = directory.resolve(id + QUARANTINE_SUFFIX);
        log.info("Карантин: {} -> {}", original, target);
        try {
            xorCopy(file, target);
            removeOriginal.run(file);
        } catch (IOException | RuntimeException e) {
            discard(target, e);
            throw e;
        }

        QuarantinedItem item = QuarantinedItem.builder()
            .id(id)
            .originalPath(original)
            .quarantinePath(target.toString())
            .fileHash(hash)
            .fileSizeBytes(size)
            .quarantinedAt(clock.instant())
            .threatCategory(threat.getCategory())
            .severity(threat.getSeverity())
            .threatName(threat.getName())
            .status(QuarantineStatus.ACTIVE)
            .build();
        items.add(item);
        saveIndex();
        return item;
    }

    public synchronized List<QuarantinedItem> listActive() {
        return items.stream()
            .filter(i -> i.getStatus() == QuarantineStatus.ACTIVE)
            .collect(Collectors.toList());
    }

    public synchronized List<QuarantinedItem> listAll() {
        return List.copyOf(items);
    }

    public synchronized Optional<QuarantinedItem> find(String id) {
        return items.stream().filter(i -> i.getId().equals(id)).findFirst();
    }

    /**
     * Вернуть файл на исходное место. Существующий файл по этому пути не перезаписывается.
     */
    public synchronized QuarantinedItem restore(String id) throws IOException {
        QuarantinedItem item = find(id)
            .orElseThrow(() -> new QuarantineException("Запись карантина не найдена: " + id));
        if (item.getStatus() != QuarantineStatus.ACTIVE) {
            throw new QuarantineException("Запись не активна в карантине: " + id);
        }
        Path stored = Path.of(item.getQuarantinePath());
        Path original = Path.of(item.getOriginalPath());
        if (!Files.exists(stored)) {
            item.setStatus(QuarantineStatus.DELETED);
            item.setDeletedAt(clock.instant());
            saveIndex();
            throw new QuarantineException("Файл карантина отсутствует - восстановление невозможно");
        }
        if (Files.exists(original, LinkOption.NOFOLLOW_LINKS)) {
            throw new QuarantineException("По исходному пути уже есть файл: " + original);
        }

        log.info("Восстановление: {} -> {}", stored, original);
        Path parent = original.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        xorCopy(stored, original);
        Files.delete(stored);
        item.setStatus(QuarantineStatus.RESTORED);
        item.setRestoredAt(clock.instant());
        saveIndex();
        return item;
    }

    /**
     * Перезаписать содержимое случайными данными и удалить файл карантина
     */
    public synchronized QuarantinedItem deletePermanently(String id) throws IOException {
        QuarantinedItem item = find(id)
            .orElseThrow(() -> new QuarantineException("Запись карантина не найдена: " + id));
        Path stored = Path.of(item.getQuarantinePath());
        if (Files.exists(stored)) {
            overwrite(stored);
            Files.delete(stored);
        } else {
            log.info("Файл карантина уже отсутствует: {}", stored);
        }
        item.setStatus(QuarantineStatus.DELETED);
        item.setDeletedAt(clock.instant());
        saveIndex();
        return item;
    }

    /**
     * Убрать из индекса восстановленные и удалённые записи старше заданного числа дней
     *
     * @return сколько записей удалено
     */
    public synchronized int cleanup(int daysOld) throws IOException {
        Instant cutoff = clock.instant().minus(Duration.ofDays(daysOld));
        int before = items.size();
        items.removeIf(i ->
            (i.getStatus() == QuarantineStatus.DELETED && isBefore(i.getDeletedAt(), cutoff))
                || (i.getStatus() == QuarantineStatus.RESTORED && isBefore(i.getRestoredAt(), cutoff)));
        int removed = before - items.size();
        if (removed > 0) {
            log.info("Очищено записей карантина: {}", removed);
            saveIndex();
        }
        return removed;
    }

    public Path getDirectory() {
        return directory;
    }

    private static boolean isBefore(Instant moment, Instant cutoff) {
        return moment != null && moment.isBefore(cutoff);
    }

    private void xorCopy(Path source, Path target) throws IOException {
        byte[] buffer = new byte[BUFFER_SIZE];
        long position = 0;
        try (InputStream in = Files.newInputStream(source);
             OutputStream out = Files.newOutputStream(target,
                 StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                for (int i = 0; i < read; i++) {
                    buffer[i] ^= key[(int) ((position + i) % key.length)];
                }
                out.write(buffer, 0, read);
                position += read;
            }
        }
    }

    private static void discard(Path target, Exception cause) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            log.warn("Не удалось удалить неполную копию {}: {}", target, e.getMessage());
            cause.addSuppressed(e);
        }
    }

    private static void overwrite(Path file) throws IOException {
        long length = Files.size(file);
        SecureRandom random = new SecureRandom();
        byte[] buffer = new byte[BUFFER_SIZE];
        try (OutputStream out = Files.newOutputStream(file, StandardOpenOption.WRITE)) {
            long written = 0;
            while (written < length) {
                random.nextBytes(buffer);
                int chunk = (int) Math.min(buffer.length, length - written);
                out.write(buffer, 0, chunk);
                written += chunk;
            }
        }
    }

    private static boolean isLocked(Path file) throws IOException {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            FileLock lock = channel.tryLock();
            if (lock == null) {
                return true;
            }
            lock.release();
            return false;
        } catch (AccessDeniedException e) {
            throw e;
        } catch (OverlappingFileLockException e) {
            return true;
        } catch (IOException e) {
            log.debug("Файл занят {}: {}", file, e.getMessage());
            return true;
        }
    }

    private void loadIndex() {
        Path index = directory.resolve(INDEX_FILE);
        if (!Files.exists(index)) {
            return;
        }
        try {
            List<QuarantinedItem> loaded = objectMapper.readValue(index.toFile(),
                new TypeReference<List<QuarantinedItem>>() { });
            if (loaded != null) {
                items.addAll(loaded);
            }
            log.info("Загружено записей карантина: {}", items.size());
        } catch (IOException e) {
            log.error("Индекс карантина повреждён, начинаем с пустого: {}", e.getMessage());
        }
    }

    private void saveIndex() throws IOException {
        objectMapper.writeValue(directory.resolve(INDEX_FILE).toFile(), items);
    }
}
