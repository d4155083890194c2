package com.vtb.threatscan.signatures;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.vtb.threatscan.models.Severity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Загрузка базы сигнатур из YAML.
 * Порядок записей в файле сохраняется - он определяет приоритет совпадений.
 */
@Slf4j
public class SignatureLoader {

    public static final String DEFAULT_RESOURCE = "signatures.yaml";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    /**
     * Встроенная база из classpath
     */
    public SignatureStore loadDefault() {
        try (InputStream is = SignatureLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new SignatureLoadException(DEFAULT_RESOURCE + " не найден в classpath");
            }
            return load(is, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new SignatureLoadException("Ошибка чтения " + DEFAULT_RESOURCE + ": " + e.getMessage(), e);
        }
    }

    public SignatureStore load(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is, path.toString());
        } catch (IOException e) {
            throw new SignatureLoadException("Ошибка чтения определений " + path + ": " + e.getMessage(), e);
        }
    }

    SignatureStore load(InputStream is, String source) throws IOException {
        SignatureDefinitions definitions = mapper.readValue(is, SignatureDefinitions.class);
        if (definitions == null) {
            throw new SignatureLoadException("Пустой файл определений: " + source);
        }
        SignatureStore store = toStore(definitions);
        log.info("Загружено {} сигнатур из {} (версия {})",
            store.size(), source, definitions.getVersion() != null ? definitions.getVersion() : "n/a");
        return store;
    }

    public static SignatureStore toStore(SignatureDefinitions definitions) {
        SignatureStore.Builder builder = SignatureStore.builder();
        for (SignatureDefinitions.NameEntry entry : nullSafe(definitions.getProcesses())) {
            builder.process(entry.getPattern(), orDefault(entry.getSeverity(), Severity.CRITICAL), entry.getDescription());
        }
        for (SignatureDefinitions.NameEntry entry : nullSafe(definitions.getFileNames())) {
            builder.fileName(entry.getPattern(), orDefault(entry.getSeverity(), Severity.MEDIUM), entry.getDescription());
        }
        for (SignatureDefinitions.NameEntry entry : nullSafe(definitions.getRegistryValues())) {
            builder.registryValue(entry.getPattern(), orDefault(entry.getSeverity(), Severity.HIGH), entry.getDescription());
        }
        for (String marker : nullSafe(definitions.getAdwareMarkers())) {
            builder.adwareMarker(marker);
        }
        for (SignatureDefinitions.HashEntry entry : nullSafe(definitions.getHashes())) {
            builder.hash(entry.getSha256(), entry.getDescription());
        }
        return builder.build();
    }

    private static <T> List<T> nullSafe(List<T> list) {
        return list != null ? list : List.of();
    }

    private static Severity orDefault(Severity severity, Severity fallback) {
        return severity != null ? severity : fallback;
    }
}
