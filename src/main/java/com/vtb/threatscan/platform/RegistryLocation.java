package com.vtb.threatscan.platform;

import lombok.Value;

import java.util.Arrays;
import java.util.Optional;

/**
 * Разобранный путь реестра: куст (может отсутствовать), путь ключа и имя значения.
 * Формат: {@code HKCU\SOFTWARE\...\Run\ValueName} или без префикса куста.
 */
@Value
public class RegistryLocation {
    /** null, если в строке не было префикса куста */
    RegistryHive hive;
    String keyPath;
    /** null для ссылки на ключ целиком */
    String valueName;

    /**
     * Разобрать строку вида "HIVE\key\path" как ключ (без имени значения)
     */
    public static Optional<RegistryLocation> parseKey(String text) {
        String[] parts = split(text);
        if (parts.length == 0) {
            return Optional.empty();
        }
        Optional<RegistryHive> hive = RegistryHive.parse(parts[0]);
        int from = hive.isPresent() ? 1 : 0;
        if (parts.length <= from) {
            return Optional.empty();
        }
        return Optional.of(new RegistryLocation(hive.orElse(null), join(parts, from, parts.length), null));
    }

    /**
     * Разобрать строку вида "HIVE\key\path\valueName": последний сегмент - имя значения
     */
    public static Optional<RegistryLocation> parseValue(String text) {
        String[] parts = split(text);
        Optional<RegistryHive> hive = parts.length > 0 ? RegistryHive.parse(parts[0]) : Optional.empty();
        int from = hive.isPresent() ? 1 : 0;
        if (parts.length - from < 2) {
            return Optional.empty();
        }
        return Optional.of(new RegistryLocation(
            hive.orElse(null),
            join(parts, from, parts.length - 1),
            parts[parts.length - 1]));
    }

    public Optional<RegistryHive> hive() {
        return Optional.ofNullable(hive);
    }

    /**
     * Строка для отображения и для поля location угрозы
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        if (hive != null) {
            sb.append(hive.name()).append('\\');
        }
        sb.append(keyPath);
        if (valueName != null) {
            sb.append('\\').append(valueName);
        }
        return sb.toString();
    }

    public RegistryLocation withValue(String name) {
        return new RegistryLocation(hive, keyPath, name);
    }

    private static String[] split(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return Arrays.stream(text.trim().replace('/', '\\').split("\\\\"))
            .filter(part -> !part.isEmpty())
            .toArray(String[]::new);
    }

    private static String join(String[] parts, int from, int to) {
        return String.join("\\", Arrays.copyOfRange(parts, from, to));
    }
}
