package com.vtb.threatscan.platform;

import java.util.Locale;
import java.util.Optional;

/**
 * Кусты реестра, с которыми работает сканер
 */
public enum RegistryHive {
    HKCU("HKEY_CURRENT_USER"),
    HKLM("HKEY_LOCAL_MACHINE");

    private final String fullName;

    RegistryHive(String fullName) {
        this.fullName = fullName;
    }

    public String getFullName() {
        return fullName;
    }

    /**
     * Распознать куст по сокращённому или полному имени
     */
    public static Optional<RegistryHive> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String upper = text.trim().toUpperCase(Locale.ROOT);
        for (RegistryHive hive : values()) {
            if (hive.name().equals(upper) || hive.fullName.equals(upper)) {
                return Optional.of(hive);
            }
        }
        return Optional.empty();
    }
}
