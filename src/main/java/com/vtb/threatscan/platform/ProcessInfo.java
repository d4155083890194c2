package com.vtb.threatscan.platform;

import lombok.Value;

import java.util.Locale;

/**
 * Снимок запущенного процесса
 */
@Value
public class ProcessInfo {
    long pid;
    /** Имя образа, например "xmrig.exe" */
    String name;
    /** Полный путь к исполняемому файлу, если удалось определить */
    String executablePath;

    /**
     * Имя без расширения в нижнем регистре: "XMRig.exe" -> "xmrig"
     */
    public String baseName() {
        return stripExtension(name);
    }

    public static String stripExtension(String name) {
        if (name == null) {
            return "";
        }
        String lower = name.trim().toLowerCase(Locale.ROOT);
        int dot = lower.lastIndexOf('.');
        return dot > 0 ? lower.substring(0, dot) : lower;
    }
}
