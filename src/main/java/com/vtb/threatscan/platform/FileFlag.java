package com.vtb.threatscan.platform;

/**
 * Атрибуты файла, значимые для сканирования и удаления
 */
public enum FileFlag {
    READ_ONLY,
    HIDDEN,
    SYSTEM,
    ARCHIVE
}
