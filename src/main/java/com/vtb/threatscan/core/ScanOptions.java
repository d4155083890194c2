package com.vtb.threatscan.core;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Параметры запуска: корни пользовательского сканирования и включённые фазы.
 * Пустой список корней - все локальные тома.
 */
@Value
@Builder
public class ScanOptions {
    @Builder.Default
    List<Path> roots = List.of();
    @Builder.Default
    boolean processes = true;
    @Builder.Default
    boolean startup = true;
    @Builder.Default
    boolean browserExtensions = true;
    @Builder.Default
    boolean fileSystem = true;
    @Builder.Default
    boolean registry = true;
    @Builder.Default
    boolean scheduledTasks = true;

    public static ScanOptions fullScan() {
        return builder().build();
    }

    public boolean isCustomRoots() {
        return roots != null && !roots.isEmpty();
    }
}
