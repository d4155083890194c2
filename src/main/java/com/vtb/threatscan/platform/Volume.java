package com.vtb.threatscan.platform;

import lombok.Value;

import java.nio.file.Path;
import java.util.Set;

/**
 * Готовый локальный том (или корень пользовательского сканирования)
 */
@Value
public class Volume {
    Path root;
    String label;
    /** Каталоги внутри тома, в которые обход не заходит (псевдо-ФС и т.п.) */
    Set<Path> excludedPaths;

    public static Volume of(Path root) {
        return new Volume(root, root.toString(), Set.of());
    }
}
