package com.vtb.threatscan.platform;

import lombok.Value;

import java.nio.file.Path;

/**
 * Каталог хранилища расширений браузера
 */
@Value
public class BrowserExtensionRoot {
    String browser;
    Path path;
    /**
     * true - path содержит каталоги профилей, расширения лежат в {@code <profile>/extensions}
     * (браузеры на движке Gecko)
     */
    boolean profileContainer;
}
