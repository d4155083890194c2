package com.vtb.threatscan.platform;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Файловая операция, которую можно повторить после повышения прав
 */
@FunctionalInterface
public interface FileOperation {
    void run(Path path) throws IOException;
}
