package com.vtb.threatscan.remediation;

import com.vtb.threatscan.config.ScannerConfig;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Системные каталоги Windows, которые принадлежат TrustedInstaller.
 * Файлы под ними не удаляются и не помещаются в карантин.
 *
 * Путь сравнивается после приведения к каноническому виду: без префиксов
 * {@code \\?\} и {@code \\.\}, без повторных разделителей и сегментов {@code .} и {@code ..}.
 * Префикс совпадает только целиком по границе сегмента.
 */
public class ProtectedPathGuard {

    private static final char SEPARATOR = '\\';

    private final List<String> protectedPrefixes;
    private final List<String> markers;

    public ProtectedPathGuard(ScannerConfig.Remediation settings) {
        this.protectedPrefixes = settings.getProtectedPaths().stream()
            .map(ProtectedPathGuard::canonicalize)
            .filter(p -> !p.isEmpty())
            .collect(Collectors.toList());
        this.markers = settings.getProtectedPathMarkers().stream()
            .map(m -> m.trim().toLowerCase(Locale.ROOT))
            .filter(m -> !m.isEmpty())
            .collect(Collectors.toList());
    }

    public boolean isProtected(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String canonical = canonicalize(path);
        for (String prefix : protectedPrefixes) {
            if (canonical.equals(prefix) || canonical.startsWith(prefix + SEPARATOR)) {
                return true;
            }
        }
        for (String marker : markers) {
            if (canonical.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Windows-путь в нижнем регистре с обратными слешами и разрешёнными {@code .}/{@code ..}
     */
    static String canonicalize(String path) {
        String value = path.trim().replace('/', SEPARATOR).toLowerCase(Locale.ROOT);

        boolean unc = false;
        if (value.startsWith("\\\\?\\unc\\")) {
            value = value.substring("\\\\?\\unc\\".length());
            unc = true;
        } else if (value.startsWith("\\\\?\\") || value.startsWith("\\\\.\\")) {
            value = value.substring(4);
        } else if (value.startsWith("\\\\")) {
            unc = true;
        }

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : value.split("\\\\")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                // корень диска не поднимается выше себя
                if (!segments.isEmpty() && !isDriveRoot(segments.peekLast(), segments.size())) {
                    segments.removeLast();
                }
                continue;
            }
            segments.addLast(segment);
        }

        String joined = String.join(String.valueOf(SEPARATOR), segments);
        return unc ? "\\\\" + joined : joined;
    }

    private static boolean isDriveRoot(String segment, int depth) {
        return depth == 1 && segment.length() == 2 && segment.charAt(1) == ':';
    }
}
