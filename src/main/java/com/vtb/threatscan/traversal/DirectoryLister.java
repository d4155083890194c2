package com.vtb.threatscan.traversal;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Чтение содержимого каталога для обхода.
 *
 * Ошибки чтения не прерывают обход: каталог (или его непрочитанный остаток) пропускается.
 * Символические ссылки не разыменовываются. Порядок записей детерминирован,
 * чтобы проход подсчёта и проход сканирования видели одно и то же.
 */
@Slf4j
public class DirectoryLister {

    private static final Comparator<Path> BY_NAME = Comparator.comparing(p -> String.valueOf(p.getFileName()));

    public Listing list(Path directory) {
        List<Path> files = new ArrayList<>();
        List<Path> directories = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
            for (Path entry : stream) {
                if (Files.isDirectory(entry, LinkOption.NOFOLLOW_LINKS)) {
                    directories.add(entry);
                } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
                    files.add(entry);
                }
            }
        } catch (IOException | DirectoryIteratorException | SecurityException e) {
            log.debug("Каталог пропущен {}: {}", directory, e.toString());
        }
        files.sort(BY_NAME);
        directories.sort(BY_NAME);
        return new Listing(files, directories);
    }

    @Value
    public static class Listing {
        List<Path> files;
        List<Path> directories;
    }
}
