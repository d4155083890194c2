package com.vtb.threatscan.platform;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Запуск внешних утилит ОС (reg, sc, takeown, icacls) с ограничением по времени.
 * Аргументы передаются массивом, без оболочки.
 */
@Slf4j
public class CommandRunner {

    public CommandResult run(Duration timeout, String... command) throws IOException {
        return run(timeout, List.of(command));
    }

    public CommandResult run(Duration timeout, List<String> command) throws IOException {
        log.debug("Запуск команды: {}", command);
        ProcessBuilder pb = new ProcessBuilder(command).redirectErrorStream(true);
        Process process = pb.start();
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> drain(process.getInputStream()));

        try {
            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.warn("Команда {} не завершилась за {} мс, процесс принудительно остановлен",
                    command.get(0), timeout.toMillis());
                process.destroyForcibly();
                return new CommandResult(-1, "", true);
            }
            String text = output.get(1, TimeUnit.SECONDS);
            log.debug("Команда {} завершилась с кодом {}", command.get(0), process.exitValue());
            return new CommandResult(process.exitValue(), text, false);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Ожидание команды " + command.get(0) + " прервано", e);
        } catch (ExecutionException | TimeoutException e) {
            return new CommandResult(process.exitValue(), "", false);
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), Charset.defaultCharset());
        } catch (IOException e) {
            log.debug("Не удалось прочитать вывод команды: {}", e.getMessage());
            return "";
        }
    }
}
