package com.vtb.threatscan.cli;

import com.vtb.threatscan.config.ScannerConfig;
import com.vtb.threatscan.core.ScanEventListener;
import com.vtb.threatscan.core.ScanHandle;
import com.vtb.threatscan.core.ScanOptions;
import com.vtb.threatscan.core.ScanOrchestrator;
import com.vtb.threatscan.models.RemovalResult;
import com.vtb.threatscan.models.ScanResult;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;
import com.vtb.threatscan.platform.LocalPlatformProbe;
import com.vtb.threatscan.platform.PlatformProbe;
import com.vtb.threatscan.remediation.RemediationEngine;
import com.vtb.threatscan.remediation.quarantine.QuarantineVault;
import com.vtb.threatscan.reports.JsonReportGenerator;
import com.vtb.threatscan.signatures.SignatureLoader;
import com.vtb.threatscan.signatures.SignatureStore;
import com.vtb.threatscan.util.DurationFormat;
import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Главная CLI команда сканера угроз
 */
@Slf4j
@Command(
    name = "threat-scanner",
    mixinStandardHelpOptions = true,
    version = "VTB Threat Scanner 1.0.0",
    description = """

        VTB Threat Scanner

        Проверка хоста на вредоносное ПО по требованию

        Возможности:
          • Проверка всех локальных томов (имена, двойные расширения, SHA-256)
          • Процессы, автозагрузка, расширения браузеров
          • Точки перехвата в реестре и задачи планировщика
          • Удаление угроз или перемещение в карантин
          • JSON отчет

        Коды выхода: 0 - угроз нет, 1 - найдены угрозы, 2 - ошибка

        """
)
public class MainCommand implements Callable<Integer> {

    static final int EXIT_CLEAN = 0;
    static final int EXIT_THREATS = 1;
    static final int EXIT_ERROR = 2;

    @Option(
        names = {"-p", "--path"},
        description = "Проверить только указанный каталог (можно повторять); по умолчанию все локальные тома"
    )
    private List<Path> paths = new ArrayList<>();

    @Option(
        names = {"-c", "--config"},
        description = "Файл конфигурации YAML (по умолчанию встроенный threat-scanner-config.yaml)"
    )
    private Path configPath;

    @Option(
        names = {"-s", "--signatures"},
        description = "Файл определений сигнатур YAML (по умолчанию встроенный signatures.yaml)"
    )
    private Path signaturesPath;

    @Option(
        names = {"-o", "--output"},
        description = "Сохранить JSON отчет в файл"
    )
    private Path outputPath;

    @Option(
        names = {"--remove"},
        description = "Удалить найденные угрозы, которые можно удалить автоматически"
    )
    private boolean remove = false;

    @Option(
        names = {"--quarantine"},
        description = "Файлы угроз помещать в карантин вместо удаления (вместе с --remove)"
    )
    private boolean quarantine = false;

    private final PlatformProbe probe;
    private final PrintStream out;

    public MainCommand() {
        this(null, System.out);
    }

    MainCommand(PlatformProbe probe, PrintStream out) {
        this.probe = probe;
        this.out = out;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        try {
            ScannerConfig config = configPath != null ? ScannerConfig.load(configPath) : ScannerConfig.load();
            SignatureLoader loader = new SignatureLoader();
            SignatureStore signatures = signaturesPath != null ? loader.load(signaturesPath) : loader.loadDefault();
            PlatformProbe platform = probe != null ? probe : new LocalPlatformProbe(config);
            QuarantineVault vault = quarantine ? QuarantineVault.open(config.getQuarantine()) : null;
            RemediationEngine remediation = new RemediationEngine(platform, config, vault);

            ScanResult result;
            try (ScanOrchestrator orchestrator = new ScanOrchestrator(config, signatures, platform, remediation,
                    Clock.systemDefaultZone(), System::nanoTime)) {
                ScanOptions options = ScanOptions.builder().roots(List.copyOf(paths)).build();
                ScanHandle handle = orchestrator.startScan(options, new ConsoleProgress());
                result = handle.await();
            }

            printResults(result);

            if (outputPath != null) {
                new JsonReportGenerator().generate(result, outputPath);
                out.println("Отчет сохранен: " + outputPath);
            }

            if (result.hasError()) {
                log.error("Сканирование завершилось с ошибкой: {}", result.getError());
                return EXIT_ERROR;
            }
            if (remove && !result.getThreats().isEmpty()) {
                removeThreats(result, remediation);
            }
            return result.getThreats().isEmpty() ? EXIT_CLEAN : EXIT_THREATS;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Сканирование прервано");
            return EXIT_ERROR;
        } catch (Exception e) {
            log.error("Ошибка при сканировании: {}", e.getMessage(), e);
            return EXIT_ERROR;
        }
    }

    private void removeThreats(ScanResult result, RemediationEngine remediation) {
        out.println();
        out.println("УДАЛЕНИЕ УГРОЗ:");
        for (Threat threat : result.getThreats()) {
            if (!threat.isRemovable()) {
                out.printf("   [пропущено] %s - требуется ручное удаление%n", threat.getName());
                continue;
            }
            RemovalResult removal = quarantine && threat.getCategory() == ThreatCategory.FILE
                ? remediation.quarantine(threat)
                : remediation.remove(threat);
            String status = removal.isSuccess() ? "OK" : removal.isProtectedSystem() ? "защищено" : "ошибка";
            out.printf("   [%s] %s: %s%n", status, threat.getName(), removal.getMessage());
        }
    }

    /**
     * Вывести детальные результаты
     */
    private void printResults(ScanResult result) {
        out.println();
        out.println("=".repeat(80));
        out.println("VTB THREAT SCAN REPORT");
        out.println("=".repeat(80));
        out.println();
        out.println("Начало: " + result.getStartedAt());
        out.println("Длительность: " + DurationFormat.format(result.getDuration()));
        out.println("Состояние: " + result.getPhase());
        if (result.hasError()) {
            out.println("Ошибка: " + result.getError());
        }
        out.println();
        out.println("СТАТИСТИКА:");
        out.printf("   Проверено объектов: %,d (оценка файлов: %,d)%n",
            result.getFilesScanned(), result.getEstimatedFiles());
        out.println("   Всего угроз: " + result.getThreatCount());
        out.println();
        for (Severity severity : Severity.values()) {
            out.printf("%-9s %d%n", severity.name() + ":", result.getThreatCountBySeverity(severity));
        }
        out.println();

        if (!result.getThreats().isEmpty()) {
            out.println("УГРОЗЫ:");
            for (Threat threat : result.getThreats()) {
                out.printf("   [%s] %s%n", threat.getSeverity(), threat.getName());
                out.printf("      → %s%n", threat.getLocation());
            }
            out.println();
        }
        out.println("=".repeat(80));
    }

    /**
     * Прогресс в консоль: только смена процента
     */
    private final class ConsoleProgress implements ScanEventListener {
        private int lastPercent = -1;

        @Override
        public void onProgress(String message, int percent) {
            if (percent != lastPercent) {
                lastPercent = percent;
                out.printf("[%3d%%] %s%n", percent, message);
            }
        }

        @Override
        public void onThreatFound(Threat threat) {
            out.printf("   ! [%s] %s%n", threat.getSeverity(), threat.getName());
        }
    }
}
