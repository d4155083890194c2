package com.vtb.threatscan.reports;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.vtb.threatscan.models.ScanResult;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Генератор отчетов в формате JSON
 */
@Slf4j
public class JsonReportGenerator implements ReportGenerator {

    private final ObjectMapper objectMapper;

    public JsonReportGenerator() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public void generate(ScanResult result, Path outputPath) throws IOException {
        log.info("Генерация JSON отчета: {}", outputPath);

        if (result == null) {
            throw new IllegalArgumentException("ScanResult не может быть null");
        }
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, toJson(result));

        log.info("JSON отчет сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }

    @Override
    public String getFileExtension() {
        return "json";
    }

    /**
     * Отчет: сводка по критичности и полный список угроз
     */
    public String toJson(ScanResult result) throws IOException {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("startedAt", result.getStartedAt());
        report.put("finishedAt", result.getFinishedAt());
        report.put("durationSeconds", result.getDuration().toMillis() / 1000.0);
        report.put("phase", result.getPhase());
        report.put("cancelled", result.isCancelled());
        report.put("error", result.getError());
        report.put("filesScanned", result.getFilesScanned());
        report.put("estimatedFiles", result.getEstimatedFiles());

        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.name(), result.getThreatCountBySeverity(severity));
        }
        report.put("threatCount", result.getThreatCount());
        report.put("severityBreakdown", bySeverity);

        report.put("threats", result.getThreats().stream().map(JsonReportGenerator::threatEntry).toList());
        return objectMapper.writeValueAsString(report);
    }

    private static Map<String, Object> threatEntry(Threat threat) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("category", threat.getCategory());
        entry.put("severity", threat.getSeverity());
        entry.put("name", threat.getName());
        entry.put("description", threat.getDescription());
        entry.put("location", threat.getLocation());
        entry.put("details", threat.getDetails());
        entry.put("classification", threat.getClassification());
        entry.put("removable", threat.isRemovable());
        entry.put("sizeBytes", threat.getSizeBytes());
        entry.put("processId", threat.getProcessId());
        entry.put("detectedAt", threat.getDetectedAt());
        return entry;
    }
}
