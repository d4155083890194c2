package com.vtb.threatscan.models;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Instant;

/**
 * Одна классифицированная находка сканера.
 * Создаётся один раз сканером или обходом файловой системы и больше не меняется.
 */
@Value
@Builder
public class Threat {
    @NonNull
    ThreatCategory category;
    @NonNull
    String name;
    String description;
    /** Путь к файлу, ключ реестра или ссылка на процесс */
    @NonNull
    String location;
    /** Например, вычисленный SHA-256 или содержимое значения реестра */
    String details;
    @NonNull
    Severity severity;
    /** Свободный тег классификации: "Malware", "Adware/PUP", ... */
    String classification;
    boolean removable;
    Long sizeBytes;
    Long processId;
    @Builder.Default
    Instant detectedAt = Instant.now();
}
