package com.vtb.threatscan.signatures;

import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.ThreatCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * База сигнатур: имена вредоносных процессов, шаблоны имён файлов,
 * маркеры adware, шаблоны значений реестра и хэши известного вредоносного ПО.
 *
 * Только чтение, без состояния сканирования - безопасна для одновременных вызовов.
 * При нескольких подходящих записях побеждает первая в порядке объявления.
 */
public final class SignatureStore {

    private final List<Signature> processSignatures;
    private final List<Signature> fileNameSignatures;
    private final List<Signature> registrySignatures;
    private final List<String> adwareMarkers;
    private final Map<String, Signature> hashSignatures;

    private SignatureStore(Builder builder) {
        this.processSignatures = List.copyOf(builder.processSignatures);
        this.fileNameSignatures = List.copyOf(builder.fileNameSignatures);
        this.registrySignatures = List.copyOf(builder.registrySignatures);
        this.adwareMarkers = List.copyOf(builder.adwareMarkers);
        this.hashSignatures = Collections.unmodifiableMap(new LinkedHashMap<>(builder.hashSignatures));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SignatureStore empty() {
        return builder().build();
    }

    public Optional<Signature> matchProcess(String processName) {
        return firstMatch(processSignatures, processName);
    }

    public Optional<FileNameMatch> matchFileName(String name) {
        return firstMatch(fileNameSignatures, name).map(FileNameMatch::of);
    }

    public boolean matchHash(String digest) {
        return findHash(digest).isPresent();
    }

    public Optional<Signature> findHash(String digest) {
        if (digest == null || digest.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(hashSignatures.get(Signature.normalize(digest)));
    }

    /**
     * Сначала специальные шаблоны реестра, затем шаблоны имён файлов
     */
    public Optional<Signature> matchRegistryValue(String valueText) {
        Optional<Signature> registryMatch = firstMatch(registrySignatures, valueText);
        if (registryMatch.isPresent()) {
            return registryMatch;
        }
        return firstMatch(fileNameSignatures, valueText);
    }

    /**
     * Первый маркер adware, встречающийся в тексте (например, в manifest.json расширения)
     */
    public Optional<String> matchAdwareMarker(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String lower = Signature.normalize(text);
        for (String marker : adwareMarkers) {
            if (lower.contains(marker)) {
                return Optional.of(marker);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return processSignatures.size() + fileNameSignatures.size() + registrySignatures.size()
            + adwareMarkers.size() + hashSignatures.size();
    }

    public int getProcessSignatureCount() {
        return processSignatures.size();
    }

    public int getFileNameSignatureCount() {
        return fileNameSignatures.size();
    }

    public int getHashCount() {
        return hashSignatures.size();
    }

    private static Optional<Signature> firstMatch(List<Signature> signatures, String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        String lower = Signature.normalize(text);
        for (Signature signature : signatures) {
            if (signature.matchesLowerCase(lower)) {
                return Optional.of(signature);
            }
        }
        return Optional.empty();
    }

    /**
     * Построитель базы; порядок вызовов определяет приоритет совпадений
     */
    public static final class Builder {
        private final List<Signature> processSignatures = new ArrayList<>();
        private final List<Signature> fileNameSignatures = new ArrayList<>();
        private final List<Signature> registrySignatures = new ArrayList<>();
        private final List<String> adwareMarkers = new ArrayList<>();
        private final Map<String, Signature> hashSignatures = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder process(String pattern, Severity severity, String description) {
            processSignatures.add(nameSignature(pattern, ThreatCategory.PROCESS, severity, description));
            return this;
        }

        public Builder fileName(String pattern, Severity severity, String description) {
            fileNameSignatures.add(nameSignature(pattern, ThreatCategory.FILE, severity, description));
            return this;
        }

        public Builder registryValue(String pattern, Severity severity, String description) {
            registrySignatures.add(nameSignature(pattern, ThreatCategory.REGISTRY, severity, description));
            return this;
        }

        public Builder adwareMarker(String marker) {
            String normalized = Signature.normalize(marker);
            if (!normalized.isEmpty()) {
                adwareMarkers.add(normalized);
            }
            return this;
        }

        public Builder hash(String sha256, String description) {
            String normalized = Signature.normalize(sha256);
            if (normalized.isEmpty()) {
                throw new SignatureLoadException("Пустой хэш в определениях сигнатур");
            }
            // первое объявление хэша остаётся в силе
            hashSignatures.putIfAbsent(normalized, Signature.builder()
                .kind(MatchKind.HASH_EXACT)
                .pattern(normalized)
                .category(ThreatCategory.FILE)
                .severity(Severity.CRITICAL)
                .description(description)
                .build());
            return this;
        }

        public SignatureStore build() {
            return new SignatureStore(this);
        }

        private static Signature nameSignature(String pattern,
                                               ThreatCategory category,
                                               Severity severity,
                                               String description) {
            String normalized = Signature.normalize(pattern);
            if (normalized.isEmpty()) {
                throw new SignatureLoadException("Пустой шаблон сигнатуры категории " + category);
            }
            return Signature.builder()
                .kind(MatchKind.NAME_SUBSTRING)
                .pattern(normalized)
                .category(category)
                .severity(severity != null ? severity : Severity.MEDIUM)
                .description(description)
                .build();
        }
    }
}
