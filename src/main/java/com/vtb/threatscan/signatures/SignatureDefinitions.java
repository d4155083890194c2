package com.vtb.threatscan.signatures;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vtb.threatscan.models.Severity;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Формат файла signatures.yaml
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SignatureDefinitions {

    private String version;
    private List<NameEntry> processes = new ArrayList<>();
    private List<NameEntry> fileNames = new ArrayList<>();
    private List<NameEntry> registryValues = new ArrayList<>();
    private List<String> adwareMarkers = new ArrayList<>();
    private List<HashEntry> hashes = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class NameEntry {
        private String pattern;
        private Severity severity;
        private String description;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class HashEntry {
        private String sha256;
        private String description;
    }
}
