package com.vtb.threatscan.remediation.quarantine;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.ThreatCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Запись индекса карантина
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QuarantinedItem {
    private String id;
    private String originalPath;
    private String quarantinePath;
    /** SHA-256 исходного содержимого */
    private String fileHash;
    private long fileSizeBytes;
    private Instant quarantinedAt;
    private ThreatCategory threatCategory;
    private Severity severity;
    private String threatName;
    private QuarantineStatus status;
    private Instant restoredAt;
    private Instant deletedAt;
}
