package com.vtb.threatscan.testing;

import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.Threat;
import com.vtb.threatscan.models.ThreatCategory;

public final class TestThreats {

    private TestThreats() {
    }

    public static Threat of(ThreatCategory category, Severity severity, String location) {
        return Threat.builder()
            .category(category)
            .name("Тестовая угроза " + category)
            .location(location)
            .severity(severity)
            .removable(true)
            .build();
    }
}
