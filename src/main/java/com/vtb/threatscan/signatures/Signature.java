package com.vtb.threatscan.signatures;

import com.vtb.threatscan.models.Severity;
import com.vtb.threatscan.models.ThreatCategory;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.util.Locale;

/**
 * Одна запись базы сигнатур
 */
@Value
@Builder
public class Signature {
    @NonNull
    MatchKind kind;
    /** Подстрока имени или hex SHA-256, всегда в нижнем регистре */
    @NonNull
    String pattern;
    @NonNull
    ThreatCategory category;
    @NonNull
    Severity severity;
    String description;

    /**
     * Сопоставить с именем или содержимым (ожидается уже приведённый к нижнему регистру текст)
     */
    boolean matchesLowerCase(String lowerCaseText) {
        if (lowerCaseText == null) {
            return false;
        }
        return kind == MatchKind.HASH_EXACT
            ? pattern.equals(lowerCaseText)
            : lowerCaseText.contains(pattern);
    }

    static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
