package com.vtb.threatscan.signatures;

import lombok.Value;

/**
 * Результат проверки имени по шаблонам файлов
 */
@Value
public class FileNameMatch {
    boolean suspicious;
    /** Описание сработавшего шаблона */
    String description;
    Signature signature;

    static FileNameMatch of(Signature signature) {
        String description = signature.getDescription() != null && !signature.getDescription().isBlank()
            ? signature.getDescription()
            : signature.getPattern();
        return new FileNameMatch(true, description, signature);
    }
}
