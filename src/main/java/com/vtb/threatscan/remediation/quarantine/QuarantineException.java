package com.vtb.threatscan.remediation.quarantine;

import java.io.IOException;

/**
 * Отказ карантина по бизнес-правилу: файл слишком большой, занят, уже в карантине, ...
 */
public class QuarantineException extends IOException {

    public QuarantineException(String message) {
        super(message);
    }
}
