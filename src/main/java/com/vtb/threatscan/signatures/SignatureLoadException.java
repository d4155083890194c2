package com.vtb.threatscan.signatures;

/**
 * Файл определений сигнатур не найден или некорректен
 */
public class SignatureLoadException extends RuntimeException {

    public SignatureLoadException(String message) {
        super(message);
    }

    public SignatureLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
