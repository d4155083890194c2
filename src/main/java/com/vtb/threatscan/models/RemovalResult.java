package com.vtb.threatscan.models;

import lombok.Value;

/**
 * Итог одной попытки удаления угрозы
 */
@Value
public class RemovalResult {
    boolean success;
    String message;
    /** Защищённый компонент ОС: не ошибка движка, пользователю можно не беспокоиться */
    boolean protectedSystem;

    public static RemovalResult success(String message) {
        return new RemovalResult(true, message, false);
    }

    public static RemovalResult failure(String message) {
        return new RemovalResult(false, message, false);
    }

    public static RemovalResult protectedSystem(String message) {
        return new RemovalResult(false, message, true);
    }
}
