package com.vtb.threatscan.models;

/**
 * Уровни критичности угроз
 */
public enum Severity {
    CRITICAL("Критический", 4),
    HIGH("Высокий", 3),
    MEDIUM("Средний", 2),
    LOW("Низкий", 1);
    
    private final String russianName;
    private final int priority;
    
    Severity(String russianName, int priority) {
        this.russianName = russianName;
        this.priority = priority;
    }
    
    public String getRussianName() {
        return russianName;
    }
    
    public int getPriority() {
        return priority;
    }
}
