package com.vtb.threatscan.signatures;

/**
 * Способ сопоставления сигнатуры
 */
public enum MatchKind {
    /** Регистронезависимое вхождение подстроки в имя */
    NAME_SUBSTRING,
    /** Точное совпадение SHA-256 содержимого файла */
    HASH_EXACT
}
