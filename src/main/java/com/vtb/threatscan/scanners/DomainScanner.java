package com.vtb.threatscan.scanners;

import com.vtb.threatscan.core.ScanContext;
import com.vtb.threatscan.core.WalkOutcome;
import com.vtb.threatscan.models.ScanPhase;

/**
 * Сканер одной поверхности платформы (процессы, автозагрузка, реестр, ...).
 *
 * Ошибка чтения отдельной записи не прерывает сканер; найденные угрозы добавляются
 * через {@link ScanContext#addThreat}, каждая проверенная запись учитывается в общем счётчике.
 */
public interface DomainScanner {

    /**
     * Фаза сканирования, в которой работает сканер
     */
    ScanPhase getPhase();

    String getName();

    WalkOutcome scan(ScanContext context);
}
