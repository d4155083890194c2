package com.vtb.threatscan.traversal;

import com.vtb.threatscan.core.WalkOutcome;
import lombok.Value;

/**
 * Итог прохода подсчёта
 */
@Value
public class FileCount {
    long total;
    WalkOutcome outcome;
}
