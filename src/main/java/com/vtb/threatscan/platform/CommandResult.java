package com.vtb.threatscan.platform;

import lombok.Value;

import java.util.Locale;

/**
 * Итог запуска внешней команды
 */
@Value
public class CommandResult {
    int exitCode;
    String output;
    boolean timedOut;

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }

    public boolean outputContains(String fragment) {
        return output != null && output.toLowerCase(Locale.ROOT)
            .contains(fragment.toLowerCase(Locale.ROOT));
    }
}
