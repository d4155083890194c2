package com.vtb.threatscan.platform;

import lombok.Value;

@Value
public class ServiceControlResult {
    boolean serviceExists;
    boolean disabled;
    boolean stopped;
    String message;

    public static ServiceControlResult missing(String serviceName) {
        return new ServiceControlResult(false, false, false, "Служба " + serviceName + " не найдена");
    }
}
