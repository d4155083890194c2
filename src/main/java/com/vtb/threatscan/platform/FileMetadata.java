package com.vtb.threatscan.platform;

import lombok.Value;

import java.time.Instant;
import java.util.Set;

@Value
public class FileMetadata {
    long size;
    Instant creationTime;
    Set<FileFlag> flags;

    public boolean isHidden() {
        return flags.contains(FileFlag.HIDDEN);
    }

    public boolean isReadOnly() {
        return flags.contains(FileFlag.READ_ONLY);
    }
}
