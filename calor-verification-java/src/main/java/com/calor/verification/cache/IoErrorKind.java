package com.calor.verification.cache;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;

public enum IoErrorKind {
    PERMISSION_DENIED,
    DISK_FULL,
    FILE_SYSTEM,
    OTHER;

    static IoErrorKind classify(IOException e) {
        if (e instanceof AccessDeniedException) return PERMISSION_DENIED;
        String message = e.getMessage();
        if (message != null && message.contains("No space left")) return DISK_FULL;
        if (e instanceof FileSystemException) return FILE_SYSTEM;
        return OTHER;
    }
}
