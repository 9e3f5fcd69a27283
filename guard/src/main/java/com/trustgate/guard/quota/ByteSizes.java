package com.trustgate.guard.quota;

import java.util.Locale;

/** Human formatting of byte counts, e.g. {@code 1,048,577 bytes (1.0 MiB)}. */
public final class ByteSizes {

    private static final double KIB = 1024.0;
    private static final double MIB = 1024.0 * 1024.0;

    private ByteSizes() {}

    public static String format(long bytes) {
        if (bytes >= MIB) {
            return String.format(Locale.US, "%,d bytes (%.1f MiB)", bytes, bytes / MIB);
        }
        if (bytes >= KIB) {
            return String.format(Locale.US, "%,d bytes (%.1f KiB)", bytes, bytes / KIB);
        }
        return String.format(Locale.US, "%,d bytes", bytes);
    }
}
