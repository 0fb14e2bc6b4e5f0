package com.example.cloudmedia.util;

import java.util.Locale;

public final class FileSizeFormatter {

    private static final String[] UNITS = {"B", "KB", "MB", "GB"};

    private FileSizeFormatter() {
    }

    public static String format(long sizeBytes) {
        double size = sizeBytes;
        for (String unit : UNITS) {
            if (size < 1024.0) {
                return String.format(Locale.ROOT, "%.2f %s", size, unit);
            }
            size /= 1024.0;
        }
        return String.format(Locale.ROOT, "%.2f TB", size);
    }
}
