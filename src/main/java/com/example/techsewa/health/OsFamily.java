package com.example.techsewa.health;

import java.util.Locale;

public enum OsFamily {
    WINDOWS,
    LINUX,
    MAC,
    OTHER;

    public static OsFamily current() {
        return fromName(System.getProperty("os.name", ""));
    }

    static OsFamily fromName(String osName) {
        String n = osName.toLowerCase(Locale.ROOT);
        if (n.startsWith("windows")) {
            return WINDOWS;
        }
        if (n.contains("linux")) {
            return LINUX;
        }
        if (n.contains("mac") || n.contains("darwin")) {
            return MAC;
        }
        return OTHER;
    }
}
