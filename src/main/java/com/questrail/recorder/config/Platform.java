package com.questrail.recorder.config;

import java.util.Locale;

/**
 * Operating system family whose console the output is rendered on.
 *
 * Glyph availability depends on it.
 */
public enum Platform {
    MAC_OS,
    WINDOWS,
    LINUX,
    OTHER;

    /**
     * Returns the platform of the running JVM.
     */
    public static Platform current() {
        return fromOsName(System.getProperty("os.name", ""));
    }

    static Platform fromOsName(String osName) {
        String name = osName.toLowerCase(Locale.ROOT);
        if (name.startsWith("mac") || name.startsWith("darwin")) {
            return MAC_OS;
        }
        if (name.startsWith("windows")) {
            return WINDOWS;
        }
        if (name.startsWith("linux")) {
            return LINUX;
        }
        return OTHER;
    }
}
