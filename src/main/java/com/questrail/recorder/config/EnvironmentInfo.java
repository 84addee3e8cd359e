package com.questrail.recorder.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Versions reported at the start of a run.
 *
 * @param libraryVersion version of this testing library
 * @param runtimeVersion version of the Java runtime
 * @param osVersion      operating system name and version
 */
public record EnvironmentInfo(String libraryVersion, String runtimeVersion, String osVersion) {
    private static final Logger log = LoggerFactory.getLogger(EnvironmentInfo.class);

    static final String VERSION_RESOURCE = "/com/questrail/recorder/version.properties";
    static final String UNKNOWN = "unknown";

    public EnvironmentInfo {
        Objects.requireNonNull(libraryVersion, "libraryVersion");
        Objects.requireNonNull(runtimeVersion, "runtimeVersion");
        Objects.requireNonNull(osVersion, "osVersion");
    }

    /**
     * Describes the running JVM.
     */
    public static EnvironmentInfo current() {
        return new EnvironmentInfo(
                readLibraryVersion(),
                Runtime.version().toString(),
                System.getProperty("os.name", UNKNOWN) + " " + System.getProperty("os.version", "")
        );
    }

    static String readLibraryVersion() {
        try (InputStream in = EnvironmentInfo.class.getResourceAsStream(VERSION_RESOURCE)) {
            if (in == null) {
                log.debug("{} not found on the classpath", VERSION_RESOURCE);
                return UNKNOWN;
            }
            Properties properties = new Properties();
            properties.load(in);
            String version = properties.getProperty("version", UNKNOWN).trim();
            // Unfiltered resource, e.g. when running from an IDE build.
            if (version.isEmpty() || version.startsWith("${")) {
                return UNKNOWN;
            }
            return version;
        } catch (IOException e) {
            log.debug("Could not read {}", VERSION_RESOURCE, e);
            return UNKNOWN;
        }
    }
}
