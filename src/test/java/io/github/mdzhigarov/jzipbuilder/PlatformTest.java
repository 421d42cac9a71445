package io.github.mdzhigarov.jzipbuilder;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Platform detection.
 */
class PlatformTest {

    @Test
    @DisplayName("Should detect the host from the OS name")
    void shouldDetectHost() {
        assertEquals(Platform.WINDOWS, Platform.detect("Windows 11"));
        assertEquals(Platform.WINDOWS, Platform.detect("windows server 2022"));
        assertEquals(Platform.MACOS, Platform.detect("Mac OS X"));
        assertEquals(Platform.MACOS, Platform.detect("Darwin"));
        assertEquals(Platform.UNIX, Platform.detect("Linux"));
        assertEquals(Platform.UNIX, Platform.detect("FreeBSD"));
        assertEquals(Platform.UNIX, Platform.detect(""));
    }

    @Test
    @DisplayName("Should combine host id and ZIP version 6.2")
    void shouldComputeVersionMadeBy() {
        assertEquals(0x033E, Platform.UNIX.versionMadeBy());
        assertEquals(0x0B3E, Platform.WINDOWS.versionMadeBy());
        assertEquals(0x133E, Platform.MACOS.versionMadeBy());
    }

    @Test
    @DisplayName("Should default to regular file and directory modes")
    void shouldProvideDefaultAttributes() {
        assertEquals(0100644, Platform.UNIX.defaultFileAttributes());
        assertEquals(040755, Platform.UNIX.defaultDirectoryAttributes());
        assertEquals(0100644, Platform.MACOS.defaultFileAttributes());
        assertEquals(040755, Platform.MACOS.defaultDirectoryAttributes());
        assertEquals(128, Platform.WINDOWS.defaultFileAttributes());
        assertEquals(16, Platform.WINDOWS.defaultDirectoryAttributes());
    }

    @Test
    @DisplayName("Should match the running JVM")
    void shouldMatchRunningJvm() {
        assertEquals(Platform.detect(System.getProperty("os.name")), Platform.current());
    }
}
