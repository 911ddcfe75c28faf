package org.netpreserve.printroo.cdp;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.printroo.ConfigurationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChromeArgumentsTest {
    @Test
    void defaults() {
        var arguments = new ChromeArguments();
        var list = arguments.toList();
        assertEquals("--headless", list.get(0));
        assertTrue(list.contains("--remote-debugging-port=0"));
        assertTrue(list.contains("--window-size=1366,768"));
        assertTrue(list.contains("--disable-crash-reporter"));
        assertEquals(list.size(), list.stream().distinct().count());
    }

    @Test
    void addingAnExistingFlagDoesNothing() {
        var arguments = new ChromeArguments();
        int size = arguments.toList().size();
        arguments.add("--mute-audio");
        arguments.add("--MUTE-AUDIO");
        assertEquals(size, arguments.toList().size());
    }

    @Test
    void addingWithValueReplacesInPlace() {
        var arguments = new ChromeArguments();
        int position = arguments.toList().indexOf("--window-size=1366,768");
        arguments.add("--window-size", "800,600");
        assertEquals("--window-size=800,600", arguments.toList().get(position));
        assertEquals(Optional.of("800,600"), arguments.value("--window-size"));

        arguments.add("--user-agent=Test Agent");
        assertEquals(Optional.of("Test Agent"), arguments.value("--user-agent"));
        assertTrue(arguments.toList().contains("--user-agent=Test Agent"));
    }

    @Test
    void mandatoryFlagsCanNotBeRemoved() {
        var arguments = new ChromeArguments();
        for (String flag : ChromeArguments.MANDATORY) {
            assertThrows(ConfigurationException.class, () -> arguments.remove(flag));
        }
        assertThrows(ConfigurationException.class, () -> arguments.remove("--Headless"));
        assertTrue(arguments.contains("--headless"));
    }

    @Test
    void otherFlagsCanBeRemoved() {
        var arguments = new ChromeArguments();
        arguments.remove("--hide-scrollbars");
        assertFalse(arguments.contains("--hide-scrollbars"));
        arguments.remove("--not-present");
    }

    @Test
    void blankFlagsAreRejected() {
        var arguments = new ChromeArguments();
        assertThrows(ConfigurationException.class, () -> arguments.add(" "));
        assertThrows(ConfigurationException.class, () -> arguments.add(null));
        assertThrows(ConfigurationException.class, () -> arguments.add("--foo", null));
    }

    @Test
    void windowSize() {
        var arguments = new ChromeArguments();
        arguments.setWindowSize(WindowSize.FHD);
        assertEquals(Optional.of("1920,1080"), arguments.value("--window-size"));
        assertThrows(ConfigurationException.class, () -> arguments.setWindowSize(0, 100));
    }

    @Test
    void diskCache(@TempDir Path dir) {
        var arguments = new ChromeArguments();
        arguments.setDiskCache(dir, 10L);
        assertEquals(Optional.of(dir.toString()), arguments.value("--disk-cache-dir"));
        assertEquals(Optional.of("10485760"), arguments.value("--disk-cache-size"));
        assertThrows(ConfigurationException.class, () -> arguments.setDiskCache(dir, 0L));
        assertThrows(ConfigurationException.class, () -> arguments.setDiskCache(dir.resolve("missing"), null));
    }

    @Test
    void userProfileSurvivesReset(@TempDir Path dir) throws Exception {
        var profile = Files.createDirectory(dir.resolve("profile"));
        var arguments = new ChromeArguments();
        arguments.setUserProfile(profile);
        arguments.add("--mute-audio=false");
        arguments.reset();
        assertEquals(profile.toAbsolutePath(), arguments.userProfile());
        assertEquals(Optional.of(profile.toAbsolutePath().toString()), arguments.value("--user-data-dir"));
        assertThrows(ConfigurationException.class, () -> arguments.setUserProfile(dir.resolve("missing")));
    }

    @Test
    void userDataDirFlagAndUserProfileStayInStep(@TempDir Path dir) throws Exception {
        var profile = Files.createDirectory(dir.resolve("profile"));
        var arguments = new ChromeArguments();
        arguments.setUserProfile(profile);
        arguments.remove("--user-data-dir");
        assertFalse(arguments.contains("--user-data-dir"));
        assertNull(arguments.userProfile());

        arguments.reset();
        assertFalse(arguments.contains("--user-data-dir"));

        arguments.add("--user-data-dir=" + profile);
        assertEquals(profile.toAbsolutePath(), arguments.userProfile());
        arguments.remove("--USER-DATA-DIR");
        assertNull(arguments.userProfile());
    }

    @Test
    void proxyAndUserAgent() {
        var arguments = new ChromeArguments();
        arguments.setProxyServer("socks5://127.0.0.1:1080");
        arguments.setProxyBypassList("*.example.org;127.0.0.1");
        arguments.setUserAgent("printroo");
        var list = arguments.toList();
        assertTrue(list.contains("--proxy-server=socks5://127.0.0.1:1080"));
        assertTrue(list.contains("--proxy-bypass-list=*.example.org;127.0.0.1"));
        assertTrue(list.contains("--user-agent=printroo"));
    }
}
