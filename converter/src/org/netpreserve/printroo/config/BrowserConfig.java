package org.netpreserve.printroo.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.printroo.ConfigurationException;
import org.netpreserve.printroo.Converter;
import org.netpreserve.printroo.cdp.WindowSize;
import org.netpreserve.printroo.util.ArgumentListDeserializer;
import org.netpreserve.printroo.util.ByteSizeDeserializer;
import org.netpreserve.printroo.util.DurationDeserializer;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * How to run the browser.
 *
 * @param executable      binary to invoke (e.g. "chromium"), searched for if null
 * @param userProfile     existing profile directory to use instead of a throwaway one
 * @param options         extra command-line flags, as a list or a single string
 * @param removeOptions   default flags to drop
 * @param windowSize      viewport size, which is also the size of image output
 * @param diskCacheDir    lets the browser cache to this directory
 * @param diskCacheSize   cache size limit, e.g. 100M
 * @param user            run the browser as this user through sudo
 * @param startupTimeout  how long to wait for the browser to start
 */
public record BrowserConfig(
        String executable,
        Path userProfile,
        @JsonDeserialize(using = ArgumentListDeserializer.class)
        List<String> options,
        List<String> removeOptions,
        WindowSize windowSize,
        String proxyServer,
        String proxyBypassList,
        String proxyPacUrl,
        String userAgent,
        Path diskCacheDir,
        @JsonDeserialize(using = ByteSizeDeserializer.class)
        Long diskCacheSize,
        String user,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration startupTimeout
) {
    private static final long MEGABYTE = 1024 * 1024;

    /**
     * Applies these settings to a converter whose browser hasn't been started yet.
     */
    public void applyTo(Converter converter) {
        converter.setExecutable(executable);
        if (removeOptions != null) removeOptions.forEach(converter::removeChromeArgument);
        if (options != null) options.forEach(converter::addChromeArgument);
        if (windowSize != null) converter.setWindowSize(windowSize);
        if (proxyServer != null) converter.setProxyServer(proxyServer);
        if (proxyBypassList != null) converter.setProxyBypassList(proxyBypassList);
        if (proxyPacUrl != null) converter.setProxyPacUrl(proxyPacUrl);
        if (userAgent != null) converter.setUserAgent(userAgent);
        if (userProfile != null) converter.setUserProfile(userProfile);
        if (diskCacheDir != null) {
            Long megabytes = null;
            if (diskCacheSize != null) {
                if (diskCacheSize < MEGABYTE) {
                    throw new ConfigurationException("Disk cache size has to be at least 1M: " + diskCacheSize);
                }
                megabytes = diskCacheSize / MEGABYTE;
            }
            converter.setDiskCache(diskCacheDir, megabytes);
        }
        if (user != null) converter.setUser(user, null);
        converter.setStartupTimeout(startupTimeout);
    }
}
