package io.mvccstore.segment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Properties;

import io.mvccstore.util.PropertiesUtils;

/**
 * Process wide settings, read from system properties.
 *
 * On first use the optional classpath resource {@value #CONFIG_RESOURCE} is loaded, its entries only fill in keys
 * which are not already set as system properties.
 */
public enum SystemConfig {
    FAILFAST("mvccstore.failfast", "true"),
    PARALLEL_MAX_WORKERS("mvccstore.parallel.max.workers", "2"),
    PARALLEL_LEADER_PARTICIPATION("mvccstore.parallel.leader.participation", "true"),
    PARALLEL_WORKER_SLOTS("mvccstore.parallel.worker.slots", "8"),
    AGG_BUCKET_LIMIT("mvccstore.agg.bucket.limit", "65000"),
    PAGE_SIZE("mvccstore.page.size", "8192"),
    FAULT_UNWRAP_DEPTH("mvccstore.fault.unwrap.depth", "8"),
    SPIN_WAIT_YIELD("mvccstore.spin.wait.yield", "true");

    public static final String CONFIG_RESOURCE = "mvccstore.config.properties";

    public final String key;
    public final String defaultValue;

    private SystemConfig(String key, String defaultValue) {
        this.key = key;
        this.defaultValue = defaultValue;
    }

    public boolean getBool() {
        return Boolean.parseBoolean(get());
    }

    public int getInt() {
        return Integer.parseInt(get());
    }

    public long getLong() {
        return Long.parseLong(get());
    }

    public String get() {
        Loader.ensureLoaded();
        return System.getProperty(key, defaultValue);
    }

    private static class Loader {
        private static final Logger log = LoggerFactory.getLogger(SystemConfig.class);
        private static volatile boolean loaded = false;

        static void ensureLoaded() {
            if (loaded) {
                return;
            }
            synchronized (Loader.class) {
                if (loaded) {
                    return;
                }
                try {
                    Properties config = PropertiesUtils.loadResourceIfExists(SystemConfig.class.getClassLoader(), CONFIG_RESOURCE);
                    for (String name : config.stringPropertyNames()) {
                        if (System.getProperty(name) == null) {
                            System.setProperty(name, config.getProperty(name));
                        }
                    }
                } catch (IOException e) {
                    log.error("Failed to load {}", CONFIG_RESOURCE, e);
                }
                Properties ours = PropertiesUtils.subSet(System.getProperties(), "mvccstore");
                for (String name : ours.stringPropertyNames()) {
                    log.info("mvccstore.{} = {}", name, ours.getProperty(name));
                }
                loaded = true;
            }
        }
    }
}
