package io.mvccstore.util;

import org.apache.commons.io.IOUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class PropertiesUtils {

    /**
     * Load a properties resource from the classpath.
     *
     * @return the loaded properties, or empty properties if the resource does not exist.
     */
    public static Properties loadResourceIfExists(ClassLoader classLoader, String name) throws IOException {
        Properties p = new Properties();
        InputStream input = classLoader.getResourceAsStream(name);
        if (input == null) {
            return p;
        }
        try {
            p.load(input);
        } finally {
            IOUtils.closeQuietly(input);
        }
        return p;
    }

    public static Properties subSet(Properties properties, String prefix) {
        if (!prefix.endsWith(".")) {
            prefix = prefix + ".";
        }
        Properties p = new Properties();
        final String finalPrefix = prefix;

        properties.forEach((k, v) -> {
            String key = k.toString();
            if (key.startsWith(finalPrefix)) {
                p.put(key.substring(finalPrefix.length()), v);
            }
        });
        return p;
    }
}
