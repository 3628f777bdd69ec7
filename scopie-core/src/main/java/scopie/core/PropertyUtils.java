/* 
 * Copyright (C) 2025 Scopie developers
 *
 * This File is part of Scopie
 *
 * Scopie is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * Scopie is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with Scopie.  If not, see <http://www.gnu.org/licenses/>.
 */
package scopie.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.util.Properties;

/**
 * Application settings.
 * Defaults are read from {@code scopie.properties} on the classpath, then overridden by the user file given by the system property {@value #USER_FILE_PROPERTY} (default: {@code ~/.scopie/scopie.properties}) if it exists.
 * @author Scopie developers
 */
public class PropertyUtils {
    public final static Logger logger = LoggerFactory.getLogger(PropertyUtils.class);
    private static Properties props;
    public final static String USER_FILE_PROPERTY = "scopie.properties.file";
    public final static String DEFAULTS_RESOURCE = "/scopie.properties";
    public final static String REGISTRATION_MAX_SIZE = "registration.max_size";
    public final static String REGISTRATION_REQUESTED_SIZE = "registration.requested_size";
    public final static String REGISTRATION_NORMALIZE = "registration.normalize_cross_power";
    public final static String PROCESSING_WORKERS = "processing.workers";
    public final static String GUIDING_WORKERS = "guiding.workers";
    public final static String CAMERA_CONTROL_REFRESH_MS = "camera.control_refresh_ms";

    public static synchronized Properties getProps() {
        if (props == null) {
            Properties p = new Properties();
            try (InputStream in = PropertyUtils.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
                if (in != null) p.load(in);
                else logger.warn("default property file {} not found on classpath", DEFAULTS_RESOURCE);
            } catch (IOException e) {
                logger.error("Error while trying to load default properties", e);
            }
            File f = getFile();
            if (f.isFile()) {
                try (Reader r = new FileReader(f)) {
                    p.load(r);
                    logger.info("user properties loaded from: {}", f);
                } catch (IOException e) {
                    logger.error("Error while trying to load property file: {}", f, e);
                }
            }
            props = p;
        }
        return props;
    }

    public static File getFile() {
        String path = System.getProperty(USER_FILE_PROPERTY);
        if (path == null) path = System.getProperty("user.home") + File.separator + ".scopie" + File.separator + "scopie.properties";
        return new File(path);
    }

    /**
     * Forgets loaded values: they will be read again at next access
     */
    public static synchronized void reset() {
        props = null;
    }

    public static String get(String key) {
        return getProps().getProperty(key);
    }
    public static String get(String key, String defaultValue) {
        return getProps().getProperty(key, defaultValue);
    }
    public static boolean get(String key, boolean defaultValue) {
        return Boolean.parseBoolean(getProps().getProperty(key, Boolean.toString(defaultValue)).trim());
    }
    public static int get(String key, int defaultValue) {
        String v = getProps().getProperty(key);
        if (v==null) return defaultValue;
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for property "+key+": "+v, e);
        }
    }
    public static long get(String key, long defaultValue) {
        String v = getProps().getProperty(key);
        if (v==null) return defaultValue;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer value for property "+key+": "+v, e);
        }
    }
    public static void set(String key, String value) {
        if (value!=null) getProps().setProperty(key, value);
        else remove(key);
    }
    public static void set(String key, int value) {
        getProps().setProperty(key, Integer.toString(value));
    }
    public static void set(String key, long value) {
        getProps().setProperty(key, Long.toString(value));
    }
    public static void set(String key, boolean value) {
        getProps().setProperty(key, Boolean.toString(value));
    }
    public static void remove(String key) {
        getProps().remove(key);
    }
}
