/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * This software is proprietary and confidential. Unauthorized copying,
 * distribution, modification, or use is strictly prohibited without
 * explicit written permission from the copyright holder.
 * Patent Pending.
 */
package com.riskcanvas.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Typed property accessor for code that runs outside a Spring context, such as the
 * event client embedded in desktop tools and tests.
 *
 * <h3>Resolution order</h3>
 * <ol>
 *   <li>JVM system properties ({@code -Driskcanvas.events.endpoint=...})</li>
 *   <li>the classpath resource passed to {@link #load(String)}</li>
 * </ol>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 *   RCProperties props = RCProperties.load("riskcanvas.properties");
 *   Duration delay = props.getDuration("riskcanvas.events.reconnect-delay", Duration.ofSeconds(5));
 *   Map<String, String> headers = props.getSubProperties("riskcanvas.events.header.");
 * }</pre>
 *
 * <p>Instances are effectively immutable after construction; reads are safe from any thread.</p>
 */
public final class RCProperties {

    private static final Logger log = LoggerFactory.getLogger(RCProperties.class);

    public static final String DEFAULT_RESOURCE = "riskcanvas.properties";

    private final Map<String, String> properties;

    public RCProperties(Map<String, String> properties) {
        this.properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    public static RCProperties of(Properties props) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String name : props.stringPropertyNames()) {
            map.put(name, props.getProperty(name));
        }
        return new RCProperties(map);
    }

    public static RCProperties empty() {
        return new RCProperties(Map.of());
    }

    /**
     * Load a classpath resource (missing resource is not an error) and overlay JVM system
     * properties on top of it.
     */
    public static RCProperties load(String resource) {
        Properties merged = new Properties();
        try (InputStream is = RCProperties.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                merged.load(is);
                log.info("Loaded {} properties from classpath:{}", merged.size(), resource);
            } else {
                log.debug("Classpath resource {} not found, using system properties only", resource);
            }
        } catch (IOException e) {
            log.warn("Could not load classpath properties {}: {}", resource, e.getMessage());
        }
        Properties system = System.getProperties();
        for (String name : system.stringPropertyNames()) {
            merged.setProperty(name, system.getProperty(name));
        }
        return of(merged);
    }

    public static RCProperties load() {
        return load(DEFAULT_RESOURCE);
    }

    // ─── Core Typed Getters ─────────────────────────────────────────

    /** Raw property value, or {@code null} if absent. */
    public String getString(String key) {
        return properties.get(key);
    }

    public String getString(String key, String defaultValue) {
        return properties.getOrDefault(key, defaultValue);
    }

    public int getInt(String key, int defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        try { return Integer.parseInt(val.trim()); }
        catch (NumberFormatException e) {
            log.warn("Property {}='{}' is not an integer, using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        try { return Long.parseLong(val.trim()); }
        catch (NumberFormatException e) {
            log.warn("Property {}='{}' is not a long, using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        return "true".equalsIgnoreCase(val.trim());
    }

    /**
     * Parse a duration string. Supports:
     * <ul>
     *   <li>Plain number → milliseconds</li>
     *   <li>{@code "250ms"}, {@code "30s"}, {@code "5m"}, {@code "2h"}</li>
     *   <li>ISO-8601 ({@code "PT30S"}) via {@link Duration#parse}</li>
     * </ul>
     */
    public Duration getDuration(String key, Duration defaultValue) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return defaultValue;
        val = val.trim().toLowerCase(Locale.ROOT);
        try {
            if (val.startsWith("pt")) return Duration.parse(val.toUpperCase(Locale.ROOT));
            if (val.endsWith("ms")) return Duration.ofMillis(Long.parseLong(val.substring(0, val.length() - 2).trim()));
            if (val.endsWith("s"))  return Duration.ofSeconds(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            if (val.endsWith("m"))  return Duration.ofMinutes(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            if (val.endsWith("h"))  return Duration.ofHours(Long.parseLong(val.substring(0, val.length() - 1).trim()));
            return Duration.ofMillis(Long.parseLong(val));
        } catch (RuntimeException e) {
            log.warn("Property {}='{}' is not a duration, using default {}", key, val, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Comma-separated value as a list, trimmed, blanks skipped.
     */
    public List<String> getList(String key) {
        String val = properties.get(key);
        if (val == null || val.isBlank()) return Collections.emptyList();
        return Arrays.stream(val.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    // ─── Namespace Helpers ──────────────────────────────────────────

    /**
     * All properties under a prefix, with the prefix stripped.
     * <p>Example: {@code getSubProperties("riskcanvas.events.header.")} returns
     * {@code {"x-demo-user" → "demo-user"}}</p>
     */
    public Map<String, String> getSubProperties(String prefix) {
        return properties.entrySet().stream()
                .filter(e -> e.getKey().startsWith(prefix) && e.getKey().length() > prefix.length())
                .collect(Collectors.toMap(
                        e -> e.getKey().substring(prefix.length()),
                        Map.Entry::getValue,
                        (a, b) -> b,
                        LinkedHashMap::new
                ));
    }

    public boolean hasProperty(String key) {
        return properties.containsKey(key);
    }

    public int size() {
        return properties.size();
    }

    public Map<String, String> getAll() {
        return properties;
    }

    @Override
    public String toString() {
        return "RCProperties{count=" + properties.size() + "}";
    }
}
