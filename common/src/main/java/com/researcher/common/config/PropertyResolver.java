/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 * Proprietary and confidential.
 */
package com.researcher.common.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import java.util.Properties;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves {@code ${key}} and {@code ${key:defaultValue}} placeholders in messaging
 * configuration values using a waterfall:
 *
 * <ol>
 *   <li><strong>JVM system properties</strong> ({@code -DRABBITMQ_HOST=broker})</li>
 *   <li><strong>messaging.properties</strong> entries</li>
 *   <li><strong>Environment variables</strong> ({@code RABBITMQ_HOST})</li>
 *   <li><strong>Default value</strong> after the colon: {@code ${RABBITMQ_HOST:localhost}}</li>
 *   <li>Nothing resolves: {@link ConfigResolutionException}, the service must not start</li>
 * </ol>
 *
 * <p>Use {@code \:} for a literal colon inside a default value.</p>
 */
public class PropertyResolver {

    private static final Logger log = LoggerFactory.getLogger(PropertyResolver.class);
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private final Properties fileProperties;
    private final Function<String, String> environment;

    public PropertyResolver() {
        this(new Properties(), System::getenv);
    }

    public PropertyResolver(Properties properties) {
        this(properties, System::getenv);
    }

    /**
     * @param environment environment lookup, replaceable so tests do not depend on the real process env
     */
    public PropertyResolver(Properties properties, Function<String, String> environment) {
        this.fileProperties = properties != null ? properties : new Properties();
        this.environment = environment;
    }

    /**
     * Load a properties resource from the classpath. A missing resource is not an error:
     * every key has an inline default.
     */
    public void loadClasspathProperties(String resource) {
        try (InputStream is = PropertyResolver.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) {
                fileProperties.load(is);
                log.info("Loaded {} messaging properties from classpath:{}", fileProperties.size(), resource);
            } else {
                log.debug("No classpath:{} found, using defaults", resource);
            }
        } catch (IOException e) {
            log.warn("Could not load classpath properties {}: {}", resource, e.getMessage());
        }
    }

    /**
     * Raw value of a key with all placeholders resolved, or {@code null} when the key is absent.
     */
    public String getResolved(String key) {
        String raw = fileProperties.getProperty(key);
        return raw == null ? null : resolve(raw);
    }

    /**
     * Resolve a single string value, replacing all ${...} placeholders.
     *
     * @throws ConfigResolutionException if a placeholder cannot be resolved
     */
    public String resolve(String value) {
        if (value == null || !value.contains("${")) return value;

        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String resolved = resolveExpression(matcher.group(1));
            matcher.appendReplacement(result, Matcher.quoteReplacement(resolved));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Snapshot of every key with placeholders resolved.
     */
    public Map<String, String> resolveAll() {
        Map<String, String> out = new java.util.LinkedHashMap<>();
        for (String key : fileProperties.stringPropertyNames()) {
            out.put(key, resolve(fileProperties.getProperty(key)));
        }
        return out;
    }

    private String resolveExpression(String expr) {
        String key;
        String defaultValue = null;

        int colonIdx = findUnescapedColon(expr);
        if (colonIdx >= 0) {
            key = expr.substring(0, colonIdx).trim();
            defaultValue = unescape(expr.substring(colonIdx + 1));
        } else {
            key = expr.trim();
        }

        String val = System.getProperty(key);
        if (val != null) {
            log.debug("Resolved ${{{}}} from JVM system property", key);
            return val;
        }

        val = fileProperties.getProperty(key);
        if (val != null) {
            log.debug("Resolved ${{{}}} from messaging.properties", key);
            return val;
        }

        val = environment.apply(key);
        if (val != null) {
            log.debug("Resolved ${{{}}} from environment variable", key);
            return val;
        }

        if (defaultValue != null) {
            return defaultValue;
        }

        String msg = "Cannot resolve configuration placeholder ${" + key + "}. " +
                "Provide it as: (1) JVM arg -D" + key + "=value, " +
                "(2) messaging.properties entry, " +
                "(3) environment variable, or " +
                "(4) inline default ${" + key + ":defaultValue}";
        log.error(msg);
        throw new ConfigResolutionException(msg);
    }

    private int findUnescapedColon(String expr) {
        for (int i = 0; i < expr.length(); i++) {
            if (expr.charAt(i) == ':' && (i == 0 || expr.charAt(i - 1) != '\\')) {
                return i;
            }
        }
        return -1;
    }

    private String unescape(String value) {
        return value.replace("\\:", ":");
    }

    /**
     * Thrown when a placeholder cannot be resolved through the waterfall, or a resolved
     * value is not valid for its key.
     */
    public static class ConfigResolutionException extends RuntimeException {
        public ConfigResolutionException(String message) {
            super(message);
        }
    }
}
