package com.microsoft.azure.kusto.core.data;

import java.io.IOException;
import java.io.InputStream;
import java.lang.invoke.MethodHandles;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

public class Utils {
    private static final Logger log = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());
    private static final String VERSION_FILE = "/kusto-core.properties";
    private static final String UNKNOWN_VERSION = "unknown";

    private Utils() {
        // Hide constructor, as this is a static utility class
    }

    // big decimals are kept exact on both sides, doubles lose precision on the service's decimal values
    public static ObjectMapper getObjectMapper() {
        return JsonMapper.builder()
                .configure(MapperFeature.PROPAGATE_TRANSIENT_MARKER, true)
                .addModule(new JavaTimeModule())
                .build()
                .configure(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS, true)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true)
                .setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));
    }

    public static String getPackageVersion() {
        try (InputStream versionFileStream = Utils.class.getResourceAsStream(VERSION_FILE)) {
            if (versionFileStream == null) {
                log.debug("Version file {} is not on the classpath", VERSION_FILE);
                return UNKNOWN_VERSION;
            }
            Properties props = new Properties();
            props.load(versionFileStream);
            return props.getProperty("version", UNKNOWN_VERSION).trim();
        } catch (IOException e) {
            log.warn("Failed to read version file {}", VERSION_FILE, e);
            return UNKNOWN_VERSION;
        }
    }
}
