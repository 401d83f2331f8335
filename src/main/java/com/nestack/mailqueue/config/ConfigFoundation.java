package com.nestack.mailqueue.config;

import com.google.gson.Gson;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Loads JSON5 configuration files into a map.
 * <p>The reader is lenient so comments, unquoted keys and single quoted strings are accepted.
 */
public class ConfigFoundation extends BasicConfig {

    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        super();
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        super(map);
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read file.
     */
    public ConfigFoundation(String path) throws IOException {
        super(load(Path.of(path)));
    }

    /**
     * Reads a JSON5 file into a map.
     *
     * @param path File path.
     * @return Configuration map, never null.
     * @throws IOException Unable to read or parse file.
     */
    static Map<String, Object> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             JsonReader jsonReader = new JsonReader(reader)) {
            jsonReader.setLenient(true);
            Map<String, Object> parsed = new Gson().fromJson(jsonReader, MAP_TYPE);
            return parsed != null ? parsed : new HashMap<>();
        } catch (RuntimeException e) {
            throw new IOException("Unable to parse configuration file: " + path, e);
        }
    }
}
