package com.calor.analysis.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

public class VerifierConfigReader {

    private static final Gson GSON = new Gson();

    /**
     * Reads and deserializes a {@code calor.json}.
     *
     * @throws ConfigReadException if the file is missing, empty or malformed
     */
    public VerifierConfig read(Path configPath) {
        if (!Files.exists(configPath)) {
            throw new ConfigReadException("Config file not found: " + configPath);
        }
        try (FileReader reader = new FileReader(configPath.toFile(), StandardCharsets.UTF_8)) {
            VerifierConfig config = GSON.fromJson(reader, VerifierConfig.class);
            if (config == null) {
                throw new ConfigReadException("Config file is empty or invalid JSON: " + configPath);
            }
            return config;
        } catch (FileNotFoundException e) {
            throw new ConfigReadException("Config file not found: " + configPath, e);
        } catch (JsonParseException e) {
            throw new ConfigReadException("Config file is not valid JSON: " + configPath + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw new ConfigReadException("Failed to read config: " + configPath + ": " + e.getMessage(), e);
        }
    }

    /** {@code <projectDirectory>/calor.json}, or defaults when the project has none. */
    public VerifierConfig readOrDefaults(Path projectDirectory) {
        Path configPath = projectDirectory.resolve(VerifierConfig.FILE_NAME);
        if (!Files.exists(configPath)) {
            System.err.println("[calor-verifier] No " + VerifierConfig.FILE_NAME + " in " + projectDirectory + ", using defaults");
            return VerifierConfig.defaults();
        }
        return read(configPath);
    }

    public static class ConfigReadException extends RuntimeException {
        public ConfigReadException(String message) { super(message); }
        public ConfigReadException(String message, Throwable cause) { super(message, cause); }
    }
}
