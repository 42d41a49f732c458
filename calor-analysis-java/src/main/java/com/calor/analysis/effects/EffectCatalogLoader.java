package com.calor.analysis.effects;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads effect catalogs: the bundled built-in catalog, then the user's, then the project's.
 */
public class EffectCatalogLoader {

    public static final String BUILT_IN_RESOURCE = "/calor/builtin-effects.json";
    public static final String SUPPORTED_VERSION = "1.0";

    private static final Gson GSON = new Gson();

    public static class CatalogLoadException extends RuntimeException {
        public CatalogLoadException(String message) { super(message); }
        public CatalogLoadException(String message, Throwable cause) { super(message, cause); }
    }

    /** {@code ~/.calor/effects.json}. */
    public static Path defaultUserCatalog() {
        return Paths.get(System.getProperty("user.home"), ".calor", "effects.json");
    }

    /**
     * Built-in entries plus whichever of {@code userCatalog} and {@code projectCatalog} exist.
     * A broken user or project file is reported and skipped; a broken built-in catalog is fatal.
     */
    public EffectCatalog loadStandard(Path userCatalog, Path projectCatalog) {
        EffectCatalog catalog = new EffectCatalog();
        loadBuiltIn(catalog);
        loadIfPresent(catalog, userCatalog, CatalogLayer.USER);
        loadIfPresent(catalog, projectCatalog, CatalogLayer.PROJECT);
        System.err.println("[calor-verifier] Effect catalog loaded: " + catalog.size() + " entries");
        return catalog;
    }

    public void loadBuiltIn(EffectCatalog catalog) {
        try (InputStream in = EffectCatalogLoader.class.getResourceAsStream(BUILT_IN_RESOURCE)) {
            if (in == null) {
                throw new CatalogLoadException("Built-in effect catalog missing from classpath: " + BUILT_IN_RESOURCE);
            }
            try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                addAll(catalog, parse(reader, BUILT_IN_RESOURCE), CatalogLayer.BUILT_IN, "builtin:" + BUILT_IN_RESOURCE);
            }
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read built-in effect catalog: " + e.getMessage(), e);
        }
    }

    /**
     * @throws CatalogLoadException if the file is missing, malformed, of an unsupported version,
     *                              or names an unknown effect code
     */
    public void loadFile(EffectCatalog catalog, Path file, CatalogLayer layer) {
        if (!Files.exists(file)) {
            throw new CatalogLoadException("Effect catalog not found: " + file);
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            addAll(catalog, parse(reader, file.toString()), layer, file.toString());
        } catch (IOException e) {
            throw new CatalogLoadException("Failed to read effect catalog " + file + ": " + e.getMessage(), e);
        }
    }

    private void loadIfPresent(EffectCatalog catalog, Path file, CatalogLayer layer) {
        if (file == null || !Files.exists(file)) {
            return;
        }
        try {
            loadFile(catalog, file, layer);
        } catch (CatalogLoadException e) {
            System.err.println("[calor-verifier] WARNING: ignoring effect catalog: " + e.getMessage());
        }
    }

    private static CatalogFile parse(Reader reader, String source) {
        CatalogFile file;
        try {
            file = GSON.fromJson(reader, CatalogFile.class);
        } catch (JsonParseException e) {
            throw new CatalogLoadException("Effect catalog is not valid JSON: " + source, e);
        }
        if (file == null) {
            throw new CatalogLoadException("Effect catalog is empty: " + source);
        }
        if (file.getVersion() != null && !SUPPORTED_VERSION.equals(file.getVersion())) {
            throw new CatalogLoadException("Unsupported effect catalog version '" + file.getVersion()
                    + "' in " + source + " (expected '" + SUPPORTED_VERSION + "')");
        }
        return file;
    }

    private static void addAll(EffectCatalog catalog, CatalogFile file, CatalogLayer layer, String source) {
        // Validate everything before adding anything, so a bad file leaves the catalog untouched.
        List<CatalogEntry> entries = new ArrayList<>();
        for (CatalogFile.Entry raw : file.getEntries()) {
            if (raw == null) {
                throw new CatalogLoadException("Null entry in " + source);
            }
            String signature = raw.getSignature();
            if (signature == null || !signature.contains("::")) {
                throw new CatalogLoadException("Entry without a Type::Member signature in " + source);
            }
            for (String code : raw.getEffects()) {
                if (code == null) {
                    throw new CatalogLoadException("Null effect code for " + signature + " in " + source);
                }
            }
            List<String> unknown = new ArrayList<>();
            EffectSet effects = EffectSet.parse(raw.getEffects(), unknown::add);
            if (!unknown.isEmpty()) {
                throw new CatalogLoadException("Unknown effect code(s) " + unknown + " for " + signature + " in " + source);
            }
            entries.add(new CatalogEntry(signature, effects, layer, source));
        }
        entries.forEach(catalog::add);
    }
}
