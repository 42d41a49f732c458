package com.calor.analysis.effects;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EffectCatalogTest {

    @TempDir
    Path tempDir;

    private static CatalogEntry entry(String signature, CatalogLayer layer, String source, String... codes) {
        return new CatalogEntry(signature, EffectSet.parse(List.of(codes), c -> fail(c)), layer, source);
    }

    private static EffectSet codes(String... codes) {
        return EffectSet.parse(List.of(codes), c -> fail(c));
    }

    @Test
    void exactSignatureWinsOverMethodAndWildcard() {
        EffectCatalog catalog = new EffectCatalog();
        catalog.add(entry("Acme.Io::*", CatalogLayer.BUILT_IN, "b", "fs:rw"));
        catalog.add(entry("Acme.Io::Read", CatalogLayer.BUILT_IN, "b", "fs:r"));
        catalog.add(entry("Acme.Io::Read(System.String)", CatalogLayer.BUILT_IN, "b", "cw"));

        assertEquals(codes("cw"), catalog.resolve("Acme.Io::Read(System.String)").effects());
        assertEquals(codes("fs:r"), catalog.resolve("Acme.Io::Read(System.Int32)").effects());
        assertEquals(codes("fs:rw"), catalog.resolve("Acme.Io::Delete(System.String)").effects());
        assertEquals(CatalogResolution.Status.UNRESOLVED, catalog.resolve("Acme.Net::Send()").status());
    }

    @Test
    void lookupKeysInTierOrder() {
        assertEquals(List.of("A.B::M(X,Y)", "A.B::M", "A.B::*"), EffectCatalog.lookupKeys("A.B::M(X,Y)"));
        assertEquals(List.of("A.B::*"), EffectCatalog.lookupKeys("A.B::*"));
    }

    @Test
    void higherLayerOverridesLowerOne() {
        EffectCatalog catalog = new EffectCatalog();
        catalog.add(entry("System.DateTime::get_Now()", CatalogLayer.BUILT_IN, "builtin", "time"));
        catalog.add(entry("System.DateTime::get_Now()", CatalogLayer.USER, "user", "time", "cw"));
        catalog.add(entry("System.DateTime::get_Now()", CatalogLayer.PROJECT, "project"));

        CatalogResolution resolution = catalog.resolve("System.DateTime::get_Now()");
        assertEquals(CatalogResolution.Status.RESOLVED, resolution.status());
        assertTrue(resolution.effects().isEmpty());
        assertEquals("project", resolution.candidates().get(0).source());
    }

    @Test
    void conflictingEntriesInOneLayerAreAmbiguousInAnyOrder() {
        List<CatalogEntry> entries = List.of(
                entry("Acme.Metrics::Emit(System.String)", CatalogLayer.PROJECT, "a.json", "net:w"),
                entry("Acme.Metrics::Emit(System.String)", CatalogLayer.PROJECT, "b.json", "cw"),
                entry("Acme.Metrics::Emit(System.String)", CatalogLayer.USER, "c.json", "db:w"));

        CatalogResolution first = null;
        for (List<CatalogEntry> order : permutations(entries)) {
            EffectCatalog catalog = new EffectCatalog();
            order.forEach(catalog::add);
            CatalogResolution resolution = catalog.resolve("Acme.Metrics::Emit(System.String)");

            assertEquals(CatalogResolution.Status.AMBIGUOUS, resolution.status());
            assertEquals(codes("cw", "net:w"), resolution.effects());
            assertEquals(2, resolution.candidates().size());
            if (first == null) {
                first = resolution;
            } else {
                assertEquals(first, resolution, "resolution must not depend on insertion order");
            }
        }
    }

    @Test
    void identicalDuplicatesAreNotAmbiguous() {
        EffectCatalog catalog = new EffectCatalog();
        catalog.add(entry("Acme.Log::Write", CatalogLayer.USER, "one", "cw"));
        catalog.add(entry("Acme.Log::Write", CatalogLayer.USER, "two", "cw"));

        CatalogResolution resolution = catalog.resolve("Acme.Log::Write(System.String)");
        assertEquals(CatalogResolution.Status.RESOLVED, resolution.status());
        assertEquals(codes("cw"), resolution.effects());
    }

    @Test
    void builtInCatalogLoadsFromClasspath() {
        EffectCatalog catalog = new EffectCatalog();
        new EffectCatalogLoader().loadBuiltIn(catalog);

        assertTrue(catalog.size() > 20);
        assertEquals(codes("cw"), catalog.resolve("System.Console::WriteLine(System.String)").effects());
        assertEquals(codes("cw"), catalog.resolve("System.Console::WriteLine(System.Int32)").effects());
        assertEquals(codes("time"), catalog.resolve("System.DateTime::get_Now()").effects());
        assertTrue(catalog.resolve("System.Math::Abs(System.Int32)").effects().isEmpty());
        assertEquals(CatalogResolution.Status.RESOLVED, catalog.resolve("System.IO.File::Move(System.String,System.String)").status());
    }

    @Test
    void loadFileReadsEntries() throws IOException {
        Path file = write("ok.json", """
                {"version": "1.0", "entries": [
                  {"signature": "Acme.Store::Save(Acme.Order)", "effects": ["db:w", "io:network_write"]}
                ]}
                """);
        EffectCatalog catalog = new EffectCatalog();
        new EffectCatalogLoader().loadFile(catalog, file, CatalogLayer.PROJECT);

        CatalogResolution resolution = catalog.resolve("Acme.Store::Save(Acme.Order)");
        assertEquals(codes("db:w", "net:w"), resolution.effects());
        assertEquals(CatalogLayer.PROJECT, resolution.candidates().get(0).layer());
    }

    @Test
    void loadFileRejectsBadInput() throws IOException {
        EffectCatalogLoader loader = new EffectCatalogLoader();
        EffectCatalog catalog = new EffectCatalog();

        assertThrows(EffectCatalogLoader.CatalogLoadException.class,
                () -> loader.loadFile(catalog, tempDir.resolve("missing.json"), CatalogLayer.USER));
        assertThrows(EffectCatalogLoader.CatalogLoadException.class,
                () -> loader.loadFile(catalog, write("syntax.json", "{ not json"), CatalogLayer.USER));
        assertThrows(EffectCatalogLoader.CatalogLoadException.class,
                () -> loader.loadFile(catalog, write("version.json", "{\"version\": \"2.0\", \"entries\": []}"),
                        CatalogLayer.USER));
        assertThrows(EffectCatalogLoader.CatalogLoadException.class,
                () -> loader.loadFile(catalog, write("nosig.json",
                        "{\"version\": \"1.0\", \"entries\": [{\"signature\": \"Save\", \"effects\": []}]}"),
                        CatalogLayer.USER));
        assertThrows(EffectCatalogLoader.CatalogLoadException.class,
                () -> loader.loadFile(catalog, write("nullentry.json",
                        "{\"version\": \"1.0\", \"entries\": [null]}"), CatalogLayer.USER));
        assertThrows(EffectCatalogLoader.CatalogLoadException.class,
                () -> loader.loadFile(catalog, write("nullcode.json",
                        "{\"version\": \"1.0\", \"entries\": [{\"signature\": \"A.B::C()\", \"effects\": [null]}]}"),
                        CatalogLayer.USER));

        EffectCatalogLoader.CatalogLoadException badCode = assertThrows(EffectCatalogLoader.CatalogLoadException.class,
                () -> loader.loadFile(catalog, write("code.json", """
                        {"version": "1.0", "entries": [
                          {"signature": "A.B::Good()", "effects": ["cw"]},
                          {"signature": "A.B::Bad()", "effects": ["teleport"]}
                        ]}
                        """), CatalogLayer.USER));
        assertTrue(badCode.getMessage().contains("teleport"));
        assertEquals(0, catalog.size(), "a rejected file adds nothing");
    }

    @Test
    void loadStandardSkipsBrokenUserCatalog() throws IOException {
        Path user = write("user.json", "{ broken");
        Path project = write("project.json", """
                {"version": "1.0", "entries": [{"signature": "Acme.Clock::Tick()", "effects": ["time"]}]}
                """);

        EffectCatalog catalog = new EffectCatalogLoader().loadStandard(user, project);

        assertEquals(codes("time"), catalog.resolve("Acme.Clock::Tick()").effects());
        assertEquals(codes("cw"), catalog.resolve("System.Console::WriteLine(System.String)").effects());
    }

    @Test
    void loadStandardSkipsProjectCatalogWithNullEntries() throws IOException {
        Path project = write("project-nulls.json", """
                {"version": "1.0", "entries": [
                  {"signature": "Acme.Clock::Tick()", "effects": ["time"]},
                  null,
                  {"signature": "Acme.Clock::Reset()", "effects": [null]}
                ]}
                """);

        EffectCatalog catalog = new EffectCatalogLoader().loadStandard(null, project);

        assertEquals(CatalogResolution.Status.UNRESOLVED, catalog.resolve("Acme.Clock::Tick()").status());
        assertEquals(codes("cw"), catalog.resolve("System.Console::WriteLine(System.String)").effects());
    }

    @Test
    void loadStandardToleratesAbsentFiles() {
        EffectCatalog catalog = new EffectCatalogLoader().loadStandard(
                tempDir.resolve("none-user.json"), null);
        assertTrue(catalog.size() > 0);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static <T> List<List<T>> permutations(List<T> items) {
        if (items.size() <= 1) return List.of(items);
        List<List<T>> result = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            List<T> rest = new ArrayList<>(items);
            T head = rest.remove(i);
            for (List<T> tail : permutations(rest)) {
                List<T> perm = new ArrayList<>();
                perm.add(head);
                perm.addAll(tail);
                result.add(perm);
            }
        }
        return result;
    }
}
