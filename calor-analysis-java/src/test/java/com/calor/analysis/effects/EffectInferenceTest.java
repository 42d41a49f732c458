package com.calor.analysis.effects;

import com.calor.analysis.diagnostics.CallSite;
import com.calor.analysis.diagnostics.Diagnostic;
import com.calor.analysis.diagnostics.DiagnosticBag;
import com.calor.analysis.diagnostics.DiagnosticCode;
import com.calor.analysis.diagnostics.Severity;
import com.calor.analysis.ir.BoundFunction;
import com.calor.analysis.ir.BoundModule;
import com.calor.analysis.ir.BoundStatement;
import com.calor.analysis.ir.FunctionKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.calor.analysis.ir.Ir.*;
import static org.junit.jupiter.api.Assertions.*;

class EffectInferenceTest {

    private static EffectCatalog catalog(String... signatureThenCodes) {
        EffectCatalog catalog = new EffectCatalog();
        for (String stub : signatureThenCodes) {
            String[] parts = stub.split("=", 2);
            List<String> codes = parts[1].isEmpty() ? List.of() : List.of(parts[1].split(","));
            catalog.add(new CatalogEntry(parts[0], EffectSet.parse(codes, c -> fail(c)), CatalogLayer.BUILT_IN, "test"));
        }
        return catalog;
    }

    private static EffectSet codes(String... codes) {
        return EffectSet.parse(List.of(codes), c -> fail(c));
    }

    @Test
    void effectsPropagateUpTheCallChain() {
        BoundModule module = module(
                fn("main", List.of(exec(call("save"))), "fs:w"),
                fn("save", List.of(exec(call("System.IO.File::WriteAllText(System.String,System.String)"))), "fs:w"));
        DiagnosticBag bag = new DiagnosticBag();

        EffectInferenceResult result = new EffectInference(
                catalog("System.IO.File::WriteAllText(System.String,System.String)=fs:w"), UnknownCallPolicy.STRICT)
                .infer(module, bag);

        assertTrue(result.allAccepted());
        assertEquals(codes("fs:w"), result.profile("main").computed());
        assertEquals(0, bag.size());
    }

    @Test
    void mutualRecursionReportsCalleeThatPrints() {
        BoundModule module = module(
                fn("A", List.of(exec(callAt(2, "B"))), "cw"),
                fn("B", List.of(printAt(7, lit(1)), exec(callAt(8, "A")))));
        DiagnosticBag bag = new DiagnosticBag();

        EffectInferenceResult result = new EffectInference(new EffectCatalog(), UnknownCallPolicy.STRICT).infer(module, bag);

        assertEquals(List.of(List.of("A", "B")), result.components());
        assertTrue(result.profile("A").accepted());
        assertEquals(codes("cw"), result.profile("A").computed(), "propagated around the cycle");
        FunctionEffectProfile b = result.profile("B");
        assertFalse(b.accepted());
        assertEquals(Effect.CONSOLE_WRITE, b.firstViolation());
        assertEquals(codes("cw"), b.computed());

        List<Diagnostic> errors = bag.withCode(DiagnosticCode.FORBIDDEN_EFFECT);
        assertEquals(1, errors.size());
        assertEquals("B", errors.get(0).function());
        assertEquals(List.of(new CallSite("B", at(7))), errors.get(0).callChain());
    }

    @Test
    void mutualRecursionReportsCallerWithShortestChain() {
        BoundModule module = module(
                fn("A", List.of(exec(callAt(2, "B")))),
                fn("B", List.of(printAt(7, lit(1)), exec(callAt(8, "A"))), "cw"));
        DiagnosticBag bag = new DiagnosticBag();

        new EffectInference(new EffectCatalog(), UnknownCallPolicy.STRICT).infer(module, bag);

        List<Diagnostic> errors = bag.withCode(DiagnosticCode.FORBIDDEN_EFFECT);
        assertEquals(1, errors.size());
        assertEquals("A", errors.get(0).function());
        assertEquals(List.of(new CallSite("A", at(2)), new CallSite("B", at(7))), errors.get(0).callChain());
        assertTrue(errors.get(0).message().contains("'cw'"));
    }

    @Test
    void chainFollowsTheShortestPath() {
        BoundModule module = module(
                fn("main", List.of(exec(callAt(1, "long1")), exec(callAt(2, "short")))),
                fn("long1", List.of(exec(callAt(10, "long2"))), "time"),
                fn("long2", List.of(exec(callAt(20, "clock"))), "time"),
                fn("short", List.of(exec(callAt(30, "clock"))), "time"),
                fn("clock", List.of(exec(callAt(40, "System.DateTime::get_Now()"))), "time"));
        DiagnosticBag bag = new DiagnosticBag();

        new EffectInference(catalog("System.DateTime::get_Now()=time"), UnknownCallPolicy.STRICT).infer(module, bag);

        Diagnostic error = bag.withCode(DiagnosticCode.FORBIDDEN_EFFECT).get(0);
        assertEquals(List.of("main", "short", "clock"),
                error.callChain().stream().map(CallSite::function).toList());
        assertEquals(at(40), error.callChain().get(2).span());
    }

    @Test
    void strictPolicyTreatsUnknownCallsAsUnknownEffects() {
        BoundModule module = module(fn("main", List.of(exec(call("Vendor.Sdk::Launch()"))), "cw"));
        DiagnosticBag bag = new DiagnosticBag();

        EffectInferenceResult result = new EffectInference(new EffectCatalog(), UnknownCallPolicy.STRICT).infer(module, bag);

        assertTrue(result.profile("main").computed().isUnknown());
        Diagnostic unknown = bag.withCode(DiagnosticCode.UNKNOWN_EXTERNAL_CALL).get(0);
        assertEquals(Severity.ERROR, unknown.severity());
        assertTrue(unknown.message().contains("Vendor.Sdk::Launch()"));
        assertEquals(1, bag.withCode(DiagnosticCode.FORBIDDEN_EFFECT).size());
    }

    @Test
    void warnPolicyTreatsUnknownCallsAsPure() {
        BoundModule module = module(fn("main", List.of(exec(call("Vendor.Sdk::Launch()")))));
        DiagnosticBag bag = new DiagnosticBag();

        EffectInferenceResult result = new EffectInference(new EffectCatalog(), UnknownCallPolicy.WARN).infer(module, bag);

        assertTrue(result.allAccepted());
        assertFalse(bag.hasErrors());
        assertEquals(Severity.WARNING, bag.withCode(DiagnosticCode.UNKNOWN_EXTERNAL_CALL).get(0).severity());
    }

    @Test
    void ambiguousStubIsAnErrorButStillContributesItsUnion() {
        EffectCatalog catalog = new EffectCatalog();
        catalog.add(new CatalogEntry("Acme.Metrics::Emit()", codes("net:w"), CatalogLayer.PROJECT, "one.json"));
        catalog.add(new CatalogEntry("Acme.Metrics::Emit()", codes("cw"), CatalogLayer.PROJECT, "two.json"));
        BoundModule module = module(fn("main", List.of(exec(call("Acme.Metrics::Emit()"))), "cw", "net:w"));
        DiagnosticBag bag = new DiagnosticBag();

        EffectInferenceResult result = new EffectInference(catalog, UnknownCallPolicy.STRICT).infer(module, bag);

        assertEquals(codes("cw", "net:w"), result.profile("main").computed());
        Diagnostic ambiguous = bag.withCode(DiagnosticCode.AMBIGUOUS_STUB).get(0);
        assertTrue(ambiguous.isError());
        assertTrue(ambiguous.message().contains("one.json"));
        assertTrue(ambiguous.message().contains("two.json"));
        assertTrue(bag.withCode(DiagnosticCode.FORBIDDEN_EFFECT).isEmpty());
    }

    @Test
    void effectsInsideLambdasBelongToTheEnclosingFunction() {
        BoundModule module = module(fn("main", List.of(
                bind("callback", lambda(List.of("x"), print(ref("x")))),
                exec(call("run", ref("callback"))))),
                fn("run", List.of()));
        DiagnosticBag bag = new DiagnosticBag();

        EffectInferenceResult result = new EffectInference(new EffectCatalog(), UnknownCallPolicy.STRICT).infer(module, bag);

        assertEquals(codes("cw"), result.profile("main").computed());
        assertTrue(result.profile("run").computed().isEmpty());
    }

    @Test
    void writingFieldsOfLocallyAllocatedObjectsIsNotMutation() {
        EffectCatalog catalog = catalog("Acme.Point::.ctor()=");
        BoundModule module = module(
                fn("build", List.of(
                        bind("p", newObject("Acme.Point")),
                        setField(ref("p"), "x", lit(1)),
                        ret(ref("p")))),
                fn("move", List.of(param("p", "Acme.Point")), List.of(
                        setField(ref("p"), "x", lit(2)))),
                new BoundFunction("Acme.Point::.ctor()", FunctionKind.CONSTRUCTOR, List.of(), null,
                        List.of(setField(ref("this"), "x", lit(0))), List.of(), List.of(), List.of()));
        DiagnosticBag bag = new DiagnosticBag();

        EffectInferenceResult result = new EffectInference(catalog, UnknownCallPolicy.STRICT).infer(module, bag);

        assertTrue(result.profile("build").accepted());
        assertTrue(result.profile("Acme.Point::.ctor()").accepted());
        assertEquals(codes("mut"), result.profile("move").computed());
        assertFalse(result.profile("move").accepted());
    }

    @Test
    void readWriteDeclarationCoversRead() {
        BoundModule module = module(fn("load",
                List.of(exec(call("System.IO.File::ReadAllText(System.String)"))), "fs:rw"));
        DiagnosticBag bag = new DiagnosticBag();

        EffectInferenceResult result = new EffectInference(
                catalog("System.IO.File::ReadAllText(System.String)=fs:r"), UnknownCallPolicy.STRICT).infer(module, bag);

        assertTrue(result.allAccepted());
        assertFalse(bag.hasErrors());
    }

    @Test
    void unrecognizedDeclaredCodeIsWarnedAndIgnored() {
        BoundModule module = module(fn("f", List.of(raise(lit(1))), "throw", "teleport"));
        DiagnosticBag bag = new DiagnosticBag();

        EffectInferenceResult result = new EffectInference(new EffectCatalog(), UnknownCallPolicy.STRICT).infer(module, bag);

        assertTrue(result.profile("f").accepted());
        assertEquals(1, bag.withCode(DiagnosticCode.UNRECOGNIZED_EFFECT_CODE).size());
    }

    @Test
    void parallelInferenceMatchesSequential() throws Exception {
        BoundModule module = layeredModule(6, 8);
        EffectCatalog catalog = catalog("System.Console::WriteLine(System.String)=cw", "System.Random::Next()=rand");

        DiagnosticBag sequentialBag = new DiagnosticBag();
        EffectInferenceResult sequential = new EffectInference(catalog, UnknownCallPolicy.STRICT)
                .infer(module, sequentialBag);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            for (int run = 0; run < 5; run++) {
                DiagnosticBag parallelBag = new DiagnosticBag();
                EffectInferenceResult parallel = new EffectInference(catalog, UnknownCallPolicy.STRICT, pool)
                        .infer(module, parallelBag);
                assertEquals(sequential.profiles(), parallel.profiles());
                assertEquals(sequentialBag.sorted(), parallelBag.sorted());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    /** Layers of functions; each calls two functions of the next layer, and the bottom layer hits the catalog. */
    private static BoundModule layeredModule(int layers, int width) {
        List<BoundFunction> functions = new ArrayList<>();
        for (int layer = 0; layer < layers; layer++) {
            for (int i = 0; i < width; i++) {
                List<BoundStatement> body = new ArrayList<>();
                if (layer + 1 < layers) {
                    body.add(exec(call("f" + (layer + 1) + "_" + i)));
                    body.add(exec(call("f" + (layer + 1) + "_" + ((i + 1) % width))));
                } else if (i % 2 == 0) {
                    body.add(exec(call("System.Console::WriteLine(System.String)")));
                } else {
                    body.add(exec(call("System.Random::Next()")));
                }
                // Every third function in a layer also calls back up, forming cycles across layers.
                if (layer > 0 && i % 3 == 0) {
                    body.add(exec(call("f" + (layer - 1) + "_" + i)));
                }
                String[] declared = i % 4 == 0 ? new String[]{"cw", "rand"} : new String[]{"cw"};
                functions.add(fn("f" + layer + "_" + i, body, declared));
            }
        }
        return new BoundModule("layered", functions);
    }
}
