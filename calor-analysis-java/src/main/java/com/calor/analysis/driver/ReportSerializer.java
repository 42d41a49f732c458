package com.calor.analysis.driver;

import com.calor.analysis.diagnostics.CallSite;
import com.calor.analysis.diagnostics.Diagnostic;
import com.calor.analysis.effects.FunctionEffectProfile;
import com.calor.verification.ContractOutcome;
import com.calor.verification.cache.CacheStatistics;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Writes a {@link VerificationReport} to {@code verification_report.json}, with every array
 * sorted so identical runs produce identical files.
 */
public class ReportSerializer {

    public static final String REPORT_FILE = "verification_report.json";
    static final String REPORT_VERSION = "1.0";

    public static class ReportWriteException extends RuntimeException {
        public ReportWriteException(String msg, Throwable cause) { super(msg, cause); }
    }

    public Path write(VerificationReport report, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new ReportWriteException("Could not create output directory: " + outputDir, e);
        }

        var gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        Path reportPath = outputDir.resolve(REPORT_FILE);
        try (Writer w = Files.newBufferedWriter(reportPath, StandardCharsets.UTF_8)) {
            gson.toJson(toModel(report), w);
        } catch (IOException e) {
            throw new ReportWriteException("Failed to write " + REPORT_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[calor-verifier] " + REPORT_FILE + " written: " + reportPath);
        return reportPath;
    }

    ReportModel.ReportRoot toModel(VerificationReport report) {
        ReportModel.ReportRoot root = new ReportModel.ReportRoot();
        root.reportVersion = REPORT_VERSION;
        root.module = report.moduleName();
        root.passed = report.passed();

        root.diagnostics = new ArrayList<>();
        List<Diagnostic> diagnostics = new ArrayList<>(report.diagnostics());
        diagnostics.sort(Diagnostic.ORDER);
        for (Diagnostic d : diagnostics) {
            ReportModel.ReportDiagnostic rd = new ReportModel.ReportDiagnostic();
            rd.code = d.code();
            rd.severity = d.severity().name().toLowerCase(Locale.ROOT);
            rd.function = d.function();
            rd.message = d.message();
            rd.callChain = d.callChain().stream().map(CallSite::toString).toList();
            root.diagnostics.add(rd);
        }

        // Profiles are keyed by signature in a sorted map already.
        root.functions = new ArrayList<>();
        for (FunctionEffectProfile profile : report.effects().profiles().values()) {
            ReportModel.ReportFunction rf = new ReportModel.ReportFunction();
            rf.function = profile.function();
            rf.declaredEffects = profile.declared().surfaceCodes();
            rf.computedEffects = profile.computed().surfaceCodes();
            rf.accepted = profile.accepted();
            root.functions.add(rf);
        }
        root.components = report.effects().components();

        root.contracts = new ArrayList<>();
        List<ContractOutcome> contracts = new ArrayList<>(report.contracts());
        contracts.sort(Comparator.comparing(ContractOutcome::functionName)
                .thenComparing(ContractOutcome::kind)
                .thenComparingInt(ContractOutcome::index));
        for (ContractOutcome outcome : contracts) {
            ReportModel.ReportContract rc = new ReportModel.ReportContract();
            rc.function = outcome.functionName();
            rc.kind = outcome.kind().name().toLowerCase(Locale.ROOT);
            rc.index = outcome.index();
            rc.contractHash = outcome.contractHash();
            rc.status = outcome.result().status().name().toLowerCase(Locale.ROOT);
            rc.counterexample = outcome.result().counterexample();
            rc.durationMillis = outcome.result().duration().toMillis();
            rc.fromCache = outcome.fromCache();
            root.contracts.add(rc);
        }

        CacheStatistics stats = report.cacheStatistics();
        root.cache = new ReportModel.ReportCache();
        root.cache.hits = stats.hits();
        root.cache.misses = stats.misses();
        root.cache.writes = stats.writes();
        root.cache.errors = stats.errors();
        root.cache.evictions = stats.evictions();
        root.cache.hitRate = stats.hitRate();
        return root;
    }
}
