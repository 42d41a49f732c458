package com.calor.analysis.driver;

import com.calor.analysis.diagnostics.Diagnostic;
import com.calor.analysis.effects.EffectInferenceResult;
import com.calor.verification.ContractOutcome;
import com.calor.verification.cache.CacheStatistics;

import java.util.List;

/**
 * Everything one run of the driver produced. Diagnostics are already in their fixed order.
 */
public record VerificationReport(
        String moduleName,
        List<Diagnostic> diagnostics,
        EffectInferenceResult effects,
        List<ContractOutcome> contracts,
        CacheStatistics cacheStatistics
) {
    public VerificationReport {
        diagnostics = List.copyOf(diagnostics);
        contracts = List.copyOf(contracts);
    }

    public boolean passed() {
        return diagnostics.stream().noneMatch(Diagnostic::isError);
    }

    public List<Diagnostic> withCode(String code) {
        return diagnostics.stream().filter(d -> d.code().equals(code)).toList();
    }
}
