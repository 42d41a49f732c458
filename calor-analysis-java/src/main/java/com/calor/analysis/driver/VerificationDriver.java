package com.calor.analysis.driver;

import com.calor.analysis.cfg.CfgBuilder;
import com.calor.analysis.cfg.ControlFlowGraph;
import com.calor.analysis.config.VerifierConfig;
import com.calor.analysis.diagnostics.DiagnosticBag;
import com.calor.analysis.diagnostics.DiagnosticCode;
import com.calor.analysis.effects.CallGraph;
import com.calor.analysis.effects.CallGraphBuilder;
import com.calor.analysis.effects.EffectCatalog;
import com.calor.analysis.effects.EffectInference;
import com.calor.analysis.effects.EffectInferenceResult;
import com.calor.analysis.ir.BoundFunction;
import com.calor.analysis.ir.BoundModule;
import com.calor.analysis.validation.IrValidator;
import com.calor.verification.ContractOutcome;
import com.calor.verification.ContractVerificationPass;
import com.calor.verification.cache.CacheStatistics;
import com.calor.verification.cache.VerificationCache;
import com.calor.verification.contract.FunctionContracts;
import com.calor.verification.solver.ConstraintSolver;
import com.calor.verification.solver.TimeBoundedSolver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.*;

/**
 * Runs the verification middle-end over one module:
 * <ol>
 *   <li>CFG construction and IR validation, one task per function</li>
 *   <li>effect inference over the call graph</li>
 *   <li>contract verification through the cache</li>
 * </ol>
 * The catalog, solver and cache are supplied by the caller, who owns their lifecycle.
 */
public class VerificationDriver {

    private final VerifierConfig config;
    private final EffectCatalog catalog;
    private final ConstraintSolver solver;
    private final VerificationCache cache;

    public VerificationDriver(VerifierConfig config, EffectCatalog catalog,
                              ConstraintSolver solver, VerificationCache cache) {
        this.config = config;
        this.catalog = catalog;
        this.solver = solver;
        this.cache = cache;
    }

    public VerificationReport verify(BoundModule module) {
        DiagnosticBag diagnostics = new DiagnosticBag();
        int parallelism = config.getParallelism();
        ExecutorService pool = parallelism > 1 ? Executors.newFixedThreadPool(parallelism, r -> {
            Thread t = new Thread(r, "calor-verifier-worker");
            t.setDaemon(true);
            return t;
        }) : null;

        try {
            // 1. Per-function CFG validation
            System.err.println("[calor-verifier] Validating " + module.functions().size()
                    + " functions in " + module.name());
            validateFunctions(module, diagnostics, pool);

            // 2. Effect inference
            CallGraph graph = new CallGraphBuilder().build(module);
            System.err.println("[calor-verifier] Call graph: " + graph.size() + " functions, "
                    + graph.edgeCount() + " edges");
            EffectInferenceResult effects = new EffectInference(catalog, config.getUnknownCallPolicy(), pool)
                    .infer(module, graph, diagnostics);
            long rejected = effects.profiles().values().stream().filter(p -> !p.accepted()).count();
            System.err.println("[calor-verifier] Effect inference complete: "
                    + effects.components().size() + " components, " + rejected + " violations");

            // 3. Contracts
            List<ContractOutcome> contracts = verifyContracts(module, diagnostics);
            CacheStatistics stats = cache.statistics();
            System.err.println("[calor-verifier] Contracts checked: " + contracts.size()
                    + " (cache hits=" + stats.hits() + ", misses=" + stats.misses()
                    + ", writes=" + stats.writes() + ", errors=" + stats.errors()
                    + ", evictions=" + stats.evictions()
                    + String.format(", hit rate=%.1f%%)", stats.hitRate()));

            return new VerificationReport(module.name(), diagnostics.sorted(), effects, contracts, stats);
        } finally {
            if (pool != null) {
                pool.shutdownNow();
            }
        }
    }

    private void validateFunctions(BoundModule module, DiagnosticBag diagnostics, ExecutorService pool) {
        IrValidator validator = new IrValidator(config.isReportDeadAssignments());
        CfgBuilder builder = new CfgBuilder();
        if (pool == null) {
            for (BoundFunction fn : module.functions()) {
                validateOne(fn, builder, validator, diagnostics);
            }
            return;
        }
        List<Future<?>> futures = new ArrayList<>();
        for (BoundFunction fn : module.functions()) {
            futures.add(pool.submit(() -> validateOne(fn, builder, validator, diagnostics)));
        }
        for (Future<?> f : futures) {
            try {
                f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while validating " + module.name(), e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof RuntimeException re) throw re;
                throw new IllegalStateException("Validation failed for " + module.name(), e.getCause());
            }
        }
    }

    private static void validateOne(BoundFunction fn, CfgBuilder builder, IrValidator validator, DiagnosticBag diagnostics) {
        ControlFlowGraph cfg = builder.build(fn);
        validator.validate(cfg, diagnostics);
    }

    private List<ContractOutcome> verifyContracts(BoundModule module, DiagnosticBag diagnostics) {
        List<FunctionContracts> withContracts = new ArrayList<>();
        for (BoundFunction fn : module.functions()) {
            FunctionContracts contracts = fn.contracts();
            if (!contracts.isEmpty()) withContracts.add(contracts);
        }
        if (withContracts.isEmpty()) {
            return List.of();
        }

        long timeout = config.getSolverTimeoutMillis();
        List<ContractOutcome> outcomes;
        if (timeout > 0) {
            try (TimeBoundedSolver bounded = new TimeBoundedSolver(solver, Duration.ofMillis(timeout))) {
                outcomes = new ContractVerificationPass(bounded, cache).verify(withContracts);
            }
        } else {
            outcomes = new ContractVerificationPass(solver, cache).verify(withContracts);
        }

        for (ContractOutcome outcome : outcomes) {
            switch (outcome.result().status()) {
                case DISPROVEN -> diagnostics.error(DiagnosticCode.CONTRACT_DISPROVEN, outcome.functionName(),
                        "Contract " + outcome.label() + " does not hold"
                                + (outcome.result().counterexample() != null
                                        ? "; counterexample: " + outcome.result().counterexample() : ""));
                case UNSUPPORTED -> diagnostics.info(DiagnosticCode.CONTRACT_UNVERIFIED, outcome.functionName(),
                        "Contract " + outcome.label() + " uses constructs the solver cannot encode; checked at runtime");
                case SKIPPED -> diagnostics.info(DiagnosticCode.CONTRACT_UNVERIFIED, outcome.functionName(),
                        "Contract " + outcome.label() + " was not verified in time; checked at runtime");
                case PROVEN -> { }
            }
        }
        return outcomes;
    }
}
