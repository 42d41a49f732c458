package com.calor.verification;

import com.calor.verification.cache.CacheResult;
import com.calor.verification.cache.ContractHasher;
import com.calor.verification.cache.VerificationCache;
import com.calor.verification.contract.ContractExpr;
import com.calor.verification.contract.ContractKind;
import com.calor.verification.contract.FunctionContracts;
import com.calor.verification.solver.ConstraintSolver;
import com.calor.verification.solver.ContractQuery;
import com.calor.verification.solver.VerificationResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks every contract of every function: cache first, solver on a miss, then store.
 *
 * Preconditions are checked on their own. Each postcondition is checked assuming all of the
 * function's preconditions, and that list is part of its cache key.
 */
public class ContractVerificationPass {

    private final ConstraintSolver solver;
    private final VerificationCache cache;
    private final ContractHasher hasher;

    public ContractVerificationPass(ConstraintSolver solver, VerificationCache cache) {
        this(solver, cache, new ContractHasher());
    }

    public ContractVerificationPass(ConstraintSolver solver, VerificationCache cache, ContractHasher hasher) {
        this.solver = solver;
        this.cache = cache;
        this.hasher = hasher;
    }

    public List<ContractOutcome> verify(List<FunctionContracts> functions) {
        List<ContractOutcome> outcomes = new ArrayList<>();
        for (FunctionContracts fn : functions) {
            outcomes.addAll(verifyFunction(fn));
        }
        return outcomes;
    }

    public List<ContractOutcome> verifyFunction(FunctionContracts fn) {
        List<ContractOutcome> outcomes = new ArrayList<>();
        List<ContractExpr> pres = fn.preconditions();
        for (int i = 0; i < pres.size(); i++) {
            ContractQuery query = new ContractQuery(fn.functionName(), ContractKind.PRE, i,
                    fn.parameters(), fn.outputType(), List.of(), pres.get(i));
            outcomes.add(check(query));
        }
        List<ContractExpr> posts = fn.postconditions();
        for (int i = 0; i < posts.size(); i++) {
            ContractQuery query = new ContractQuery(fn.functionName(), ContractKind.POST, i,
                    fn.parameters(), fn.outputType(), pres, posts.get(i));
            outcomes.add(check(query));
        }
        return outcomes;
    }

    private ContractOutcome check(ContractQuery query) {
        String hash = hasher.hash(query);

        CacheResult cached = cache.lookup(hash);
        if (cached.isHit()) {
            VerificationResult result = cached.result();
            return new ContractOutcome(query.functionName(), query.kind(), query.index(), hash, result, true);
        }

        VerificationResult result = solver.verify(query);
        // Write failures are already counted by the cache; verification carries on regardless.
        cache.store(hash, result);
        return new ContractOutcome(query.functionName(), query.kind(), query.index(), hash, result, false);
    }
}
