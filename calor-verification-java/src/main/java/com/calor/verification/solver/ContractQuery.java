package com.calor.verification.solver;

import com.calor.verification.contract.ContractExpr;
import com.calor.verification.contract.ContractKind;
import com.calor.verification.contract.Parameter;

import java.util.List;

/**
 * What the solver is asked to decide: {@code goal} under the function's signature, assuming
 * {@code assumptions}. Preconditions carry no assumptions; postconditions assume every precondition.
 */
public record ContractQuery(
        String functionName,
        ContractKind kind,
        int index,
        List<Parameter> parameters,
        String outputType,
        List<ContractExpr> assumptions,
        ContractExpr goal
) {
    public ContractQuery {
        parameters = List.copyOf(parameters);
        assumptions = List.copyOf(assumptions);
    }

    /** Stable label for diagnostics and reports, e.g. {@code withdraw#post[1]}. */
    public String label() {
        return kind.label(functionName, index);
    }
}
