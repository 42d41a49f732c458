package com.calor.verification.contract;

import java.util.List;

/**
 * The contract-relevant slice of one bound function: its signature context and the
 * ordered pre- and postconditions. {@code outputType} is null for functions with no result.
 */
public record FunctionContracts(
        String functionName,
        List<Parameter> parameters,
        String outputType,
        List<ContractExpr> preconditions,
        List<ContractExpr> postconditions
) {
    public FunctionContracts {
        parameters = List.copyOf(parameters);
        preconditions = List.copyOf(preconditions);
        postconditions = List.copyOf(postconditions);
    }

    public boolean isEmpty() {
        return preconditions.isEmpty() && postconditions.isEmpty();
    }
}
