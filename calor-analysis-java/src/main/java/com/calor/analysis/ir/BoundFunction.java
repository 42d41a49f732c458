package com.calor.analysis.ir;

import com.calor.verification.contract.ContractExpr;
import com.calor.verification.contract.FunctionContracts;
import com.calor.verification.contract.Parameter;

import java.util.List;

/**
 * A bound function body as handed over by the binder.
 *
 * @param signature       unique name, in the same {@code Type::Method(ParamTypes)} form calls use
 * @param outputType      null when the function returns nothing
 * @param declaredEffects surface effect codes as authored, e.g. {@code cw} or {@code fs:r}
 */
public record BoundFunction(
        String signature,
        FunctionKind kind,
        List<Parameter> parameters,
        String outputType,
        List<BoundStatement> body,
        List<String> declaredEffects,
        List<ContractExpr> preconditions,
        List<ContractExpr> postconditions
) {
    public BoundFunction {
        parameters = List.copyOf(parameters);
        body = List.copyOf(body);
        declaredEffects = List.copyOf(declaredEffects);
        preconditions = List.copyOf(preconditions);
        postconditions = List.copyOf(postconditions);
    }

    public FunctionContracts contracts() {
        return new FunctionContracts(signature, parameters, outputType, preconditions, postconditions);
    }
}
