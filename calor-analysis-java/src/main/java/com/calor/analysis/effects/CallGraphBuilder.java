package com.calor.analysis.effects;

import com.calor.analysis.ir.BoundExpr.Call;
import com.calor.analysis.ir.BoundExpr.ObjectCreation;
import com.calor.analysis.ir.BoundExpr.PropertyGet;
import com.calor.analysis.ir.BoundFunction;
import com.calor.analysis.ir.BoundModule;
import com.calor.analysis.ir.BoundStatement.PropertySet;
import com.calor.analysis.ir.BoundTreeVisitor;
import com.calor.analysis.ir.SourceSpan;

import java.util.*;

/**
 * Extracts call edges from bound bodies. Method calls, property accessors and constructors all
 * count as calls. Calls inside lambdas and awaited expressions belong to the enclosing function.
 */
public class CallGraphBuilder extends BoundTreeVisitor {

    private Map<String, Integer> index;
    private List<List<CallGraph.Edge>> outgoing;
    private List<List<CallGraph.ExternalCall>> external;
    private int currentFunction = -1;

    public CallGraph build(BoundModule module) {
        List<String> names = new ArrayList<>();
        index = new HashMap<>();
        outgoing = new ArrayList<>();
        external = new ArrayList<>();
        for (BoundFunction fn : module.functions()) {
            if (index.putIfAbsent(fn.signature(), names.size()) != null) {
                throw new IllegalArgumentException("Duplicate function signature in module "
                        + module.name() + ": " + fn.signature());
            }
            names.add(fn.signature());
            outgoing.add(new ArrayList<>());
            external.add(new ArrayList<>());
        }
        for (BoundFunction fn : module.functions()) {
            currentFunction = index.get(fn.signature());
            accept(fn.body());
        }
        currentFunction = -1;
        return new CallGraph(names, outgoing, external);
    }

    @Override
    public boolean visit(Call node) {
        recordCall(node.signature(), node.span());
        return true;
    }

    @Override
    public boolean visit(PropertyGet node) {
        recordCall(node.accessorSignature(), node.span());
        return true;
    }

    @Override
    public boolean visit(PropertySet node) {
        recordCall(node.accessorSignature(), node.span());
        return true;
    }

    @Override
    public boolean visit(ObjectCreation node) {
        recordCall(node.constructorSignature(), node.span());
        return true;
    }

    private void recordCall(String signature, SourceSpan span) {
        if (currentFunction < 0) return;
        Integer callee = index.get(signature);
        if (callee != null) {
            // Keep the first call site per callee
            for (CallGraph.Edge existing : outgoing.get(currentFunction)) {
                if (existing.callee() == callee) return;
            }
            outgoing.get(currentFunction).add(new CallGraph.Edge(currentFunction, callee, span));
        } else {
            for (CallGraph.ExternalCall existing : external.get(currentFunction)) {
                if (existing.signature().equals(signature)) return;
            }
            external.get(currentFunction).add(new CallGraph.ExternalCall(currentFunction, signature, span));
        }
    }
}
