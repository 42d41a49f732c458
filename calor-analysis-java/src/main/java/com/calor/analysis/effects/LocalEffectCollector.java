package com.calor.analysis.effects;

import com.calor.analysis.ir.BoundExpr;
import com.calor.analysis.ir.BoundExpr.ObjectCreation;
import com.calor.analysis.ir.BoundExpr.VariableRef;
import com.calor.analysis.ir.BoundFunction;
import com.calor.analysis.ir.BoundStatement.Bind;
import com.calor.analysis.ir.BoundStatement.FieldAssign;
import com.calor.analysis.ir.BoundStatement.Print;
import com.calor.analysis.ir.BoundStatement.Throw;
import com.calor.analysis.ir.BoundTreeVisitor;
import com.calor.analysis.ir.FunctionKind;
import com.calor.analysis.ir.SourceSpan;

import java.util.*;

/**
 * Effects a function body performs itself, not through calls: console output, intentional
 * throws and writes to fields of objects it did not allocate. Each effect maps to the first span
 * that introduces it.
 */
final class LocalEffectCollector extends BoundTreeVisitor {


    private final Map<Effect, SourceSpan> effects = new TreeMap<>();
    private final Set<String> locallyAllocated;
    private final boolean constructor;

    private LocalEffectCollector(Set<String> locallyAllocated, boolean constructor) {
        this.locallyAllocated = locallyAllocated;
        this.constructor = constructor;
    }

    static Map<Effect, SourceSpan> collect(BoundFunction function) {
        LocalEffectCollector collector = new LocalEffectCollector(
                AllocationScan.scan(function), function.kind() == FunctionKind.CONSTRUCTOR);
        collector.accept(function.body());
        return collector.effects;
    }

    @Override
    public boolean visit(Print node) {
        effects.putIfAbsent(Effect.CONSOLE_WRITE, node.span());
        return true;
    }

    @Override
    public boolean visit(Throw node) {
        effects.putIfAbsent(Effect.THROW, node.span());
        return true;
    }

    @Override
    public boolean visit(FieldAssign node) {
        if (!isLocalObject(node.target())) {
            effects.putIfAbsent(Effect.HEAP_WRITE, node.span());
        }
        return true;
    }

    private boolean isLocalObject(BoundExpr target) {
        if (target instanceof ObjectCreation) return true;
        if (target instanceof VariableRef ref) {
            // A constructor initialising its own instance is not observable to callers.
            if (constructor && ref.name().equals(VariableRef.SELF)) return true;
            return locallyAllocated.contains(ref.name());
        }
        return false;
    }

    /** Variables whose every assignment in the function is a fresh allocation. */
    private static final class AllocationScan extends BoundTreeVisitor {
        private final Set<String> allocated = new HashSet<>();
        private final Set<String> other = new HashSet<>();

        static Set<String> scan(BoundFunction function) {
            AllocationScan scan = new AllocationScan();
            scan.accept(function.body());
            scan.allocated.removeAll(scan.other);
            for (var p : function.parameters()) {
                scan.allocated.remove(p.name());
            }
            return scan.allocated;
        }

        @Override
        public boolean visit(Bind node) {
            if (node.value() instanceof ObjectCreation) {
                allocated.add(node.variable());
            } else {
                other.add(node.variable());
            }
            return true;
        }
    }
}
