package com.calor.analysis.cfg;

import com.calor.analysis.ir.BoundExpr;
import com.calor.analysis.ir.BoundExpr.Lambda;
import com.calor.analysis.ir.BoundExpr.VariableRef;
import com.calor.analysis.ir.BoundStatement;
import com.calor.analysis.ir.BoundStatement.Bind;
import com.calor.analysis.ir.BoundTreeVisitor;

import java.util.*;

/**
 * Collects the local variables an instruction or branch condition reads. Names bound inside a
 * lambda (its parameters and its own locals) are not reads of the enclosing function.
 */
final class VariableUses extends BoundTreeVisitor {

    private final Set<String> uses = new TreeSet<>();
    private final Deque<Set<String>> lambdaScopes = new ArrayDeque<>();

    static Set<String> of(BoundStatement statement) {
        VariableUses collector = new VariableUses();
        collector.accept(statement);
        return Collections.unmodifiableSet(collector.uses);
    }

    static Set<String> of(BoundExpr expr) {
        VariableUses collector = new VariableUses();
        collector.accept(expr);
        return Collections.unmodifiableSet(collector.uses);
    }

    @Override
    public void visit(VariableRef node) {
        for (Set<String> scope : lambdaScopes) {
            if (scope.contains(node.name())) return;
        }
        uses.add(node.name());
    }

    @Override
    public boolean visit(Bind node) {
        if (!lambdaScopes.isEmpty()) {
            lambdaScopes.peek().add(node.variable());
        }
        return true;
    }

    @Override
    public boolean visit(Lambda node) {
        lambdaScopes.push(new HashSet<>(node.parameters()));
        return true;
    }

    @Override
    public void endVisit(Lambda node) {
        lambdaScopes.pop();
    }
}
