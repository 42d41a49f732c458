package com.calor.analysis.validation;

import com.calor.analysis.cfg.BasicBlock;
import com.calor.analysis.cfg.ControlFlowGraph;
import com.calor.analysis.cfg.DefinitionSite;
import com.calor.analysis.cfg.Instruction;
import com.calor.analysis.dataflow.analyses.LiveVariables;
import com.calor.analysis.dataflow.analyses.ReachingDefinitions;
import com.calor.analysis.diagnostics.DiagnosticBag;
import com.calor.analysis.diagnostics.DiagnosticCode;

import java.util.Set;
import java.util.TreeSet;

/**
 * Checks a lowered function before it is accepted: every read must be reached by at least one
 * definition, and (optionally) every assignment should be read.
 */
public class IrValidator {

    private final boolean reportDeadAssignments;

    public IrValidator(boolean reportDeadAssignments) {
        this.reportDeadAssignments = reportDeadAssignments;
    }

    /** @return true when no error was reported for this function */
    public boolean validate(ControlFlowGraph cfg, DiagnosticBag diagnostics) {
        String function = cfg.functionSignature();
        ReachingDefinitions reaching = ReachingDefinitions.analyze(cfg);
        boolean ok = true;

        for (BasicBlock block : cfg.blocks()) {
            for (Instruction instruction : block.instructions()) {
                for (String variable : new TreeSet<>(instruction.uses())) {
                    if (reaching.definitionsReaching(instruction, variable).isEmpty()) {
                        diagnostics.error(DiagnosticCode.USE_WITHOUT_DEFINITION, function,
                                "'" + variable + "' is read at " + instruction.statement().span()
                                        + " in " + function + " before any assignment reaches it");
                        ok = false;
                    }
                }
            }
            Set<String> conditionUses = new TreeSet<>(block.conditionUses());
            for (String variable : conditionUses) {
                if (reaching.definitionsReachingBranch(block.id(), variable).isEmpty()) {
                    diagnostics.error(DiagnosticCode.USE_WITHOUT_DEFINITION, function,
                            "'" + variable + "' is read by the branch condition of " + block
                                    + " in " + function + " before any assignment reaches it");
                    ok = false;
                }
            }
        }

        if (reportDeadAssignments) {
            for (DefinitionSite dead : LiveVariables.analyze(cfg).deadAssignments()) {
                diagnostics.warning(DiagnosticCode.DEAD_ASSIGNMENT, function,
                        "Value assigned to '" + dead.variable() + "' at " + dead.statement().span()
                                + " in " + function + " is never read");
            }
        }
        return ok;
    }
}
