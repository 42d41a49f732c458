package com.calor.analysis.cfg;

import com.calor.analysis.ir.BoundExpr.VariableRef;
import com.calor.analysis.ir.BoundFunction;
import com.calor.analysis.ir.BoundStatement;
import com.calor.analysis.ir.BoundStatement.*;
import com.calor.analysis.ir.FunctionKind;
import com.calor.verification.contract.Parameter;

import java.util.*;

/**
 * Lowers a structured function body into a {@link ControlFlowGraph}.
 *
 * <p>Block 0 is the entry and block 1 the exit. {@code return} and {@code throw} end their block
 * with an edge to the exit. Blocks that cannot be reached from the entry are dropped before
 * definition sites are numbered, so ids are dense over live code.
 */
public class CfgBuilder {

    public static final int ENTRY_ID = 0;
    public static final int EXIT_ID = 1;

    public static class MalformedCfgException extends RuntimeException {
        public MalformedCfgException(String message) { super(message); }
    }

    public ControlFlowGraph build(BoundFunction function) {
        return new Lowering(function).run();
    }

    private record LoopTargets(BasicBlock header, BasicBlock after) {}

    /** State for lowering one function. */
    private static final class Lowering {
        private final BoundFunction function;
        private final List<BasicBlock> blocks = new ArrayList<>();
        private final Map<BasicBlock, List<BoundStatement>> pending = new HashMap<>();
        private final Deque<LoopTargets> loops = new ArrayDeque<>();
        private final BasicBlock entry;
        private final BasicBlock exit;
        private int nextId = 0;

        Lowering(BoundFunction function) {
            this.function = function;
            this.entry = newBlock();
            this.exit = newBlock();
        }

        ControlFlowGraph run() {
            BasicBlock end = lower(function.body(), entry);
            if (end != null) {
                end.addSuccessor(exit);
            }
            List<BasicBlock> live = removeUnreachable();
            validate(live);
            List<DefinitionSite> definitions = placeInstructions(live);
            return new ControlFlowGraph(function.signature(), entry, exit, live, definitions);
        }

        private BasicBlock newBlock() {
            BasicBlock block = new BasicBlock(nextId++);
            blocks.add(block);
            pending.put(block, new ArrayList<>());
            return block;
        }

        /** Lowers {@code statements} starting in {@code current}; returns the open block, or null if control left. */
        private BasicBlock lower(List<BoundStatement> statements, BasicBlock current) {
            for (BoundStatement statement : statements) {
                if (current == null) {
                    // Code after return/break/continue; kept only until pruning.
                    current = newBlock();
                }
                current = lowerOne(statement, current);
            }
            return current;
        }

        private BasicBlock lowerOne(BoundStatement statement, BasicBlock current) {
            if (statement instanceof If s) {
                current.setBranchCondition(s.condition());
                BasicBlock whenTrue = newBlock();
                BasicBlock whenFalse = newBlock();
                current.addSuccessor(whenTrue);
                current.addSuccessor(whenFalse);
                BasicBlock trueEnd = lower(s.thenBody(), whenTrue);
                BasicBlock falseEnd = lower(s.elseBody(), whenFalse);
                if (trueEnd == null && falseEnd == null) {
                    return null;
                }
                BasicBlock join = newBlock();
                if (trueEnd != null) trueEnd.addSuccessor(join);
                if (falseEnd != null) falseEnd.addSuccessor(join);
                return join;
            }
            if (statement instanceof While s) {
                BasicBlock header = newBlock();
                current.addSuccessor(header);
                header.setBranchCondition(s.condition());
                BasicBlock body = newBlock();
                BasicBlock after = newBlock();
                header.addSuccessor(body);
                header.addSuccessor(after);
                loops.push(new LoopTargets(header, after));
                BasicBlock bodyEnd = lower(s.body(), body);
                loops.pop();
                if (bodyEnd != null) {
                    bodyEnd.addSuccessor(header);
                }
                return after;
            }
            if (statement instanceof Break) {
                current.addSuccessor(innermostLoop("break").after());
                return null;
            }
            if (statement instanceof Continue) {
                current.addSuccessor(innermostLoop("continue").header());
                return null;
            }
            pending.get(current).add(statement);
            if (statement instanceof Return || statement instanceof Throw) {
                current.addSuccessor(exit);
                return null;
            }
            return current;
        }

        private LoopTargets innermostLoop(String keyword) {
            LoopTargets loop = loops.peek();
            if (loop == null) {
                throw new MalformedCfgException("'" + keyword + "' outside of a loop in " + function.signature());
            }
            return loop;
        }

        private List<BasicBlock> removeUnreachable() {
            Set<BasicBlock> reached = new HashSet<>();
            Deque<BasicBlock> work = new ArrayDeque<>();
            work.push(entry);
            reached.add(entry);
            while (!work.isEmpty()) {
                for (BasicBlock succ : work.pop().successors()) {
                    if (reached.add(succ)) work.push(succ);
                }
            }
            // The exit stays even when no path reaches it (a loop that never terminates).
            reached.add(exit);

            List<BasicBlock> live = new ArrayList<>();
            for (BasicBlock block : blocks) {
                if (reached.contains(block)) {
                    live.add(block);
                } else {
                    for (BasicBlock succ : block.successors()) {
                        succ.removePredecessor(block);
                    }
                }
            }
            return live;
        }

        private void validate(List<BasicBlock> live) {
            for (BasicBlock block : live) {
                int expected = block == exit ? 0 : block.hasBranch() ? 2 : 1;
                if (block.successors().size() != expected) {
                    throw new MalformedCfgException("Block " + block + " of " + function.signature()
                            + " has " + block.successors().size() + " successors, expected " + expected);
                }
                if (block == exit && !pending.get(block).isEmpty()) {
                    throw new MalformedCfgException("Exit block of " + function.signature() + " holds statements");
                }
            }
        }

        private List<DefinitionSite> placeInstructions(List<BasicBlock> live) {
            List<DefinitionSite> definitions = new ArrayList<>();
            for (Parameter p : function.parameters()) {
                definitions.add(new DefinitionSite(definitions.size(), p.name(), entry.id(),
                        DefinitionSite.PARAMETER_INDEX, null));
            }
            if (hasImplicitReceiver(live)) {
                definitions.add(new DefinitionSite(definitions.size(), VariableRef.SELF, entry.id(),
                        DefinitionSite.PARAMETER_INDEX, null));
            }
            for (BasicBlock block : live) {
                List<BoundStatement> statements = pending.get(block);
                for (int i = 0; i < statements.size(); i++) {
                    BoundStatement statement = statements.get(i);
                    DefinitionSite definition = null;
                    if (statement instanceof Bind bind) {
                        definition = new DefinitionSite(definitions.size(), bind.variable(), block.id(), i, statement);
                        definitions.add(definition);
                    }
                    block.mutableInstructions().add(
                            new Instruction(block.id(), i, statement, definition, VariableUses.of(statement)));
                }
            }
            return definitions;
        }

        /** Constructors and accessors always have a receiver; other functions get one if they read it. */
        private boolean hasImplicitReceiver(List<BasicBlock> live) {
            for (Parameter p : function.parameters()) {
                if (p.name().equals(VariableRef.SELF)) return false;
            }
            if (function.kind() != FunctionKind.FUNCTION) return true;
            for (BasicBlock block : live) {
                if (block.conditionUses().contains(VariableRef.SELF)) return true;
                for (BoundStatement statement : pending.get(block)) {
                    if (VariableUses.of(statement).contains(VariableRef.SELF)) return true;
                }
            }
            return false;
        }
    }
}
