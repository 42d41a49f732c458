package com.calor.analysis.dataflow;

import com.calor.analysis.cfg.BasicBlock;
import com.calor.analysis.cfg.ControlFlowGraph;
import com.calor.analysis.cfg.Instruction;

import java.util.*;

/**
 * Round-robin fixpoint solver for monotone dataflow problems.
 *
 * <p>Forward: {@code In[b] = join(Out[p])} over predecessors, the boundary fact at the entry, and
 * {@code Out[b] = transfer(b, In[b])}. Backward is the mirror image with the boundary at the exit.
 * Blocks are visited in reverse post-order for forward problems and post-order for backward ones.
 * Passes repeat until one changes nothing.
 *
 * <p>A fact that shrinks between passes means the transfer function is not monotonic and the
 * solve is aborted. The number of passes is capped by lattice height times block count.
 */
public final class DataflowEngine<F> {

    public static class DataflowException extends RuntimeException {
        public DataflowException(String message) { super(message); }
    }

    private final Lattice<F> lattice;
    private final TransferFunction<F> transfer;
    private final Direction direction;

    public DataflowEngine(Lattice<F> lattice, TransferFunction<F> transfer, Direction direction) {
        this.lattice = lattice;
        this.transfer = transfer;
        this.direction = direction;
    }

    public DataflowResult<F> solve(ControlFlowGraph cfg) {
        return solve(cfg, lattice.bottom());
    }

    /**
     * @param boundary fact at the entry's In (forward) or the exit's Out (backward)
     */
    public DataflowResult<F> solve(ControlFlowGraph cfg, F boundary) {
        List<BasicBlock> order = visitOrder(cfg);
        BasicBlock boundaryBlock = direction == Direction.FORWARD ? cfg.entry() : cfg.exit();

        // "head" is the side facts flow into (In for forward), "tail" the side they leave by.
        Map<Integer, F> head = new HashMap<>();
        Map<Integer, F> tail = new HashMap<>();
        for (BasicBlock b : order) {
            head.put(b.id(), lattice.bottom());
            tail.put(b.id(), lattice.bottom());
        }

        long maxPasses = (long) (lattice.height() + 1) * order.size() * 2 + 2;
        int passes = 0;
        boolean changed = true;
        while (changed) {
            if (++passes > maxPasses) {
                throw new DataflowException("No fixpoint for " + cfg.functionSignature()
                        + " after " + maxPasses + " passes");
            }
            changed = false;
            for (BasicBlock block : order) {
                F incoming = block == boundaryBlock ? boundary : lattice.bottom();
                for (BasicBlock neighbour : flowSources(block)) {
                    incoming = lattice.join(incoming, tail.get(neighbour.id()));
                }
                F outgoing = transferBlock(block, incoming);

                F oldHead = head.get(block.id());
                F oldTail = tail.get(block.id());
                if (!lattice.lessOrEqual(oldHead, incoming) || !lattice.lessOrEqual(oldTail, outgoing)) {
                    throw new DataflowException("Fact shrank at " + block + " of " + cfg.functionSignature()
                            + "; transfer function is not monotonic");
                }
                if (!oldHead.equals(incoming) || !oldTail.equals(outgoing)) {
                    head.put(block.id(), incoming);
                    tail.put(block.id(), outgoing);
                    changed = true;
                }
            }
        }

        Map<Integer, BlockFacts<F>> facts = new TreeMap<>();
        for (BasicBlock b : order) {
            F h = head.get(b.id());
            F t = tail.get(b.id());
            facts.put(b.id(), direction == Direction.FORWARD ? new BlockFacts<>(h, t) : new BlockFacts<>(t, h));
        }
        return new DataflowResult<>(facts, passes);
    }

    /**
     * Pushes {@code fact} through a whole block in the analysis direction: instructions then
     * branch for forward, branch then instructions in reverse for backward.
     */
    public F transferBlock(BasicBlock block, F fact) {
        List<Instruction> instructions = block.instructions();
        if (direction == Direction.FORWARD) {
            for (Instruction instruction : instructions) {
                fact = transfer.apply(instruction, fact);
            }
            return transfer.applyBranch(block, fact);
        }
        fact = transfer.applyBranch(block, fact);
        for (int i = instructions.size() - 1; i >= 0; i--) {
            fact = transfer.apply(instructions.get(i), fact);
        }
        return fact;
    }

    private List<BasicBlock> flowSources(BasicBlock block) {
        return direction == Direction.FORWARD ? block.predecessors() : block.successors();
    }

    private List<BasicBlock> visitOrder(ControlFlowGraph cfg) {
        List<BasicBlock> order = direction == Direction.FORWARD ? cfg.reversePostOrder() : cfg.postOrder();
        if (order.size() < cfg.blocks().size()) {
            // The exit is kept even when unreachable; give it a slot so every block has facts.
            Set<Integer> seen = new HashSet<>();
            for (BasicBlock b : order) seen.add(b.id());
            order = new ArrayList<>(order);
            for (BasicBlock b : cfg.blocks()) {
                if (!seen.contains(b.id())) {
                    if (direction == Direction.FORWARD) order.add(b); else order.add(0, b);
                }
            }
        }
        return order;
    }
}
