package com.calor.analysis.cfg;

import java.util.*;

/**
 * Immutable control-flow graph of one function body. Owns all of its blocks and definition sites.
 */
public final class ControlFlowGraph {

    private final String functionSignature;
    private final BasicBlock entry;
    private final BasicBlock exit;
    private final List<BasicBlock> blocks;
    private final Map<Integer, BasicBlock> byId;
    private final List<DefinitionSite> definitions;
    private final Map<String, List<DefinitionSite>> definitionsByVariable;

    ControlFlowGraph(String functionSignature, BasicBlock entry, BasicBlock exit,
                     List<BasicBlock> blocks, List<DefinitionSite> definitions) {
        this.functionSignature = functionSignature;
        this.entry = entry;
        this.exit = exit;
        List<BasicBlock> sorted = new ArrayList<>(blocks);
        sorted.sort(Comparator.comparingInt(BasicBlock::id));
        this.blocks = Collections.unmodifiableList(sorted);
        Map<Integer, BasicBlock> index = new LinkedHashMap<>();
        for (BasicBlock b : sorted) index.put(b.id(), b);
        this.byId = Collections.unmodifiableMap(index);
        this.definitions = List.copyOf(definitions);
        Map<String, List<DefinitionSite>> grouped = new TreeMap<>();
        for (DefinitionSite d : definitions) {
            grouped.computeIfAbsent(d.variable(), k -> new ArrayList<>()).add(d);
        }
        grouped.replaceAll((k, v) -> List.copyOf(v));
        this.definitionsByVariable = Collections.unmodifiableMap(grouped);
    }

    public String functionSignature() { return functionSignature; }
    public BasicBlock entry()         { return entry; }
    public BasicBlock exit()          { return exit; }

    /** All blocks in block-id order. */
    public List<BasicBlock> blocks()  { return blocks; }

    public BasicBlock block(int id) {
        BasicBlock block = byId.get(id);
        if (block == null) {
            throw new IllegalArgumentException("No block B" + id + " in " + functionSignature);
        }
        return block;
    }

    /** Every definition site, parameters first, in id order. */
    public List<DefinitionSite> definitions() { return definitions; }

    public List<DefinitionSite> definitionsOf(String variable) {
        return definitionsByVariable.getOrDefault(variable, List.of());
    }

    public Set<String> variables() {
        return definitionsByVariable.keySet();
    }

    /** Depth-first post-order from the entry; successors are explored in order. */
    public List<BasicBlock> postOrder() {
        List<BasicBlock> order = new ArrayList<>(blocks.size());
        Set<Integer> visited = new HashSet<>();
        Deque<Iterator<BasicBlock>> stack = new ArrayDeque<>();
        Deque<BasicBlock> path = new ArrayDeque<>();
        visited.add(entry.id());
        stack.push(entry.successors().iterator());
        path.push(entry);
        while (!stack.isEmpty()) {
            Iterator<BasicBlock> it = stack.peek();
            if (it.hasNext()) {
                BasicBlock next = it.next();
                if (visited.add(next.id())) {
                    stack.push(next.successors().iterator());
                    path.push(next);
                }
            } else {
                stack.pop();
                order.add(path.pop());
            }
        }
        return order;
    }

    public List<BasicBlock> reversePostOrder() {
        List<BasicBlock> order = postOrder();
        Collections.reverse(order);
        return order;
    }

    /** Graphviz rendering for debugging; true edges are solid, false edges dashed. */
    public String toDot() {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph \"").append(functionSignature.replace("\"", "\\\"")).append("\" {\n");
        for (BasicBlock b : blocks) {
            String label = b == entry ? "entry" : b == exit ? "exit" : "B" + b.id();
            sb.append("  B").append(b.id()).append(" [label=\"").append(label)
              .append(" (").append(b.instructions().size()).append(")\"];\n");
        }
        for (BasicBlock b : blocks) {
            for (int i = 0; i < b.successors().size(); i++) {
                sb.append("  B").append(b.id()).append(" -> B").append(b.successors().get(i).id());
                if (b.hasBranch() && i == 1) sb.append(" [style=dashed]");
                sb.append(";\n");
            }
        }
        sb.append("}\n");
        return sb.toString();
    }
}
