package com.calor.analysis.effects;

import java.util.*;

/**
 * Tarjan's strongly connected components, iterative so deep call chains cannot overflow the stack.
 *
 * <p>Components come out in reverse topological order of the condensed graph: every component
 * appears after all components it calls into. Members of a component are sorted by node index.
 */
public final class TarjanScc {

    private TarjanScc() {}

    public static List<List<Integer>> compute(CallGraph graph) {
        int n = graph.size();
        int[] indexOf = new int[n];
        int[] lowLink = new int[n];
        boolean[] onStack = new boolean[n];
        Arrays.fill(indexOf, -1);

        Deque<Integer> stack = new ArrayDeque<>();
        List<List<Integer>> components = new ArrayList<>();
        int counter = 0;

        // Explicit DFS frames: node and position in its edge list.
        Deque<int[]> frames = new ArrayDeque<>();
        for (int root = 0; root < n; root++) {
            if (indexOf[root] >= 0) continue;
            frames.push(new int[]{root, 0});
            indexOf[root] = lowLink[root] = counter++;
            stack.push(root);
            onStack[root] = true;

            while (!frames.isEmpty()) {
                int[] frame = frames.peek();
                int v = frame[0];
                List<CallGraph.Edge> edges = graph.callees(v);
                if (frame[1] < edges.size()) {
                    int w = edges.get(frame[1]++).callee();
                    if (indexOf[w] < 0) {
                        indexOf[w] = lowLink[w] = counter++;
                        stack.push(w);
                        onStack[w] = true;
                        frames.push(new int[]{w, 0});
                    } else if (onStack[w]) {
                        lowLink[v] = Math.min(lowLink[v], indexOf[w]);
                    }
                    continue;
                }
                frames.pop();
                if (!frames.isEmpty()) {
                    int parent = frames.peek()[0];
                    lowLink[parent] = Math.min(lowLink[parent], lowLink[v]);
                }
                if (lowLink[v] == indexOf[v]) {
                    List<Integer> component = new ArrayList<>();
                    int w;
                    do {
                        w = stack.pop();
                        onStack[w] = false;
                        component.add(w);
                    } while (w != v);
                    Collections.sort(component);
                    components.add(List.copyOf(component));
                }
            }
        }
        return components;
    }
}
