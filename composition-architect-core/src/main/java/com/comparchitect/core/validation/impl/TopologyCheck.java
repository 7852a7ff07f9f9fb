package com.comparchitect.core.validation.impl;

import com.comparchitect.core.composition.Composition;
import com.comparchitect.core.graph.ComponentGraph;
import com.comparchitect.core.model.Finding;
import com.comparchitect.core.model.FindingCategory;
import com.comparchitect.core.validation.CompositionCheck;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * Detects circular dependencies in the undirected component graph.
 *
 * <p>Depth-first traversal starts from every unvisited component in composition order, keeping the
 * set of components on the current exploration path. The edge back to a component's own DFS parent
 * is not a cycle: every shared endpoint name is an undirected edge, so a plain sender/receiver pair
 * between two components would otherwise always be reported.
 *
 * <p>When the traversal reaches a component that is still on the path, that component is reported
 * and the branch is not followed further. Each component is reported at most once per pass, and
 * finished components are never traversed again from a later root. A closed walk through three
 * components therefore yields exactly one finding.
 */
public class TopologyCheck implements CompositionCheck {

    @Override
    public String getId() {
        return "topology";
    }

    @Override
    public String getDisplayName() {
        return "Topology Check";
    }

    @Override
    public List<Finding> check(Composition composition, ComponentGraph graph) {
        List<Finding> findings = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        Set<String> onPath = new HashSet<>();
        Set<String> reported = new HashSet<>();

        for (String root : graph.nodes()) {
            if (visited.contains(root)) {
                continue;
            }

            Deque<Frame> stack = new ArrayDeque<>();
            visited.add(root);
            onPath.add(root);
            stack.push(new Frame(root, null, graph.neighbors(root).iterator()));

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                if (!frame.neighbors().hasNext()) {
                    stack.pop();
                    onPath.remove(frame.node());
                    continue;
                }

                String next = frame.neighbors().next();
                if (next.equals(frame.parent())) {
                    continue;
                }
                if (onPath.contains(next)) {
                    if (reported.add(next)) {
                        findings.add(Finding.error(FindingCategory.TOPOLOGY, next, null,
                            "Circular dependency detected involving component '" + next + "'."));
                    }
                    continue;
                }
                if (visited.add(next)) {
                    onPath.add(next);
                    stack.push(new Frame(next, frame.node(), graph.neighbors(next).iterator()));
                }
            }
        }
        return findings;
    }

    private record Frame(String node, String parent, Iterator<String> neighbors) {
    }
}
