package com.specgate.core.validator;

import com.specgate.core.model.TaskBlock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed graph from task id to the ids it depends on, in task-document order.
 */
public class DependencyGraph {

    /** Reference from a task to a task id that does not exist. */
    public record MissingDependency(TaskBlock task, String dependency) {}

    private enum Color { WHITE, GRAY, BLACK }

    private final Map<String, List<String>> edges = new LinkedHashMap<>();
    private final List<MissingDependency> missing = new ArrayList<>();

    public DependencyGraph(List<TaskBlock> tasks) {
        for (TaskBlock task : tasks) {
            edges.putIfAbsent(task.id(), new ArrayList<>());
        }
        for (TaskBlock task : tasks) {
            for (String dep : task.dependsOn()) {
                if (edges.containsKey(dep)) {
                    edges.get(task.id()).add(dep);
                } else {
                    missing.add(new MissingDependency(task, dep));
                }
            }
        }
    }

    public List<MissingDependency> missingDependencies() {
        return List.copyOf(missing);
    }

    /**
     * Depth-first search with an explicit stack and white/gray/black coloring.
     * Returns the first cycle found as a path that starts and ends with the same
     * id, e.g. {@code [1.1, 1.2, 1.1]}. Only the first cycle is reported.
     */
    public Optional<List<String>> findFirstCycle() {
        Map<String, Color> color = new HashMap<>();
        edges.keySet().forEach(id -> color.put(id, Color.WHITE));

        for (String start : edges.keySet()) {
            if (color.get(start) != Color.WHITE) continue;

            // Each frame is a node plus the index of its next unexplored edge.
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(start));
            color.put(start, Color.GRAY);

            while (!stack.isEmpty()) {
                Frame frame = stack.peek();
                List<String> next = edges.get(frame.node);
                if (frame.index < next.size()) {
                    String target = next.get(frame.index++);
                    Color c = color.get(target);
                    if (c == Color.GRAY) {
                        return Optional.of(cyclePath(stack, target));
                    }
                    if (c == Color.WHITE) {
                        color.put(target, Color.GRAY);
                        stack.push(new Frame(target));
                    }
                } else {
                    color.put(frame.node, Color.BLACK);
                    stack.pop();
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> cyclePath(Deque<Frame> stack, String target) {
        // The stack holds the current path with the deepest node on top.
        var path = new ArrayList<String>();
        var it = stack.descendingIterator();
        boolean inCycle = false;
        while (it.hasNext()) {
            String node = it.next().node;
            if (node.equals(target)) inCycle = true;
            if (inCycle) path.add(node);
        }
        path.add(target);
        return path;
    }

    private static final class Frame {
        final String node;
        int index;

        Frame(String node) {
            this.node = node;
        }
    }
}
