package dumb.sid;

import java.util.*;

enum Graphs {
    ;

    /**
     * Depth-first search over the edge relation in document order.
     *
     * @return the first node found closing a directed cycle
     */
    static Optional<String> findCycle(Diagram d) {
        var out = new LinkedHashMap<String, List<String>>();
        for (var e : d.edges())
            out.computeIfAbsent(e.from(), k -> new ArrayList<>()).add(e.to());

        var visited = new HashSet<String>();
        var onStack = new HashSet<String>();
        for (var root : d.nodeIndex().keySet()) {
            if (visited.contains(root)) continue;
            Deque<Frame> stack = new ArrayDeque<>();
            stack.push(new Frame(root, out.getOrDefault(root, List.of()).iterator()));
            visited.add(root);
            onStack.add(root);
            while (!stack.isEmpty()) {
                var top = stack.peek();
                if (top.next.hasNext()) {
                    var n = top.next.next();
                    if (onStack.contains(n)) return Optional.of(n);
                    if (visited.add(n)) {
                        onStack.add(n);
                        stack.push(new Frame(n, out.getOrDefault(n, List.of()).iterator()));
                    }
                } else {
                    onStack.remove(stack.pop().node);
                }
            }
        }
        return Optional.empty();
    }

    static boolean hasCycle(Diagram d) {
        return findCycle(d).isPresent();
    }

    private record Frame(String node, Iterator<String> next) {
    }
}
