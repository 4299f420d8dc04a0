package info.isaksson.erland.widgettoir.component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Traversal helpers over component trees. Nested components held by {@code expression} property
 * bindings are part of the tree.
 */
public final class ComponentTrees {

    private ComponentTrees() {}

    /** Pre-order (parent before children, children in source order). */
    public static List<Component> flatten(Component root) {
        List<Component> out = new ArrayList<>();
        if (root == null) return out;
        Deque<Component> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Component c = stack.pop();
            out.add(c);
            List<Component> next = directChildren(c);
            for (int i = next.size() - 1; i >= 0; i--) {
                stack.push(next.get(i));
            }
        }
        return out;
    }

    public static Map<ComponentType, Integer> countByType(Component root) {
        Map<ComponentType, Integer> counts = new EnumMap<>(ComponentType.class);
        for (Component c : flatten(root)) {
            counts.merge(c.type(), 1, Integer::sum);
        }
        return counts;
    }

    /** Unsupported and container-fallback components, the ones reported as warnings. */
    public static List<Component> fallbacks(Component root) {
        List<Component> out = new ArrayList<>();
        for (Component c : flatten(root)) {
            if (c.type() == ComponentType.UNSUPPORTED || c.type() == ComponentType.CONTAINER_FALLBACK) {
                out.add(c);
            }
        }
        return out;
    }

    public static int depth(Component root) {
        if (root == null) return 0;
        int max = 0;
        for (Component c : directChildren(root)) {
            max = Math.max(max, depth(c));
        }
        return max + 1;
    }

    private static List<Component> directChildren(Component c) {
        if (!(c instanceof WidgetComponent)) return c.children();
        WidgetComponent w = (WidgetComponent) c;
        List<Component> out = new ArrayList<>();
        for (PropertyBinding p : w.properties) {
            if (p.component != null) out.add(p.component);
        }
        out.addAll(w.children);
        return out;
    }
}
