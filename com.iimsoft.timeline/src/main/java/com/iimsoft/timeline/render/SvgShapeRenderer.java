package com.iimsoft.timeline.render;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * In-memory SVG document.
 *
 * <p>Shapes are kept as a tree of nodes and serialized with {@link #toSvg()}. Gestures are simulated with
 * {@link #dispatch(ShapeHandle, Gesture, PointerEvent)}, which delivers them to the closest listening
 * shape the way a delegated DOM listener would.
 *
 * <p>Text has no font metrics here: its box is estimated from the character count.
 */
public class SvgShapeRenderer implements ShapeRenderer {

    static final double CHAR_WIDTH = 7;
    static final double TEXT_HEIGHT = 14;

    private final Node root = new Node("svg", null);

    public SvgShapeRenderer() {
        root.attributes.put(CLASS, "gantt");
    }

    @Override
    public ShapeHandle getRoot() {
        return root;
    }

    @Override
    public ShapeHandle createShape(String kind, Map<String, Object> attributes, ShapeHandle parent) {
        Node parentNode = parent == null ? root : node(parent);
        Node node = new Node(Objects.requireNonNull(kind, "kind"), parentNode);
        if (attributes != null) {
            node.attributes.putAll(attributes);
        }
        parentNode.children.add(node);
        return node;
    }

    @Override
    public void setAttribute(ShapeHandle handle, String key, Object value) {
        node(handle).attributes.put(key, value);
    }

    @Override
    public Object getAttribute(ShapeHandle handle, String key) {
        return node(handle).attributes.get(key);
    }

    @Override
    public BoundingBox getBoundingBox(ShapeHandle handle) {
        return box(node(handle));
    }

    private BoundingBox box(Node node) {
        switch (node.kind) {
            case "rect":
                return new BoundingBox(number(node, "x"), number(node, "y"),
                        number(node, "width"), number(node, "height"));
            case "text":
                Object text = node.attributes.get(TEXT);
                double width = text == null ? 0 : text.toString().length() * CHAR_WIDTH;
                return new BoundingBox(number(node, "x"), number(node, "y") - TEXT_HEIGHT, width, TEXT_HEIGHT);
            case "g":
            case "svg":
                BoundingBox union = BoundingBox.EMPTY;
                for (Node child : node.children) {
                    union = union.union(box(child));
                }
                return union;
            default:
                return BoundingBox.EMPTY;
        }
    }

    @Override
    public void listen(ShapeHandle target, Gesture gesture, PointerHandler handler) {
        node(target).listeners.computeIfAbsent(gesture, g -> new ArrayList<>()).add(handler);
    }

    @Override
    public void remove(ShapeHandle handle) {
        Node node = node(handle);
        if (node == root) {
            throw new IllegalArgumentException("The root shape cannot be removed");
        }
        node.parent.children.remove(node);
    }

    @Override
    public void clear() {
        root.children.clear();
    }

    /**
     * Delivers a gesture to the closest shape, {@code target} or one of its ancestors, that listens for it.
     *
     * @return false when nothing on the path listens
     */
    public boolean dispatch(ShapeHandle target, Gesture gesture, PointerEvent event) {
        for (Node n = node(target); n != null; n = n.parent) {
            List<PointerHandler> handlers = n.listeners.get(gesture);
            if (handlers != null && !handlers.isEmpty()) {
                for (PointerHandler h : new ArrayList<>(handlers)) {
                    h.handle(event, n);
                }
                return true;
            }
        }
        return false;
    }

    public List<ShapeHandle> getChildren(ShapeHandle handle) {
        return Collections.unmodifiableList(node(handle).children);
    }

    public ShapeHandle getParent(ShapeHandle handle) {
        return node(handle).parent;
    }

    /**
     * Depth-first list of shapes carrying the given CSS class.
     */
    public List<ShapeHandle> findByClass(String cssClass) {
        List<ShapeHandle> out = new ArrayList<>();
        collect(root, cssClass, out);
        return out;
    }

    private void collect(Node node, String cssClass, List<ShapeHandle> out) {
        if (hasClass(node, cssClass)) {
            out.add(node);
        }
        for (Node child : node.children) {
            collect(child, cssClass, out);
        }
    }

    public String toSvg() {
        StringBuilder sb = new StringBuilder();
        write(root, sb, 0);
        return sb.toString();
    }

    private void write(Node node, StringBuilder sb, int depth) {
        indent(sb, depth);
        sb.append('<').append(node.kind);
        if (node == root) {
            sb.append(" xmlns=\"http://www.w3.org/2000/svg\"");
        }
        for (Map.Entry<String, Object> e : node.attributes.entrySet()) {
            if (TEXT.equals(e.getKey()) || e.getValue() == null) continue;
            sb.append(' ').append(e.getKey()).append("=\"").append(escape(format(e.getValue()))).append('"');
        }
        Object text = node.attributes.get(TEXT);
        if (node.children.isEmpty() && text == null) {
            sb.append("/>\n");
            return;
        }
        sb.append('>');
        if (text != null) {
            sb.append(escape(text.toString()));
        }
        if (!node.children.isEmpty()) {
            sb.append('\n');
            for (Node child : node.children) {
                write(child, sb, depth + 1);
            }
            indent(sb, depth);
        }
        sb.append("</").append(node.kind).append(">\n");
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) sb.append("  ");
    }

    static String format(Object value) {
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d)) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        return value.toString();
    }

    private static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        for (char c : s.toCharArray()) {
            switch (c) {
                case '&': sb.append("&amp;"); break;
                case '<': sb.append("&lt;"); break;
                case '>': sb.append("&gt;"); break;
                case '"': sb.append("&quot;"); break;
                default: sb.append(c);
            }
        }
        return sb.toString();
    }

    private static double number(Node node, String key) {
        Object v = node.attributes.get(key);
        if (v instanceof Number) {
            return ((Number) v).doubleValue();
        }
        if (v == null) {
            return 0;
        }
        try {
            return Double.parseDouble(v.toString());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Attribute '" + key + "' of <" + node.kind + "> is not numeric: " + v, e);
        }
    }

    private Node node(ShapeHandle handle) {
        if (!(handle instanceof Node)) {
            throw new IllegalArgumentException("Shape does not belong to this renderer: " + handle);
        }
        return (Node) handle;
    }

    private static final class Node implements ShapeHandle {
        private final String kind;
        private final Node parent;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<Node> children = new ArrayList<>();
        private final Map<Gesture, List<PointerHandler>> listeners = new EnumMap<>(Gesture.class);

        private Node(String kind, Node parent) {
            this.kind = kind;
            this.parent = parent;
        }

        @Override
        public String getKind() {
            return kind;
        }

        @Override
        public String toString() {
            return "<" + kind + " " + attributes + ">";
        }
    }
}
