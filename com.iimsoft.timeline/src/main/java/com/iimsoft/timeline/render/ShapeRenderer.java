package com.iimsoft.timeline.render;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Drawing surface the chart draws on. Implementations own the actual shapes; the chart only keeps handles.
 */
public interface ShapeRenderer {

    /** Pseudo attribute carrying the text content of a "text" shape. */
    String TEXT = "#text";
    String CLASS = "class";

    /**
     * Root shape (an "svg") every other shape descends from.
     */
    ShapeHandle getRoot();

    /**
     * @param parent null appends to the root
     */
    ShapeHandle createShape(String kind, Map<String, Object> attributes, ShapeHandle parent);

    void setAttribute(ShapeHandle handle, String key, Object value);

    Object getAttribute(ShapeHandle handle, String key);

    BoundingBox getBoundingBox(ShapeHandle handle);

    /**
     * Registers a handler for a gesture on the target. A gesture hitting a shape is delivered to the closest
     * shape, itself or an ancestor, that listens for it.
     */
    void listen(ShapeHandle target, Gesture gesture, PointerHandler handler);

    void remove(ShapeHandle handle);

    /** Removes every child of the root, listeners included. Root listeners are kept. */
    void clear();

    default void addClass(ShapeHandle handle, String cssClass) {
        Set<String> classes = classes(handle);
        if (classes.add(cssClass)) {
            setAttribute(handle, CLASS, String.join(" ", classes));
        }
    }

    default void removeClass(ShapeHandle handle, String cssClass) {
        Set<String> classes = classes(handle);
        if (classes.remove(cssClass)) {
            setAttribute(handle, CLASS, String.join(" ", classes));
        }
    }

    default boolean hasClass(ShapeHandle handle, String cssClass) {
        return classes(handle).contains(cssClass);
    }

    private Set<String> classes(ShapeHandle handle) {
        Object value = getAttribute(handle, CLASS);
        Set<String> classes = new LinkedHashSet<>();
        if (value != null && !value.toString().isBlank()) {
            classes.addAll(Arrays.asList(value.toString().trim().split("\\s+")));
        }
        return classes;
    }
}
