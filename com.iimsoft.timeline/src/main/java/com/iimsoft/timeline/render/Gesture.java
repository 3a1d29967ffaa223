package com.iimsoft.timeline.render;

/**
 * Pointer gestures the chart listens for, named after the DOM events they stand for.
 */
public enum Gesture {
    PRESS("mousedown"),
    MOVE("mousemove"),
    RELEASE("mouseup"),
    CLICK("click"),
    DOUBLE_CLICK("dblclick"),
    FOCUS("focus"),
    SCROLL("scroll");

    private final String eventName;

    Gesture(String eventName) {
        this.eventName = eventName;
    }

    public String getEventName() {
        return eventName;
    }

    /** Accepts the DOM event name ("click") or the constant name ("CLICK"). */
    public static Gesture fromName(String name) {
        if (name != null) {
            String n = name.trim();
            for (Gesture g : values()) {
                if (g.eventName.equalsIgnoreCase(n) || g.name().equalsIgnoreCase(n)) {
                    return g;
                }
            }
        }
        throw new IllegalArgumentException("Unknown gesture: " + name);
    }
}
