package com.iimsoft.timeline.render;

@FunctionalInterface
public interface PointerHandler {

    /**
     * @param target the shape the listener was registered on
     */
    void handle(PointerEvent event, ShapeHandle target);
}
