package com.iimsoft.timeline.render;

/**
 * Opaque reference to a shape created by a {@link ShapeRenderer}.
 */
public interface ShapeHandle {

    /** Shape kind such as "rect", "g", "text", "path" or "polygon". */
    String getKind();
}
