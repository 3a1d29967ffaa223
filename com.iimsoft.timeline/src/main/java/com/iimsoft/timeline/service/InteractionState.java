package com.iimsoft.timeline.service;

public enum InteractionState {
    IDLE,
    DRAGGING,
    RESIZING_LEFT,
    RESIZING_RIGHT,
    RESIZING_PROGRESS,
    /** Dragging with vertical reorder in effect. */
    SORTING;

    public boolean isMoving() {
        return this == DRAGGING || this == SORTING;
    }
}
