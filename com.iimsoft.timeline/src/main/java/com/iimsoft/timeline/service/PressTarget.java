package com.iimsoft.timeline.service;

/**
 * Part of a bar a press landed on.
 */
public enum PressTarget {
    BODY,
    LEFT_HANDLE,
    RIGHT_HANDLE,
    PROGRESS_HANDLE,
    CARET
}
