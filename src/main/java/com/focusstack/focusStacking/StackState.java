package com.focusstack.focusStacking;

/**
 * Trạng thái của một lần chạy. Chỉ đi tiến, FAILED là trạng thái cuối.
 */
public enum StackState {
    EMPTY,
    LOADED,
    ALIGNED,
    SHARPNESS_COMPUTED,
    COMPOSITED,
    SAVED,
    FAILED
}
