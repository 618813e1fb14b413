package com.focusstack.focusStacking;

import lombok.Getter;

/**
 * Lỗi nghiêm trọng làm dừng cả lần chạy. stage là bước đang thực hiện khi lỗi xảy ra.
 */
@Getter
public class FocusStackException extends RuntimeException {
    private final StackState stage;

    public FocusStackException(String message, StackState stage) {
        super(message);
        this.stage = stage;
    }

    public FocusStackException(String message, StackState stage, Throwable cause) {
        super(message, cause);
        this.stage = stage;
    }
}
