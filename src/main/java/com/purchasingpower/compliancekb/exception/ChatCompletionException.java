package com.purchasingpower.compliancekb.exception;

public class ChatCompletionException extends RuntimeException {

    public ChatCompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
