package com.routelens.error;

/** 调用方违反前置条件，例如重复完成同一个 trace。 */
public class InvalidStateException extends DebugDataException {

    public InvalidStateException(String message) {
        super(message);
    }
}
