package com.routelens.error;

/**
 * 调试数据子系统的异常基类（非受检）。
 * 调用方可以按子类区分：找不到 / 文件损坏 / 存储 IO / 状态非法。
 */
public class DebugDataException extends RuntimeException {

    public DebugDataException(String message) {
        super(message);
    }

    public DebugDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
