package com.routelens.error;

/** 文件系统读写失败。记录器不做重试，交给调用方决定。 */
public class StorageIoException extends DebugDataException {

    public StorageIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
