package org.pnml2fast.io;

/**
 * 输入文档不是可读的 P/T 网 PNML 文档时抛出。
 */
public class PnmlFormatException extends RuntimeException {

    public PnmlFormatException(String message) {
        super(message);
    }

    public PnmlFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
