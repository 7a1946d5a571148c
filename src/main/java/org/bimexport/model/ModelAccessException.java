package org.bimexport.model;

/**
 * 宿主模型不可读（文件损坏、格式错误等）。
 * <p>
 * 属于致命错误：直接向上抛出，中止当前构件/当前调用，不做重试。
 */
public class ModelAccessException extends RuntimeException {

    public ModelAccessException(String message) {
        super(message);
    }

    public ModelAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
