package io.memblock.core;

/**
 * Base exception for failures that signal a misconfiguration of the block store
 * rather than a bad argument.
 */
public class MemblockException extends RuntimeException {

    public MemblockException(Throwable cause) {
        super(cause);
    }

    public MemblockException(String message, Throwable cause) {
        super(message, cause);
    }

    public MemblockException(String message) {
        super(message);
    }

}
