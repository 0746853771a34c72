package com.dbguardian.server.exception;

import lombok.EqualsAndHashCode;


@EqualsAndHashCode(callSuper = false)
public class DbGuardianException extends RuntimeException {

    public DbGuardianException(String message) {
        super(message);
    }

    public DbGuardianException(String message, Throwable cause) {
        super(message, cause);
    }

    public String getDbGuardianMessage() {
        StringBuilder sb = new StringBuilder();
        buildMessageChain(this, sb, 0);
        return sb.toString();
    }

    // <exception name> : <exception message> -> <cause> ...
    private static void buildMessageChain(Throwable throwable, StringBuilder sb, int depth) {
        if (throwable == null || depth > 20) return;
        sb.append("%s : %s -> ".formatted(
                throwable.getClass().getSimpleName(),
                throwable instanceof DbGuardianException ? throwable.getMessage() : throwable.toString()));
        buildMessageChain(throwable.getCause(), sb, depth + 1);
    }

    @Override
    public String toString() {
        return getDbGuardianMessage();
    }
}
