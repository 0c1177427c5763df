package com.templateweaver.core.arn;

/**
 * An ARN failed parsing or verification.
 */
public class ArnException extends RuntimeException {

    private final ArnErrorKind kind;
    private final String arn;

    public ArnException(ArnErrorKind kind, String arn, String message) {
        super(message);
        this.kind = kind;
        this.arn = arn;
    }

    public ArnErrorKind getKind() {
        return kind;
    }

    public String getArn() {
        return arn;
    }
}
