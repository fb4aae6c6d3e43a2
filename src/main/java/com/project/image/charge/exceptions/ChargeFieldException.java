package com.project.image.charge.exceptions;

/** Domain-specific exception for charge field processing errors. */
public class ChargeFieldException extends RuntimeException {
    public ChargeFieldException(String message) { super(message); }
    public ChargeFieldException(String message, Throwable cause) { super(message, cause); }
}
