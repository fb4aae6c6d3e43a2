package com.project.image.charge.exceptions;

/** Kernel size, weights or another computation parameter is malformed. */
public class InvalidParameterException extends ChargeFieldException {
    public InvalidParameterException(String message) { super(message); }
}
