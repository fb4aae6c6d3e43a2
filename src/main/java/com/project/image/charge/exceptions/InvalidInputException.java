package com.project.image.charge.exceptions;

/** The image is missing, cannot be decoded, or has no usable pixels. */
public class InvalidInputException extends ChargeFieldException {
    public InvalidInputException(String message) { super(message); }
    public InvalidInputException(String message, Throwable cause) { super(message, cause); }
}
