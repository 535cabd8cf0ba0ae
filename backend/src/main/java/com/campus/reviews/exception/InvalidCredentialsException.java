package com.campus.reviews.exception;

/** Unknown email and wrong password are reported the same way. */
public class InvalidCredentialsException extends ReviewPipelineException {

    public InvalidCredentialsException() {
        super("Invalid credentials");
    }
}
