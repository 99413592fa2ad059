package edu.cmu.cs.lti.arcstandard;

/**
 * Thrown when a transition cannot be applied to the current configuration. The configuration is
 * left untouched.
 */
public class IllegalTransitionException extends Exception {

    private static final long serialVersionUID = 1L;

    public IllegalTransitionException(String message) {
        super(message);
    }
}
