package edu.cmu.cs.lti.arcstandard;

/** Thrown when a move is requested on a parse that is already complete. */
public class AlreadyCompleteException extends IllegalTransitionException {

    private static final long serialVersionUID = 1L;

    public AlreadyCompleteException() {
        super("PartialParse already completed");
    }
}
