package edu.cmu.cs.lti.arcstandard.parser;

import com.google.common.base.Preconditions;

/**
 * An action together with the relation label it assigns. Only arc actions carry a label; use the
 * static factories to build one.
 */
public class Transition {

    private static final Transition SHIFT = new Transition(Action.SHIFT, null);

    public final Action action;
    public final String label;

    private Transition(Action action, String label) {
        this.action = Preconditions.checkNotNull(action);
        this.label = label;
    }

    public static Transition shift() {
        return SHIFT;
    }

    public static Transition leftArc(String label) {
        return new Transition(Action.LA, label);
    }

    public static Transition rightArc(String label) {
        return new Transition(Action.RA, label);
    }

    /** The label is dropped for {@link Action#SHIFT}. */
    public static Transition of(Action action, String label) {
        return action.isArc() ? new Transition(action, label) : SHIFT;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + action.hashCode();
        result = prime * result + ((label == null) ? 0 : label.hashCode());
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Transition other = (Transition) obj;
        if (action != other.action)
            return false;
        if (label == null) {
            if (other.label != null)
                return false;
        } else if (!label.equals(other.label))
            return false;
        return true;
    }

    @Override
    public String toString() {
        if (action.isArc()) {
            return action.getSymbol() + "(" + label + ")";
        }
        return action.getSymbol();
    }
}
