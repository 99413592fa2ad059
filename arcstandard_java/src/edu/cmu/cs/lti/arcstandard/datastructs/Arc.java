package edu.cmu.cs.lti.arcstandard.datastructs;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;

/** A labeled dependency {@code head ->_label dependent}. */
public class Arc implements Comparable<Arc> {

    public final int head;
    public final int dependent;
    public final String label;

    public Arc(int head, int dependent, String label) {
        this.head = head;
        this.dependent = dependent;
        this.label = label;
    }

    @Override
    public int compareTo(Arc other) {
        return ComparisonChain.start()
                .compare(head, other.head)
                .compare(dependent, other.dependent)
                .compare(label, other.label, Ordering.<String> natural().nullsFirst())
                .result();
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + head;
        result = prime * result + dependent;
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
        Arc other = (Arc) obj;
        if (head != other.head)
            return false;
        if (dependent != other.dependent)
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
        return "(" + head + ", " + dependent + ", " + label + ")";
    }
}
