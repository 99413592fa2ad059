package edu.cmu.cs.lti.arcstandard.datastructs;

public class LabeledHead {

    public static final int NO_HEAD = -1;

    public final int headId;
    public final String label;

    public LabeledHead(int headId, String label) {
        this.headId = headId;
        this.label = label;
    }

    // head of ROOT
    public LabeledHead() {
        this(NO_HEAD, null);
    }

    public boolean hasHead() {
        return headId != NO_HEAD;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + headId;
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
        LabeledHead other = (LabeledHead) obj;
        if (headId != other.headId)
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
        return "LabeledHead [headId=" + headId + ", label=" + label + "]";
    }

}
