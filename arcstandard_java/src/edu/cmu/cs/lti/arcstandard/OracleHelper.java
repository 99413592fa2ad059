package edu.cmu.cs.lti.arcstandard;

import java.util.List;
import java.util.Set;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableSet;

import edu.cmu.cs.lti.arcstandard.datastructs.Arc;
import edu.cmu.cs.lti.arcstandard.datastructs.DepTree;
import edu.cmu.cs.lti.arcstandard.datastructs.Sentence;

public class OracleHelper {

    private OracleHelper() {
    }

    /** Relation of {@code dep} to {@code head} when {@code dep} attaches to the left of it. */
    public static Optional<String> leftDepRel(DepTree tree, int head, int dep) {
        if (dep > head) {
            return Optional.absent();
        }
        return tree.getDepRel(head, dep);
    }

    /** Relation of {@code dep} to {@code head} when {@code dep} attaches to the right of it. */
    public static Optional<String> rightDepRel(DepTree tree, int head, int dep) {
        if (dep < head) {
            return Optional.absent();
        }
        return tree.getDepRel(head, dep);
    }

    // true if head still has a right dependent at or beyond the buffer front
    public static boolean hasRemainingRightDeps(DepTree tree, int head, int next) {
        for (int dep : tree.getRightChildren(head)) {
            if (dep >= next) {
                return true;
            }
        }
        return false;
    }

    /** True if two gold arcs cross. Arcs that share an endpoint never cross. */
    public static boolean isNonProjective(DepTree tree) {
        List<Arc> arcs = tree.getArcs();
        for (int i = 0; i < arcs.size(); i++) {
            for (int j = i + 1; j < arcs.size(); j++) {
                if (cross(arcs.get(i), arcs.get(j))) {
                    return true;
                }
            }
        }
        return false;
    }

    /** The arc-standard oracle only reaches trees with exactly one word attached to ROOT. */
    public static boolean hasSingleRoot(DepTree tree) {
        return tree.getChildren(Sentence.ROOT).size() == 1;
    }

    static boolean cross(Arc first, Arc second) {
        int lo1 = Math.min(first.head, first.dependent);
        int hi1 = Math.max(first.head, first.dependent);
        int lo2 = Math.min(second.head, second.dependent);
        int hi2 = Math.max(second.head, second.dependent);
        return (lo1 < lo2 && lo2 < hi1 && hi1 < hi2) || (lo2 < lo1 && lo1 < hi2 && hi2 < hi1);
    }

    /** Compares the arcs of a finished parse with the gold arcs, ignoring order. */
    public static boolean checkIfCorrect(ParseConfiguration finalState, DepTree gold) {
        Set<Arc> predicted = ImmutableSet.copyOf(finalState.getArcs());
        if (predicted.size() != finalState.getArcs().size()) {
            return false;
        }
        return predicted.equals(ImmutableSet.copyOf(gold.getArcs()));
    }

    public static String tokenPos(Sentence sentence, int pos) {
        if (pos == Sentence.ROOT) {
            return "ROOT";
        }
        return sentence.getWord(pos) + "-" + sentence.getTag(pos);
    }

    public static String sentenceToString(Sentence sentence) {
        StringBuilder builder = new StringBuilder();
        for (int i = 1; i < sentence.size(); i++) {
            builder.append(tokenPos(sentence, i));
            if (i < sentence.size() - 1) {
                builder.append(" ");
            }
        }
        return builder.toString();
    }
}
