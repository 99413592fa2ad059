package edu.cmu.cs.lti.arcstandard.parser;

import java.util.List;

import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;

import edu.cmu.cs.lti.arcstandard.AlreadyCompleteException;
import edu.cmu.cs.lti.arcstandard.IllegalTransitionException;
import edu.cmu.cs.lti.arcstandard.OracleHelper;
import edu.cmu.cs.lti.arcstandard.ParseConfiguration;
import edu.cmu.cs.lti.arcstandard.PartialParse;
import edu.cmu.cs.lti.arcstandard.datastructs.DepTree;
import edu.cmu.cs.lti.arcstandard.datastructs.Sentence;

/**
 * Static oracle for the arc-standard system. Given a projective gold tree, repeatedly applying
 * {@link #getOracle} from the initial configuration rebuilds exactly the gold arcs. Left arcs win
 * over shifts whenever both lead to the gold tree.
 *
 * <p>
 * On a non-projective tree the sequence eventually asks for an illegal move; callers that cannot
 * rule such trees out should catch {@link IllegalTransitionException} and
 * {@link IndexOutOfBoundsException} together.
 */
public class Oracle {

    private final DepTree goldTree;

    public Oracle(DepTree goldTree) {
        this.goldTree = goldTree;
    }

    public Transition getOracle(ParseConfiguration state) throws IllegalTransitionException {
        if (state.isComplete()) {
            throw new AlreadyCompleteException();
        }
        List<Integer> stack = state.getStack();
        int next = state.getNext();
        boolean bufferEmpty = next == state.getSentence().size();

        if (stack.size() == 1) {
            return Transition.shift();
        }

        if (stack.size() == 2) {
            if (bufferEmpty == false) {
                return Transition.shift();
            }
            // read the root label from the tree, corpora disagree on "root" vs "ROOT"
            Optional<String> rootRel = OracleHelper.rightDepRel(goldTree, stack.get(0), stack.get(1));
            if (rootRel.isPresent() == false) {
                throw new IllegalTransitionException("Expected the final right arc from ROOT to "
                        + stack.get(1));
            }
            return Transition.rightArc(rootRel.get());
        }

        int top = stack.get(stack.size() - 1);
        int second = stack.get(stack.size() - 2);

        Optional<String> leftRel = OracleHelper.leftDepRel(goldTree, top, second);
        if (leftRel.isPresent()) {
            return Transition.leftArc(leftRel.get());
        }
        Optional<String> rightRel = OracleHelper.rightDepRel(goldTree, second, top);
        if (rightRel.isPresent()) {
            // top is popped by the right arc, so its right dependents must be shifted in first
            if (OracleHelper.hasRemainingRightDeps(goldTree, top, next)) {
                return Transition.shift();
            }
            return Transition.rightArc(rightRel.get());
        }
        return Transition.shift();
    }

    /** Runs the oracle from the initial configuration of {@code sentence} to completion. */
    public ImmutableList<Transition> getAllTransitions(Sentence sentence)
            throws IllegalTransitionException {
        PartialParse state = new PartialParse(sentence);
        ImmutableList.Builder<Transition> transitions = ImmutableList.builder();
        while (state.isComplete() == false) {
            Transition transition = getOracle(state);
            state.parseStep(transition);
            transitions.add(transition);
        }
        return transitions.build();
    }
}
