package edu.cmu.cs.lti.arcstandard;

import java.util.Collections;
import java.util.List;
import java.util.Stack;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

import edu.cmu.cs.lti.arcstandard.datastructs.Arc;
import edu.cmu.cs.lti.arcstandard.datastructs.Sentence;
import edu.cmu.cs.lti.arcstandard.parser.Action;
import edu.cmu.cs.lti.arcstandard.parser.Transition;

/**
 * Arc-standard parser state for a single sentence. Starts with ROOT on the stack and every word in
 * the buffer, and is mutated in place by {@link #parseStep}.
 */
public class PartialParse implements ParseConfiguration {

    private final Sentence sentence;
    private final Stack<Integer> stack;
    private int next;
    private final List<Arc> arcs;
    private final ParseConfiguration view = new ReadOnlyView();

    public PartialParse(Sentence sentence) {
        this.sentence = sentence;
        this.stack = new Stack<Integer>();
        stack.push(Sentence.ROOT);
        this.next = 1;
        this.arcs = Lists.newArrayList();
    }

    @VisibleForTesting
    PartialParse(Sentence sentence, List<Integer> stack, int next, List<Arc> arcs) {
        Preconditions.checkArgument(stack.isEmpty() == false && stack.get(0) == Sentence.ROOT,
                "stack must start with ROOT: %s", stack);
        Preconditions.checkArgument(next >= 1 && next <= sentence.size(),
                "next %s outside [1, %s]", next, sentence.size());
        this.sentence = sentence;
        this.stack = new Stack<Integer>();
        this.stack.addAll(stack);
        this.next = next;
        this.arcs = Lists.newArrayList(arcs);
    }

    @Override
    public Sentence getSentence() {
        return sentence;
    }

    @Override
    public List<Integer> getStack() {
        return Collections.unmodifiableList(stack);
    }

    @Override
    public int getNext() {
        return next;
    }

    @Override
    public List<Arc> getArcs() {
        return Collections.unmodifiableList(arcs);
    }

    @Override
    public boolean isComplete() {
        return next == sentence.size() && stack.size() == 1 && stack.get(0) == Sentence.ROOT;
    }

    public void parseStep(Transition transition) throws IllegalTransitionException {
        if (transition == null) {
            throw new IllegalTransitionException("Unknown transition");
        }
        parseStep(transition.action, transition.label);
    }

    /**
     * Applies one transition. {@code deprel} names the relation of an arc transition and is
     * ignored for a shift.
     *
     * @throws IllegalTransitionException if the action is unknown or its precondition does not
     *             hold; the state is unchanged
     */
    public void parseStep(Action action, String deprel) throws IllegalTransitionException {
        if (action == null) {
            throw new IllegalTransitionException("Unknown transition");
        }
        if (isComplete()) {
            throw new AlreadyCompleteException();
        }
        switch (action) {
            case LA :
                // ROOT may never be a dependent
                if (stack.size() < 3) {
                    throw new IllegalTransitionException("Illegal Left Arc: stack " + stack);
                }
                arcs.add(new Arc(stack.get(stack.size() - 1), stack.get(stack.size() - 2), deprel));
                stack.remove(stack.size() - 2);
                break;
            case RA :
                if (stack.size() < 2) {
                    throw new IllegalTransitionException("Illegal Right Arc: stack " + stack);
                }
                arcs.add(new Arc(stack.get(stack.size() - 2), stack.get(stack.size() - 1), deprel));
                stack.pop();
                break;
            case SHIFT :
                if (next == sentence.size()) {
                    throw new IllegalTransitionException("Illegal Shift: buffer is empty");
                }
                stack.push(next);
                next++;
                break;
            default :
                throw new IllegalTransitionException("Unknown transition " + action);
        }
    }

    /** Applies every transition in order and returns the arcs built. */
    public List<Arc> parse(List<Transition> transitions) throws IllegalTransitionException {
        for (Transition transition : transitions) {
            parseStep(transition);
        }
        return getArcs();
    }

    @Override
    public List<Integer> getNLeftmostDeps(int sentenceIdx, Integer n) {
        return collectDeps(arcs, sentenceIdx, n);
    }

    @Override
    public List<Integer> getNRightmostDeps(int sentenceIdx, Integer n) {
        return collectDeps(Lists.reverse(arcs), sentenceIdx, n);
    }

    private static List<Integer> collectDeps(List<Arc> arcs, int sentenceIdx, Integer n) {
        Preconditions.checkArgument(n == null || n >= 0, "negative dependant count %s", n);
        List<Integer> deps = Lists.newArrayList();
        if (n != null && n == 0) {
            return deps;
        }
        for (Arc arc : arcs) {
            if (arc.head == sentenceIdx) {
                deps.add(arc.dependent);
                if (n != null && deps.size() == n) {
                    break;
                }
            }
        }
        return deps;
    }

    /** A view of this parse that cannot be cast back and stepped. */
    public ParseConfiguration readOnlyView() {
        return view;
    }

    private class ReadOnlyView implements ParseConfiguration {

        @Override
        public Sentence getSentence() {
            return sentence;
        }

        @Override
        public List<Integer> getStack() {
            return PartialParse.this.getStack();
        }

        @Override
        public int getNext() {
            return next;
        }

        @Override
        public List<Arc> getArcs() {
            return PartialParse.this.getArcs();
        }

        @Override
        public boolean isComplete() {
            return PartialParse.this.isComplete();
        }

        @Override
        public List<Integer> getNLeftmostDeps(int sentenceIdx, Integer n) {
            return PartialParse.this.getNLeftmostDeps(sentenceIdx, n);
        }

        @Override
        public List<Integer> getNRightmostDeps(int sentenceIdx, Integer n) {
            return PartialParse.this.getNRightmostDeps(sentenceIdx, n);
        }

        @Override
        public String toString() {
            return PartialParse.this.toString();
        }
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        builder.append("stack=");
        builder.append(stack);
        builder.append(" next=");
        builder.append(next);
        builder.append(" arcs=");
        builder.append(arcs);
        return builder.toString();
    }
}
