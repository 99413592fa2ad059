package edu.cmu.cs.lti.arcstandard;

import java.util.List;

import edu.cmu.cs.lti.arcstandard.datastructs.Arc;
import edu.cmu.cs.lti.arcstandard.datastructs.Sentence;

/**
 * Read-only view of an arc-standard configuration: the sentence, the stack (bottom first), the
 * index of the next buffer word and the arcs built so far, in creation order.
 */
public interface ParseConfiguration {

    Sentence getSentence();

    List<Integer> getStack();

    /** The buffer is {@code [getNext(), getSentence().size())}. */
    int getNext();

    List<Arc> getArcs();

    boolean isComplete();

    /**
     * Up to {@code n} dependents of {@code sentenceIdx}, scanning arcs from the first created.
     * {@code null} returns all of them.
     */
    List<Integer> getNLeftmostDeps(int sentenceIdx, Integer n);

    /**
     * Up to {@code n} dependents of {@code sentenceIdx}, scanning arcs from the last created.
     * {@code null} returns all of them.
     */
    List<Integer> getNRightmostDeps(int sentenceIdx, Integer n);
}
