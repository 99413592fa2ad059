package edu.cmu.cs.lti.arcstandard;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import edu.cmu.cs.lti.arcstandard.datastructs.Arc;
import edu.cmu.cs.lti.arcstandard.datastructs.Sentence;
import edu.cmu.cs.lti.arcstandard.datastructs.Token;
import edu.cmu.cs.lti.arcstandard.parser.Action;
import edu.cmu.cs.lti.arcstandard.parser.Transition;

public class PartialParseTest {

    static Sentence words(int from, int to) {
        List<Token> tokens = Lists.newArrayList();
        for (int x = from; x < to; x++) {
            tokens.add(new Token("word_" + x, "tag_" + x));
        }
        return new Sentence(tokens);
    }

    private static PartialParse hundredWords(List<Integer> stack, int next, List<Arc> arcs) {
        return new PartialParse(words(0, 100), stack, next, arcs);
    }

    @Test
    public void initialState() {
        PartialParse pp = new PartialParse(words(1, 4));
        assertEquals(Arrays.asList(0), pp.getStack());
        assertEquals(1, pp.getNext());
        assertTrue(pp.getArcs().isEmpty());
        assertFalse(pp.isComplete());
        assertNull(pp.getSentence().getWord(0));
        assertEquals(Sentence.ROOT_TAG, pp.getSentence().getTag(0));
    }

    @Test
    public void shift() throws IllegalTransitionException {
        PartialParse pp = hundredWords(Arrays.asList(0, 1), 2, Collections.<Arc> emptyList());
        pp.parseStep(Action.SHIFT, "tingle");
        assertEquals(Arrays.asList(0, 1, 2), pp.getStack());
        assertEquals(3, pp.getNext());
        assertTrue(pp.getArcs().isEmpty());
    }

    @Test
    public void leftArc() throws IllegalTransitionException {
        PartialParse pp = hundredWords(Arrays.asList(0, 1, 2), 3, Collections.<Arc> emptyList());
        pp.parseStep(Transition.leftArc("tingle"));
        assertEquals(Arrays.asList(0, 2), pp.getStack());
        assertEquals(3, pp.getNext());
        assertEquals(Arrays.asList(new Arc(2, 1, "tingle")), pp.getArcs());
    }

    @Test
    public void rightArc() throws IllegalTransitionException {
        PartialParse pp = hundredWords(Arrays.asList(0, 1, 2), 3, Collections.<Arc> emptyList());
        pp.parseStep(Transition.rightArc("koolimpah"));
        assertEquals(Arrays.asList(0, 1), pp.getStack());
        assertEquals(3, pp.getNext());
        assertEquals(Arrays.asList(new Arc(1, 2, "koolimpah")), pp.getArcs());
    }

    @Test
    public void parse() throws IllegalTransitionException {
        PartialParse pp = new PartialParse(words(1, 4));
        assertFalse(pp.isComplete());
        List<Arc> arcs = pp.parse(Arrays.asList(
                Transition.shift(),
                Transition.shift(),
                Transition.shift(),
                Transition.leftArc("a"),
                Transition.rightArc("b"),
                Transition.rightArc("c")));
        assertEquals(ImmutableSet.of(new Arc(0, 1, "c"), new Arc(1, 3, "b"), new Arc(3, 2, "a")),
                ImmutableSet.copyOf(arcs));
        assertEquals(Arrays.asList(0), pp.getStack());
        assertEquals(4, pp.getNext());
        assertTrue(pp.isComplete());
    }

    @Test
    public void leftArcNeedsThreeOnStack() {
        PartialParse pp = hundredWords(Arrays.asList(0, 1), 2, Collections.<Arc> emptyList());
        try {
            pp.parseStep(Transition.leftArc("x"));
            fail("ROOT cannot be a dependent");
        } catch (IllegalTransitionException e) {
            // expected
        }
        assertEquals(Arrays.asList(0, 1), pp.getStack());
        assertTrue(pp.getArcs().isEmpty());
    }

    @Test(expected = IllegalTransitionException.class)
    public void rightArcNeedsTwoOnStack() throws IllegalTransitionException {
        PartialParse pp = hundredWords(Arrays.asList(0), 5, Collections.<Arc> emptyList());
        pp.parseStep(Transition.rightArc("x"));
    }

    @Test
    public void shiftNeedsNonEmptyBuffer() {
        PartialParse pp = hundredWords(Arrays.asList(0, 100), 101, Collections.<Arc> emptyList());
        try {
            pp.parseStep(Transition.shift());
            fail("buffer is empty");
        } catch (IllegalTransitionException e) {
            assertFalse(e instanceof AlreadyCompleteException);
        }
        assertEquals(101, pp.getNext());
        assertEquals(Arrays.asList(0, 100), pp.getStack());
    }

    @Test(expected = IllegalTransitionException.class)
    public void unknownAction() throws IllegalTransitionException {
        new PartialParse(words(1, 3)).parseStep(null, "x");
    }

    @Test
    public void nullTransitionIsIllegal() {
        PartialParse pp = new PartialParse(words(1, 3));
        try {
            pp.parseStep((Transition) null);
            fail("null is not a transition");
        } catch (IllegalTransitionException e) {
            assertFalse(e instanceof AlreadyCompleteException);
        }
        assertEquals(Arrays.asList(0), pp.getStack());
        assertEquals(1, pp.getNext());
    }

    @Test
    public void readOnlyViewFollowsParse() throws IllegalTransitionException {
        PartialParse pp = new PartialParse(words(1, 3));
        ParseConfiguration view = pp.readOnlyView();
        assertFalse(view instanceof PartialParse);
        pp.parseStep(Transition.shift());
        pp.parseStep(Transition.shift());
        pp.parseStep(Transition.leftArc("a"));
        assertEquals(Arrays.asList(0, 2), view.getStack());
        assertEquals(3, view.getNext());
        assertEquals(pp.getArcs(), view.getArcs());
        assertEquals(Arrays.asList(1), view.getNLeftmostDeps(2, null));
        assertSame(pp.getSentence(), view.getSentence());
    }

    @Test
    public void stepOnCompleteParse() {
        PartialParse pp = new PartialParse(words(1, 1));
        assertTrue(pp.isComplete());
        try {
            pp.parseStep(Transition.shift());
            fail();
        } catch (AlreadyCompleteException e) {
            // expected
        } catch (IllegalTransitionException e) {
            fail("expected AlreadyCompleteException, got " + e);
        }
    }

    @Test
    public void completeParseTakesTwoTransitionsPerWord() throws IllegalTransitionException {
        int n = 6;
        PartialParse pp = new PartialParse(words(1, n + 1));
        int transitions = 0;
        for (int i = 0; i < n; i++) {
            pp.parseStep(Transition.shift());
            transitions++;
        }
        while (pp.isComplete() == false) {
            pp.parseStep(Transition.rightArc("dep"));
            transitions++;
        }
        assertEquals(2 * n, transitions);
        assertEquals(n, pp.getArcs().size());
        Set<Integer> dependents = Sets.newHashSet();
        for (Arc arc : pp.getArcs()) {
            assertTrue("dependent seen twice: " + arc, dependents.add(arc.dependent));
        }
        assertEquals(ImmutableSet.of(1, 2, 3, 4, 5, 6), dependents);
    }

    private static PartialParse withDeps() {
        return hundredWords(Arrays.asList(0, 2, 4, 8), 10, Arrays.asList(
                new Arc(0, 1, "a"),
                new Arc(4, 3, "b"),
                new Arc(4, 5, "c"),
                new Arc(4, 6, "d"),
                new Arc(8, 7, "e"),
                new Arc(8, 9, "f")));
    }

    @Test
    public void leftmostAndRightmostDeps() {
        PartialParse pp = withDeps();
        assertEquals(Arrays.asList(1), pp.getNLeftmostDeps(0, null));
        assertEquals(Arrays.asList(1), pp.getNRightmostDeps(0, 1));
        assertEquals(Collections.emptyList(), pp.getNLeftmostDeps(2, 10));
        assertEquals(Collections.emptyList(), pp.getNRightmostDeps(2, null));
        assertEquals(Collections.emptyList(), pp.getNLeftmostDeps(4, 0));
        assertEquals(Arrays.asList(3, 5), pp.getNLeftmostDeps(4, 2));
        assertEquals(Arrays.asList(3, 5, 6), pp.getNLeftmostDeps(4, 4));
        assertEquals(Arrays.asList(6, 5), pp.getNRightmostDeps(4, 2));
        assertEquals(Arrays.asList(9, 7), pp.getNRightmostDeps(8, null));
    }

    @Test
    public void zeroDepsAreEmptyForEveryWord() {
        PartialParse pp = withDeps();
        for (int i = 0; i < 10; i++) {
            assertTrue(pp.getNLeftmostDeps(i, 0).isEmpty());
            assertTrue(pp.getNRightmostDeps(i, 0).isEmpty());
        }
    }

    @Test
    public void queriesDoNotMutate() {
        PartialParse pp = withDeps();
        List<Integer> stack = ImmutableList.copyOf(pp.getStack());
        List<Arc> arcs = ImmutableList.copyOf(pp.getArcs());
        pp.getNLeftmostDeps(4, null);
        pp.getNRightmostDeps(8, 1);
        pp.isComplete();
        assertEquals(stack, pp.getStack());
        assertEquals(arcs, pp.getArcs());
        assertEquals(10, pp.getNext());
    }

    @Test(expected = IllegalArgumentException.class)
    public void negativeDepCount() {
        withDeps().getNLeftmostDeps(4, -1);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void stackViewIsReadOnly() {
        new PartialParse(words(1, 3)).getStack().add(2);
    }
}
