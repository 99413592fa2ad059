package edu.cmu.cs.lti.arcstandard.parser;

import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import edu.cmu.cs.lti.arcstandard.IllegalTransitionException;
import edu.cmu.cs.lti.arcstandard.ParseConfiguration;
import edu.cmu.cs.lti.arcstandard.PartialParse;
import edu.cmu.cs.lti.arcstandard.datastructs.Arc;
import edu.cmu.cs.lti.arcstandard.datastructs.Sentence;

/**
 * Greedy parsing of many sentences at once. Every round asks the model for the next move of up to
 * {@code batchSize} unfinished parses, applies the moves and retires the parses that are complete
 * or were given an illegal move.
 */
public class MinibatchParser {

    private static final Logger log = Logger.getLogger(MinibatchParser.class);

    private MinibatchParser() {
    }

    /**
     * @return the arcs of each sentence, in input order. A sentence whose parse got stuck keeps
     *         the arcs it had built so far.
     */
    public static List<List<Arc>> minibatchParse(List<Sentence> sentences, ParserModel model,
            int batchSize) {
        Preconditions.checkArgument(batchSize > 0, "batch size must be positive, got %s", batchSize);

        List<PartialParse> partialParses = Lists.newArrayListWithCapacity(sentences.size());
        for (Sentence sentence : sentences) {
            partialParses.add(new PartialParse(sentence));
        }

        List<PartialParse> unfinishedParses = Lists.newArrayList();
        for (PartialParse pp : partialParses) {
            // nothing to do for an empty sentence
            if (pp.isComplete() == false) {
                unfinishedParses.add(pp);
            }
        }

        int round = 0;
        int stuck = 0;
        while (unfinishedParses.isEmpty() == false) {
            List<PartialParse> minibatch = ImmutableList.copyOf(
                    unfinishedParses.subList(0, Math.min(batchSize, unfinishedParses.size())));
            List<ParseConfiguration> views = Lists.newArrayListWithCapacity(minibatch.size());
            for (PartialParse pp : minibatch) {
                views.add(pp.readOnlyView());
            }
            List<Transition> transitions = model.predict(Collections.unmodifiableList(views));
            Preconditions.checkState(transitions.size() == minibatch.size(),
                    "model returned %s transitions for %s parses",
                    transitions.size(), minibatch.size());

            List<PartialParse> stillUnfinished = Lists.newArrayList();
            for (int i = 0; i < minibatch.size(); i++) {
                PartialParse pp = minibatch.get(i);
                try {
                    pp.parseStep(transitions.get(i));
                } catch (IllegalTransitionException e) {
                    if (log.isDebugEnabled()) {
                        log.debug("dropping stuck parse after " + pp.getArcs().size() + " arcs: "
                                + e.getMessage());
                    }
                    stuck++;
                    continue;
                }
                if (pp.isComplete() == false) {
                    stillUnfinished.add(pp);
                }
            }
            stillUnfinished.addAll(unfinishedParses.subList(minibatch.size(), unfinishedParses.size()));
            unfinishedParses = stillUnfinished;
            round++;
            if (log.isDebugEnabled()) {
                log.debug("round " + round + ": " + unfinishedParses.size() + " parses left");
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("parsed " + sentences.size() + " sentences in " + round + " rounds, "
                    + stuck + " stuck");
        }

        List<List<Arc>> arcs = Lists.newArrayListWithCapacity(partialParses.size());
        for (PartialParse pp : partialParses) {
            arcs.add(ImmutableList.copyOf(pp.getArcs()));
        }
        return arcs;
    }
}
