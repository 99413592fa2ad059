package edu.cmu.cs.lti.arcstandard.parser;

import java.util.List;

import edu.cmu.cs.lti.arcstandard.ParseConfiguration;

/**
 * Scores configurations and proposes the next move for each of them.
 */
public interface ParserModel {

    /**
     * @return one transition per configuration, in the same order
     */
    List<Transition> predict(List<? extends ParseConfiguration> partialParses);
}
