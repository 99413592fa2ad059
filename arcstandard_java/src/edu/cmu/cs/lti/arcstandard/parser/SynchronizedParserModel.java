package edu.cmu.cs.lti.arcstandard.parser;

import java.util.List;

import edu.cmu.cs.lti.arcstandard.ParseConfiguration;

/** Serializes calls to a model that is not safe for concurrent prediction. */
public class SynchronizedParserModel implements ParserModel {

    private final ParserModel delegate;

    public SynchronizedParserModel(ParserModel delegate) {
        this.delegate = delegate;
    }

    @Override
    public synchronized List<Transition> predict(List<? extends ParseConfiguration> partialParses) {
        return delegate.predict(partialParses);
    }
}
