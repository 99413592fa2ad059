package edu.cmu.cs.lti.arcstandard.datastructs;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * An immutable sequence of (word, tag) pairs. Position 0 always holds the synthetic ROOT token,
 * so the first real word sits at index 1.
 */
public class Sentence {

    /** POS tag reserved for ROOT. */
    public static final String ROOT_TAG = "TOP";

    public static final int ROOT = 0;

    private final ImmutableList<Token> tokens;

    public Sentence(List<Token> words) {
        ImmutableList.Builder<Token> builder = ImmutableList.builder();
        builder.add(new Token(null, ROOT_TAG));
        builder.addAll(words);
        this.tokens = builder.build();
    }

    public static Sentence of(String... wordTagPairs) {
        Preconditions.checkArgument(wordTagPairs.length % 2 == 0,
                "expected alternating words and tags, got %s strings", wordTagPairs.length);
        ImmutableList.Builder<Token> builder = ImmutableList.builder();
        for (int i = 0; i < wordTagPairs.length; i += 2) {
            builder.add(new Token(wordTagPairs[i], wordTagPairs[i + 1]));
        }
        return new Sentence(builder.build());
    }

    /** Number of positions, ROOT included. */
    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    public String getWord(int index) {
        return tokens.get(index).word;
    }

    public String getTag(int index) {
        return tokens.get(index).tag;
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Sentence other = (Sentence) obj;
        return tokens.equals(other.tokens);
    }

    @Override
    public String toString() {
        return tokens.toString();
    }
}
