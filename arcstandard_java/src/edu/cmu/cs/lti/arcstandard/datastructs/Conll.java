package edu.cmu.cs.lti.arcstandard.datastructs;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/** One sentence block of a CoNLL file. */
public class Conll {

    public List<ConllElement> elements;
    public int size;

    public Conll(List<String> lines, boolean conll10Only) {
        this.elements = Lists.newArrayList();
        int position = 1;
        for (String line : lines) {
            ConllElement ele = ConllElement.fromLine(line, position, conll10Only);
            Preconditions.checkArgument(ele.id == position,
                    "token %s found at position %s", ele.id, position);
            elements.add(ele);
            position++;
        }
        this.size = elements.size();
    }

    public Sentence toSentence() {
        List<Token> words = Lists.newArrayListWithCapacity(size);
        for (ConllElement ele : elements) {
            words.add(new Token(ele.form, ele.postag));
        }
        return new Sentence(words);
    }

    public DepTree toDepTree() {
        DepTree tree = new DepTree(size);
        for (ConllElement ele : elements) {
            tree.addNode(ele.id, ele.head, ele.depRel);
        }
        return tree;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        for (ConllElement ele : elements) {
            builder.append(ele.toString());
            builder.append("\n");
        }
        return builder.toString();
    }

}
