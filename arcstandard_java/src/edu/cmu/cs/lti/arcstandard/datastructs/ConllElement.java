package edu.cmu.cs.lti.arcstandard.datastructs;

import com.google.common.base.Preconditions;

public class ConllElement {

    public static final int MALT_TAB_COLUMNS = 4;
    public static final int CONLL_X_COLUMNS = 10;

    public int id;
    public String form;
    public String postag;
    public int head;
    public String depRel;

    public ConllElement(int id, String form, String postag, int head, String depRel) {
        this.id = id;
        this.form = form;
        this.postag = postag;
        this.head = head;
        this.depRel = depRel;
    }

    /**
     * Reads one token line. Four columns are {@code word tag head deprel}, with the id given by
     * the line's position; ten columns are CoNLL-X, whose coarse tag column is used.
     */
    public static ConllElement fromLine(String line, int position, boolean conll10Only) {
        String trimmed = line.trim();
        String[] ele = trimmed.contains("\t") ? trimmed.split("\t") : trimmed.split("\\s+");
        if (ele.length == CONLL_X_COLUMNS) {
            return new ConllElement(Integer.parseInt(ele[0]), ele[1], ele[3],
                    Integer.parseInt(ele[6]), ele[7]);
        }
        Preconditions.checkArgument(conll10Only == false,
                "expected %s columns, got %s in line: %s", CONLL_X_COLUMNS, ele.length, line);
        Preconditions.checkArgument(ele.length == MALT_TAB_COLUMNS,
                "expected %s or %s columns, got %s in line: %s",
                MALT_TAB_COLUMNS, CONLL_X_COLUMNS, ele.length, line);
        return new ConllElement(position, ele[0], ele[1], Integer.parseInt(ele[2]), ele[3]);
    }

    @Override
    public String toString() {
        return ConllFileIO.joinTabSeparatedStrings(form, postag, head + "", depRel);
    }
}
