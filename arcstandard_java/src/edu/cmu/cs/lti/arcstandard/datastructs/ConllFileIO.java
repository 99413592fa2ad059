package edu.cmu.cs.lti.arcstandard.datastructs;

import java.io.File;
import java.io.IOException;
import java.util.List;

import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

public class ConllFileIO {

    private static final Joiner TAB_JOINER = Joiner.on('\t');

    private final boolean conll10Only;

    public ConllFileIO() {
        this(false);
    }

    public ConllFileIO(boolean conll10Only) {
        this.conll10Only = conll10Only;
    }

    public static String joinTabSeparatedStrings(String... strings) {
        return TAB_JOINER.join(strings);
    }

    public ImmutableList<Conll> readConllFile(String fileName) throws IOException {
        return readConllLines(Files.readLines(new File(fileName), Charsets.UTF_8));
    }

    public ImmutableList<Conll> readConllLines(List<String> lines) {
        ImmutableList.Builder<Conll> builder = new ImmutableList.Builder<Conll>();

        List<String> conllLines = Lists.newArrayList();
        for (String line : lines) {
            if (line.trim().equals("")) {
                if (conllLines.isEmpty() == false) {
                    builder.add(new Conll(conllLines, conll10Only));
                    conllLines = Lists.newArrayList();
                }
                continue;
            }
            conllLines.add(line);
        }
        // last block may not be followed by a blank line
        if (conllLines.isEmpty() == false) {
            builder.add(new Conll(conllLines, conll10Only));
        }
        return builder.build();
    }

    public void writeConllFile(String fileName, List<Conll> conlls) throws IOException {
        List<String> lines = Lists.newArrayList();
        for (Conll conll : conlls) {
            lines.add(conll.toString());
        }
        Files.asCharSink(new File(fileName), Charsets.UTF_8).writeLines(lines);
    }

}
