package edu.cmu.cs.lti.arcstandard;

import java.io.File;
import java.io.IOException;
import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.List;

import org.apache.log4j.Logger;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.google.common.base.Charsets;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.io.Files;

import edu.cmu.cs.lti.arcstandard.datastructs.Conll;
import edu.cmu.cs.lti.arcstandard.datastructs.ConllFileIO;
import edu.cmu.cs.lti.arcstandard.datastructs.DepTree;
import edu.cmu.cs.lti.arcstandard.datastructs.Sentence;
import edu.cmu.cs.lti.arcstandard.parser.Oracle;
import edu.cmu.cs.lti.arcstandard.parser.Transition;

/**
 * Runs the oracle over every sentence of a treebank. Sentences the oracle cannot decode are
 * skipped after checking that their gold tree is indeed out of reach of the arc-standard system.
 */
public class OracleRunner {

    private static final Logger log = Logger.getLogger(OracleRunner.class);

    private static final Joiner SPACE_JOINER = Joiner.on(' ');

    @Parameter(names = "-inp", description = "treebank in 4-column or CoNLL-X format", required = true)
    public String input;

    @Parameter(names = "-print", description = "write the oracle transitions", arity = 1)
    public boolean printTransitions = true;

    @Parameter(names = "-out", description = "transition file, defaults to <inp>.transitions")
    public String output;

    @Parameter(names = "-conll10", description = "only accept 10-column CoNLL-X lines", arity = 1)
    public boolean conll10Only = false;

    public int numSentences = 0;
    public int numUndecodable = 0;
    public int numMistakes = 0;

    /**
     * @return the oracle transitions rebuilding {@code gold}, or absent if the tree is not
     *         reachable by the arc-standard system
     * @throws IllegalStateException if the oracle fails on a reachable tree
     */
    public static Optional<ImmutableList<Transition>> decode(Sentence sentence, DepTree gold) {
        PartialParse pp = new PartialParse(sentence);
        Oracle oracle = new Oracle(gold);
        ImmutableList.Builder<Transition> transitions = ImmutableList.builder();
        while (pp.isComplete() == false) {
            try {
                Transition transition = oracle.getOracle(pp);
                pp.parseStep(transition);
                transitions.add(transition);
            } catch (IllegalTransitionException | IndexOutOfBoundsException e) {
                Preconditions.checkState(isUnreachable(gold),
                        "Oracle failed on a projective tree (%s) at %s:\n%s", e.getMessage(), pp, gold);
                return Optional.absent();
            }
        }
        return Optional.of(transitions.build());
    }

    static boolean isUnreachable(DepTree gold) {
        return OracleHelper.isNonProjective(gold) || OracleHelper.hasSingleRoot(gold) == false;
    }

    /** Decodes every sentence and returns one line of transitions per decodable sentence. */
    public List<String> run(List<Conll> conlls) {
        List<String> lines = Lists.newArrayList();
        for (Conll conll : conlls) {
            numSentences++;
            Sentence sentence = conll.toSentence();
            DepTree gold = conll.toDepTree();

            Optional<ImmutableList<Transition>> transitions = decode(sentence, gold);
            if (transitions.isPresent() == false) {
                numUndecodable++;
                if (log.isDebugEnabled()) {
                    log.debug("Skipping undecodable sentence " + numSentences + ": "
                            + OracleHelper.sentenceToString(sentence));
                }
                continue;
            }
            if (isCorrect(sentence, gold, transitions.get()) == false) {
                numMistakes++;
                log.warn("Oracle arcs differ from gold for sentence " + numSentences + ":\n" + gold);
            }
            lines.add(SPACE_JOINER.join(transitions.get()));
        }
        return lines;
    }

    private static boolean isCorrect(Sentence sentence, DepTree gold, List<Transition> transitions) {
        PartialParse replay = new PartialParse(sentence);
        try {
            replay.parse(transitions);
        } catch (IllegalTransitionException e) {
            return false;
        }
        return OracleHelper.checkIfCorrect(replay, gold);
    }

    public String outputFile() {
        return output != null ? output : input + ".transitions";
    }

    public static void main(String[] args) throws IOException {
        OracleRunner runner = new OracleRunner();
        JCommander.newBuilder().addObject(runner).build().parse(args);

        ConllFileIO reader = new ConllFileIO(runner.conll10Only);
        ImmutableList<Conll> conlls = reader.readConllFile(runner.input);
        List<String> lines = runner.run(conlls);

        if (runner.printTransitions) {
            Files.asCharSink(new File(runner.outputFile()), Charsets.UTF_8).writeLines(lines);
            log.info("Wrote " + lines.size() + " transition sequences to " + runner.outputFile());
        }

        NumberFormat formatter = new DecimalFormat("#0.00");
        int total = Math.max(runner.numSentences, 1);
        log.info("Num sentences = " + runner.numSentences);
        log.info("Num undecodable = " + runner.numUndecodable + " = "
                + formatter.format(runner.numUndecodable * 100.0 / total) + "%");
        log.info("Num mistakes = " + runner.numMistakes + " = "
                + formatter.format(runner.numMistakes * 100.0 / total) + "%");
    }

}
