package edu.cmu.cs.lti.arcstandard.datastructs;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.google.common.base.Optional;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.Lists;
import com.google.common.collect.MultimapBuilder;
import com.google.common.collect.Multimaps;

/**
 * Gold dependency tree over a sentence of {@code size} words. Position 0 is ROOT and has no head.
 * Every position keeps its own head and label, and every head keeps its dependents grouped by
 * relation label in the order they were added.
 */
public class DepTree {

    private final List<LabeledHead> headsAndDeps;
    private final List<ListMultimap<String, Integer>> deps;
    public final int size;

    public DepTree(int size) {
        Preconditions.checkArgument(size >= 0, "negative tree size %s", size);
        this.size = size;
        this.headsAndDeps = Lists.newArrayListWithCapacity(size + 1);
        this.deps = Lists.newArrayListWithCapacity(size + 1);
        for (int child = 0; child <= size; child++) {
            headsAndDeps.add(new LabeledHead());
            deps.add(MultimapBuilder.linkedHashKeys().arrayListValues().<String, Integer> build());
        }
    }

    public void addNode(int child, int head, String depRel) {
        Preconditions.checkElementIndex(child, size + 1, "child");
        Preconditions.checkElementIndex(head, size + 1, "head");
        Preconditions.checkArgument(child != Sentence.ROOT, "ROOT cannot take a head");
        Preconditions.checkArgument(headsAndDeps.get(child).hasHead() == false,
                "%s already has head %s", child, headsAndDeps.get(child).headId);
        headsAndDeps.set(child, new LabeledHead(head, depRel));
        deps.get(head).put(depRel, child);
    }

    public List<LabeledHead> getAllNodes() {
        return Collections.unmodifiableList(headsAndDeps);
    }

    public int getHead(int child) {
        return headsAndDeps.get(child).headId;
    }

    public String getHeadDepRel(int child) {
        return headsAndDeps.get(child).label;
    }

    /** Dependents of {@code head} keyed by relation label. */
    public ListMultimap<String, Integer> getDeps(int head) {
        return Multimaps.unmodifiableListMultimap(deps.get(head));
    }

    public List<Integer> getChildren(int head) {
        return ImmutableList.copyOf(deps.get(head).values());
    }

    public List<Integer> getLeftChildren(int head) {
        List<Integer> left = Lists.newArrayList();
        for (int child : deps.get(head).values()) {
            if (child < head) {
                left.add(child);
            }
        }
        return left;
    }

    public List<Integer> getRightChildren(int head) {
        List<Integer> right = Lists.newArrayList();
        for (int child : deps.get(head).values()) {
            if (child > head) {
                right.add(child);
            }
        }
        return right;
    }

    /** Label of the arc {@code head -> dependent}, if the tree has one. */
    public Optional<String> getDepRel(int head, int dependent) {
        for (Map.Entry<String, Integer> entry : deps.get(head).entries()) {
            if (entry.getValue() == dependent) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.absent();
    }

    /** All gold arcs ordered by dependent, the ROOT attachment included. */
    public List<Arc> getArcs() {
        List<Arc> arcs = Lists.newArrayListWithCapacity(size);
        for (int child = 1; child <= size; child++) {
            LabeledHead lh = headsAndDeps.get(child);
            if (lh.hasHead()) {
                arcs.add(new Arc(lh.headId, child, lh.label));
            }
        }
        return arcs;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + headsAndDeps.hashCode();
        result = prime * result + size;
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        DepTree other = (DepTree) obj;
        if (size != other.size)
            return false;
        return headsAndDeps.equals(other.headsAndDeps);
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder();
        int pos = 0;
        for (LabeledHead lh : headsAndDeps) {
            builder.append(lh.headId);
            builder.append("-");
            builder.append(lh.label);
            builder.append("->");
            builder.append(pos);
            builder.append("\n");
            pos++;
        }
        return builder.toString();
    }
}
