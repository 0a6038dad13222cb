package im.arun.lighttree.tree;

import im.arun.lighttree.model.KeyedNode;
import im.arun.lighttree.model.NodeKeys;
import lombok.Builder;
import lombok.Value;

import java.util.Comparator;
import java.util.function.Predicate;

/**
 * Rendering parameters for {@link Tree#show(ShowOptions)}.
 * A null {@code limit} renders every node.
 */
@Value
@Builder(toBuilder = true)
public class ShowOptions {

    public static final ShowOptions DEFAULT = ShowOptions.builder().build();

    String nid;

    Predicate<KeyedNode> filter;

    @Builder.Default
    boolean displayKey = true;

    @Builder.Default
    Comparator<KeyedNode> orderKey = NodeKeys.BY_KEY;

    boolean reverse;

    @Builder.Default
    LineStyle lineStyle = LineStyle.ASCII_EX;

    Integer limit;

    @Builder.Default
    int lineMaxLength = 60;

    @Builder.Default
    String keyDelimiter = ": ";
}
