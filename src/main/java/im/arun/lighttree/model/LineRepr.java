package im.arun.lighttree.model;

import lombok.Value;

/**
 * Rendered form of a node: {@code start} is printed after the tree prefix, {@code end} is
 * right-aligned on the line.
 */
@Value
public class LineRepr {
    String start;
    String end;
}
