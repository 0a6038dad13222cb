package im.arun.lighttree.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import im.arun.lighttree.exception.InvalidArgumentException;
import lombok.Getter;
import lombok.Setter;

import java.util.UUID;

/**
 * A tree node.
 *
 * <p>A node is identified by a string that is unique within the tree holding it. Children of a
 * keyed node are addressed by string keys (map semantics), children of an unkeyed node by their
 * position (list semantics). A node that does not accept children is a leaf and is always unkeyed.
 *
 * <p>The key under which a node sits is not stored here: it is derived from the parent's child
 * index by the owning tree.
 */
@Getter
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Node {

    @JsonProperty("identifier")
    private final String identifier;

    @JsonProperty("keyed")
    private final boolean keyed;

    @JsonProperty("accept_children")
    private final boolean acceptChildren;

    @Setter
    @JsonProperty("repr")
    private String display;

    @Setter
    @JsonProperty("data")
    private Object data;

    /**
     * Keyed container node with a generated identifier.
     */
    public Node() {
        this(null);
    }

    public Node(String identifier) {
        this(identifier, true);
    }

    public Node(String identifier, boolean keyed) {
        this(identifier, keyed, true, null, null);
    }

    /**
     * @param identifier node identifier, a random UUID is generated when null
     * @param keyed whether children are addressed by string keys
     * @param acceptChildren false for a leaf
     * @param display optional text used when rendering the node
     * @param data optional payload
     */
    @JsonCreator
    public Node(@JsonProperty("identifier") String identifier,
                @JsonProperty("keyed") boolean keyed,
                @JsonProperty("accept_children") boolean acceptChildren,
                @JsonProperty("repr") String display,
                @JsonProperty("data") Object data) {
        if (identifier == null) {
            identifier = UUID.randomUUID().toString();
        } else if (identifier.isBlank()) {
            throw new InvalidArgumentException("Node identifier must not be blank");
        }
        this.identifier = identifier;
        this.acceptChildren = acceptChildren;
        this.keyed = acceptChildren && keyed;
        this.display = display;
        this.data = data;
    }

    /**
     * Leaf node carrying a payload.
     */
    public static Node leaf(String identifier, String display, Object data) {
        return new Node(identifier, false, false, display, data);
    }

    /**
     * Two-part representation used by the renderer: a left "start" part and an optional
     * right-aligned "end" part.
     *
     * @param depth depth of the node in the rendered tree, ignored by default
     */
    public LineRepr lineRepr(int depth) {
        if (display != null) {
            return new LineRepr(display, "");
        }
        if (acceptChildren) {
            return new LineRepr(keyed ? "{}" : "[]", "");
        }
        if (data != null) {
            return new LineRepr(data instanceof JsonNode ? ((JsonNode) data).asText() : data.toString(), "");
        }
        return new LineRepr(identifier, "");
    }

    /**
     * Independent copy of this node, used by deep clones. Override to duplicate payload types the
     * base implementation does not know about.
     */
    public Node copy() {
        return new Node(identifier, keyed, acceptChildren, display, copyData());
    }

    protected Object copyData() {
        if (data instanceof JsonNode) {
            return ((JsonNode) data).deepCopy();
        }
        return data;
    }

    @Override
    public String toString() {
        return String.format("%s, id=%s", getClass().getSimpleName(), identifier);
    }
}
