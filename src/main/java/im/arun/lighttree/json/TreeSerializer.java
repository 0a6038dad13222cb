package im.arun.lighttree.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.lighttree.exception.InvalidArgumentException;
import im.arun.lighttree.exception.InvalidOperationException;
import im.arun.lighttree.exception.NotFoundNodeException;
import im.arun.lighttree.exception.TreeSerializationException;
import im.arun.lighttree.model.KeyedNode;
import im.arun.lighttree.model.Node;
import im.arun.lighttree.tree.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Converts trees to and from their {@link SerializedTree} form.
 */
public class TreeSerializer {
    private static final Logger logger = LoggerFactory.getLogger(TreeSerializer.class);
    private final ObjectMapper objectMapper;

    public TreeSerializer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public SerializedTree serialize(Tree tree) {
        Map<String, Node> nodes = new LinkedHashMap<>();
        Map<String, String> parentOf = new LinkedHashMap<>();
        Map<String, Object> childrenOf = new LinkedHashMap<>();

        for (KeyedNode keyedNode : tree.list()) {
            String nid = keyedNode.getIdentifier();
            Node node = keyedNode.getNode();
            nodes.put(nid, node);
            parentOf.put(nid, nid.equals(tree.getRoot()) ? null : tree.parentId(nid));
            if (!node.isAcceptChildren()) {
                continue;
            }
            if (node.isKeyed()) {
                Map<String, String> keyed = new LinkedHashMap<>();
                for (KeyedNode child : tree.children(nid)) {
                    keyed.put(child.getIdentifier(), (String) child.getKey());
                }
                childrenOf.put(nid, keyed);
            } else {
                childrenOf.put(nid, tree.childrenIds(nid));
            }
        }
        return new SerializedTree(tree.getRoot(), tree.getPathSeparator(), nodes, parentOf, childrenOf);
    }

    public Tree deserialize(SerializedTree serialized) {
        String separator = serialized.getPathSeparator() == null
            ? Tree.DEFAULT_PATH_SEPARATOR
            : serialized.getPathSeparator();
        return deserializeInto(serialized, new Tree(separator));
    }

    /**
     * Rebuilds a serialized tree into {@code target}, which must be empty. Every node must be
     * reachable from the root and agree with {@code parent_of}.
     */
    public <T extends Tree> T deserializeInto(SerializedTree serialized, T target) {
        if (serialized == null) {
            throw new InvalidArgumentException("Serialized tree must not be null");
        }
        Map<String, Node> nodes = serialized.getNodes() == null ? Map.of() : serialized.getNodes();
        if (serialized.getRoot() == null) {
            if (!nodes.isEmpty()) {
                throw new InvalidOperationException("Serialized tree has nodes but no root");
            }
            return target;
        }
        Map<String, String> parentOf = serialized.getParentOf() == null ? Map.of() : serialized.getParentOf();
        Map<String, Object> childrenOf = serialized.getChildrenOf() == null ? Map.of() : serialized.getChildrenOf();

        target.insertNode(lookup(nodes, serialized.getRoot()));
        Deque<String> queue = new ArrayDeque<>();
        queue.add(serialized.getRoot());
        while (!queue.isEmpty()) {
            String pid = queue.poll();
            Object children = childrenOf.get(pid);
            if (children == null) {
                continue;
            }
            if (children instanceof Map) {
                for (Map.Entry<?, ?> entry : ((Map<?, ?>) children).entrySet()) {
                    String cid = entry.getKey().toString();
                    attach(target, nodes, parentOf, pid, cid, entry.getValue());
                    queue.add(cid);
                }
            } else if (children instanceof List) {
                for (Object child : (List<?>) children) {
                    String cid = child.toString();
                    attach(target, nodes, parentOf, pid, cid, null);
                    queue.add(cid);
                }
            } else {
                throw new InvalidArgumentException(String.format(
                    "Children of <%s> must be an object or an array, got %s", pid, children.getClass().getSimpleName()));
            }
        }
        if (target.size() != nodes.size()) {
            throw new InvalidOperationException(String.format(
                "Serialized tree holds %d nodes, only %d reachable from root <%s>",
                nodes.size(), target.size(), serialized.getRoot()));
        }
        logger.debug("Deserialized tree of {} nodes", target.size());
        return target;
    }

    private void attach(Tree target, Map<String, Node> nodes, Map<String, String> parentOf,
                        String pid, String cid, Object key) {
        if (!pid.equals(parentOf.get(cid))) {
            throw new InvalidOperationException(String.format(
                "Node <%s> listed under <%s> but its parent is <%s>", cid, pid, parentOf.get(cid)));
        }
        target.insertNode(lookup(nodes, cid), pid, key);
    }

    private Node lookup(Map<String, Node> nodes, String nid) {
        Node node = nodes.get(nid);
        if (node == null) {
            throw new NotFoundNodeException(String.format("Node id <%s> referenced but not serialized", nid));
        }
        return node;
    }

    public String toJson(Tree tree) {
        try {
            return objectMapper.writeValueAsString(serialize(tree));
        } catch (JsonProcessingException e) {
            throw new TreeSerializationException("Failed to write tree", e);
        }
    }

    public Tree fromJson(String json) {
        try {
            return deserialize(objectMapper.readValue(json, SerializedTree.class));
        } catch (JsonProcessingException e) {
            throw new TreeSerializationException("Failed to read tree", e);
        }
    }
}
