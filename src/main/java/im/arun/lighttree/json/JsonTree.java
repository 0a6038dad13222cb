package im.arun.lighttree.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import im.arun.lighttree.exception.InvalidArgumentException;
import im.arun.lighttree.exception.TreeSerializationException;
import im.arun.lighttree.model.KeyedNode;
import im.arun.lighttree.model.Node;
import im.arun.lighttree.tree.Tree;

import java.util.Iterator;
import java.util.Map;

/**
 * Tree view of a JSON document: objects become map nodes, arrays list nodes, and scalars (null
 * included) leaves carrying the scalar as payload.
 */
public class JsonTree extends Tree {
    private static final ObjectMapper objectMapper = new ObjectMapper();

    public JsonTree() {
        this(DEFAULT_PATH_SEPARATOR);
    }

    public JsonTree(String pathSeparator) {
        super(pathSeparator);
    }

    public JsonTree(JsonNode json) {
        this(json, DEFAULT_PATH_SEPARATOR);
    }

    public JsonTree(JsonNode json, String pathSeparator) {
        super(pathSeparator);
        if (json != null && !json.isMissingNode()) {
            fill(json, null, null);
        }
    }

    /**
     * Builds a tree from plain Java values (maps, lists, strings, numbers, booleans, null).
     */
    public static JsonTree fromValue(Object value) {
        return new JsonTree(objectMapper.valueToTree(value));
    }

    public static JsonTree parse(String json) {
        try {
            return new JsonTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new TreeSerializationException("Invalid JSON document", e);
        }
    }

    @Override
    protected Tree newInstance(boolean deep) {
        return new JsonTree(getPathSeparator());
    }

    private void fill(JsonNode data, String parentId, Object key) {
        if (data.isArray()) {
            Node node = new Node(null, false);
            insertNode(node, parentId, key);
            for (JsonNode element : data) {
                fill(element, node.getIdentifier(), null);
            }
            return;
        }
        if (data.isObject()) {
            Node node = new Node(null, true);
            insertNode(node, parentId, key);
            Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                fill(field.getValue(), node.getIdentifier(), field.getKey());
            }
            return;
        }
        if (data.isValueNode()) {
            String display = data.isNull() ? "null" : data.asText();
            insertNode(Node.leaf(null, display, data), parentId, key);
            return;
        }
        throw new InvalidArgumentException(String.format("Unsupported JSON node type %s", data.getNodeType()));
    }

    /**
     * Rebuilds the JSON document; a missing node when the tree is empty.
     */
    public JsonNode toJson() {
        if (isEmpty()) {
            return MissingNode.getInstance();
        }
        return toJson(getRoot());
    }

    /**
     * Rebuilds the JSON content found below {@code nid}.
     */
    public JsonNode toJson(String nid) {
        Node node = getNode(nid);
        if (!node.isAcceptChildren()) {
            return node.getData() instanceof JsonNode
                ? (JsonNode) node.getData()
                : node.getData() == null ? NullNode.getInstance() : objectMapper.valueToTree(node.getData());
        }
        if (node.isKeyed()) {
            ObjectNode object = JsonNodeFactory.instance.objectNode();
            for (KeyedNode child : children(nid)) {
                object.set((String) child.getKey(), toJson(child.getIdentifier()));
            }
            return object;
        }
        ArrayNode array = JsonNodeFactory.instance.arrayNode();
        for (KeyedNode child : children(nid)) {
            array.add(toJson(child.getIdentifier()));
        }
        return array;
    }

    /**
     * Rebuilds the document as plain Java values, null when the tree is empty.
     */
    public Object toValue() {
        if (isEmpty()) {
            return null;
        }
        return objectMapper.convertValue(toJson(), Object.class);
    }
}
