package im.arun.lighttree.json;

import im.arun.lighttree.exception.InvalidArgumentException;
import im.arun.lighttree.exception.InvalidOperationException;
import im.arun.lighttree.exception.NotFoundNodeException;
import im.arun.lighttree.exception.TreeSerializationException;
import im.arun.lighttree.model.Node;
import im.arun.lighttree.tree.Tree;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeSerializerTest {

    private TreeSerializer serializer;

    @BeforeEach
    void setUp() {
        serializer = new TreeSerializer();
    }

    private static Tree smallTree(String separator) {
        Tree t = new Tree(separator);
        t.insertNode(new Node("root"));
        t.insertNode(new Node("a"), "root", "a");
        t.insertNode(new Node("l", false), "root", "l");
        t.insertNode(Node.leaf("l0", "L0", null), "l", null);
        t.insertNode(Node.leaf("l1", "L1", null), "l", null);
        return t;
    }

    @Test
    void serialize_describesBothDirections() {
        SerializedTree serialized = serializer.serialize(smallTree("."));
        assertThat(serialized.getRoot()).isEqualTo("root");
        assertThat(serialized.getPathSeparator()).isEqualTo(".");
        assertThat(serialized.getNodes()).containsOnlyKeys("root", "a", "l", "l0", "l1");
        assertThat(serialized.getParentOf()).containsEntry("root", null).containsEntry("l1", "l");
        assertThat(serialized.getChildrenOf().get("root")).isEqualTo(Map.of("a", "a", "l", "l"));
        assertThat(serialized.getChildrenOf().get("l")).isEqualTo(List.of("l0", "l1"));
        assertThat(serialized.getChildrenOf()).doesNotContainKey("l0");
    }

    @Test
    void json_roundTrip() {
        Tree original = smallTree("|");
        String json = serializer.toJson(original);
        assertThat(json).contains("\"children_of\"").contains("\"path_separator\" : \"|\"");

        Tree read = serializer.fromJson(json);
        assertThat(read.show()).isEqualTo(original.show());
        assertThat(read.getPathSeparator()).isEqualTo("|");
        assertThat(read.getPath("l1")).isEqualTo("l|1");
    }

    @Test
    void deserializeInto_jsonTree() {
        JsonTree original = JsonTree.parse("{\"a\":[1,{\"b\":\"x\"}]}");
        JsonTree read = serializer.deserializeInto(serializer.serialize(original), new JsonTree());
        assertThat(read.toValue()).isEqualTo(original.toValue());
        assertThat(read.show()).isEqualTo(original.show());
    }

    @Test
    void emptyTree() {
        Tree read = serializer.fromJson(serializer.toJson(new Tree()));
        assertThat(read.isEmpty()).isTrue();
    }

    @Test
    void deserialize_rejectsInconsistentInput() {
        Map<String, Node> nodes = new LinkedHashMap<>();
        nodes.put("r", new Node("r", false));
        nodes.put("x", new Node("x"));
        Map<String, String> parentOf = new HashMap<>();
        parentOf.put("r", null);
        parentOf.put("x", "r");

        assertThatThrownBy(() -> serializer.deserialize(new SerializedTree(null, ".", nodes, parentOf, Map.of())))
            .isInstanceOf(InvalidOperationException.class);

        // x never listed as a child
        assertThatThrownBy(() -> serializer.deserialize(new SerializedTree("r", ".", nodes, parentOf, Map.of())))
            .isInstanceOf(InvalidOperationException.class);

        Map<String, Object> missingChild = Map.of("r", List.of("x", "ghost"));
        Map<String, String> ghostParent = new HashMap<>(parentOf);
        ghostParent.put("ghost", "r");
        assertThatThrownBy(() -> serializer.deserialize(new SerializedTree("r", ".", nodes, ghostParent, missingChild)))
            .isInstanceOf(NotFoundNodeException.class);

        Map<String, String> wrongParent = new HashMap<>(parentOf);
        wrongParent.put("x", "elsewhere");
        assertThatThrownBy(() -> serializer.deserialize(
            new SerializedTree("r", ".", nodes, wrongParent, Map.of("r", List.of("x")))))
            .isInstanceOf(InvalidOperationException.class);

        assertThatThrownBy(() -> serializer.deserialize(
            new SerializedTree("r", ".", nodes, parentOf, Map.of("r", "x"))))
            .isInstanceOf(InvalidArgumentException.class);

        Tree ok = serializer.deserialize(new SerializedTree("r", ".", nodes, parentOf, Map.of("r", List.of("x"))));
        assertThat(ok.childrenIds("r")).containsExactly("x");
    }

    @Test
    void fromJson_invalidDocument() {
        assertThatThrownBy(() -> serializer.fromJson("not json")).isInstanceOf(TreeSerializationException.class);
    }
}
