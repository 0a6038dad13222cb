package im.arun.lighttree.tree;

import im.arun.lighttree.exception.DuplicateKeyException;
import im.arun.lighttree.exception.DuplicatedNodeException;
import im.arun.lighttree.exception.InvalidArgumentException;
import im.arun.lighttree.exception.InvalidOperationException;
import im.arun.lighttree.exception.NotFoundNodeException;
import im.arun.lighttree.model.Node;
import org.junit.jupiter.api.Test;

import static im.arun.lighttree.tree.TreeFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TreeCloneMergeTest {

    @Test
    void clone_shallowSharesNodes() {
        Tree t = sampleTree();
        Tree copy = t.clone();
        assertThat(copy).isNotSameAs(t);
        assertThat(copy.show()).isEqualTo(t.show());
        assertThat(copy.getNode("aa0")).isSameAs(t.getNode("aa0"));
        TreeSanity.check(copy);
    }

    @Test
    void clone_shallowSeesNodeMutations() {
        Tree t = sampleTree();
        Tree copy = t.clone();
        t.getNode("aa0").setDisplay("changed");
        assertThat(copy.getNode("aa0").getDisplay()).isEqualTo("changed");
    }

    @Test
    void clone_deepCopiesNodes() {
        Tree t = sampleTree();
        Tree copy = t.clone(true, true, null);
        assertThat(copy.show()).isEqualTo(t.show());
        assertThat(copy.getNode("aa0")).isNotSameAs(t.getNode("aa0"));
        assertThat(copy.getNode("aa0").getIdentifier()).isEqualTo("aa0");

        t.getNode("aa0").setDisplay("changed");
        assertThat(copy.getNode("aa0").getDisplay()).isEqualTo("AA0");
    }

    @Test
    void clone_structureIsIndependent() {
        Tree t = sampleTree();
        Tree copy = t.clone();
        copy.dropNode("a");
        copy.insertNode(Node.leaf("c2", "C2", null), "c", null);
        assertThat(t.size()).isEqualTo(9);
        assertThat(t.childrenIds("c")).containsExactly("c0", "c1");
        TreeSanity.check(t);
        TreeSanity.check(copy);
    }

    @Test
    void clone_withoutNodes() {
        Tree t = sampleTree("|");
        Tree empty = t.clone(false, false, null);
        assertThat(empty.isEmpty()).isTrue();
        assertThat(empty.getPathSeparator()).isEqualTo("|");
    }

    @Test
    void clone_ofEmptyTree() {
        assertThat(new Tree().clone().isEmpty()).isTrue();
    }

    @Test
    void clone_fromNewRoot() {
        Tree t = sampleTree();
        Tree copy = t.clone(true, false, "a");
        assertThat(copy.getRoot()).isEqualTo("a");
        assertThat(copy.size()).isEqualTo(5);
        assertThat(copy.getKey("a")).isNull();
        assertThat(copy.getPath("aa1")).isEqualTo("a.1");
        TreeSanity.check(copy);
        assertThatThrownBy(() -> t.clone(true, false, "nope")).isInstanceOf(NotFoundNodeException.class);
    }

    @Test
    void subtree_keepsKeyAndLeavesTreeUntouched() {
        Tree t = sampleTree();
        KeyedTree sub = t.subtree("c");
        assertThat(sub.getKey()).isEqualTo("c");
        assertThat(sub.getTree().getRoot()).isEqualTo("c");
        assertThat(sub.getTree().childrenIds("c")).containsExactly("c0", "c1");
        assertThat(sub.getTree().getNode("c0")).isSameAs(t.getNode("c0"));
        assertThat(t.size()).isEqualTo(9);

        KeyedTree deep = t.subtree("aa0", true);
        assertThat(deep.getKey()).isEqualTo(0);
        assertThat(deep.getTree().getNode("aa0")).isNotSameAs(t.getNode("aa0"));
    }

    @Test
    void merge_ontoListNodeKeepsPositions() {
        Tree t = sampleTree();
        Tree result = t.merge(sampleTree2(), "c");
        assertThat(result).isSameAs(t);
        assertThat(t.contains("broot")).isFalse();
        assertThat(t.childrenIds("c")).containsExactly("b1", "b2", "c0", "c1");
        TreeSanity.check(t);
        assertThat(t.show(ShowOptions.builder().nid("c").build())).isEqualTo(lines(
            "[]",
            "├── {}",
            "│   └── a: {}",
            "├── {}",
            "├── C0",
            "└── C1"));
    }

    @Test
    void merge_intoEmptyTreeTakesWholeTree() {
        Tree t = new Tree();
        t.merge(sampleTree2());
        assertThat(t.getRoot()).isEqualTo("broot");
        TreeSanity.check(t);
        assertThat(t.show()).isEqualTo(lines(
            "[]",
            "├── {}",
            "│   └── a: {}",
            "└── {}"));
    }

    @Test
    void merge_keyedOntoKeyed() {
        Tree t = sampleTree();
        Tree other = new Tree();
        other.insertNode(new Node("oroot"));
        other.insertNode(new Node("oz"), "oroot", "z");
        other.insertNode(Node.leaf("oz0", "OZ0", null), "oz", "leaf");
        t.merge(other);
        assertThat(t.parentId("oz")).isEqualTo("root");
        assertThat(t.getPath("oz0")).isEqualTo("z.leaf");
        assertThat(t.contains("oroot")).isFalse();
        TreeSanity.check(t);
    }

    @Test
    void merge_rejectsConflicts() {
        Tree t = sampleTree();

        Tree keyClash = new Tree();
        keyClash.insertNode(new Node("oroot"));
        keyClash.insertNode(new Node("oa"), "oroot", "a");
        assertThatThrownBy(() -> t.merge(keyClash)).isInstanceOf(DuplicateKeyException.class);

        Tree idClash = new Tree();
        idClash.insertNode(new Node("oroot"));
        idClash.insertNode(new Node("aa"), "oroot", "z");
        assertThatThrownBy(() -> t.merge(idClash)).isInstanceOf(DuplicatedNodeException.class);

        assertThatThrownBy(() -> t.merge(sampleTree2(), "a")).isInstanceOf(InvalidOperationException.class);
        assertThatThrownBy(() -> t.merge(sampleTree2(), "c0")).isInstanceOf(InvalidOperationException.class);
        assertThatThrownBy(() -> t.merge(sampleTree2(), "nope")).isInstanceOf(NotFoundNodeException.class);
        assertThatThrownBy(() -> t.merge(null)).isInstanceOf(InvalidArgumentException.class);

        assertThat(t.show()).isEqualTo(sampleTree().show());
        TreeSanity.check(t);
    }

    @Test
    void merge_emptyOrChildlessTreeIsNoop() {
        Tree t = sampleTree();
        t.merge(new Tree(), "c");
        Tree lonely = new Tree();
        lonely.insertNode(new Node("lonely"));
        t.merge(lonely, "a");
        assertThat(t.size()).isEqualTo(9);
        assertThat(t.contains("lonely")).isFalse();
    }

    @Test
    void merge_intoEmptyTreeWithNidFails() {
        assertThatThrownBy(() -> new Tree().merge(sampleTree2(), "x"))
            .isInstanceOf(NotFoundNodeException.class);
    }
}
