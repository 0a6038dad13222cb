package im.arun.lighttree.tree;

import im.arun.lighttree.model.Node;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Operations on a single chain far deeper than the JVM call stack allows for recursive walks.
 */
class TreeDepthTest {

    private static final int DEPTH = 20_000;

    private static Tree chain() {
        Tree t = new Tree();
        t.insertNode(new Node("n0", false));
        for (int i = 1; i < DEPTH; i++) {
            t.insertNode(new Node("n" + i, false), "n" + (i - 1), null);
        }
        return t;
    }

    @Test
    void show_deepChain() {
        Tree t = chain();
        String shown = t.show();
        assertThat(shown.split("\n")).hasSize(DEPTH);
        assertThat(shown).startsWith("[]\n└── []\n    └── []\n");
    }

    @Test
    void dropNode_deepChain() {
        Tree t = chain();
        t.dropNode("n1");
        assertThat(t.size()).isEqualTo(1);
        assertThat(t.isLeaf("n0")).isTrue();

        Tree other = chain();
        other.dropNode("n0");
        assertThat(other.isEmpty()).isTrue();
    }

    @Test
    void dropSubtree_deepChain() {
        Tree t = chain();
        KeyedTree removed = t.dropSubtree("n10");
        assertThat(t.size()).isEqualTo(10);
        assertThat(removed.getKey()).isEqualTo(0);
        assertThat(removed.getTree().size()).isEqualTo(DEPTH - 10);
        assertThat(removed.getTree().depth("n" + (DEPTH - 1))).isEqualTo(DEPTH - 11);
    }

    @Test
    void insertAbove_deepChain() {
        Tree t = chain();
        t.insertNodeAbove(new Node("top", false), "n0", null);
        assertThat(t.getRoot()).isEqualTo("top");
        assertThat(t.depth("n" + (DEPTH - 1))).isEqualTo(DEPTH);
    }

    @Test
    void expand_deepChain() {
        Tree t = chain();
        int count = 0;
        for (Object ignored : t.expand()) {
            count++;
        }
        assertThat(count).isEqualTo(DEPTH);
    }
}
