package im.arun.lighttree.tree;

import im.arun.lighttree.exception.AmbiguousInsertionException;
import im.arun.lighttree.exception.DuplicateKeyException;
import im.arun.lighttree.exception.DuplicatedNodeException;
import im.arun.lighttree.exception.InvalidArgumentException;
import im.arun.lighttree.exception.InvalidOperationException;
import im.arun.lighttree.exception.MultipleRootException;
import im.arun.lighttree.exception.NotFoundNodeException;
import im.arun.lighttree.model.KeyedNode;
import im.arun.lighttree.model.Node;
import im.arun.lighttree.model.NodeKeys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Mutable ordered tree holding two kinds of container nodes:
 * <ul>
 *     <li>"map" nodes, whose children are referenced by a string key ({@link Node#isKeyed()})</li>
 *     <li>"list" nodes, whose children are referenced by their position</li>
 * </ul>
 *
 * <p>Each node is identified by its id and a tree never holds two nodes with the same id. The
 * child to parent relation is stored both ways (child id to parent id, parent id to children ids),
 * and both directions are only ever updated together by {@link #register} and {@link #unregister}.
 *
 * <p>Nodes are shared, not copied, by shallow clones, subtrees, tree insertions and merges: a node
 * mutated through one tree is seen mutated through the other. Use {@link #clone(boolean, boolean, String)}
 * with {@code deep=true} for isolation.
 *
 * <p>Not thread-safe. Mutating a tree while consuming one of its {@link #expand} iterators gives
 * unspecified results.
 */
public class Tree {
    private static final Logger logger = LoggerFactory.getLogger(Tree.class);

    public static final String DEFAULT_PATH_SEPARATOR = ".";

    private final String pathSeparator;

    private String root;
    // node id -> node, in registration order
    private final Map<String, Node> nodes = new LinkedHashMap<>();
    // node id -> parent node id, root excluded
    private final Map<String, String> parentOf = new HashMap<>();
    // "map" node id -> (child id -> key)
    private final Map<String, Map<String, String>> keyedChildren = new HashMap<>();
    // "list" node id -> ordered children ids
    private final Map<String, List<String>> listChildren = new HashMap<>();

    public Tree() {
        this(DEFAULT_PATH_SEPARATOR);
    }

    public Tree(String pathSeparator) {
        if (pathSeparator == null || pathSeparator.isEmpty()) {
            throw new InvalidArgumentException("Path separator must be a non-empty string");
        }
        this.pathSeparator = pathSeparator;
    }

    /**
     * Creates the empty tree that clones and subtrees are built into. Subclasses carrying extra
     * state override this so that derived trees keep their type.
     *
     * @param deep whether extra state should be deep copied
     */
    protected Tree newInstance(boolean deep) {
        return new Tree(pathSeparator);
    }

    public String getPathSeparator() {
        return pathSeparator;
    }

    /**
     * @return root identifier, null when the tree is empty
     */
    public String getRoot() {
        return root;
    }

    public boolean isEmpty() {
        return root == null;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String nid) {
        return nid != null && nodes.containsKey(nid);
    }

    // ------------------------------------------------------------------ queries

    public KeyedNode get(String nid) {
        ensurePresent(nid);
        return new KeyedNode(getKey(nid), nodes.get(nid));
    }

    public Node getNode(String nid) {
        ensurePresent(nid);
        return nodes.get(nid);
    }

    /**
     * Key of a node: null for the root, the string key under a map node, the position under a
     * list node.
     */
    public Object getKey(String nid) {
        ensurePresent(nid);
        if (nid.equals(root)) {
            return null;
        }
        String pid = parentOf.get(nid);
        if (nodes.get(pid).isKeyed()) {
            return keyedChildren.get(pid).get(nid);
        }
        return listChildren.get(pid).indexOf(nid);
    }

    public List<KeyedNode> list() {
        return list(null, null, null);
    }

    /**
     * Lists nodes in registration order.
     *
     * @param idIn keep only these identifiers, ignored when null
     * @param depthIn keep only nodes at these depths, ignored when null
     * @param filter keep only nodes matching it, ignored when null
     */
    public List<KeyedNode> list(Collection<String> idIn, Collection<Integer> depthIn, Predicate<Node> filter) {
        // positions under list parents, computed once instead of one indexOf per node
        Map<String, Integer> positions = new HashMap<>();
        for (List<String> ids : listChildren.values()) {
            for (int i = 0; i < ids.size(); i++) {
                positions.put(ids.get(i), i);
            }
        }
        List<KeyedNode> result = new ArrayList<>();
        for (Map.Entry<String, Node> entry : nodes.entrySet()) {
            String nid = entry.getKey();
            if ((idIn == null || idIn.contains(nid))
                    && (filter == null || filter.test(entry.getValue()))
                    && (depthIn == null || depthIn.contains(depth(nid)))) {
                result.add(new KeyedNode(keyOf(nid, positions), entry.getValue()));
            }
        }
        return result;
    }

    private Object keyOf(String nid, Map<String, Integer> positions) {
        if (nid.equals(root)) {
            return null;
        }
        String pid = parentOf.get(nid);
        if (nodes.get(pid).isKeyed()) {
            return keyedChildren.get(pid).get(nid);
        }
        return positions.get(nid);
    }

    /**
     * @throws NotFoundNodeException if the node is absent, or is the root (which has no parent)
     */
    public String parentId(String nid) {
        ensurePresent(nid);
        if (nid.equals(root)) {
            throw new NotFoundNodeException(String.format("Root node <%s> has no parent", nid));
        }
        return parentOf.get(nid);
    }

    /**
     * @return the parent with its own key, empty for the root
     */
    public Optional<KeyedNode> parent(String nid) {
        ensurePresent(nid);
        if (nid.equals(root)) {
            return Optional.empty();
        }
        return Optional.of(get(parentOf.get(nid)));
    }

    /**
     * Children identifiers. List order is authoritative for list nodes; map nodes return their
     * children in insertion order, which is not the key order.
     */
    public List<String> childrenIds(String nid) {
        ensurePresent(nid);
        Node node = nodes.get(nid);
        if (!node.isAcceptChildren()) {
            return new ArrayList<>();
        }
        if (node.isKeyed()) {
            return new ArrayList<>(keyedChildren.get(nid).keySet());
        }
        return new ArrayList<>(listChildren.get(nid));
    }

    public List<KeyedNode> children(String nid) {
        ensurePresent(nid);
        Node node = nodes.get(nid);
        List<KeyedNode> result = new ArrayList<>();
        if (!node.isAcceptChildren()) {
            return result;
        }
        if (node.isKeyed()) {
            keyedChildren.get(nid).forEach((cid, key) -> result.add(new KeyedNode(key, nodes.get(cid))));
        } else {
            List<String> ids = listChildren.get(nid);
            for (int i = 0; i < ids.size(); i++) {
                result.add(new KeyedNode(i, nodes.get(ids.get(i))));
            }
        }
        return result;
    }

    public List<String> siblingsIds(String nid) {
        ensurePresent(nid);
        if (nid.equals(root)) {
            return new ArrayList<>();
        }
        List<String> siblings = childrenIds(parentOf.get(nid));
        siblings.remove(nid);
        return siblings;
    }

    public List<KeyedNode> siblings(String nid) {
        return siblingsIds(nid).stream().map(this::get).collect(Collectors.toList());
    }

    public boolean isLeaf(String nid) {
        return childrenIds(nid).isEmpty();
    }

    /**
     * Depth of a node, 0 for the root.
     */
    public int depth(String nid) {
        return ancestorsIds(nid).size();
    }

    public List<String> ancestorsIds(String nid) {
        return ancestorsIds(nid, false, false);
    }

    /**
     * Walks the parent chain up to the root.
     *
     * @param fromRoot return the chain root first
     * @param includeCurrent include {@code nid} itself
     */
    public List<String> ancestorsIds(String nid, boolean fromRoot, boolean includeCurrent) {
        ensurePresent(nid);
        List<String> ancestors = new ArrayList<>();
        if (includeCurrent) {
            ancestors.add(nid);
        }
        String current = nid;
        while (!current.equals(root)) {
            current = parentOf.get(current);
            ancestors.add(current);
        }
        if (fromRoot) {
            Collections.reverse(ancestors);
        }
        return ancestors;
    }

    public List<KeyedNode> ancestors(String nid, boolean fromRoot, boolean includeCurrent) {
        return ancestorsIds(nid, fromRoot, includeCurrent).stream().map(this::get).collect(Collectors.toList());
    }

    public List<String> leavesIds() {
        return leavesIds(null);
    }

    /**
     * Leaves of the subtree starting at {@code nid}, or of the whole tree when null.
     */
    public List<String> leavesIds(String nid) {
        String start = nid == null ? root : ensurePresent(nid);
        if (start == null) {
            return new ArrayList<>();
        }
        return structuralOrder(start).stream()
            .map(KeyedNode::getIdentifier)
            .filter(this::isLeaf)
            .collect(Collectors.toList());
    }

    public List<KeyedNode> leaves(String nid) {
        return leavesIds(nid).stream().map(this::get).collect(Collectors.toList());
    }

    // ------------------------------------------------------------------ paths

    /**
     * Resolves a path made of keys joined by the path separator; the empty path is the root.
     * Segments under list nodes are positions.
     */
    public String getNodeIdByPath(String path) {
        if (path == null) {
            throw new InvalidArgumentException("Path must not be null");
        }
        if (isEmpty()) {
            throw new NotFoundNodeException(String.format("Path <%s> not found, tree is empty", path));
        }
        if (path.isEmpty()) {
            return root;
        }
        String current = root;
        for (String segment : path.split(Pattern.quote(pathSeparator), -1)) {
            current = childIdAt(current, segment, path);
        }
        return current;
    }

    private String childIdAt(String pid, String segment, String path) {
        Node parent = nodes.get(pid);
        if (!parent.isAcceptChildren()) {
            throw new NotFoundNodeException(String.format("Path <%s> goes through leaf <%s>", path, pid));
        }
        if (parent.isKeyed()) {
            for (Map.Entry<String, String> child : keyedChildren.get(pid).entrySet()) {
                if (child.getValue().equals(segment)) {
                    return child.getKey();
                }
            }
            throw new NotFoundNodeException(String.format("No key <%s> under <%s> (path <%s>)", segment, pid, path));
        }
        List<String> ids = listChildren.get(pid);
        try {
            int position = Integer.parseInt(segment);
            if (position >= 0 && position < ids.size()) {
                return ids.get(position);
            }
        } catch (NumberFormatException e) {
            logger.debug("Non numeric segment <{}> under list node <{}>", segment, pid);
        }
        throw new NotFoundNodeException(String.format("No position <%s> under <%s> (path <%s>)", segment, pid, path));
    }

    /**
     * Inverse of {@link #getNodeIdByPath(String)}.
     */
    public String getPath(String nid) {
        List<String> chain = ancestorsIds(nid, true, true);
        return chain.stream()
            .skip(1)
            .map(id -> NodeKeys.asSegment(getKey(id)))
            .collect(Collectors.joining(pathSeparator));
    }

    // ------------------------------------------------------------------ node insertion

    /**
     * Inserts the root of an empty tree.
     */
    public Object insertNode(Node node) {
        return insertNode(node, null, null, null);
    }

    /**
     * Inserts a node below {@code parentId} (at root when null). Under a map node the key is a
     * mandatory string; under a list node it is an optional position, the node being appended when
     * the key is null.
     *
     * @return the key of the inserted node
     */
    public Object insertNode(Node node, String parentId, Object key) {
        return insertNode(node, parentId, null, key);
    }

    /**
     * Inserts a node in place of {@code childId}, which is re-attached below the new node under
     * {@code key}. The new node takes over the slot (parent and key) the child had.
     */
    public Object insertNodeAbove(Node node, String childId, Object key) {
        if (childId == null) {
            throw new InvalidArgumentException("childId is required to insert above a node");
        }
        return insertNode(node, null, childId, key);
    }

    /**
     * Single entry point: inserts above {@code childId} when given, else below {@code parentId},
     * else at root.
     */
    public Object insertNode(Node node, String parentId, String childId, Object key) {
        validateNodeInsertion(node);
        if (parentId != null && childId != null) {
            throw new InvalidArgumentException("Can declare at most \"parentId\" or \"childId\"");
        }
        if (childId != null) {
            insertNodeAboveChecked(node, childId, key);
        } else {
            insertNodeBelowChecked(node, parentId, key);
        }
        logger.debug("Inserted node <{}> (parent <{}>, child <{}>, key <{}>)", node.getIdentifier(), parentId, childId, key);
        return getKey(node.getIdentifier());
    }

    private void insertNodeBelowChecked(Node node, String parentId, Object key) {
        if (parentId == null) {
            validateRootSlot(key);
        } else {
            validateChildSlot(parentId, key);
        }
        register(node, parentId, key);
    }

    private void insertNodeAboveChecked(Node node, String childId, Object key) {
        ensurePresent(childId);
        validateKeyFor(node, key);
        String slotParent = childId.equals(root) ? null : parentOf.get(childId);
        Object slotKey = getKey(childId);

        Tree detached = detachSubtree(childId);
        register(node, slotParent, slotKey);
        graft(detached, node.getIdentifier(), key);
    }

    // ------------------------------------------------------------------ tree insertion

    public Object insertTree(Tree newTree) {
        return insertTree(newTree, null, null, null, null);
    }

    public Object insertTree(Tree newTree, String parentId, Object key) {
        return insertTree(newTree, parentId, null, null, key);
    }

    /**
     * Inserts {@code newTree} in place of {@code childId}; the detached subtree goes below
     * {@code childIdBelow} of the new tree under {@code key}. {@code childIdBelow} may be null when
     * the new tree has a single leaf.
     */
    public Object insertTreeAbove(Tree newTree, String childId, String childIdBelow, Object key) {
        if (childId == null) {
            throw new InvalidArgumentException("childId is required to insert above a node");
        }
        return insertTree(newTree, null, childId, childIdBelow, key);
    }

    /**
     * Splices every node of {@code newTree} into this tree. Nodes are shared, not copied. All
     * identifiers of {@code newTree} are checked against this tree before anything is modified.
     *
     * @return key of the inserted tree root, null when {@code newTree} is empty
     */
    public Object insertTree(Tree newTree, String parentId, String childId, String childIdBelow, Object key) {
        validateTreeInsertion(newTree);
        if (newTree.isEmpty()) {
            return null;
        }
        if (parentId != null && childId != null) {
            throw new InvalidArgumentException("Can declare at most \"parentId\" or \"childId\"");
        }
        if (childId != null) {
            insertTreeAboveChecked(newTree, childId, childIdBelow, key);
        } else {
            if (childIdBelow != null) {
                throw new InvalidArgumentException("\"childIdBelow\" only applies to insertion above a node");
            }
            if (parentId == null) {
                validateRootSlot(key);
            } else {
                validateChildSlot(parentId, key);
            }
            graft(newTree, parentId, key);
        }
        logger.debug("Inserted tree of {} nodes rooted at <{}> (parent <{}>, child <{}>)",
            newTree.size(), newTree.getRoot(), parentId, childId);
        return getKey(newTree.getRoot());
    }

    private void insertTreeAboveChecked(Tree newTree, String childId, String childIdBelow, Object key) {
        ensurePresent(childId);
        if (childIdBelow != null) {
            newTree.ensurePresent(childIdBelow);
        } else {
            List<String> newLeaves = newTree.leavesIds();
            if (newLeaves.size() > 1) {
                throw new AmbiguousInsertionException(
                    "Ambiguous tree insertion, use \"childIdBelow\" to specify under which node of the new tree "
                        + "existing nodes should be placed");
            }
            childIdBelow = newLeaves.get(0);
        }
        newTree.validateChildSlot(childIdBelow, key);

        String slotParent = childId.equals(root) ? null : parentOf.get(childId);
        Object slotKey = getKey(childId);
        Tree detached = detachSubtree(childId);
        graft(newTree, slotParent, slotKey);
        graft(detached, childIdBelow, key);
    }

    /**
     * Copies the structure of {@code source} below {@code parentId} (at root when null), the
     * source root taking {@code key}. Preconditions are checked by callers.
     */
    private void graft(Tree source, String parentId, Object key) {
        List<KeyedNode> ordered = source.structuralOrder(source.getRoot());
        for (int i = 0; i < ordered.size(); i++) {
            KeyedNode keyedNode = ordered.get(i);
            if (i == 0) {
                register(keyedNode.getNode(), parentId, key);
            } else {
                register(keyedNode.getNode(), source.parentOf.get(keyedNode.getIdentifier()), keyedNode.getKey());
            }
        }
    }

    // ------------------------------------------------------------------ drop

    /**
     * Drops a node together with its children.
     */
    public KeyedNode dropNode(String nid) {
        return dropNode(nid, true);
    }

    /**
     * Drops a node.
     *
     * <p>With {@code withChildren=false} the node's children are rebased onto the node's parent:
     * map children keep their key, list children take the dropped node's position, in order. This
     * requires the node and its parent to be of the same kind.
     *
     * @return the dropped node with the key it had
     */
    public KeyedNode dropNode(String nid, boolean withChildren) {
        ensurePresent(nid);
        if (withChildren) {
            KeyedNode removed = dropCascade(nid);
            logger.debug("Dropped node <{}> with its children", nid);
            return removed;
        }
        KeyedNode removed = dropRebase(nid);
        logger.debug("Dropped node <{}>, children rebased", nid);
        return removed;
    }

    private KeyedNode dropRebase(String nid) {
        KeyedNode removed = get(nid);
        List<KeyedNode> children = children(nid);

        if (nid.equals(root)) {
            if (children.size() > 1) {
                throw new MultipleRootException(String.format(
                    "Cannot drop current root <%s> without its children, else tree would have multiple roots", nid));
            }
            if (children.isEmpty()) {
                unregister(nid);
                return removed;
            }
            Tree orphan = detachSubtree(children.get(0).getIdentifier());
            unregister(nid);
            graft(orphan, null, null);
            return removed;
        }

        String pid = parentOf.get(nid);
        Node parent = nodes.get(pid);
        if (parent.isKeyed() != removed.getNode().isKeyed()) {
            throw new InvalidOperationException(String.format(
                "Cannot rebase children of <%s> onto <%s>: keyed and list nodes do not share key types", nid, pid));
        }
        if (children.isEmpty()) {
            unregister(nid);
            return removed;
        }
        if (parent.isKeyed()) {
            Map<String, String> parentKeys = keyedChildren.get(pid);
            for (KeyedNode child : children) {
                if (parentKeys.containsValue(child.getKey()) && !child.getKey().equals(removed.getKey())) {
                    throw new DuplicateKeyException(String.format(
                        "Cannot rebase <%s>: key <%s> already used under <%s>", child.getIdentifier(), child.getKey(), pid));
                }
            }
        }

        List<Tree> detached = new ArrayList<>();
        for (KeyedNode child : children) {
            detached.add(detachSubtree(child.getIdentifier()));
        }
        unregister(nid);
        for (int i = 0; i < children.size(); i++) {
            Object key = parent.isKeyed() ? children.get(i).getKey() : (Integer) removed.getKey() + i;
            graft(detached.get(i), pid, key);
        }
        return removed;
    }

    /**
     * Removes a node and all its descendants. Reverse pre-order removes every node after its
     * descendants, and list children from the last one.
     */
    private KeyedNode dropCascade(String nid) {
        List<KeyedNode> ordered = structuralOrder(nid);
        for (int i = ordered.size() - 1; i >= 0; i--) {
            unregister(ordered.get(i).getIdentifier());
        }
        return ordered.get(0);
    }

    /**
     * Removes a node and its descendants, returning them as an independent tree.
     *
     * @return the removed tree with the key its root had
     */
    public KeyedTree dropSubtree(String nid) {
        ensurePresent(nid);
        Object key = getKey(nid);
        Tree removed = detachSubtree(nid);
        logger.debug("Dropped subtree <{}> ({} nodes)", nid, removed.size());
        return new KeyedTree(key, removed);
    }

    private Tree detachSubtree(String nid) {
        Tree removed = clone(true, false, nid);
        dropCascade(nid);
        return removed;
    }

    // ------------------------------------------------------------------ subtree, clone, merge

    public KeyedTree subtree(String nid) {
        return subtree(nid, false);
    }

    /**
     * Independent tree rooted at {@code nid}, with the key {@code nid} has in this tree.
     */
    public KeyedTree subtree(String nid, boolean deep) {
        ensurePresent(nid);
        return new KeyedTree(getKey(nid), clone(true, deep, nid));
    }

    @Override
    public Tree clone() {
        return clone(true, false, null);
    }

    /**
     * @param withNodes false returns an empty tree of the same type
     * @param deep copy nodes ({@link Node#copy()}) instead of sharing them
     * @param newRoot restrict the clone to the subtree of this node, whole tree when null
     */
    public Tree clone(boolean withNodes, boolean deep, String newRoot) {
        Tree copy = newInstance(deep);
        if (!withNodes) {
            return copy;
        }
        String start = newRoot == null ? root : ensurePresent(newRoot);
        if (start == null) {
            return copy;
        }
        for (KeyedNode keyedNode : structuralOrder(start)) {
            String nid = keyedNode.getIdentifier();
            Node node = deep ? keyedNode.getNode().copy() : keyedNode.getNode();
            if (nid.equals(start)) {
                copy.register(node, null, null);
            } else {
                copy.register(node, parentOf.get(nid), keyedNode.getKey());
            }
        }
        return copy;
    }

    public Tree merge(Tree newTree) {
        return merge(newTree, null);
    }

    /**
     * Pastes the children of {@code newTree}'s root below {@code nid} (the root when null), each
     * under the key it had. The root of {@code newTree} is discarded, unless this tree is empty and
     * {@code nid} is null, in which case the whole of {@code newTree} becomes this tree's content.
     */
    public Tree merge(Tree newTree, String nid) {
        if (newTree == null) {
            throw new InvalidArgumentException("Tree to merge must not be null");
        }
        List<KeyedNode> incoming = newTree.isEmpty() ? new ArrayList<>() : newTree.children(newTree.getRoot());
        for (KeyedNode child : incoming) {
            validateTreeInsertion(newTree.subtree(child.getIdentifier()).getTree());
        }

        if (isEmpty() && nid == null) {
            validateTreeInsertion(newTree);
            if (!newTree.isEmpty()) {
                graft(newTree, null, null);
            }
            logger.debug("Merged tree of {} nodes into empty tree", newTree.size());
            return this;
        }
        String target = nid == null ? root : ensurePresent(nid);
        if (incoming.isEmpty()) {
            return this;
        }
        Node targetNode = nodes.get(target);
        if (!targetNode.isAcceptChildren()) {
            throw new InvalidOperationException(String.format("Node <%s> does not accept children", target));
        }
        if (targetNode.isKeyed() != newTree.getNode(newTree.getRoot()).isKeyed()) {
            throw new InvalidOperationException(String.format(
                "Cannot merge children of <%s> onto <%s>: keyed and list nodes do not share key types",
                newTree.getRoot(), target));
        }
        for (KeyedNode child : incoming) {
            if (targetNode.isKeyed() && keyedChildren.get(target).containsValue(child.getKey())) {
                throw new DuplicateKeyException(String.format("Key <%s> already used under <%s>", child.getKey(), target));
            }
        }
        for (KeyedNode child : incoming) {
            graft(newTree.subtree(child.getIdentifier()).getTree(), target, child.getKey());
        }
        logger.debug("Merged {} children of <{}> onto <{}>", incoming.size(), newTree.getRoot(), target);
        return this;
    }

    // ------------------------------------------------------------------ traversal & rendering

    public Iterable<KeyedNode> expand() {
        return expand(Traversal.DEFAULT);
    }

    public Iterable<KeyedNode> expand(String nid) {
        return expand(Traversal.builder().nid(nid).build());
    }

    /**
     * Lazy walk of the tree, or of the subtree of {@link Traversal#getNid()}. Every call to
     * {@code iterator()} starts a fresh walk. An empty tree yields nothing.
     */
    public Iterable<KeyedNode> expand(Traversal traversal) {
        if (traversal == null || traversal.getMode() == null) {
            throw new InvalidArgumentException("Traversal and its mode must not be null");
        }
        String start = traversal.getNid() == null ? root : ensurePresent(traversal.getNid());
        return () -> new TreeTraversal(this, traversal, start);
    }

    public String show() {
        return show(ShowOptions.DEFAULT);
    }

    public String show(ShowOptions options) {
        return new TreeRenderer(this, options).render();
    }

    @Override
    public String toString() {
        return show();
    }

    // ------------------------------------------------------------------ validation

    String ensurePresent(String nid) {
        if (nid == null) {
            throw new InvalidArgumentException("'nid' set to null not supported");
        }
        if (!nodes.containsKey(nid)) {
            throw new NotFoundNodeException(String.format("Node id <%s> doesn't exist in tree", nid));
        }
        return nid;
    }

    private void validateNodeInsertion(Node node) {
        if (node == null) {
            throw new InvalidArgumentException("Node must not be null");
        }
        if (nodes.containsKey(node.getIdentifier())) {
            throw new DuplicatedNodeException(String.format("Can't create node with id '%s'", node.getIdentifier()));
        }
    }

    private void validateTreeInsertion(Tree newTree) {
        if (newTree == null) {
            throw new InvalidArgumentException("Tree must not be null");
        }
        for (String nid : newTree.nodes.keySet()) {
            if (nodes.containsKey(nid)) {
                throw new DuplicatedNodeException(String.format("Can't create node with id '%s'", nid));
            }
        }
    }

    private void validateRootSlot(Object key) {
        if (!isEmpty()) {
            throw new MultipleRootException("A tree takes one root merely.");
        }
        if (key != null) {
            throw new InvalidArgumentException("No key on root node");
        }
    }

    private void validateChildSlot(String parentId, Object key) {
        ensurePresent(parentId);
        Node parent = nodes.get(parentId);
        validateKeyFor(parent, key);
        if (parent.isKeyed() && keyedChildren.get(parentId).containsValue(key)) {
            throw new DuplicateKeyException(String.format("Already present node for key %s under %s node.", key, parentId));
        }
    }

    private static void validateKeyFor(Node parent, Object key) {
        if (!parent.isAcceptChildren()) {
            throw new InvalidOperationException(String.format("Node <%s> does not accept children", parent.getIdentifier()));
        }
        if (parent.isKeyed()) {
            if (key == null) {
                throw new InvalidOperationException(String.format("Key is compulsory under map node <%s>", parent.getIdentifier()));
            }
            if (!(key instanceof String)) {
                throw new InvalidOperationException(String.format("Key must be of type String, got %s", key.getClass().getSimpleName()));
            }
            return;
        }
        if (key != null) {
            if (!(key instanceof Integer)) {
                throw new InvalidOperationException(String.format("Key must be of type Integer, got %s", key.getClass().getSimpleName()));
            }
            if ((Integer) key < 0) {
                throw new InvalidOperationException(String.format("Position must not be negative, got %s", key));
            }
        }
    }

    // ------------------------------------------------------------------ index primitives

    /**
     * Adds a node to both index directions. A null parent makes it the root; under a list parent a
     * null key appends and a position past the end appends too.
     */
    private void register(Node node, String parentId, Object key) {
        String nid = node.getIdentifier();
        if (parentId == null) {
            root = nid;
        } else {
            if (nodes.get(parentId).isKeyed()) {
                keyedChildren.get(parentId).put(nid, (String) key);
            } else {
                List<String> siblings = listChildren.get(parentId);
                if (key == null) {
                    siblings.add(nid);
                } else {
                    siblings.add(Math.min((Integer) key, siblings.size()), nid);
                }
            }
            parentOf.put(nid, parentId);
        }
        nodes.put(nid, node);
        if (node.isAcceptChildren()) {
            if (node.isKeyed()) {
                keyedChildren.put(nid, new LinkedHashMap<>());
            } else {
                listChildren.put(nid, new ArrayList<>());
            }
        }
    }

    /**
     * Removes a childless node from both index directions.
     */
    private void unregister(String nid) {
        if (!isLeaf(nid)) {
            throw new InvalidOperationException(String.format("Cannot drop node <%s> having children", nid));
        }
        String pid = parentOf.remove(nid);
        if (pid == null) {
            root = null;
        } else if (nodes.get(pid).isKeyed()) {
            keyedChildren.get(pid).remove(nid);
        } else {
            // searched from the end: cascades remove list children last first
            List<String> siblings = listChildren.get(pid);
            siblings.remove(siblings.lastIndexOf(nid));
        }
        keyedChildren.remove(nid);
        listChildren.remove(nid);
        nodes.remove(nid);
    }

    /**
     * Pre-order walk following children index order, without sorting.
     */
    List<KeyedNode> structuralOrder(String start) {
        List<KeyedNode> ordered = new ArrayList<>();
        Deque<KeyedNode> stack = new ArrayDeque<>();
        stack.push(get(start));
        while (!stack.isEmpty()) {
            KeyedNode current = stack.pop();
            ordered.add(current);
            List<KeyedNode> children = children(current.getIdentifier());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return ordered;
    }
}
