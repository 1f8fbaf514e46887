// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: Apache-2.0
//

package io.github.simbo1905.simple_tree;

import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.logging.Logger;

/// An immutable, ordered, multi-way tree. Apart from the empty tree every node has a value and an ordered
/// list of children. There are three implementations behind this one read contract:
/// - [EmptyTree] the canonical empty tree, which has no node at all (it is not a leaf),
/// - [NodeTree] the inflated form, a graph of linked nodes,
/// - [ArrayTree] the deflated form, two aligned arrays of child counts and values in reversed preorder.
///
/// Every traversal is written against `value()` and `children()` only, so a tree answers exactly the same
/// whichever form backs it. Trees compare equal when they hold the same values in the same shape.
public sealed interface Tree<T> permits NodeTree, ArrayTree, EmptyTree {

  Logger LOGGER = Logger.getLogger(Tree.class.getName());

  // PROPERTIES

  /// @return the value of the root node
  /// @throws NoSuchElementException if this is the empty tree
  T value();

  /// @return the direct children in order, an unmodifiable list
  List<Tree<T>> children();

  /// @return the number of direct children
  int childrenCount();

  /// @return the number of nodes in the tree, 0 for the empty tree
  int size();

  /// @return the number of leaves, same as the number of branches
  int width();

  /// @return the length of the longest branch
  int height();

  /// @return true if this is a node without children
  boolean isLeaf();

  /// @return true if this is the empty tree
  boolean isEmpty();

  /// @return this tree as a graph of linked nodes
  Tree<T> inflated();

  /// @return this tree encoded in two linear arrays
  Tree<T> deflated();

  default Optional<T> valueOption() {
    return isEmpty() ? Optional.empty() : Optional.of(value());
  }

  // CREATION

  /// @return the empty tree
  @SuppressWarnings("unchecked")
  static <T> Tree<T> empty() {
    return (Tree<T>) (Tree<?>) EmptyTree.INSTANCE;
  }

  /// Creates a leaf
  static <T> Tree<T> of(@NotNull T value) {
    return new NodeTree<>(value, List.of());
  }

  /// Creates a node with the given children, empty trees among the children are dropped
  @SafeVarargs
  static <T> Tree<T> of(@NotNull T value, Tree<T>... children) {
    Objects.requireNonNull(children, "children must not be null");
    return new NodeTree<>(value, Arrays.asList(children));
  }

  /// Creates a node with the given children, empty trees among the children are dropped
  static <T> Tree<T> of(@NotNull T value, @NotNull List<Tree<T>> children) {
    return new NodeTree<>(value, children);
  }

  // VALUES

  /// @return all values, top-down, depth-first
  default List<T> values() {
    return values(TraversingMode.TOP_DOWN_DEPTH_FIRST);
  }

  default List<T> values(@NotNull TraversingMode mode) {
    return TreeTraversal.toList(new MapFilterIterator<TreeLevel<T>, T>(
        TreeTraversal.nodesAndLevels(this, mode, Integer.MAX_VALUE), level -> level.tree().value(), value -> true));
  }

  /// @return values of the leaves, left to right
  default List<T> leaves() {
    final Iterator<Tree<T>> leafTrees = new MapFilterIterator<TreeLevel<T>, Tree<T>>(
        TreeTraversal.nodesAndLevels(this, TraversingMode.TOP_DOWN_DEPTH_FIRST, Integer.MAX_VALUE),
        TreeLevel::tree, Tree::isLeaf);
    return TreeTraversal.toList(new MapFilterIterator<Tree<T>, T>(leafTrees, Tree::value, value -> true));
  }

  default List<T> childrenValues() {
    final List<T> result = new ArrayList<>(childrenCount());
    for (Tree<T> child : children()) {
      result.add(child.value());
    }
    return List.copyOf(result);
  }

  // TREES

  /// @return this tree and all of its subtrees, top-down, depth-first
  default List<Tree<T>> trees() {
    return trees(TraversingMode.TOP_DOWN_DEPTH_FIRST);
  }

  default List<Tree<T>> trees(@NotNull TraversingMode mode) {
    return TreeTraversal.toList(treesWithFilter(tree -> true, mode, Integer.MAX_VALUE).iterator());
  }

  /// Lazily enumerates the subtrees accepted by the filter. The filter only decides what is emitted,
  /// every node down to `maxDepth` is visited.
  /// @param filter return true to emit the subtree
  /// @param mode depth-first or breadth-first
  /// @param maxDepth the deepest level visited, the root is at level 1
  default Iterable<Tree<T>> treesWithFilter(@NotNull Predicate<Tree<T>> filter, @NotNull TraversingMode mode,
                                           int maxDepth) {
    Objects.requireNonNull(filter, "filter must not be null");
    return () -> new MapFilterIterator<>(TreeTraversal.nodesAndLevels(this, mode, maxDepth), TreeLevel::tree, filter);
  }

  /// Same as [#treesWithFilter(Predicate, TraversingMode, int)] but each subtree comes with its level
  default Iterable<TreeLevel<T>> treesAndLevelsWithFilter(@NotNull Predicate<Tree<T>> filter,
                                                         @NotNull TraversingMode mode, int maxDepth) {
    Objects.requireNonNull(filter, "filter must not be null");
    return () -> new MapFilterIterator<>(TreeTraversal.nodesAndLevels(this, mode, maxDepth), level -> level,
        level -> filter.test(level.tree()));
  }

  // BRANCHES

  /// @return all root-to-leaf paths, depth-first, left to right
  default List<List<T>> branches() {
    return TreeTraversal.toList(branchIterator(branch -> true));
  }

  default Iterator<List<T>> branchIterator(@NotNull Predicate<List<T>> filter) {
    return branchIterator(filter, Integer.MAX_VALUE);
  }

  /// Iterates over branches. A branch ends at a leaf or at `maxDepth` when the node there has children.
  /// The filter is applied to complete branches only and never prunes the walk.
  default Iterator<List<T>> branchIterator(@NotNull Predicate<List<T>> filter, int maxDepth) {
    return TreeTraversal.branches(this, filter, maxDepth, false);
  }

  default Iterable<List<T>> branchesWithFilter(@NotNull Predicate<List<T>> filter, int maxDepth) {
    return () -> branchIterator(filter, maxDepth);
  }

  default int countBranches(@NotNull Predicate<List<T>> filter) {
    int count = 0;
    final Iterator<List<T>> iterator = branchIterator(filter);
    while (iterator.hasNext()) {
      iterator.next();
      count++;
    }
    return count;
  }

  /// @return every path from the root to any node, in preorder
  default List<List<T>> paths() {
    return TreeTraversal.toList(pathsWithFilter(path -> true, Integer.MAX_VALUE).iterator());
  }

  default Iterable<List<T>> pathsWithFilter(@NotNull Predicate<List<T>> filter, int maxDepth) {
    return () -> TreeTraversal.branches(this, filter, maxDepth, true);
  }

  // PATH QUERIES

  /// @return true if the branch leads from the root all the way to a leaf
  default boolean containsBranch(@NotNull List<T> branch) {
    final List<Tree<T>> matched = TreeTraversal.followPath(this, branch);
    return !branch.isEmpty() && matched.size() == branch.size() && matched.get(matched.size() - 1).isLeaf();
  }

  /// @return true if the path leads from the root to some node
  default boolean containsPath(@NotNull List<T> path) {
    return !path.isEmpty() && TreeTraversal.followPath(this, path).size() == path.size();
  }

  default Optional<Tree<T>> selectTree(@NotNull List<T> path) {
    final List<Tree<T>> matched = TreeTraversal.followPath(this, path);
    return !path.isEmpty() && matched.size() == path.size()
        ? Optional.of(matched.get(matched.size() - 1))
        : Optional.empty();
  }

  default Optional<T> selectValue(@NotNull List<T> path) {
    return selectTree(path).map(Tree::value);
  }

  // DISTINCT MODIFICATIONS

  /// Adds a leaf in front of the children unless a child with the same value exists already
  default Tree<T> insertLeaf(@NotNull T value) {
    return insertChild(Tree.of(value));
  }

  /// Same as `insertChild(child, MergeOrder.BEFORE)`
  default Tree<T> insertChild(@NotNull Tree<T> child) {
    return insertChild(child, MergeOrder.BEFORE);
  }

  /// Inserts a child keeping the children distinct. When a child with the same value exists the new
  /// child's children are folded into it, before or after its own children depending on `order`,
  /// recursively. Otherwise the child is put at the front (`BEFORE`) or at the back (`AFTER`).
  default Tree<T> insertChild(@NotNull Tree<T> child, @NotNull MergeOrder order) {
    return DistinctMerge.keepRepresentation(this, DistinctMerge.insertChild(this, child, order));
  }

  /// Inserts a branch of values starting at the root, reusing the nodes that already exist along the path.
  /// If the first value is not the root value the tree is returned unchanged.
  default Tree<T> insertBranch(@NotNull List<T> branch) {
    return DistinctMerge.keepRepresentation(this, DistinctMerge.insertBranch(this, branch));
  }

  /// Collapses siblings having the same value down to the configured [TreeOptions#maxLookupLevel()]
  default Tree<T> makeTreeDistinct() {
    return makeTreeDistinct(TreeOptions.current().maxLookupLevel());
  }

  /// Collapses siblings having the same value. The first occurrence keeps its position and takes over
  /// the children of the later ones.
  /// @param maxLookupLevel the deepest level whose children are examined, merged content is always examined
  default Tree<T> makeTreeDistinct(int maxLookupLevel) {
    return DistinctMerge.keepRepresentation(this, DistinctMerge.makeTreeDistinct(this, maxLookupLevel));
  }

  // SERIALIZATION

  /// Iterates over `(childCount, value)` pairs in reversed preorder.
  /// [TreeBuilder#fromPairsIterator(Iterator)] builds the tree back.
  default Iterator<TreePair<T>> toPairsIterator() {
    return TreeCodec.pairsIterator(this);
  }

  default List<TreePair<T>> toPairs() {
    return TreeTraversal.toList(toPairsIterator());
  }

  /// Encodes the tree as two aligned sequences of child counts and values in reversed preorder.
  /// The empty tree encodes to two empty sequences.
  default TreeArrays<T> toArrays() {
    return TreeCodec.toArrays(this);
  }

  default int[] toStructureArray() {
    return TreeCodec.toStructureArray(this);
  }
}
