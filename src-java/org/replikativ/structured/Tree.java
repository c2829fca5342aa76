package org.replikativ.structured;

import clojure.lang.*;
import java.util.*;
import java.util.function.*;
import java.util.logging.Logger;

/**
 * Immutable rose tree: a value, an ordered vector of child trees and a
 * metadata map.
 *
 * Navigation is strictly parent to child, a tree cannot answer who its parent
 * is. Every edit returns a new tree and leaves the receiver untouched.
 *
 * Iterating, {@link #count()} and {@link #reduce(IFn, Object)} all see the
 * same fully unnested value sequence: values in pre-order, where a missing
 * value is skipped on inner nodes and on the root, and shows up as
 * {@code null} on leaves below the root. Payloads that are lists are spliced
 * in element by element, recursively. This is {@link #values()} with every
 * nested list spliced into its parent.
 *
 * {@link #contains(Object)}, {@link #leaves()}, iteration and counting use an
 * explicit stack and take trees of any depth. {@link #values()},
 * {@link #equals(Object)}, {@link #hasheq()}, {@link #toString()},
 * {@link #str()} and {@link #removeChild(Tree)} (through {@code equals})
 * recurse once per level and overflow the call stack on trees tens of
 * thousands of levels deep.
 *
 * @param <V> payload type, {@code null} means "no value"
 */
@SuppressWarnings("unchecked")
public class Tree<V> implements IObj, IPersistentCollection, IReduceInit, IHashEq, Iterable<Object> {

  private static final Logger LOGGER = Logger.getLogger(Tree.class.getName());

  public static final Tree EMPTY = new Tree();

  // Null when absent
  public final V _value;

  // NotNull, every element is a Tree
  public final IPersistentVector _children;

  // NotNull
  public final IPersistentMap _meta;

  // 0 == not computed yet
  private int _hasheq;

  public Tree() {
    this(null, PersistentVector.EMPTY, PersistentArrayMap.EMPTY);
  }

  public Tree(V value) {
    this(value, PersistentVector.EMPTY, PersistentArrayMap.EMPTY);
  }

  public Tree(V value, IPersistentVector children) {
    this(value, children, PersistentArrayMap.EMPTY);
  }

  public Tree(V value, IPersistentVector children, IPersistentMap meta) {
    if (children == null) {
      throw new IllegalArgumentException("children must not be null, use PersistentVector.EMPTY");
    }
    assert allTrees(children) : "Children must be trees: " + children;

    _value    = value;
    _children = children;
    _meta     = meta == null ? PersistentArrayMap.EMPTY : meta;
  }

  public static <V> Tree<V> leaf(V value) {
    return new Tree<>(value);
  }

  @SafeVarargs
  public static <V> Tree<V> of(V value, Tree<V>... children) {
    return new Tree<>(value, PersistentVector.create((Object[]) children));
  }

  /**
   * Builds a tree from a scalar or a nested list.
   *
   * <ul>
   *   <li>a non-list becomes a childless tree holding it;</li>
   *   <li>an empty list becomes {@link #EMPTY};</li>
   *   <li>for a non-empty list the head is the value and every remaining
   *       element goes through {@code from} again, so nested lists become
   *       subtrees and scalars become leaves.</li>
   * </ul>
   *
   * A {@code Tree} found anywhere in the input is taken as-is.
   * {@code Tree.from(list).values()} gives back {@code list}.
   */
  public static Tree<Object> from(Object input) {
    if (input instanceof Tree) {
      return (Tree<Object>) input;
    }
    if (!(input instanceof List)) {
      return new Tree<>(input);
    }

    List<Object> list = (List<Object>) input;
    if (list.isEmpty()) {
      return EMPTY;
    }

    Iterator<Object> iter = list.iterator();
    Object value = iter.next();
    ITransientCollection children = PersistentVector.EMPTY.asTransient();
    while (iter.hasNext()) {
      children = children.conj(from(iter.next()));
    }
    return new Tree<>(value, (IPersistentVector) children.persistent());
  }

  public V value() {
    return _value;
  }

  public boolean hasValue() {
    return _value != null;
  }

  public IPersistentVector children() {
    return _children;
  }

  public Tree<V> child(int idx) {
    return (Tree<V>) _children.nth(idx);
  }

  public int childCount() {
    return _children.count();
  }

  /**
   * No value and no children. A valueless tree that has a child is not empty.
   */
  public boolean isEmpty() {
    return _value == null && _children.count() == 0;
  }

  public boolean isLeaf() {
    return _children.count() == 0;
  }

  /**
   * True if this tree or any descendant holds a value equivalent to
   * {@code target}. Depth-first, children in order, stops at the first hit.
   */
  public boolean contains(Object target) {
    ArrayDeque<Tree> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      Tree node = stack.pop();
      if (Util.equiv(node._value, target)) {
        return true;
      }
      pushChildren(stack, node);
    }
    return false;
  }

  /**
   * Returns the tree as nested vectors: {@code [value child1 child2 ...]},
   * where a leaf child contributes its bare value and any other child a
   * nested vector of its own. A missing value is left out of its vector.
   *
   * <pre>
   *   []              for a tree without value and children
   *   [v]             for a childless tree with value v
   *   [v [c d] e]     for v with children (c with child d) and e
   * </pre>
   */
  public IPersistentVector values() {
    if (isLeaf()) {
      return _value == null ? PersistentVector.EMPTY : PersistentVector.EMPTY.cons(_value);
    }
    return (IPersistentVector) flatten(this);
  }

  private static Object flatten(Tree node) {
    if (node.isLeaf()) {
      return node._value;
    }
    ITransientCollection out = PersistentVector.EMPTY.asTransient();
    if (node._value != null) {
      out = out.conj(node._value);
    }
    for (int i = 0; i < node._children.count(); ++i) {
      out = out.conj(flatten((Tree) node._children.nth(i)));
    }
    return out.persistent();
  }

  /**
   * All childless descendants, depth-first, left to right. A childless tree
   * is its own only leaf.
   */
  public IPersistentVector leaves() {
    ITransientCollection out = PersistentVector.EMPTY.asTransient();
    ArrayDeque<Tree> stack = new ArrayDeque<>();
    stack.push(this);
    while (!stack.isEmpty()) {
      Tree node = stack.pop();
      if (node.isLeaf()) {
        out = out.conj(node);
      } else {
        pushChildren(stack, node);
      }
    }
    return (IPersistentVector) out.persistent();
  }

  public IPersistentVector leafValues() {
    ITransientCollection out = PersistentVector.EMPTY.asTransient();
    IPersistentVector leaves = leaves();
    for (int i = 0; i < leaves.count(); ++i) {
      out = out.conj(((Tree) leaves.nth(i))._value);
    }
    return (IPersistentVector) out.persistent();
  }

  // Structural edits

  /**
   * Appends {@code child} as the last child, keeping its value, children and meta.
   */
  public Tree<V> insertChild(Tree<V> child) {
    if (child == null) {
      throw new IllegalArgumentException("child must not be null, use insertChildValue(null) for a valueless leaf");
    }
    return new Tree<>(_value, _children.cons(child), _meta);
  }

  /**
   * Wraps {@code value} in a leaf and appends it as the last child.
   */
  public Tree<V> insertChildValue(V value) {
    return insertChild(new Tree<>(value));
  }

  /**
   * Removes the first direct child equal to {@code child}, meta included.
   * Returns this very tree when there is none.
   */
  public Tree<V> removeChild(Tree<V> child) {
    for (int i = 0; i < _children.count(); ++i) {
      if (_children.nth(i).equals(child)) {
        return withoutChild(i);
      }
    }
    LOGGER.finer(() -> "removeChild: no child equal to " + child + " under " + this);
    return this;
  }

  /**
   * Removes the first direct child whose value equals {@code value}. Numbers
   * compare by magnitude across types, so 1.0 matches 1. Only direct children
   * are looked at. Returns this very tree when there is none.
   */
  public Tree<V> removeChildValue(Object value) {
    for (int i = 0; i < _children.count(); ++i) {
      if (valueEquals(((Tree) _children.nth(i))._value, value)) {
        return withoutChild(i);
      }
    }
    LOGGER.finer(() -> "removeChildValue: no child with value " + RT.printString(value) + " under " + this);
    return this;
  }

  private static boolean valueEquals(Object a, Object b) {
    if (a instanceof Number && b instanceof Number) {
      return Numbers.equiv((Number) a, (Number) b);
    }
    return Util.equiv(a, b);
  }

  private Tree<V> withoutChild(int idx) {
    ITransientCollection out = PersistentVector.EMPTY.asTransient();
    for (int i = 0; i < _children.count(); ++i) {
      if (i != idx) {
        out = out.conj(_children.nth(i));
      }
    }
    return new Tree<>(_value, (IPersistentVector) out.persistent(), _meta);
  }

  public Tree<V> withValue(V value) {
    return new Tree<>(value, _children, _meta);
  }

  public Tree<V> withChildren(IPersistentVector children) {
    return new Tree<>(_value, children, _meta);
  }

  // IObj
  public IPersistentMap meta() {
    return _meta;
  }

  public Tree<V> withMeta(IPersistentMap meta) {
    if (_meta == meta) {
      return this;
    }
    return new Tree<>(_value, _children, meta);
  }

  // IPersistentCollection

  /**
   * Length of the fully unnested value sequence. 0 for the empty tree.
   */
  public int count() {
    int count = 0;
    for (Iterator iter = iterator(); iter.hasNext(); iter.next()) {
      ++count;
    }
    return count;
  }

  /**
   * {@link #insertChild(Tree)} for a tree, {@link #insertChildValue(Object)}
   * for anything else.
   */
  public Tree<V> cons(Object o) {
    if (o instanceof Tree) {
      return insertChild((Tree<V>) o);
    }
    return insertChildValue((V) o);
  }

  public Tree<V> empty() {
    return new Tree<>(null, PersistentVector.EMPTY, _meta);
  }

  public boolean equiv(Object o) {
    return equals(o);
  }

  // Seqable
  public ISeq seq() {
    return RT.chunkIteratorSeq(iterator());
  }

  // IReduceInit
  public Object reduce(IFn f, Object start) {
    Object acc = start;
    for (Iterator iter = iterator(); iter.hasNext(); ) {
      acc = f.invoke(acc, iter.next());
      if (RT.isReduced(acc)) {
        return ((IDeref) acc).deref();
      }
    }
    return acc;
  }

  public <A> A reduce(A start, BiFunction<A, Object, A> f) {
    A acc = start;
    for (Object value: this) {
      acc = f.apply(acc, value);
    }
    return acc;
  }

  // Iterable
  public Iterator<Object> iterator() {
    return new ValueIter(this);
  }

  // IHashEq
  public int hasheq() {
    int h = _hasheq;
    if (h == 0) {
      h = Util.hasheq(_value);
      h = 31 * h + Util.hasheq(_children);
      h = 31 * h + Util.hasheq(_meta);
      _hasheq = h;
    }
    return h;
  }

  @Override
  public int hashCode() {
    return hasheq();
  }

  /**
   * Structural equality: value (by equivalence), children and meta.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Tree)) {
      return false;
    }
    Tree other = (Tree) o;
    return Util.equiv(_value, other._value)
      && Util.equiv(_meta, other._meta)
      && Util.equiv(_children, other._children);
  }

  @Override
  public String toString() {
    return "#tree " + RT.printString(values());
  }

  /**
   * Indented outline, one node per line, meta printed next to its node.
   */
  public String str() {
    StringBuilder sb = new StringBuilder();
    toString(sb, "");
    return sb.toString();
  }

  public void toString(StringBuilder sb, String indent) {
    sb.append(indent).append(RT.printString(_value));
    if (_meta.count() > 0) {
      sb.append(" ").append(RT.printString(_meta));
    }
    sb.append("\n");
    for (int i = 0; i < _children.count(); ++i) {
      ((Tree) _children.nth(i)).toString(sb, indent + "  ");
    }
  }

  private static void pushChildren(ArrayDeque<Tree> stack, Tree node) {
    for (int i = node._children.count() - 1; i >= 0; --i) {
      stack.push((Tree) node._children.nth(i));
    }
  }

  private static boolean allTrees(IPersistentVector children) {
    for (int i = 0; i < children.count(); ++i) {
      if (!(children.nth(i) instanceof Tree)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Pre-order walk over the unnested value sequence with an explicit stack.
   * List payloads are drained from {@code _lists} before the walk moves on.
   */
  static class ValueIter implements Iterator<Object> {
    final ArrayDeque<Tree> _stack = new ArrayDeque<>();
    final ArrayDeque<Iterator> _lists = new ArrayDeque<>();
    boolean _atRoot = true;
    boolean _ready = false;
    Object _next;

    ValueIter(Tree root) {
      _stack.push(root);
    }

    @Override
    public boolean hasNext() {
      while (!_ready) {
        if (!_lists.isEmpty()) {
          Iterator iter = _lists.peek();
          if (iter.hasNext()) {
            emit(iter.next());
          } else {
            _lists.pop();
          }
        } else if (!_stack.isEmpty()) {
          Tree node = _stack.pop();
          pushChildren(_stack, node);
          if (node._value != null || (!_atRoot && node.isLeaf())) {
            emit(node._value);
          }
          _atRoot = false;
        } else {
          break;
        }
      }
      return _ready;
    }

    private void emit(Object value) {
      if (value instanceof List) {
        _lists.push(((List) value).iterator());
      } else {
        _next  = value;
        _ready = true;
      }
    }

    @Override
    public Object next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Object value = _next;
      _next  = null;
      _ready = false;
      return value;
    }
  }
}
