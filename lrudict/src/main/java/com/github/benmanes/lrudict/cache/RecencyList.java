/*
 * Copyright 2026 The LruDict Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.benmanes.lrudict.cache;

import static com.github.benmanes.lrudict.cache.LruDict.requireState;
import static java.util.Objects.requireNonNull;

import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.jspecify.annotations.Nullable;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Var;

/**
 * A doubly-linked list of keys where the link pointers are held by the {@link Node} itself, so that
 * any node may be unlinked in constant time. The list is ordered from the most recently used key
 * (first) to the least recently used key (last).
 * <p>
 * A node can be linked into at most one list at a time and records the list that owns it. Every
 * structural operation verifies that ownership and fails with an {@link IllegalStateException} when
 * it is violated, as that indicates a defect in the caller rather than a recoverable condition.
 * <p>
 * This class is not thread-safe; in the absence of external synchronization it does not support
 * concurrent access. The iterators are <i>fail-fast</i> and walk the list at the time that they
 * are consumed.
 *
 * @param <K> the type of keys held by the nodes
 */
final class RecencyList<K> implements Iterable<K> {

  // The first and last elements are tracked directly instead of using a sentinel node so that an
  // unlinked node has null links and no owner, which is how detachment is detected.

  /**
   * Pointer to first node.
   * Invariant: (first == null && last == null) ||
   *            (first.previous == null)
   */
  @Nullable Node<K> first;

  /**
   * Pointer to last node.
   * Invariant: (first == null && last == null) ||
   *            (last.next == null)
   */
  @Nullable Node<K> last;

  /** The number of linked nodes. */
  int size;

  /**
   * The number of times this list has been <i>structurally modified</i>, which includes reordering
   * the nodes.
   */
  int modCount;

  /**
   * Links the detached node to the front of the list so that it becomes the first node.
   *
   * @param node the detached node
   * @throws IllegalStateException if the node is already linked into a list
   */
  public void addFirst(Node<K> node) {
    requireNonNull(node);
    requireState(node.list == null, "%s already belongs to a list", node);
    linkFirst(node);
  }

  /**
   * Unlinks the node from this list and clears its links and owner.
   *
   * @param node a node linked into this list
   * @throws IllegalStateException if the node belongs to another list or to none
   */
  public void remove(Node<K> node) {
    requireNonNull(node);
    requireState(node.list == this, "%s does not belong to this list", node);
    unlink(node);
  }

  /**
   * Unlinks and returns the last node, the least recently used.
   *
   * @return the detached node
   * @throws IllegalStateException if the list is empty
   */
  @CanIgnoreReturnValue
  @SuppressWarnings("NullAway")
  public Node<K> removeLast() {
    requireState(last != null, "the list is empty");
    Node<K> node = last;
    unlink(node);
    return node;
  }

  /**
   * Moves the node to the front of the list so that it becomes the first node.
   *
   * @param node a node linked into this list
   * @throws IllegalStateException if the node belongs to another list or to none
   */
  public void moveToFront(Node<K> node) {
    requireNonNull(node);
    requireState(node.list == this, "%s does not belong to this list", node);
    if (node != first) {
      unlink(node);
      linkFirst(node);
    }
  }

  /** Returns if the node is at the front of the list. */
  public boolean isFirst(@Nullable Node<K> node) {
    return (node != null) && (node == first);
  }

  /** Returns the first node, or {@code null} if the list is empty. */
  public @Nullable Node<K> peekFirst() {
    return first;
  }

  /** Returns the last node, or {@code null} if the list is empty. */
  public @Nullable Node<K> peekLast() {
    return last;
  }

  /** Returns the number of linked nodes in constant time. */
  public int size() {
    return size;
  }

  public boolean isEmpty() {
    return (first == null);
  }

  /** Unlinks every node, clearing each node's links and owner. */
  public void clear() {
    @Var Node<K> node = first;
    while (node != null) {
      Node<K> next = node.next;
      node.detach();
      node = next;
    }
    first = last = null;
    size = 0;
    modCount++;
  }

  /** Returns an iterator over the keys from the most recently used to the least. */
  @Override
  public Iterator<K> iterator() {
    return new KeyIterator(first) {
      @Override @Nullable Node<K> computeNext(Node<K> node) {
        return node.next;
      }
    };
  }

  /** Returns an iterator over the keys from the least recently used to the most. */
  public Iterator<K> descendingIterator() {
    return new KeyIterator(last) {
      @Override @Nullable Node<K> computeNext(Node<K> node) {
        return node.previous;
      }
    };
  }

  @Override
  public String toString() {
    var s = new StringBuilder().append('[');
    for (Iterator<K> it = iterator(); it.hasNext();) {
      s.append(it.next());
      if (it.hasNext()) {
        s.append(", ");
      }
    }
    return s.append(']').toString();
  }

  private void linkFirst(Node<K> node) {
    Node<K> f = first;
    first = node;
    if (f == null) {
      last = node;
    } else {
      f.previous = node;
      node.next = f;
    }
    node.list = this;
    size++;
    modCount++;
  }

  private void unlink(Node<K> node) {
    Node<K> previous = node.previous;
    Node<K> next = node.next;

    if (previous == null) {
      first = next;
    } else {
      previous.next = next;
    }

    if (next == null) {
      last = previous;
    } else {
      next.previous = previous;
    }

    node.detach();
    size--;
    modCount++;
  }

  /**
   * An element of a {@link RecencyList} that holds a key and the links to its neighbors.
   *
   * @param <K> the type of key
   */
  static class Node<K> {
    final K key;

    @Nullable Node<K> previous;
    @Nullable Node<K> next;
    @Nullable RecencyList<K> list;

    Node(K key) {
      this.key = requireNonNull(key);
    }

    /** Returns the key held by this node. */
    public K getKey() {
      return key;
    }

    /** Returns if the node is not linked into any list. */
    public boolean isDetached() {
      return (list == null);
    }

    void detach() {
      previous = null;
      next = null;
      list = null;
    }

    @Override
    public String toString() {
      return getClass().getSimpleName() + '{' + key + '}';
    }
  }

  abstract class KeyIterator implements Iterator<K> {
    @Nullable Node<K> cursor;
    int expectedModCount;

    /**
     * Creates an iterator that traverses the list.
     *
     * @param start the initial node to begin traversal from
     */
    KeyIterator(@Nullable Node<K> start) {
      expectedModCount = modCount;
      cursor = start;
    }

    @Override
    public boolean hasNext() {
      checkForComodification();
      return (cursor != null);
    }

    @Override
    @SuppressWarnings("NullAway")
    public K next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Node<K> node = cursor;
      cursor = computeNext(node);
      return node.key;
    }

    /** Retrieves the next node to traverse to or {@code null} if there are no more nodes. */
    abstract @Nullable Node<K> computeNext(Node<K> node);

    /**
     * If the expected modCount value that the iterator believes that the backing list should have
     * is violated then the iterator has detected concurrent modification.
     */
    void checkForComodification() {
      if (modCount != expectedModCount) {
        throw new ConcurrentModificationException();
      }
    }
  }
}
