/* ____  ______________  ________________________  __________
 * \   \/   /      \   \/   /   __/   /      \   \/   /      \
 *  \______/___/\___\______/___/_____/___/\___\______/___/\___\
 *
 * The MIT License (MIT)
 *
 * Copyright 2024 Vavr, https://vavr.io
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */
package ch.randelshofer.vavr.bst;

import io.vavr.Tuple2;
import io.vavr.control.Option;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Map;
import java.util.Objects;

/**
 * Implements a mutable sorted map using an unbalanced binary search tree.
 * <p>
 * Features:
 * <ul>
 *     <li>keys are ordered by a {@link Comparator} or by their natural ordering</li>
 *     <li>does not allow null keys, allows null values</li>
 *     <li>is mutable</li>
 *     <li>is not thread-safe</li>
 *     <li>only leaf entries can be removed</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>put: O(h)</li>
 *     <li>get: O(h)</li>
 *     <li>remove: O(h)</li>
 *     <li>size: O(1)</li>
 *     <li>toString: O(N)</li>
 * </ul>
 * where h is the height of the tree. The tree is never rebalanced, its shape
 * depends only on the insertion order. Inserting keys in sorted order yields
 * a tree of height N.
 * <p>
 * Implementation details:
 * <p>
 * Every node is referenced by exactly one slot: either the {@code root} field
 * of the map, or the {@code left} or {@code right} field of its parent. Nodes
 * are never shared and never re-parented.
 * <p>
 * {@link #remove} does not promote a successor into the slot of a removed
 * inner node. It only detaches leaves, and throws an
 * {@link InvalidOperationException} for any node that still has a child.
 * <p>
 * All operations must be serialized by the caller. A {@link #toString()}
 * running concurrently with {@link #put} or {@link #remove} may observe a
 * partially updated tree.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public class OrderedMap<K, V> {

    private final Comparator<K> comparator;
    private Node<K, V> root;
    /**
     * The number of nodes reachable from {@link #root}.
     */
    private int size;

    private OrderedMap(Comparator<? super K> comparator) {
        this.comparator = narrow(comparator);
    }

    /**
     * Returns an empty {@code OrderedMap} that orders its keys by their
     * natural ordering.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return A new empty map
     */
    public static <K extends Comparable<? super K>, V> OrderedMap<K, V> empty() {
        return new OrderedMap<>(Comparator.naturalOrder());
    }

    /**
     * Returns an empty {@code OrderedMap} that orders its keys with the given
     * comparator.
     *
     * @param comparator The key comparator
     * @param <K>        The key type
     * @param <V>        The value type
     * @return A new empty map
     * @throws NullPointerException if {@code comparator} is null
     */
    public static <K, V> OrderedMap<K, V> empty(Comparator<? super K> comparator) {
        Objects.requireNonNull(comparator, "comparator is null");
        return new OrderedMap<>(comparator);
    }

    /**
     * Returns an {@code OrderedMap} of one entry.
     *
     * @param key   A singleton map key.
     * @param value A singleton map value.
     * @param <K>   The key type
     * @param <V>   The value type
     * @return A new Map containing the given entry
     */
    public static <K extends Comparable<? super K>, V> OrderedMap<K, V> of(K key, V value) {
        final OrderedMap<K, V> map = empty();
        map.put(key, value);
        return map;
    }

    /**
     * Creates an OrderedMap of the given list of key-value pairs.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given entries
     */
    public static <K extends Comparable<? super K>, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2) {
        final OrderedMap<K, V> map = of(k1, v1);
        map.put(k2, v2);
        return map;
    }

    /**
     * Creates an OrderedMap of the given list of key-value pairs.
     *
     * @param k1  a key for the map
     * @param v1  the value for k1
     * @param k2  a key for the map
     * @param v2  the value for k2
     * @param k3  a key for the map
     * @param v3  the value for k3
     * @param <K> The key type
     * @param <V> The value type
     * @return A new Map containing the given entries
     */
    public static <K extends Comparable<? super K>, V> OrderedMap<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        final OrderedMap<K, V> map = of(k1, v1, k2, v2);
        map.put(k3, v3);
        return map;
    }

    /**
     * Creates an OrderedMap of the given entries. Entries are inserted in the
     * given order, so the first entry becomes the root of the tree.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <K extends Comparable<? super K>, V> OrderedMap<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return OrderedMap.<K, V>ofEntries(Arrays.asList(entries));
    }

    /**
     * Creates an OrderedMap of the given entries.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    public static <K extends Comparable<? super K>, V> OrderedMap<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        final OrderedMap<K, V> map = empty();
        for (Tuple2<? extends K, ? extends V> entry : entries) {
            map.put(entry);
        }
        return map;
    }

    /**
     * Creates an OrderedMap of the given entries.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new Map containing the given entries
     */
    @SafeVarargs
    @SuppressWarnings("varargs")
    public static <K extends Comparable<? super K>, V> OrderedMap<K, V> ofEntries(Map.Entry<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        final OrderedMap<K, V> map = empty();
        for (Map.Entry<? extends K, ? extends V> entry : entries) {
            map.put(entry.getKey(), entry.getValue());
        }
        return map;
    }

    @SuppressWarnings("unchecked")
    private static <K> Comparator<K> narrow(Comparator<? super K> comparator) {
        return (Comparator<K>) comparator;
    }

    /**
     * Returns the comparator that orders the keys of this map.
     *
     * @return the key comparator
     */
    public Comparator<K> comparator() {
        return comparator;
    }

    /**
     * Returns the number of entries in this map.
     *
     * @return the number of entries
     */
    public int size() {
        return size;
    }

    /**
     * Returns true if this map contains no entries.
     *
     * @return true if {@code size() == 0}
     */
    public boolean isEmpty() {
        return size == 0;
    }

    /**
     * Associates the given value with the given key.
     * <p>
     * If the key is already present, its value is replaced in place and the
     * shape of the tree does not change. Otherwise, a new leaf is attached at
     * the empty slot where the search for the key ended.
     *
     * @param key   the key
     * @param value the value
     * @return the previous value if the key was present, {@code Option.none()}
     * if a new entry was inserted
     * @throws NullPointerException if {@code key} is null
     */
    public Option<V> put(K key, V value) {
        Objects.requireNonNull(key, "key is null");
        if (root == null) {
            root = new Node<>(key, value);
            size++;
            return Option.none();
        }
        Node<K, V> node = root;
        while (true) {
            final int c = comparator.compare(key, node.key);
            if (c == 0) {
                return Option.some(node.setValue(value));
            }
            if (c > 0) {
                if (node.right == null) {
                    node.right = new Node<>(key, value);
                    break;
                }
                node = node.right;
            } else {
                if (node.left == null) {
                    node.left = new Node<>(key, value);
                    break;
                }
                node = node.left;
            }
        }
        size++;
        return Option.none();
    }

    /**
     * Associates the value of the given entry with its key, see {@link #put(Object, Object)}.
     *
     * @param entry a key-value pair
     * @return the previous value if the key was present, {@code Option.none()} otherwise
     * @throws NullPointerException if {@code entry} or its key is null
     */
    public Option<V> put(Tuple2<? extends K, ? extends V> entry) {
        Objects.requireNonNull(entry, "entry is null");
        return put(entry._1, entry._2);
    }

    /**
     * Looks up the value of the given key.
     *
     * @param key the key
     * @return the value, or {@code Option.none()} if the key is absent
     * @throws NullPointerException if {@code key} is null
     */
    public Option<V> get(K key) {
        final Node<K, V> node = find(key);
        return node == null ? Option.none() : Option.some(node.value);
    }

    /**
     * Returns the value of the given key, or {@code defaultValue} if the key is absent.
     *
     * @param key          the key
     * @param defaultValue the value returned for an absent key
     * @return the value of the key or {@code defaultValue}
     * @throws NullPointerException if {@code key} is null
     */
    public V getOrElse(K key, V defaultValue) {
        return get(key).getOrElse(defaultValue);
    }

    /**
     * Returns true if this map contains an entry for the given key.
     *
     * @param key the key
     * @return true if the key is present
     * @throws NullPointerException if {@code key} is null
     */
    public boolean containsKey(K key) {
        return find(key) != null;
    }

    /**
     * Removes the entry with the given key, provided that its node is a leaf.
     *
     * @param key the key
     * @return the removed value, or {@code Option.none()} if the key is absent
     * @throws InvalidOperationException if the node of the key has a child;
     *                                   the map is not modified
     * @throws NullPointerException      if {@code key} is null
     */
    public Option<V> remove(K key) {
        Objects.requireNonNull(key, "key is null");
        // the slot being examined is parent.left, parent.right, or root if parent is null
        Node<K, V> parent = null;
        Node<K, V> node = root;
        while (node != null) {
            final int c = comparator.compare(key, node.key);
            if (c == 0) {
                if (!node.isLeaf()) {
                    throw InvalidOperationException.onlyLeafNodes();
                }
                if (parent == null) {
                    root = null;
                } else if (parent.left == node) {
                    parent.left = null;
                } else {
                    parent.right = null;
                }
                size--;
                return Option.some(node.value);
            }
            parent = node;
            node = c > 0 ? node.right : node.left;
        }
        return Option.none();
    }

    private Node<K, V> find(K key) {
        Objects.requireNonNull(key, "key is null");
        Node<K, V> node = root;
        while (node != null) {
            final int c = comparator.compare(key, node.key);
            if (c == 0) {
                return node;
            }
            node = c > 0 ? node.right : node.left;
        }
        return null;
    }

    /**
     * Renders all entries in ascending key order, for example
     * {@code "[ (1, one) (2, two) ]"}. An empty map renders as {@code "[ ]"}.
     * <p>
     * The traversal keeps its own stack, so degenerate trees of any height
     * can be rendered.
     *
     * @return the entries in ascending key order
     */
    @Override
    public String toString() {
        final StringBuilder buf = new StringBuilder("[ ");
        final ArrayDeque<Node<K, V>> stack = new ArrayDeque<>();
        Node<K, V> node = root;
        while (node != null || !stack.isEmpty()) {
            if (node != null) {
                stack.push(node);
                node = node.left;
            } else {
                node = stack.pop();
                buf.append('(').append(node.key).append(", ").append(node.value).append(") ");
                node = node.right;
            }
        }
        return buf.append(']').toString();
    }

    private static final class Node<K, V> {
        final K key;
        V value;
        Node<K, V> left;
        Node<K, V> right;

        Node(K key, V value) {
            this.key = key;
            this.value = value;
        }

        V setValue(V value) {
            final V old = this.value;
            this.value = value;
            return old;
        }

        boolean isLeaf() {
            return left == null && right == null;
        }
    }
}
