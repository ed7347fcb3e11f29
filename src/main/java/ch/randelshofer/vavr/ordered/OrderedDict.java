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
package ch.randelshofer.vavr.ordered;

import io.vavr.Function3;
import io.vavr.Function4;
import io.vavr.Tuple;
import io.vavr.Tuple2;
import io.vavr.Tuple3;
import io.vavr.collection.HashMap;
import io.vavr.collection.HashSet;
import io.vavr.collection.Iterator;
import io.vavr.collection.Vector;
import io.vavr.control.Option;

import java.io.IOException;
import java.io.InvalidObjectException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.ObjectStreamException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collector;

/**
 * Implements an immutable dictionary whose entries have a position.
 * <p>
 * Features:
 * <ul>
 *     <li>allows null keys and null values</li>
 *     <li>is immutable</li>
 *     <li>is thread-safe</li>
 *     <li>iterates in an order that is controlled by the caller: entries can be
 *     inserted at the start, at the end, or at any index, and can be moved</li>
 * </ul>
 * <p>
 * Performance characteristics:
 * <ul>
 *     <li>get, containsKey: O(1)</li>
 *     <li>size: O(1)</li>
 *     <li>getKeyAt, getValueAt, getEntryAt: O(1) in an effective sense</li>
 *     <li>append, prepend, put of a new key: O(1) in an effective sense</li>
 *     <li>indexOf, remove, and inserting a key that is already present: O(N),
 *     because the key has to be found in the order sequence</li>
 *     <li>reorder, insertAt: O(N)</li>
 * </ul>
 * <p>
 * Implementation details:
 * <p>
 * The dictionary consists of two persistent structures: a {@link HashMap} from keys to
 * values, and a {@link KeySequence} that holds every key of the map exactly once, in
 * iteration order. Every operation that creates a new dictionary updates both structures,
 * and shares all unmodified parts with the dictionary it was derived from.
 * <p>
 * Inserting a key that is already present first removes the key from its old position
 * in the order sequence, and then inserts it at the new position. Therefore, the length of
 * the order sequence is always equal to the size of the map.
 * <p>
 * Read operations skip keys in the order sequence that are not present in the map.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public final class OrderedDict<K, V> implements Iterable<Tuple2<K, V>>, Serializable {
    private static final long serialVersionUID = 1L;
    private static final OrderedDict<?, ?> EMPTY = new OrderedDict<>(HashMap.empty(), KeySequence.empty());

    @SuppressWarnings("serial") // Conditionally serializable
    private final HashMap<K, V> entries;
    /**
     * The keys of {@link #entries} in iteration order.
     */
    @SuppressWarnings("serial") // Replaced by SerializationProxy
    private final KeySequence<K> order;

    OrderedDict(HashMap<K, V> entries, KeySequence<K> order) {
        this.entries = Objects.requireNonNull(entries);
        this.order = Objects.requireNonNull(order);
    }

    /**
     * Returns a {@link Collector} which may be used in conjunction with
     * {@link java.util.stream.Stream#collect(Collector)} to obtain an {@link OrderedDict}.
     * <p>
     * A key that occurs more than once gets the value and the position of its last occurrence.
     *
     * @param <K> The key type
     * @param <V> The value type
     * @return An {@link OrderedDict} Collector.
     */
    public static <K, V> Collector<Tuple2<K, V>, ArrayList<Tuple2<K, V>>, OrderedDict<K, V>> collector() {
        final BinaryOperator<ArrayList<Tuple2<K, V>>> combiner = (left, right) -> {
            left.addAll(right);
            return left;
        };
        return Collector.<Tuple2<K, V>, ArrayList<Tuple2<K, V>>, OrderedDict<K, V>>of(
                ArrayList::new, ArrayList::add, combiner, list -> OrderedDict.ofEntries(list));
    }

    @SuppressWarnings("unchecked")
    public static <K, V> OrderedDict<K, V> empty() {
        return (OrderedDict<K, V>) EMPTY;
    }

    /**
     * Narrows a widened {@code OrderedDict<? extends K, ? extends V>} to {@code OrderedDict<K, V>}
     * by performing a type-safe cast. This is eligible because immutable/read-only
     * collections are covariant.
     *
     * @param dict An {@code OrderedDict}.
     * @param <K>  Key type
     * @param <V>  Value type
     * @return the given {@code dict} instance as narrowed type {@code OrderedDict<K, V>}.
     */
    @SuppressWarnings("unchecked")
    public static <K, V> OrderedDict<K, V> narrow(OrderedDict<? extends K, ? extends V> dict) {
        return (OrderedDict<K, V>) dict;
    }

    public static <K, V> OrderedDict<K, V> of(K key, V value) {
        return OrderedDict.<K, V>empty().append(key, value);
    }

    public static <K, V> OrderedDict<K, V> of(K k1, V v1, K k2, V v2) {
        return OrderedDict.<K, V>empty().append(k1, v1).append(k2, v2);
    }

    public static <K, V> OrderedDict<K, V> of(K k1, V v1, K k2, V v2, K k3, V v3) {
        return OrderedDict.<K, V>empty().append(k1, v1).append(k2, v2).append(k3, v3);
    }

    /**
     * Returns an {@code OrderedDict} with the entries of a java.util.Map, in the iteration
     * order of the map.
     *
     * @param map A map
     * @param <K> The key type
     * @param <V> The value type
     * @return A new dictionary containing the given map
     */
    public static <K, V> OrderedDict<K, V> ofAll(Map<? extends K, ? extends V> map) {
        Objects.requireNonNull(map, "map is null");
        OrderedDict<K, V> result = empty();
        for (Map.Entry<? extends K, ? extends V> entry : map.entrySet()) {
            result = result.append(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Creates an OrderedDict of the given entries.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new dictionary containing the given entries
     */
    @SafeVarargs
    public static <K, V> OrderedDict<K, V> ofEntries(Map.Entry<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        OrderedDict<K, V> result = empty();
        for (Map.Entry<? extends K, ? extends V> entry : entries) {
            result = result.append(entry.getKey(), entry.getValue());
        }
        return result;
    }

    /**
     * Creates an OrderedDict of the given entries.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new dictionary containing the given entries
     */
    @SafeVarargs
    public static <K, V> OrderedDict<K, V> ofEntries(Tuple2<? extends K, ? extends V>... entries) {
        Objects.requireNonNull(entries, "entries is null");
        return OrderedDict.<K, V>empty().appendAllTuples(Arrays.asList(entries));
    }

    /**
     * Creates an OrderedDict of the given entries.
     * <p>
     * The entries are appended one after the other. A key that occurs more than once
     * gets the value and the position of its last occurrence, for example
     * {@code ofEntries((1, a), (2, b), (1, c))} is {@code OrderedDict((2, b), (1, c))}.
     *
     * @param entries Map entries
     * @param <K>     The key type
     * @param <V>     The value type
     * @return A new dictionary containing the given entries
     */
    public static <K, V> OrderedDict<K, V> ofEntries(Iterable<? extends Tuple2<? extends K, ? extends V>> entries) {
        Objects.requireNonNull(entries, "entries is null");
        return OrderedDict.<K, V>empty().appendAllTuples(entries);
    }

    private OrderedDict<K, V> appendAllTuples(Iterable<? extends Tuple2<? extends K, ? extends V>> tuples) {
        OrderedDict<K, V> result = this;
        for (Tuple2<? extends K, ? extends V> t : tuples) {
            result = result.append(t._1, t._2);
        }
        return result;
    }

    // -- positional insert

    /**
     * Stores the value at the key, and moves the key to index 0.
     *
     * @param key   a key
     * @param value a value
     * @return a new dictionary
     */
    public OrderedDict<K, V> prepend(K key, V value) {
        return new OrderedDict<>(entries.put(key, value), orderWithout(key).prepend(key));
    }

    /**
     * Stores the value at the key, and moves the key to the last index.
     *
     * @param key   a key
     * @param value a value
     * @return a new dictionary
     */
    public OrderedDict<K, V> append(K key, V value) {
        return new OrderedDict<>(entries.put(key, value), orderWithout(key).append(key));
    }

    /**
     * Stores the value at the key, and moves the key to the given index.
     * <p>
     * The index refers to the order sequence after the key has been removed from it.
     * If the index is greater or equal than that length, the key is appended.
     * If the index is less or equal than 0, the key is prepended.
     *
     * @param index the target index
     * @param key   a key
     * @param value a value
     * @return a new dictionary
     */
    public OrderedDict<K, V> insertAt(int index, K key, V value) {
        return new OrderedDict<>(entries.put(key, value), orderWithout(key).insert(index, key));
    }

    private KeySequence<K> orderWithout(K key) {
        return entries.containsKey(key) ? order.remove(key) : order;
    }

    /**
     * Stores the value at the key. An existing key keeps its position, a new key
     * is appended.
     *
     * @param key   a key
     * @param value a value
     * @return a new dictionary
     */
    public OrderedDict<K, V> put(K key, V value) {
        return entries.containsKey(key)
                ? new OrderedDict<>(entries.put(key, value), order)
                : append(key, value);
    }

    public OrderedDict<K, V> putAll(Iterable<? extends Tuple2<? extends K, ? extends V>> tuples) {
        Objects.requireNonNull(tuples, "tuples is null");
        OrderedDict<K, V> result = this;
        for (Tuple2<? extends K, ? extends V> t : tuples) {
            result = result.put(t._1, t._2);
        }
        return result;
    }

    /**
     * Replaces the value of an existing key. The key keeps its position.
     *
     * @param key   a key
     * @param value the new value
     * @return a new dictionary, or this dictionary if it does not contain the key
     */
    public OrderedDict<K, V> replaceValue(K key, V value) {
        return entries.containsKey(key)
                ? new OrderedDict<>(entries.put(key, value), order)
                : this;
    }

    // -- reads

    public Option<V> get(K key) {
        return entries.get(key);
    }

    public V getOrElse(K key, V defaultValue) {
        return entries.getOrElse(key, defaultValue);
    }

    /**
     * Returns the value of the key.
     *
     * @param key a key
     * @return the value
     * @throws NoSuchElementException if the dictionary does not contain the key
     */
    public V apply(K key) {
        return get(key).getOrElseThrow(() -> new NoSuchElementException(String.valueOf(key)));
    }

    public boolean containsKey(K key) {
        return entries.containsKey(key);
    }

    /**
     * Returns the position of the key.
     *
     * @param key a key
     * @return the index of the key, or {@code None} if the dictionary does not contain the key
     */
    public Option<Integer> indexOf(K key) {
        if (!entries.containsKey(key)) {
            return Option.none();
        }
        final int index = order.indexOf(key);
        return index < 0 ? Option.none() : Option.some(index);
    }

    /**
     * Returns the key at the given index.
     *
     * @param index an index
     * @return the key, or {@code None} if the index is negative or {@code >= size()}
     */
    public Option<K> getKeyAt(int index) {
        return order.isDefinedAt(index) ? Option.some(order.get(index)) : Option.none();
    }

    public Option<V> getValueAt(int index) {
        return getKeyAt(index).flatMap(entries::get);
    }

    public Option<Tuple2<K, V>> getEntryAt(int index) {
        return getKeyAt(index).flatMap(key -> entries.get(key).map(value -> Tuple.of(key, value)));
    }

    public Option<Tuple2<K, V>> head() {
        return getEntryAt(0);
    }

    public Option<Tuple2<K, V>> last() {
        return getEntryAt(size() - 1);
    }

    public int size() {
        return order.length();
    }

    public boolean isEmpty() {
        return order.isEmpty();
    }

    // -- removal

    public OrderedDict<K, V> remove(K key) {
        return entries.containsKey(key)
                ? new OrderedDict<>(entries.remove(key), order.remove(key))
                : this;
    }

    /**
     * Removes the key at the given index.
     *
     * @param index an index
     * @return a new dictionary, or this dictionary if the index is out of range
     */
    public OrderedDict<K, V> removeAt(int index) {
        return order.isDefinedAt(index)
                ? new OrderedDict<>(entries.remove(order.get(index)), order.removeAt(index))
                : this;
    }

    /**
     * Removes the key at the given index, but only if it is equal to the given key.
     *
     * @param index an index
     * @param key   the key expected at the index
     * @return a new dictionary, or this dictionary if the index holds a different key
     */
    public OrderedDict<K, V> removeAtIfKey(int index, K key) {
        return order.isDefinedAt(index) && Objects.equals(order.get(index), key)
                ? removeAt(index)
                : this;
    }

    /**
     * Retains the entries whose key is contained in the given keys.
     *
     * @param keys the keys to retain
     * @return a new dictionary with the retained entries in their current order
     */
    public OrderedDict<K, V> take(Iterable<? extends K> keys) {
        Objects.requireNonNull(keys, "keys is null");
        final HashSet<K> retained = HashSet.ofAll(keys);
        return filterKeys(retained::contains);
    }

    /**
     * Removes the entries whose key is contained in the given keys.
     *
     * @param keys the keys to remove
     * @return a new dictionary with the remaining entries in their current order
     */
    public OrderedDict<K, V> drop(Iterable<? extends K> keys) {
        Objects.requireNonNull(keys, "keys is null");
        final HashSet<K> removed = HashSet.ofAll(keys);
        return filterKeys(key -> !removed.contains(key));
    }

    private OrderedDict<K, V> filterKeys(Predicate<? super K> predicate) {
        final KeySequence<K> filtered = order.filter(predicate);
        return filtered.length() == order.length()
                ? this
                : new OrderedDict<>(entries.filterKeys(predicate), filtered);
    }

    // -- reorder

    /**
     * Moves the entry at {@code oldIndex} to {@code newIndex}. The entries between the
     * two indices shift by one position, all other entries stay where they are.
     * <p>
     * Both indices are clamped to {@code [0, size() - 1]}.
     * <p>
     * Example: {@code [a, b, c, d, e, f].reorder(1, 3)} is {@code [a, c, d, b, e, f]}.
     *
     * @param oldIndex the current index of the entry
     * @param newIndex the new index of the entry
     * @return a new dictionary, or this dictionary if nothing moves
     */
    public OrderedDict<K, V> reorder(int oldIndex, int newIndex) {
        if (isEmpty()) {
            return this;
        }
        final int from = clamp(oldIndex);
        final int to = clamp(newIndex);
        return from == to ? this : new OrderedDict<>(entries, order.move(from, to));
    }

    private int clamp(int index) {
        return Math.max(0, Math.min(index, size() - 1));
    }

    // -- views

    public Vector<K> keys() {
        return Vector.ofAll(iterator().map(Tuple2::_1));
    }

    public Vector<V> values() {
        return Vector.ofAll(iterator().map(Tuple2::_2));
    }

    public Vector<Tuple2<K, V>> toSequence() {
        return Vector.ofAll(iterator());
    }

    /**
     * Returns the entries with their positions.
     *
     * @return a vector of (key, value, index) triples
     */
    public Vector<Tuple3<K, V, Integer>> toIndexedSequence() {
        return Vector.ofAll(iterator().zipWithIndex()
                .map(t -> Tuple.of(t._1._1, t._1._2, t._2)));
    }

    public java.util.LinkedHashMap<K, V> toJavaMap() {
        final java.util.LinkedHashMap<K, V> map = new java.util.LinkedHashMap<>();
        for (Tuple2<K, V> entry : this) {
            map.put(entry._1, entry._2);
        }
        return map;
    }

    /**
     * Iterates over the entries in order.
     */
    @Override
    public Iterator<Tuple2<K, V>> iterator() {
        return order.iterator().flatMap(key -> entries.get(key).map(value -> Tuple.of(key, value)));
    }

    // -- traversal

    /**
     * Folds the entries from left to right.
     *
     * @param zero the initial value
     * @param f    a function of the accumulator, key, value and index
     * @param <U>  the type of the accumulator
     * @return the folded value
     */
    public <U> U fold(U zero, Function4<? super U, ? super K, ? super V, ? super Integer, ? extends U> f) {
        Objects.requireNonNull(f, "f is null");
        U acc = zero;
        int index = 0;
        for (Tuple2<K, V> entry : this) {
            acc = f.apply(acc, entry._1, entry._2, index++);
        }
        return acc;
    }

    public void forEach(IndexedConsumer<? super K, ? super V> action) {
        Objects.requireNonNull(action, "action is null");
        fold(null, (acc, key, value, index) -> {
            action.accept(key, value, index);
            return acc;
        });
    }

    /**
     * Maps the values. Keys and order do not change.
     *
     * @param mapper a function of key, value and index
     * @param <W>    the new value type
     * @return a new dictionary
     */
    public <W> OrderedDict<K, W> mapValues(Function3<? super K, ? super V, ? super Integer, ? extends W> mapper) {
        Objects.requireNonNull(mapper, "mapper is null");
        final HashMap<K, W> mapped = fold(HashMap.<K, W>empty(),
                (acc, key, value, index) -> acc.put(key, mapper.apply(key, value, index)));
        return new OrderedDict<>(mapped, order.filter(mapped::containsKey));
    }

    public OrderedDict<K, V> filter(IndexedPredicate<? super K, ? super V> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        final HashSet<K> rejected = fold(HashSet.<K>empty(),
                (acc, key, value, index) -> predicate.test(key, value, index) ? acc : acc.add(key));
        return rejected.isEmpty()
                ? this
                : new OrderedDict<>(entries.removeAll(rejected), order.filter(key -> !rejected.contains(key)));
    }

    // -- upsert

    /**
     * Updates the value of the key, or inserts the key.
     * <p>
     * The handler is called exactly once. It receives an {@link Upsert.Update} if the
     * dictionary contains the key, and an {@link Upsert.Insert} otherwise. The dictionary
     * returned by the handler is the result of this method.
     *
     * @param key     a key
     * @param handler a function that decides how to update or insert
     * @return the dictionary returned by the handler
     */
    public OrderedDict<K, V> upsert(K key, Function<? super Upsert<K, V>, ? extends OrderedDict<K, V>> handler) {
        Objects.requireNonNull(handler, "handler is null");
        final Upsert<K, V> request = entries.containsKey(key)
                ? new Upsert.Update<>(this, key, entries.get(key).get())
                : new Upsert.Insert<>(this, key);
        return Objects.requireNonNull(handler.apply(request), "handler returned null");
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof OrderedDict)) {
            return false;
        }
        final OrderedDict<?, ?> that = (OrderedDict<?, ?>) o;
        return size() == that.size()
                && order.equals(that.order)
                && entries.equals(that.entries);
    }

    @Override
    public int hashCode() {
        return toSequence().hashCode();
    }

    @Override
    public String toString() {
        return iterator().mkString("OrderedDict(", ", ", ")");
    }

    private Object writeReplace() throws ObjectStreamException {
        return new SerializationProxy<>(this);
    }

    private void readObject(ObjectInputStream s) throws InvalidObjectException {
        throw new InvalidObjectException("Proxy required");
    }

    /**
     * A serialization proxy which, in this context, is used to deserialize immutable
     * dictionaries with final instance fields.
     *
     * @param <K> The key type
     * @param <V> The value type
     */
    // DEV NOTE: The serialization proxy pattern is not compatible with non-final, i.e. extendable,
    // classes. Also, it may not be compatible with circular object graphs.
    private static final class SerializationProxy<K, V> implements Serializable {

        private static final long serialVersionUID = 1L;

        // the instance to be serialized/deserialized
        private transient OrderedDict<K, V> dict;

        SerializationProxy(OrderedDict<K, V> dict) {
            this.dict = dict;
        }

        /**
         * Read an object from a deserialization stream.
         *
         * @param s An object deserialization stream.
         * @throws ClassNotFoundException If the object's class read from the stream cannot be found.
         * @throws InvalidObjectException If the stream contains a negative size.
         * @throws IOException            If an error occurs reading from the stream.
         */
        @SuppressWarnings("unchecked")
        private void readObject(ObjectInputStream s) throws ClassNotFoundException, IOException {
            s.defaultReadObject();
            final int size = s.readInt();
            if (size < 0) {
                throw new InvalidObjectException("No elements");
            }
            OrderedDict<K, V> result = empty();
            for (int i = 0; i < size; i++) {
                final K key = (K) s.readObject();
                final V value = (V) s.readObject();
                result = result.append(key, value);
            }
            dict = result;
        }

        private Object readResolve() {
            return dict;
        }

        /**
         * Write an object to a serialization stream.
         *
         * @param s An object serialization stream.
         * @throws IOException If an error occurs writing to the stream.
         */
        private void writeObject(ObjectOutputStream s) throws IOException {
            s.defaultWriteObject();
            s.writeInt(dict.size());
            for (Tuple2<K, V> e : dict) {
                s.writeObject(e._1);
                s.writeObject(e._2);
            }
        }
    }
}
