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

import io.vavr.collection.Iterator;
import io.vavr.collection.Vector;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * KeySequence is the order sequence of an {@link OrderedDict}. It is an immutable
 * sequence of keys, in which every key occurs at most once.
 * <p>
 * The implementation is based on a Vavr {@link Vector}, which provides effectively
 * constant time access to any element. Splicing a key into the middle of the sequence
 * is done with {@code take}/{@code drop}, which are effectively constant as well.
 * <p>
 * This class does not check for duplicates by itself. Callers must remove a key
 * before they insert it again.
 *
 * @param <K> the key type
 */
final class KeySequence<K> {

    private static final KeySequence<?> EMPTY = new KeySequence<>(Vector.empty());

    private final Vector<K> keys;

    private KeySequence(Vector<K> keys) {
        this.keys = keys;
    }

    @SuppressWarnings("unchecked")
    static <K> KeySequence<K> empty() {
        return (KeySequence<K>) EMPTY;
    }

    static <K> KeySequence<K> ofAll(Iterable<? extends K> keys) {
        Objects.requireNonNull(keys, "keys is null");
        return KeySequence.<K>empty().wrap(Vector.ofAll(keys));
    }

    boolean isDefinedAt(int index) {
        return 0 <= index && index < length();
    }

    int length() {
        return keys.length();
    }

    boolean isEmpty() {
        return keys.isEmpty();
    }

    K get(int index) {
        if (isDefinedAt(index)) {
            return keys.get(index);
        }
        throw new IndexOutOfBoundsException("get(" + index + ")");
    }

    /**
     * Returns the index of the given key, or -1 if the sequence does not contain it.
     */
    int indexOf(K key) {
        return keys.indexOf(key);
    }

    KeySequence<K> prepend(K key) {
        return wrap(keys.prepend(key));
    }

    KeySequence<K> append(K key) {
        return wrap(keys.append(key));
    }

    /**
     * Inserts the key at the given index.
     * An index {@code <= 0} prepends, an index {@code >= length()} appends.
     */
    KeySequence<K> insert(int index, K key) {
        if (index <= 0) {
            return prepend(key);
        }
        if (index >= length()) {
            return append(key);
        }
        return wrap(keys.insert(index, key));
    }

    KeySequence<K> remove(K key) {
        final int index = indexOf(key);
        return index < 0 ? this : removeAt(index);
    }

    KeySequence<K> removeAt(int index) {
        return isDefinedAt(index) ? wrap(keys.removeAt(index)) : this;
    }

    /**
     * Moves the key at index {@code from} to index {@code to}. The keys between the two
     * indices shift by one position towards {@code from}.
     *
     * @throws IndexOutOfBoundsException if one of the indices is out of range
     */
    KeySequence<K> move(int from, int to) {
        final K key = get(from);
        if (!isDefinedAt(to)) {
            throw new IndexOutOfBoundsException("move(" + from + ", " + to + ")");
        }
        if (from == to) {
            return this;
        }
        final int distance = Math.abs(to - from);
        final Vector<K> prefix = keys.take(Math.min(from, to));
        final Vector<K> gap;
        final Vector<K> rest;
        if (from < to) {
            gap = keys.slice(from + 1, from + 1 + distance);
            rest = keys.drop(to + 1);
            return wrap(prefix.appendAll(gap).append(key).appendAll(rest));
        } else {
            gap = keys.slice(to, from);
            rest = keys.drop(from + 1);
            return wrap(prefix.append(key).appendAll(gap).appendAll(rest));
        }
    }

    KeySequence<K> filter(Predicate<? super K> predicate) {
        Objects.requireNonNull(predicate, "predicate is null");
        return wrap(keys.filter(predicate));
    }

    Iterator<K> iterator() {
        return keys.iterator();
    }

    private KeySequence<K> wrap(Vector<K> keys) {
        if (keys == this.keys) {
            return this;
        }
        return keys.isEmpty() ? empty() : new KeySequence<>(keys);
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        return o instanceof KeySequence && keys.equals(((KeySequence<?>) o).keys);
    }

    @Override
    public int hashCode() {
        return keys.hashCode();
    }

    @Override
    public String toString() {
        return keys.mkString("KeySequence(", ", ", ")");
    }
}
