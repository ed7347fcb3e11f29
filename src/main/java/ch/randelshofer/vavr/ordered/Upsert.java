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

import java.util.Objects;
import java.util.function.Function;

/**
 * The request that {@link OrderedDict#upsert(Object, Function)} passes to its handler.
 * <p>
 * An {@code Upsert} is either an {@link Update}, if the dictionary contains the key,
 * or an {@link Insert}, if it does not. Each variant offers exactly the continuation
 * that makes sense for it, so the handler cannot produce an update for a missing key
 * or an insert for an existing one.
 * <p>
 * Example: count words, appending new words at the end.
 * <pre>{@code
 * counts = counts.upsert(word, u -> u.fold(
 *         update -> update.set(update.currentValue() + 1),
 *         insert -> insert.insert(InsertPosition.END, 1)));
 * }</pre>
 *
 * @param <K> the key type
 * @param <V> the value type
 */
public abstract class Upsert<K, V> {

    final OrderedDict<K, V> dict;
    final K key;

    private Upsert(OrderedDict<K, V> dict, K key) {
        this.dict = dict;
        this.key = key;
    }

    /**
     * Returns the key of the upsert.
     *
     * @return the key
     */
    public K key() {
        return key;
    }

    public abstract boolean isUpdate();

    /**
     * Applies {@code ifUpdate} if this is an {@link Update}, otherwise {@code ifInsert}.
     *
     * @param ifUpdate function applied to an update
     * @param ifInsert function applied to an insert
     * @param <R>      the result type
     * @return the result of the applied function
     */
    public abstract <R> R fold(Function<? super Update<K, V>, ? extends R> ifUpdate,
                               Function<? super Insert<K, V>, ? extends R> ifInsert);

    /**
     * The key is present in the dictionary.
     *
     * @param <K> the key type
     * @param <V> the value type
     */
    public static final class Update<K, V> extends Upsert<K, V> {
        private final V currentValue;

        Update(OrderedDict<K, V> dict, K key, V currentValue) {
            super(dict, key);
            this.currentValue = currentValue;
        }

        public V currentValue() {
            return currentValue;
        }

        /**
         * Returns the dictionary with {@code value} stored at the key. The key keeps its position.
         *
         * @param value the new value
         * @return the updated dictionary
         */
        public OrderedDict<K, V> set(V value) {
            return dict.replaceValue(key, value);
        }

        @Override
        public boolean isUpdate() {
            return true;
        }

        @Override
        public <R> R fold(Function<? super Update<K, V>, ? extends R> ifUpdate,
                          Function<? super Insert<K, V>, ? extends R> ifInsert) {
            Objects.requireNonNull(ifUpdate, "ifUpdate is null");
            return ifUpdate.apply(this);
        }

        @Override
        public String toString() {
            return "Update(" + key + ", " + currentValue + ")";
        }
    }

    /**
     * The key is absent from the dictionary.
     *
     * @param <K> the key type
     * @param <V> the value type
     */
    public static final class Insert<K, V> extends Upsert<K, V> {

        Insert(OrderedDict<K, V> dict, K key) {
            super(dict, key);
        }

        /**
         * Returns the dictionary with the key inserted at the given position.
         *
         * @param position where to put the key
         * @param value    the value of the key
         * @return the extended dictionary
         */
        public OrderedDict<K, V> insert(InsertPosition position, V value) {
            Objects.requireNonNull(position, "position is null");
            return position.insert(dict, key, value);
        }

        @Override
        public boolean isUpdate() {
            return false;
        }

        @Override
        public <R> R fold(Function<? super Update<K, V>, ? extends R> ifUpdate,
                          Function<? super Insert<K, V>, ? extends R> ifInsert) {
            Objects.requireNonNull(ifInsert, "ifInsert is null");
            return ifInsert.apply(this);
        }

        @Override
        public String toString() {
            return "Insert(" + key + ")";
        }
    }
}
