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

import java.io.Serializable;

/**
 * Selects where {@link Upsert.Insert#insert(InsertPosition, Object)} places a new key.
 * <ul>
 *     <li>{@link #START} prepends the key</li>
 *     <li>{@link #END} appends the key</li>
 *     <li>{@link #at(int)} inserts the key at an index. An index {@code <= 0} is the same as
 *     {@link #START}, an index beyond the last entry appends.</li>
 * </ul>
 */
public final class InsertPosition implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final InsertPosition START = new InsertPosition(Kind.START, 0);
    public static final InsertPosition END = new InsertPosition(Kind.END, -1);

    private enum Kind {
        START, END, INDEX
    }

    private final Kind kind;
    private final int index;

    private InsertPosition(Kind kind, int index) {
        this.kind = kind;
        this.index = index;
    }

    public static InsertPosition at(int index) {
        return index <= 0 ? START : new InsertPosition(Kind.INDEX, index);
    }

    <K, V> OrderedDict<K, V> insert(OrderedDict<K, V> dict, K key, V value) {
        switch (kind) {
            case START:
                return dict.prepend(key, value);
            case END:
                return dict.append(key, value);
            default:
                return dict.insertAt(index, key, value);
        }
    }

    private Object readResolve() {
        switch (kind) {
            case START:
                return START;
            case END:
                return END;
            default:
                return this;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (o == this) {
            return true;
        }
        if (!(o instanceof InsertPosition)) {
            return false;
        }
        final InsertPosition that = (InsertPosition) o;
        return kind == that.kind && index == that.index;
    }

    @Override
    public int hashCode() {
        return 31 * kind.hashCode() + index;
    }

    @Override
    public String toString() {
        switch (kind) {
            case START:
                return "START";
            case END:
                return "END";
            default:
                return "at(" + index + ")";
        }
    }
}
