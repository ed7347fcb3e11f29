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

import io.vavr.Tuple;
import io.vavr.collection.List;
import io.vavr.control.Option;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class UpsertTest {

    private static OrderedDict<String, Integer> increment(OrderedDict<String, Integer> dict, String key, InsertPosition position) {
        return dict.upsert(key, u -> u.fold(
                update -> update.set(update.currentValue() + 1),
                insert -> insert.insert(position, 1)));
    }

    private static OrderedDict<String, Integer> abc() {
        return OrderedDict.of("a", 1, "b", 2, "c", 3);
    }

    @Test
    public void shouldCountWords() {
        OrderedDict<String, Integer> counts = OrderedDict.empty();
        for (String word : List.of("to", "be", "or", "not", "to", "be")) {
            counts = increment(counts, word, InsertPosition.END);
        }
        assertThat(counts.toSequence()).containsExactly(
                Tuple.of("to", 2), Tuple.of("be", 2), Tuple.of("or", 1), Tuple.of("not", 1));
    }

    @Test
    public void shouldUpdateInPlace() {
        final OrderedDict<String, Integer> dict = increment(abc(), "b", InsertPosition.START);
        assertThat(dict.toSequence()).containsExactly(Tuple.of("a", 1), Tuple.of("b", 3), Tuple.of("c", 3));
    }

    @Test
    public void shouldInsertAtStart() {
        assertThat(increment(abc(), "x", InsertPosition.START).keys()).containsExactly("x", "a", "b", "c");
    }

    @Test
    public void shouldInsertAtEnd() {
        assertThat(increment(abc(), "x", InsertPosition.END).keys()).containsExactly("a", "b", "c", "x");
    }

    @Test
    public void shouldInsertAtIndex() {
        assertThat(increment(abc(), "x", InsertPosition.at(2)).keys()).containsExactly("a", "b", "x", "c");
        assertThat(increment(abc(), "x", InsertPosition.at(99)).keys()).containsExactly("a", "b", "c", "x");
    }

    @Test
    public void shouldTreatNonPositiveIndexAsStart() {
        assertThat(InsertPosition.at(0)).isSameAs(InsertPosition.START);
        assertThat(InsertPosition.at(-4)).isSameAs(InsertPosition.START);
        assertThat(increment(abc(), "x", InsertPosition.at(-4)).keys()).containsExactly("x", "a", "b", "c");
    }

    @Test
    public void shouldPassUpdateForPresentKey() {
        abc().upsert("c", u -> {
            assertThat(u.isUpdate()).isTrue();
            assertThat(u.key()).isEqualTo("c");
            assertThat(u).isInstanceOf(Upsert.Update.class);
            assertThat(((Upsert.Update<String, Integer>) u).currentValue()).isEqualTo(3);
            return abc();
        });
    }

    @Test
    public void shouldPassInsertForAbsentKey() {
        abc().upsert("x", u -> {
            assertThat(u.isUpdate()).isFalse();
            assertThat(u.key()).isEqualTo("x");
            assertThat(u).isInstanceOf(Upsert.Insert.class);
            return abc();
        });
    }

    @Test
    public void shouldCallHandlerExactlyOnce() {
        final AtomicInteger calls = new AtomicInteger();
        abc().upsert("a", u -> {
            calls.incrementAndGet();
            return abc();
        });
        abc().upsert("x", u -> {
            calls.incrementAndGet();
            return abc();
        });
        assertThat(calls.get()).isEqualTo(2);
    }

    @Test
    public void shouldReturnWhatTheHandlerReturns() {
        final OrderedDict<String, Integer> other = OrderedDict.of("z", 0);
        assertThat(abc().upsert("a", u -> other)).isSameAs(other);
    }

    @Test
    public void shouldUpdateNullValue() {
        final OrderedDict<String, Integer> dict = OrderedDict.<String, Integer>empty().append("n", null);
        final OrderedDict<String, Integer> actual = dict.upsert("n", u -> u.fold(
                update -> update.set(update.currentValue() == null ? 0 : 1),
                insert -> insert.insert(InsertPosition.END, -1)));
        assertThat(actual.get("n")).isEqualTo(Option.some(0));
    }

    @Test
    public void shouldRejectNullHandler() {
        assertThatThrownBy(() -> abc().upsert("a", null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    public void shouldRejectNullResult() {
        assertThatThrownBy(() -> abc().upsert("a", u -> null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    public void shouldDescribeInsertPositions() {
        assertThat(InsertPosition.START.toString()).isEqualTo("START");
        assertThat(InsertPosition.END.toString()).isEqualTo("END");
        assertThat(InsertPosition.at(3).toString()).isEqualTo("at(3)");
        assertThat(InsertPosition.at(3)).isEqualTo(InsertPosition.at(3));
        assertThat(InsertPosition.at(3)).isNotEqualTo(InsertPosition.at(4));
    }
}
