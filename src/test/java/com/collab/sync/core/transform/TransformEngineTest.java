package com.collab.sync.core.transform;

import com.collab.sync.core.model.Operation;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TransformEngineTest {

    private final TransformEngine engine = new TransformEngine();

    @Test
    void insertAtOrBeforeShiftsIncomingRight() {
        Operation incoming = Operation.insert(5, "x");

        assertThat(engine.transform(incoming, Operation.insert(5, "abc")).position()).isEqualTo(8);
        assertThat(engine.transform(incoming, Operation.insert(2, "ab")).position()).isEqualTo(7);
    }

    @Test
    void insertAfterLeavesIncomingUnchanged() {
        Operation incoming = Operation.insert(2, "x");

        assertThat(engine.transform(incoming, Operation.insert(3, "abc"))).isEqualTo(incoming);
    }

    @Test
    void deleteBeforeShiftsLeftByOverlapOnly() {
        // deleted range [2,6) covers the incoming position 4: shift by 2, not 4
        Operation shifted = engine.transform(Operation.insert(4, "x"), Operation.delete(2, "abcd"));
        assertThat(shifted.position()).isEqualTo(2);

        Operation past = engine.transform(Operation.insert(10, "x"), Operation.delete(2, "abc"));
        assertThat(past.position()).isEqualTo(7);
    }

    @Test
    void deleteAtSamePositionLeavesIncomingUnchanged() {
        Operation incoming = Operation.delete(3, "z");

        assertThat(engine.transform(incoming, Operation.delete(3, "abc"))).isEqualTo(incoming);
    }

    @Test
    void nullConcurrentReturnsIncoming() {
        Operation incoming = Operation.insert(1, "a");

        assertThat(engine.transform(incoming, null)).isSameAs(incoming);
    }

    @Test
    void transformKeepsTextKindAndRevision() {
        Operation incoming = Operation.insert(4, "hey").withRevision(7L);

        Operation out = engine.transform(incoming, Operation.insert(0, "ab"));

        assertThat(out.text()).isEqualTo("hey");
        assertThat(out.kind()).isEqualTo(Operation.Kind.INSERT);
        assertThat(out.revision()).isEqualTo(7L);
    }

    @Test
    void insertThenDeleteOfSameTextRestoresContent() {
        String content = "hello world";
        Operation insert = Operation.insert(5, ", dear");

        String inserted = engine.apply(content, insert);
        String restored = engine.apply(inserted, Operation.delete(5, ", dear"));

        assertThat(inserted).isEqualTo("hello, dear world");
        assertThat(restored).isEqualTo(content);
    }

    @Test
    void applyClampsPositionsPastTheEnd() {
        assertThat(engine.apply("abc", Operation.insert(10, "d"))).isEqualTo("abcd");
        assertThat(engine.apply("abc", Operation.delete(10, "xyz"))).isEqualTo("abc");
        assertThat(engine.apply("abcdef", Operation.delete(4, "xyzw"))).isEqualTo("abcd");
    }

    @Test
    void applyOnNullContentTreatsItAsEmpty() {
        assertThat(engine.apply(null, Operation.insert(3, "foo"))).isEqualTo("foo");
    }

    @Test
    void twoConcurrentInsertsConvergeWhenSecondIsTransformed() {
        // both users saw "foo"; A inserts "X" at 0, B inserts "Y" at 3
        String base = "foo";
        Operation a = Operation.insert(0, "X");
        Operation b = Operation.insert(3, "Y");

        String afterA = engine.apply(base, a);
        String result = engine.apply(afterA, engine.transform(b, a));

        assertThat(result).isEqualTo("XfooY");
    }

    @Test
    void insertAndConcurrentEmptyDeleteConvergeInEitherOrder() {
        Operation insert = Operation.insert(0, "foo");
        Operation emptyDelete = Operation.delete(0, "");

        String insertFirst = engine.apply(engine.apply("", insert), engine.transform(emptyDelete, insert));
        String deleteFirst = engine.apply(engine.apply("", emptyDelete), engine.transform(insert, emptyDelete));

        assertThat(insertFirst).isEqualTo("foo");
        assertThat(deleteFirst).isEqualTo("foo");
    }

    @Test
    void deleteThenReinsertOfSameSliceRestoresContent() {
        String content = "hello world";

        String deleted = engine.apply(content, Operation.delete(5, " world"));
        String restored = engine.apply(deleted, Operation.insert(5, " world"));

        assertThat(deleted).isEqualTo("hello");
        assertThat(restored).isEqualTo(content);
    }
}
