package com.collab.sync.core.session;

import com.collab.sync.core.model.Operation;
import com.collab.sync.core.transform.TransformEngine;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class LiveDocumentTest {

    private final TransformEngine engine = new TransformEngine();

    @Test
    void applyAdvancesRevisionAndMarksDirty() {
        LiveDocument doc = new LiveDocument("d", "foo", 0);

        LiveDocument.AppliedEdit edit = doc.apply("alice", Operation.insert(3, "bar"), engine);

        assertThat(edit.content()).isEqualTo("foobar");
        assertThat(edit.revision()).isEqualTo(1);
        assertThat(edit.operation().revision()).isEqualTo(1L);
        assertThat(doc.snapshot().dirty()).isTrue();
    }

    @Test
    void staleOperationFromAnotherUserIsTransformed() {
        LiveDocument doc = new LiveDocument("d", "foo", 0);
        doc.apply("alice", Operation.insert(0, "X").withRevision(0L), engine);

        LiveDocument.AppliedEdit edit = doc.apply("bob", Operation.insert(3, "Y").withRevision(0L), engine);

        assertThat(edit.operation().position()).isEqualTo(4);
        assertThat(edit.content()).isEqualTo("XfooY");
    }

    @Test
    void sameAuthorIsNotTransformedAgainstItself() {
        LiveDocument doc = new LiveDocument("d", "foo", 0);
        doc.apply("alice", Operation.insert(0, "X").withRevision(0L), engine);

        LiveDocument.AppliedEdit edit = doc.apply("alice", Operation.insert(1, "Y").withRevision(0L), engine);

        assertThat(edit.content()).isEqualTo("XYfoo");
    }

    @Test
    void operationWithoutRevisionIsAppliedAsSent() {
        LiveDocument doc = new LiveDocument("d", "foo", 0);
        doc.apply("alice", Operation.insert(0, "X"), engine);

        LiveDocument.AppliedEdit edit = doc.apply("bob", Operation.insert(3, "Y"), engine);

        assertThat(edit.content()).isEqualTo("XfoYo");
    }
}
