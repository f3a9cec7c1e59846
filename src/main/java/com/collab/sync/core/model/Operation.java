package com.collab.sync.core.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * =====================================================================
 * Operation
 * =====================================================================
 *
 * PURPOSE
 * -------
 * A single edit primitive sent by a client: insert {@link #text} at
 * {@link #position}, or delete {@code text.length()} characters starting at
 * {@link #position}.
 *
 * IMMUTABILITY
 * ------------
 * Operations are never mutated. Transformation produces a new instance
 * (see {@code TransformEngine#transform}).
 *
 * REVISION
 * --------
 * {@link #revision} is the last document revision the client had seen when it
 * produced the operation. It is optional and only used by the live edit path to
 * decide whether the operation is concurrent with the most recently applied one.
 *
 * WIRE FORMAT
 * -----------
 * <pre>
 * {"position": 3, "text": "abc", "kind": "insert", "revision": 12}
 * </pre>
 * The legacy field names {@code pos} and {@code op_type} are accepted on input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Operation(
        @JsonAlias("pos") int position,
        String text,
        @JsonAlias({"op_type", "type"}) Kind kind,
        Long revision
) {

    public Operation {
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0 but was: " + position);
        }
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
    }

    public static Operation insert(int position, String text) {
        return new Operation(position, text, Kind.INSERT, null);
    }

    public static Operation delete(int position, String text) {
        return new Operation(position, text, Kind.DELETE, null);
    }

    /** Number of characters this operation inserts or removes. */
    public int length() {
        return text.length();
    }

    public boolean isInsert() {
        return kind == Kind.INSERT;
    }

    public boolean isDelete() {
        return kind == Kind.DELETE;
    }

    public Operation withPosition(int newPosition) {
        return new Operation(newPosition, text, kind, revision);
    }

    public Operation withRevision(Long newRevision) {
        return new Operation(position, text, kind, newRevision);
    }

    /**
     * Edit kind. Serialized in lower case ({@code insert} / {@code delete}).
     */
    public enum Kind {
        INSERT,
        DELETE;

        @JsonCreator
        public static Kind fromJson(String value) {
            if (value == null) {
                return null;
            }
            return Kind.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }

        @JsonValue
        public String toJson() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
