package com.collab.sync.collab.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Document content as returned by the document service.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DocumentSnapshot(String id, String content, long version) {

    public static DocumentSnapshot empty(String id) {
        return new DocumentSnapshot(id, "", 0);
    }
}
