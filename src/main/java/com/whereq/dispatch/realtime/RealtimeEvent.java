package com.whereq.dispatch.realtime;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Change notification published on the realtime bus of a domain
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RealtimeEvent {

    public static final String CREATED = "CREATED";
    public static final String UPDATED = "UPDATED";
    public static final String DELETED = "DELETED";
    public static final String NOTIFIED = "NOTIFIED";

    private String domain;

    private String verb;

    private String doctype;

    private Map<String, Object> doc;

    /**
     * Previous version of the document, for updates
     */
    private Map<String, Object> oldDoc;

    @JsonIgnore
    public String getDocId() {
        return idOf(doc);
    }

    @JsonIgnore
    public String getOldDocId() {
        return idOf(oldDoc);
    }

    private static String idOf(Map<String, Object> document) {
        if (document == null) {
            return null;
        }
        Object id = document.get("_id");
        return id != null ? id.toString() : null;
    }
}
