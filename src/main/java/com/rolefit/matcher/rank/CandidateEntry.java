package com.rolefit.matcher.rank;

import com.rolefit.matcher.document.Document;
import com.rolefit.matcher.document.DocumentRole;

/**
 * A named candidate document to be ranked.
 *
 * @param id       caller-chosen identifier, usually the file name
 * @param document the candidate document
 */
public record CandidateEntry(String id, Document document) {

    public CandidateEntry {
        if (id == null) {
            throw new IllegalArgumentException("Id cannot be null");
        }
        if (document == null || document.role() != DocumentRole.CANDIDATE) {
            throw new IllegalArgumentException("Entry '" + id + "' must hold a candidate document");
        }
    }

    public static CandidateEntry of(String id, String text) {
        return new CandidateEntry(id, Document.candidate(text));
    }
}
