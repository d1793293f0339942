package com.whereq.dispatch.store;

import java.util.UUID;

/**
 * Identifier and revision generation shared by the stores
 */
final class Identifiers {

    private Identifiers() {
    }

    static String newId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    /**
     * Next revision, {@code <generation>-<random>}
     */
    static String nextRevision(String revision) {
        int generation = 0;
        if (revision != null) {
            int dash = revision.indexOf('-');
            if (dash > 0) {
                try {
                    generation = Integer.parseInt(revision.substring(0, dash));
                } catch (NumberFormatException e) {
                    generation = 0;
                }
            }
        }
        return (generation + 1) + "-" + newId().substring(0, 16);
    }
}
