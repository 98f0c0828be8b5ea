package io.kubestate.exporter.model;

/**
 * Kinds of incremental change delivered by a resource watch.
 */
public enum EventType {
    ADDED("added"),
    MODIFIED("modified"),
    DELETED("deleted"),
    BOOKMARK("bookmark");

    public final String label;

    EventType(String label) {
        this.label = label;
    }
}
