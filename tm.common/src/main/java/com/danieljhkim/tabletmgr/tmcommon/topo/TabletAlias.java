package com.danieljhkim.tabletmgr.tmcommon.topo;

/**
 * Immutable identifier of one tablet instance: the cell it lives in plus a numeric uid.
 * The string form is {@code <cell>-<uid padded to 10 digits>}, e.g. {@code cell1-0000000100}.
 */
public record TabletAlias(String cell, long uid) implements Comparable<TabletAlias> {

    public TabletAlias {
        if (cell == null || cell.isBlank()) {
            throw new IllegalArgumentException("cell cannot be null or blank");
        }
        if (uid < 0) {
            throw new IllegalArgumentException("uid cannot be negative");
        }
    }

    /**
     * Parses {@code <cell>-<uid>}. The cell may itself contain dashes; the uid is everything after the last one.
     */
    public static TabletAlias parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("tablet alias cannot be null");
        }
        int idx = value.lastIndexOf('-');
        if (idx <= 0 || idx == value.length() - 1) {
            throw new IllegalArgumentException("invalid tablet alias: " + value);
        }
        try {
            return new TabletAlias(value.substring(0, idx), Long.parseLong(value.substring(idx + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid tablet alias uid: " + value, e);
        }
    }

    @Override
    public int compareTo(TabletAlias other) {
        int c = cell.compareTo(other.cell);
        return c != 0 ? c : Long.compare(uid, other.uid);
    }

    @Override
    public String toString() {
        return String.format("%s-%010d", cell, uid);
    }
}
