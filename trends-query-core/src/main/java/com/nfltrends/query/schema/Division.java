package com.nfltrends.query.schema;

import java.util.ArrayList;
import java.util.List;

public enum Division {

    AFC_EAST("AFC East"),
    AFC_NORTH("AFC North"),
    AFC_SOUTH("AFC South"),
    AFC_WEST("AFC West"),
    NFC_EAST("NFC East"),
    NFC_NORTH("NFC North"),
    NFC_SOUTH("NFC South"),
    NFC_WEST("NFC West");

    private final String label;

    Division(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static List<String> labels() {
        List<String> labels = new ArrayList<>();
        for (Division division : values()) {
            labels.add(division.label);
        }
        return labels;
    }
}
