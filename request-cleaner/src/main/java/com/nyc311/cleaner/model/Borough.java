package com.nyc311.cleaner.model;

/**
 * The five canonical NYC boroughs, labelled the way the cleaned table stores them.
 */
public enum Borough {

    BRONX("BRONX"),
    BROOKLYN("BROOKLYN"),
    MANHATTAN("MANHATTAN"),
    QUEENS("QUEENS"),
    STATEN_ISLAND("STATEN ISLAND");

    private final String label;

    Borough(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
