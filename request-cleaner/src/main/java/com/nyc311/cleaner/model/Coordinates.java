package com.nyc311.cleaner.model;

/** A latitude/longitude pair that passed the bounding-box check. */
public record Coordinates(double latitude, double longitude) {}
