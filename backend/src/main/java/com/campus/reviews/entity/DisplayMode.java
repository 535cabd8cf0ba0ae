package com.campus.reviews.entity;

public enum DisplayMode {
    ANONYMOUS,
    NAMED
}
