package com.campus.reviews.entity;

public enum FlagSource {
    USER,
    AUTO
}
