package com.campus.reviews.entity;

public enum Role {
    USER,
    ADMIN
}
