package com.campus.reviews.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.util.UUID;

// Catalog rows are maintained elsewhere; this service only resolves them.
@Entity
@Data
@Table(name = "professors")
public class Professor {

    @Id
    private UUID id;

    @Column(nullable = false, length = 256)
    private String name;
}
