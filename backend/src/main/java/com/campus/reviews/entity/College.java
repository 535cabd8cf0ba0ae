package com.campus.reviews.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.util.UUID;

@Entity
@Data
@Table(name = "colleges")
public class College {

    @Id
    private UUID id;

    @Column(nullable = false, length = 256)
    private String name;
}
