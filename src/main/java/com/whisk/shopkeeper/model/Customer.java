package com.whisk.shopkeeper.model;

import jakarta.persistence.*;
import lombok.Data;

@Entity
@Table(name = "customers")
@Data
public class Customer {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String name;

    private String email;
    private String phone;
    private String address;

    // YYYY-MM-DD as entered at the counter, may be empty
    private String birthday;
    private String anniversary;
}
