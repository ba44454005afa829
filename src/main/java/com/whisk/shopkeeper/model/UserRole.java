package com.whisk.shopkeeper.model;

public enum UserRole {
    ADMIN,
    STAFF
}
