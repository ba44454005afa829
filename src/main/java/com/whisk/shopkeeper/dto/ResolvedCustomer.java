package com.whisk.shopkeeper.dto;

import lombok.Value;

@Value
public class ResolvedCustomer {
    Long id;
    String name;
}
