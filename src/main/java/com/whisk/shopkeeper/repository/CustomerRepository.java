package com.whisk.shopkeeper.repository;

import com.whisk.shopkeeper.model.Customer;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface CustomerRepository extends JpaRepository<Customer, Long> {
    List<Customer> findByNameAndPhone(String name, String phone);
}
