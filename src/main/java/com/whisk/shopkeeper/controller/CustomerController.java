package com.whisk.shopkeeper.controller;

import com.whisk.shopkeeper.dto.PageResponse;
import com.whisk.shopkeeper.exception.NotFoundException;
import com.whisk.shopkeeper.model.Customer;
import com.whisk.shopkeeper.repository.CustomerRepository;
import com.whisk.shopkeeper.util.PageParams;
import org.springframework.data.domain.Sort;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/customers")
public class CustomerController {

    private final CustomerRepository customerRepository;

    public CustomerController(CustomerRepository customerRepository) {
        this.customerRepository = customerRepository;
    }

    @GetMapping
    public PageResponse<Customer> list(@RequestParam(defaultValue = "0") int skip,
            @RequestParam(defaultValue = "10") int limit) {
        PageParams.check(skip, limit, 100);
        return PageResponse.from(customerRepository.findAll(PageParams.of(skip, limit, Sort.by("id"))));
    }

    @GetMapping("/{customerId}")
    public Customer get(@PathVariable Long customerId) {
        return customerRepository.findById(customerId)
                .orElseThrow(() -> new NotFoundException("Customer not found"));
    }
}
