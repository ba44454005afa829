package com.whisk.shopkeeper.service;

import com.whisk.shopkeeper.dto.InvoiceDraft;
import com.whisk.shopkeeper.dto.ResolvedCustomer;
import com.whisk.shopkeeper.exception.InvalidInputException;
import com.whisk.shopkeeper.exception.NotFoundException;
import com.whisk.shopkeeper.model.Customer;
import com.whisk.shopkeeper.repository.CustomerRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns the customer part of an invoice draft into a stored customer.
 * <p>
 * A draft without {@code customerId} always produces a new customer row, even
 * if one with the same name and phone already exists.
 */
@Service
@Slf4j
public class CustomerResolver {

    private final CustomerRepository customerRepository;
    private final AuditService auditService;

    public CustomerResolver(CustomerRepository customerRepository, AuditService auditService) {
        this.customerRepository = customerRepository;
        this.auditService = auditService;
    }

    public ResolvedCustomer resolve(InvoiceDraft draft) {
        if (hasText(draft.getCustomerId())) {
            Long id = parseId(draft.getCustomerId());
            Customer customer = customerRepository.findById(id)
                    .orElseThrow(() -> NotFoundException.inRequestBody("Customer not found"));
            return new ResolvedCustomer(customer.getId(), customer.getName());
        }

        String phone = draft.resolvePhone();
        if (!hasText(draft.getCustomerName()) || !hasText(phone)) {
            throw new InvalidInputException("Missing new customer details (name and phone required)");
        }

        Customer customer = new Customer();
        customer.setName(draft.getCustomerName());
        customer.setPhone(phone);
        customer.setEmail(orEmpty(draft.getCustomerEmail()));
        customer.setAddress(orEmpty(draft.getCustomerAddress()));
        customer.setBirthday(orEmpty(draft.getCustomerBirthday()));
        customer.setAnniversary(orEmpty(draft.getCustomerAnniversary()));
        Customer saved = customerRepository.save(customer);

        log.info("Created customer {} ({}) while issuing an invoice", saved.getId(), saved.getName());
        auditService.log("CREATE_CUSTOMER", "Customer: " + saved.getId() + ", Name: " + saved.getName());
        return new ResolvedCustomer(saved.getId(), draft.getCustomerName());
    }

    private Long parseId(String raw) {
        try {
            return Long.valueOf(raw.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Invalid customer id: " + raw);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }
}
