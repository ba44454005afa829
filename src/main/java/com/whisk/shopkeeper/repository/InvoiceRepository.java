package com.whisk.shopkeeper.repository;

import com.whisk.shopkeeper.model.Invoice;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;
import java.util.Optional;

public interface InvoiceRepository extends JpaRepository<Invoice, Long> {
    List<Invoice> findByInvoiceNumber(String invoiceNumber);

    List<Invoice> findByCustomerId(Long customerId);

    // Newest (highest id) invoice whose number is neither null nor empty
    Optional<Invoice> findTopByInvoiceNumberNotOrderByIdDesc(String excluded);
}
