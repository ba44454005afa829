package com.whisk.shopkeeper.repository;

import com.whisk.shopkeeper.model.InvoiceSequence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InvoiceSequenceRepository extends JpaRepository<InvoiceSequence, String> {

    // Single-statement increment, the row stays locked until the caller's transaction ends
    @Modifying(clearAutomatically = true)
    @Query("UPDATE InvoiceSequence s SET s.lastValue = s.lastValue + 1 WHERE s.name = :name")
    int increment(@Param("name") String name);
}
