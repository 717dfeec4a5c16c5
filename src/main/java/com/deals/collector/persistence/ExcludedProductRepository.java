package com.deals.collector.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ExcludedProductRepository extends JpaRepository<ExcludedProductEntity, String> {

    @Query("SELECT e.asin FROM ExcludedProductEntity e")
    List<String> findAllAsins();
}
