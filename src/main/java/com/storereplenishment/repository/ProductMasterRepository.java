package com.storereplenishment.repository;

import com.storereplenishment.entity.ProductMaster;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface ProductMasterRepository extends JpaRepository<ProductMaster, String> {

    List<ProductMaster> findAllByOrderByItemIdAsc();
}
