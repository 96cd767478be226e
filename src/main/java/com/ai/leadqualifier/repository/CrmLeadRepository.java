package com.ai.leadqualifier.repository;

import com.ai.leadqualifier.entity.CrmLead;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface CrmLeadRepository extends JpaRepository<CrmLead, Long> {
	List<CrmLead> findByPhoneOrderByCreatedAtDesc(String phone);

	long countByStatus(String status);
}
