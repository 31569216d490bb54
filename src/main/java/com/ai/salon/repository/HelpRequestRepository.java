package com.ai.salon.repository;

import com.ai.salon.entity.HelpRequest;
import com.ai.salon.entity.HelpRequestStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface HelpRequestRepository extends JpaRepository<HelpRequest, String> {

    List<HelpRequest> findByStatusOrderByCreatedAtDesc(HelpRequestStatus status);
}
