package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.AdminAction;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AdminActionRepository extends JpaRepository<AdminAction, UUID> {

    List<AdminAction> findByMatchIdOrderByCreatedAtDesc(UUID matchId);
}
