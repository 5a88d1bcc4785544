package com.deuceleague.deuce_api.repository;

import com.deuceleague.deuce_api.model.DivisionMembership;
import com.deuceleague.deuce_api.model.MembershipStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface DivisionMembershipRepository extends JpaRepository<DivisionMembership, UUID> {

    boolean existsByUserIdAndDivisionIdAndStatus(UUID userId, UUID divisionId, MembershipStatus status);
}
