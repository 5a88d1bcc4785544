package com.deuceleague.deuce_api.engine;

import com.deuceleague.deuce_api.model.MembershipStatus;
import com.deuceleague.deuce_api.repository.DivisionMembershipRepository;
import org.springframework.stereotype.Component;

import java.util.UUID;

@Component
public class JpaDivisionMembershipOracle implements DivisionMembershipOracle {

    private final DivisionMembershipRepository membershipRepository;

    public JpaDivisionMembershipOracle(DivisionMembershipRepository membershipRepository) {
        this.membershipRepository = membershipRepository;
    }

    @Override
    public boolean isActiveMember(UUID userId, UUID divisionId) {
        return membershipRepository.existsByUserIdAndDivisionIdAndStatus(userId, divisionId, MembershipStatus.ACTIVE);
    }
}
