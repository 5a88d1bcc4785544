package com.deuceleague.deuce_api.engine;

import java.util.UUID;

public interface DivisionMembershipOracle {

    boolean isActiveMember(UUID userId, UUID divisionId);
}
