package com.deuceleague.deuce_api.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * League-wide match lifecycle settings, bound from {@code deuce.*}.
 * Defaults below are the production values; tests construct this directly.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "deuce")
public class DeuceProperties {

    private Matches matches = new Matches();
    private Invitations invitations = new Invitations();
    private Conflicts conflicts = new Conflicts();
    private Disputes disputes = new Disputes();
    private Standings standings = new Standings();
    private Recalculation recalculation = new Recalculation();
    private Penalties penalties = new Penalties();
    private Worker worker = new Worker();

    @Getter
    @Setter
    public static class Matches {
        /**
         * When true a submitted result waits in ONGOING for the other side.
         * Individual matches may override this at creation time.
         */
        private boolean requiresConfirmation = true;
        private int lateCancellationHours = 4;
        /** A result nobody confirmed or disputed within this window is approved automatically. */
        private int autoApproveHours = 24;
        private int maxReschedules = 3;
    }

    @Getter
    @Setter
    public static class Invitations {
        private int expiryHours = 48;
    }

    @Getter
    @Setter
    public static class Conflicts {
        private int creationWindowHours = 2;
        private int acceptanceWindowHours = 3;
    }

    @Getter
    @Setter
    public static class Disputes {
        /** OPEN disputes older than this are raised to URGENT. */
        private int escalationHours = 48;
    }

    @Getter
    @Setter
    public static class Standings {
        private int bestResultsCount = 6;
    }

    @Getter
    @Setter
    public static class Recalculation {
        private int maxAttempts = 5;
        private int retryBackoffMinutes = 5;
    }

    @Getter
    @Setter
    public static class Penalties {
        private int lateCancellationPoints = 2;
        private int lateCancellationSuspensionDays = 7;
    }

    @Getter
    @Setter
    public static class Worker {
        private boolean enabled = true;
    }
}
