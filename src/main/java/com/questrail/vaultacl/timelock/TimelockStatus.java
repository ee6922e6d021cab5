package com.questrail.vaultacl.timelock;

import java.util.List;

/**
 * Point-in-time view of the timelock for display.
 *
 * @param duration           configured delay in seconds
 * @param phase              phase at the time the status was taken
 * @param expiresAt          when staged changes become applicable, {@code 0} if none
 * @param secondsRemaining   seconds until then, never negative
 * @param pendingDescription one line per row of {@link PendingUpdateDescriber} output
 */
public record TimelockStatus(long duration,
                             TimelockPhase phase,
                             long expiresAt,
                             long secondsRemaining,
                             List<String> pendingDescription)
{
    public TimelockStatus {
        pendingDescription = List.copyOf(pendingDescription);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Timelock: ").append(duration).append(" seconds");
        if (expiresAt != 0) {
            sb.append(", remaining: ").append(secondsRemaining).append('s')
              .append(" (").append(secondsRemaining / 60).append("m ")
              .append(secondsRemaining % 60).append("s)");
        }
        sb.append('\n');
        if (pendingDescription.isEmpty()) {
            sb.append("\nNo pending state updates.");
        } else {
            sb.append("\nPending state updates:");
            for (String line : pendingDescription) {
                sb.append('\n').append(line);
            }
        }
        return sb.toString();
    }
}
