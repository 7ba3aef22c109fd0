package agentpool.dispatcher.health;

/**
 * Outcome counts of one probe round.
 */
public record ProbeRound(int probed, int healthy, int failed) {

    public static ProbeRound empty() {
        return new ProbeRound(0, 0, 0);
    }
}
