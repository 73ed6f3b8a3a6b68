package nl.bytesoflife.heaterrisk.verdict;

import java.util.Objects;

/**
 * The single recommendation for a unit.
 *
 * @param action what to do
 * @param badge  display badge
 * @param urgent whether it should happen now rather than at the next visit
 * @param title  short headline
 * @param reason one-sentence explanation with the deciding numbers
 */
public record Verdict(Action action, Badge badge, boolean urgent, String title, String reason) {

    public Verdict {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(badge, "badge");
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Verdict title must not be blank");
        }
    }

    public static Verdict replace(Badge badge, boolean urgent, String title, String reason) {
        return new Verdict(Action.REPLACE, badge, urgent, title, reason);
    }

    public static Verdict repair(boolean urgent, String title, String reason) {
        return new Verdict(Action.REPAIR, Badge.SERVICE, urgent, title, reason);
    }

    public static Verdict pass(Badge badge, String title, String reason) {
        return new Verdict(Action.PASS, badge, false, title, reason);
    }

    public boolean isReplacement() {
        return action == Action.REPLACE;
    }

    @Override
    public String toString() {
        return action + (urgent ? " (urgent)" : "") + " [" + badge + "] " + title + ": " + reason;
    }
}
