package nl.bytesoflife.heaterrisk.verdict;

/**
 * One step of the verdict ladder. Returns null when the rule does not apply.
 */
public interface VerdictRule {

    Verdict evaluate(VerdictContext context);
}
