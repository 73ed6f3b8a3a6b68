package nl.bytesoflife.heaterrisk.verdict;

import nl.bytesoflife.heaterrisk.issue.InfrastructureIssue;

/**
 * The first detected violation, in reporting order, decides the repair headline.
 */
public class CodeViolationRule implements VerdictRule {

    @Override
    public Verdict evaluate(VerdictContext context) {
        for (InfrastructureIssue issue : context.issues()) {
            if (issue.isViolation()) {
                return Verdict.repair(true, issue.friendlyName(),
                        issue.finding() + ". " + issue.remediation() + ".");
            }
        }
        return null;
    }
}
