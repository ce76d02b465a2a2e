package com.jasmin.floodguard.services.mitigation;

import com.jasmin.floodguard.models.MitigationAction;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

/**
 * Maps a threat score to an action, escalating repeat offenders.
 * <ul>
 *   <li>score &ge; block threshold: BLOCK</li>
 *   <li>score &ge; challenge threshold: CHALLENGE, or BLOCK above the challenge-block score or strike count</li>
 *   <li>score &ge; rate-limit threshold: RATE_LIMIT, adding a strike; too many strikes escalate to a challenge</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class MitigationPolicy {

    private final MitigationProperties props;

    @Value
    public static class Decision {
        MitigationAction action;
        int strikes;
        boolean escalated;
    }

    public Decision decide(double score, int strikes) {
        if (score >= props.getBlockThreshold()) {
            return new Decision(MitigationAction.BLOCK, strikes, false);
        }
        if (score >= props.getChallengeThreshold()) {
            return challenge(score, strikes, false);
        }
        if (score >= props.getRateLimitThreshold()) {
            int next = strikes + 1;
            if (next > props.getRateLimitEscalationStrikes()) {
                return challenge(score, next, true);
            }
            return new Decision(MitigationAction.RATE_LIMIT, next, false);
        }
        return new Decision(MitigationAction.NONE, strikes, false);
    }

    private Decision challenge(double score, int strikes, boolean escalated) {
        if (score > props.getChallengeBlockScore() || strikes > props.getChallengeBlockStrikes()) {
            return new Decision(MitigationAction.BLOCK, strikes, true);
        }
        return new Decision(MitigationAction.CHALLENGE, strikes, escalated);
    }
}
