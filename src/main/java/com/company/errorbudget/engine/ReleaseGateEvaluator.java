package com.company.errorbudget.engine;

import com.company.errorbudget.domain.BurnRateSnapshot;
import com.company.errorbudget.domain.Forecast;
import com.company.errorbudget.domain.MonitoredService;
import com.company.errorbudget.domain.ReleaseDecision;
import com.company.errorbudget.domain.enums.GateState;
import com.company.errorbudget.domain.enums.RiskLevel;
import com.company.errorbudget.exception.InvalidReleaseRequestException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns the last completed evaluation of a service into an allow/block decision.
 *
 * <p>SAFE and OBSERVE allow; DANGER and FREEZE block unless a justified override is
 * supplied. An override only changes the outcome, never the reported risk level.
 */
@Component
public class ReleaseGateEvaluator {

    public static final double IMMINENT_EXHAUSTION_HOURS = 4.0;

    /**
     * Rejects requests that cannot produce a decision.
     */
    public void validate(ReleaseCheckCommand command) {
        if (command.getServiceName() == null || command.getServiceName().isBlank()) {
            throw new InvalidReleaseRequestException("service_name is required");
        }
        if (command.isOverride() && !command.hasOverrideReason()) {
            throw new InvalidReleaseRequestException("override_reason is required when override is true");
        }
    }

    /**
     * @param snapshot worst latest snapshot across the service's targets, null if none yet
     * @param forecast exhaustion forecast, may be null
     */
    public ReleaseDecision evaluate(MonitoredService service, ReleaseCheckCommand command,
                                    BurnRateSnapshot snapshot, Forecast forecast, Instant now) {
        validate(command);

        RiskLevel risk = snapshot != null && snapshot.getRiskLevel() != null
                ? snapshot.getRiskLevel() : RiskLevel.SAFE;
        double burnRate = snapshot != null ? snapshot.getCompositeBurnRate() : 0.0;
        double remaining = snapshot != null ? snapshot.getErrorBudgetRemaining() : 100.0;
        Double timeToExhaustion = forecast != null ? forecast.getTimeToExhaustionHours() : null;

        boolean blocked = risk.blocksRelease();
        boolean overridden = blocked && command.isOverride();
        boolean allowed = !blocked || overridden;

        String reason;
        if (overridden) {
            reason = String.format(Locale.ROOT, "Override approved at risk level %s (composite burn rate %.2f): %s",
                    risk, burnRate, command.getOverrideReason().trim());
        } else if (blocked) {
            reason = String.format(Locale.ROOT, "Deployment blocked: risk level %s (composite burn rate %.2f, %.1f%% budget remaining)",
                    risk, burnRate, remaining);
        } else {
            reason = String.format(Locale.ROOT, "Deployment allowed: risk level %s (composite burn rate %.2f, %.1f%% budget remaining)",
                    risk, burnRate, remaining);
        }

        return ReleaseDecision.builder()
                .serviceId(service.getServiceId())
                .serviceName(service.getName())
                .deploymentId(command.getDeploymentId())
                .version(command.getVersion())
                .requestedBy(command.getRequestedBy())
                .overrideRequested(command.isOverride())
                .overrideReason(command.hasOverrideReason() ? command.getOverrideReason().trim() : null)
                .overridden(overridden)
                .state(allowed ? GateState.ALLOWED : GateState.BLOCKED)
                .allowed(allowed)
                .reason(reason)
                .riskLevel(risk)
                .compositeBurnRate(burnRate)
                .errorBudgetRemaining(remaining)
                .timeToExhaustionHours(timeToExhaustion)
                .snapshotEvaluatedAt(snapshot != null ? snapshot.getEvaluatedAt() : null)
                .recommendations(recommendations(risk, overridden, timeToExhaustion, snapshot == null))
                .decidedAt(now)
                .build();
    }

    List<String> recommendations(RiskLevel risk, boolean overridden, Double timeToExhaustion, boolean noEvaluation) {
        List<String> recommendations = new ArrayList<>();

        if (noEvaluation) {
            recommendations.add("No completed evaluation yet; wait for the first evaluation before relying on this decision");
        }

        switch (risk) {
            case FREEZE -> {
                recommendations.add("Halt non-critical deploys");
                recommendations.add("Investigate and resolve active incidents before deploying");
                recommendations.add("Consider rolling back recent changes");
            }
            case DANGER -> {
                recommendations.add("Require incident-commander sign-off before deploying");
                recommendations.add("Wait for the system to stabilize or provide an override with justification");
            }
            case OBSERVE -> {
                recommendations.add("Monitor error rates closely during rollout");
                recommendations.add("Consider smaller deployment batches");
            }
            case SAFE -> {
                // nothing to add
            }
        }

        if (overridden) {
            recommendations.add("Deployment approved via override - monitor closely");
        }

        if (timeToExhaustion != null && timeToExhaustion < IMMINENT_EXHAUSTION_HOURS) {
            recommendations.add(String.format(Locale.ROOT,
                    "Error budget projected to exhaust in %.1f hours", timeToExhaustion));
        }
        return recommendations;
    }
}
