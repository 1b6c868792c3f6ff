package nl.pim16aap2.protonkeeper.manager.fallback;

import nl.pim16aap2.protonkeeper.runtime.VersionRequirement;

import java.util.List;
import java.util.Objects;

/**
 * The ordered attempts for resolving a requirement.
 * <p>
 * Steps are evaluated lazily: the first step that yields a usable runtime wins and later steps are never touched. The
 * last step is always a {@link PlanStep.Fail}.
 *
 * @param requirement
 *     The requirement the plan was made for.
 * @param steps
 *     The attempts, in order.
 */
public record ResolutionPlan(VersionRequirement requirement, List<PlanStep> steps)
{
    public ResolutionPlan
    {
        Objects.requireNonNull(requirement, "requirement may not be null.");
        steps = List.copyOf(steps);
        if (steps.isEmpty() || !(steps.get(steps.size() - 1) instanceof PlanStep.Fail))
            throw new IllegalArgumentException("A resolution plan must end with a failure step.");
    }
}
