package logq.engine.plan;

import logq.engine.exec.PhysicalPlan;
import logq.engine.types.Variables;

/** A lowered plan together with the variables it needs to be turned into a stream. */
public record PhysicalPlanResult(PhysicalPlan plan, Variables variables) {}
