package com.stagegate.core.collaborator;

/**
 * Human sign-off on the plan. Blocks without a timeout until a decision is made.
 */
public interface PlanApprover {

    boolean awaitApproval(Plan plan);
}
