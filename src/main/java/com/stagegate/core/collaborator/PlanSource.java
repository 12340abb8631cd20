package com.stagegate.core.collaborator;

public interface PlanSource {

    Plan plan(StageContext context);
}
