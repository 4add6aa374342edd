package com.amphitheatre.composer.workflow;

/**
 * What the cluster currently holds for one Actor.
 *
 * @param detail human-readable reason attached to a FAILED job or FAILING
 *               deployment, may be null
 */
public record ObservedState(JobCondition build,
                            JobCondition push,
                            DeploymentCondition deployment,
                            String detail) {

    public static ObservedState nothing() {
        return new ObservedState(JobCondition.ABSENT, JobCondition.ABSENT,
                                 DeploymentCondition.ABSENT, null);
    }

    public ObservedState withBuild(JobCondition condition) {
        return new ObservedState(condition, push, deployment, detail);
    }

    public ObservedState withPush(JobCondition condition) {
        return new ObservedState(build, condition, deployment, detail);
    }

    public ObservedState withDeployment(DeploymentCondition condition) {
        return new ObservedState(build, push, condition, detail);
    }
}
