package com.amphitheatre.composer.support;

import org.slf4j.MDC;

/**
 * MDC keys set while a Playbook is being reconciled.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setPlaybook(String playbookId) {
        MDC.put("playbookId", playbookId);
    }

    public static void setActor(String actor, String stage) {
        MDC.put("actor", actor);
        MDC.put("stage", stage);
    }

    public static void clearActor() {
        MDC.remove("actor");
        MDC.remove("stage");
    }

    public static void clear() {
        MDC.remove("playbookId");
        clearActor();
    }
}
