package com.hcltech.causal.calculus.identify;

public enum IdentificationMethod {
    BACKDOOR("Backdoor criterion satisfied"),
    FRONTDOOR("Frontdoor criterion satisfied"),
    INSTRUMENTAL("Instrumental variable available"),
    DO_CALCULUS("Identifiable via do-calculus");

    private final String successReason;

    IdentificationMethod(String successReason) {
        this.successReason = successReason;
    }

    public String successReason() {
        return successReason;
    }
}
