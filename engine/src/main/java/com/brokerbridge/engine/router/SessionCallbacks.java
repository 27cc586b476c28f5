package com.brokerbridge.engine.router;

/**
 * Session-level reactions to routed events. Called on the receipt path; must not block.
 */
public interface SessionCallbacks {

    void onConnectionState(boolean connected, String reason);

    /**
     * A managed account was seen for the first time.
     */
    void onNewAccount(String account);

    /**
     * A financial-advisor group was reported.
     */
    void onAdvisorGroup(String groupName);
}
