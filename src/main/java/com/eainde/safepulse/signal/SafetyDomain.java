package com.eainde.safepulse.signal;

/** The independent decision domains hosted by the core. */
public enum SafetyDomain {
    DANGER,
    COERCION,
    SITUATIONAL,
    INTENT
}
