package com.docfederation.model.sync;

public enum TriggerSource {
    WEBHOOK,
    MANUAL,
    RECONCILE
}
