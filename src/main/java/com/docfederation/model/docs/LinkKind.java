package com.docfederation.model.docs;

public enum LinkKind {
    INTERNAL_SAME_REPO,
    CROSS_REPO,
    EXTERNAL,
    UNRESOLVED
}
