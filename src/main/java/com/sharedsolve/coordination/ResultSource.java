package com.sharedsolve.coordination;

public enum ResultSource {
    GENERATED,
    SHARED,
    FALLBACK_GENERATED
}
