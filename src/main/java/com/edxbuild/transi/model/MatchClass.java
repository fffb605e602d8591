package com.edxbuild.transi.model;

public enum MatchClass {

    /**
     * Resolved to an entry whose code carries the M-class marker; uses the M text variants.
     */
    M,

    /**
     * Resolved to a regular narration entry.
     */
    NON_M,

    /**
     * No narration entry applies; narration falls back to the step title.
     */
    NONE
}
