package com.edxbuild.transi.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * One authored narration entry of the narration catalog.
 */
@Value
@Builder(toBuilder = true)
public class NarrEntry {

    @NonNull
    String code;

    @Builder.Default
    String opmStep = "";

    @Builder.Default
    String sourceTitle = "";

    @Builder.Default
    String narrSimple = "";

    @Builder.Default
    String narrFull = "";

    @Builder.Default
    String narrMSimple = "";

    @Builder.Default
    String narrMFull = "";
}
