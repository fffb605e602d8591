package com.edxbuild.transi.model;

import lombok.Value;

/**
 * A reviewer's pick for one raw step: a narration code or a full {@code OPM_Step} value.
 */
@Value
public class ManualMapEntry {
    String rawCode;
    String matchToken;
}
