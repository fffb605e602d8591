package com.edxbuild.transi.model;

import lombok.Value;

/**
 * A successor code that names no RAW step. Reported, never fatal.
 */
@Value
public class UnresolvedReference {
    String code;
    String column;
    String target;
}
