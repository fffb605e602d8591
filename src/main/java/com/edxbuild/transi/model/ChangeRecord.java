package com.edxbuild.transi.model;

import lombok.Value;

/**
 * One cell overwritten by a reviewer edit.
 */
@Value
public class ChangeRecord {
    String code;
    String field;
    String from;
    String to;
}
