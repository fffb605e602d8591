package com.edxbuild.transi.model;

import lombok.Value;

/**
 * Advisory candidate narration entry for a raw step, ranked from 1.
 */
@Value
public class Suggestion {
    String rawCode;
    int rank;
    NarrEntry narrEntry;
    double score;
}
