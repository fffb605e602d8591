package com.edxbuild.transi.derive;

import java.util.List;

import com.edxbuild.transi.model.MatchClass;
import com.edxbuild.transi.model.PreMergeRow;
import com.edxbuild.transi.model.UnresolvedReference;

import lombok.Value;

/**
 * Derived row for one raw step plus the successor codes that could not be resolved.
 */
@Value
public class Derivation {
    PreMergeRow row;
    MatchClass matchClass;
    List<UnresolvedReference> unresolvedReferences;
}
