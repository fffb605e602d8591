package com.edxbuild.transi.merge;

import java.util.List;

import com.edxbuild.transi.model.ChangeRecord;
import com.edxbuild.transi.model.PreMergeTable;

import lombok.Value;

/**
 * Final rows with reviewer edits applied, and the log of every cell that changed.
 */
@Value
public class MergeOutcome {

    PreMergeTable table;
    List<ChangeRecord> changes;

    public int changedRowCount() {
        return (int) table.getRows().stream().filter(r -> r.isMismatch()).count();
    }
}
