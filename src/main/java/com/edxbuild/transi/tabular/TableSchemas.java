package com.edxbuild.transi.tabular;

import static com.edxbuild.transi.tabular.TableColumns.*;

/**
 * Schemas of every table the pipeline reads.
 */
public final class TableSchemas {

    private TableSchemas() {
    }

    public static final TableSchema RAW = TableSchema.of("RAW",
            ColumnSpec.required(CODE),
            ColumnSpec.required(TITLE),
            ColumnSpec.optional(DECI_QUESTION),
            ColumnSpec.optional(NEXT1_CODE),
            ColumnSpec.optional(NEXT2_CODE),
            ColumnSpec.optional(NEXT3_CODE),
            ColumnSpec.optional(NARR3));

    public static final TableSchema NARR = TableSchema.of("Narr",
            ColumnSpec.required(CODE),
            ColumnSpec.required(OPM_STEP),
            ColumnSpec.required(SOURCE_TITLE),
            ColumnSpec.required(STEP_NARR_OUT_SIMPLE),
            ColumnSpec.required(STEP_NARR_OUT),
            ColumnSpec.required(STEP_NARR_M_OUT_SIMPLE),
            ColumnSpec.required(STEP_NARR_M_OUT));

    public static final TableSchema MANUAL_MAP = TableSchema.of("manual map",
            ColumnSpec.required(MAP_CODE, CODE),
            ColumnSpec.required(MATCH, MATCH_CODE_OPM, "selected_code", "opm_code"),
            ColumnSpec.optional(OPM_STEP, "OPM step"));

    public static final TableSchema LEGACY_MAP = TableSchema.of("mapping",
            ColumnSpec.required(CODE, MAP_CODE),
            ColumnSpec.optional(MATCH_CODE_OPM, "match_code", "selected_code", "opm_code", "chosen_code", OPM_STEP));

    public static final TableSchema PREMERGE = TableSchema.of("PreMerge",
            ColumnSpec.required(CODE, MAP_CODE));

    public static final TableSchema EDITED = TableSchema.of("resp_merge",
            ColumnSpec.required(CODE, MAP_CODE));
}
