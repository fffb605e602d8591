package com.edxbuild.transi.tabular;

import java.util.List;

/**
 * Column names of the input and output tables.
 */
public final class TableColumns {

    private TableColumns() {
    }

    // RAW
    public static final String CODE = "Code";
    public static final String TITLE = "Title";
    public static final String DECI_QUESTION = "Deci_Question";
    public static final String NEXT1_CODE = "next1_code";
    public static final String NEXT2_CODE = "next2_code";
    public static final String NEXT3_CODE = "next3_code";
    public static final List<String> NEXT_CODES = List.of(NEXT1_CODE, NEXT2_CODE, NEXT3_CODE);

    // Narr
    public static final String OPM_STEP = "OPM_Step";
    public static final String SOURCE_TITLE = "Source_Title";
    public static final String STEP_NARR_OUT_SIMPLE = "Step_narr_out_simple";
    public static final String STEP_NARR_OUT = "Step_narr_out";
    public static final String STEP_NARR_M_OUT_SIMPLE = "Step_narr_m_out_simple";
    public static final String STEP_NARR_M_OUT = "Step_narr_m_out";

    // manual map
    public static final String MAP_CODE = "CODE";
    public static final String MATCH = "Match";

    // derived (PreMerge / mk_tw_in)
    public static final String MATCH_CODE_OPM = "match_code_OPM";
    public static final String NARR1 = "Narr1";
    public static final String NARR2 = "Narr2";
    public static final String NARR3 = "Narr3";
    public static final String DISP_NEXT1 = "Disp_next1";
    public static final String DISP_NEXT2 = "Disp_next2";
    public static final String DISP_NEXT3 = "Disp_next3";
    public static final String UAP_URL = "UAP url";
    public static final String UAP_LABEL = "UAP Label";
    public static final String START_HERE = "start_here";
    public static final String MISMATCH = "Mismatch";

    public static final List<String> DERIVED = List.of(
            MATCH_CODE_OPM, OPM_STEP, SOURCE_TITLE,
            NARR1, NARR2, NARR3,
            DISP_NEXT1, DISP_NEXT2, DISP_NEXT3,
            UAP_URL, UAP_LABEL, START_HERE, MISMATCH);

    // change log
    public static final String FIELD = "Field";
    public static final String FROM = "From";
    public static final String TO = "To";
    public static final List<String> CHANGE_LOG = List.of(CODE, FIELD, FROM, TO);

    // manual suggestions
    public static final String MATCH_CONF = "Match_Conf";
    public static final String RANK = "Rank";
    public static final String NARR_CODE = "Narr_Code";
    public static final String SCORE = "Score";

    public static final String YES = "Yes";
    public static final String NO = "No";
}
