package com.kotsin.nox.config;

import java.time.Duration;
import java.util.List;

/**
 * Central constants for NOx feature engineering.
 *
 * Column names are the case-normalized names produced by the acquisition layer.
 */
public final class FeatureConstants {

    private FeatureConstants() {
        throw new UnsupportedOperationException("Constants class");
    }

    // ========== INPUT COLUMNS ==========

    public static final String TIMESTAMP_COLUMN = "_time_gateway";
    public static final String TARGET_COLUMN = "nox_value";
    public static final String WEIGHT_CHANNEL = "icf_cra_wt_k";

    // ========== EVENT COLUMNS ==========

    public static final String TRASH_DROP = "trash_drop";
    public static final String TRASH_DROP_COUNT_30MIN = "trash_drop_count_30min";
    public static final String IS_SPIKE = "is_spike";
    public static final String NOX_RANGE_1MIN = "nox_range_1min";
    public static final String NOX_STD_1MIN = "nox_std_1min";

    // ========== CHANNEL SET ==========

    /**
     * The 17 channels that receive interval statistics, in feature order.
     * The last two are derived by the trash-drop detector.
     */
    public static final List<String> DEFAULT_CHANNELS = List.of(
        "bft_eo_fg_t",
        "br1_eo_fg_t",
        "br1_eo_o2_a",
        "br1_eo_st_t",
        "dr1_eq_bw_c",
        "icf_ccs_fg_t_1",
        WEIGHT_CHANNEL,
        "icf_ff1_ar_f_1",
        "icf_ff1_ss_s_1",
        "icf_ff1_ss_s_2",
        "icf_ff2_ss_s_1",
        "icf_idf_ss_s_1",
        "icf_scs_fg_t_1",
        "icf_tms_nox_a",
        "sdr_htr_fg_t",
        TRASH_DROP,
        TRASH_DROP_COUNT_30MIN
    );

    // ========== WINDOW SET ==========

    public static final List<Integer> DEFAULT_WINDOWS_SECONDS = List.of(60, 180, 300, 600, 1800);

    // ========== TRASH DROP ==========

    public static final int TRASH_PEAK_WINDOW_SAMPLES = 10;
    public static final double TRASH_DROP_THRESHOLD = -10.0;
    public static final Duration TRASH_COUNT_WINDOW = Duration.ofMinutes(30);

    // ========== SPIKE ==========

    public static final Duration SPIKE_WINDOW = Duration.ofMinutes(1);
    public static final double SPIKE_RANGE_THRESHOLD = 8.0;
    public static final double SPIKE_STD_THRESHOLD = 6.0;

    // ========== CURATION ==========

    public static final long MAX_MISSING_COUNT = 10_000L;

    // ========== NUMERICS ==========

    public static final double EPSILON = 1e-10;
    public static final long NANOS_PER_SECOND = 1_000_000_000L;
}
