package com.tripmatch.pojo.model;

/**
 * 可参与推荐的出团状态，code 即 STATUS_CODE 特征值。
 * Cancelled / Full 在库存侧已被过滤，不会出现在候选中。
 */
public enum TripStatus {

    AVAILABLE(0, "Open"),
    GUARANTEED(1, "Guaranteed"),
    LAST_PLACES(2, "Last Places");

    private final int code;
    private final String label;

    TripStatus(int code, String label) {
        this.code = code;
        this.label = label;
    }

    public int getCode() {
        return code;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return 对应状态；Cancelled / Full 等不可推荐状态返回 null
     */
    public static TripStatus fromLabel(String label) {
        if (label == null) {
            return AVAILABLE;
        }
        String s = label.trim();
        for (TripStatus st : values()) {
            if (st.label.equalsIgnoreCase(s) || st.name().equalsIgnoreCase(s)) {
                return st;
            }
        }
        if ("Available".equalsIgnoreCase(s) || s.isEmpty()) {
            return AVAILABLE;
        }
        return null;
    }
}
